package com.flexledger.jdbc.calcite;

import java.util.Map;
import java.util.Objects;
import org.apache.calcite.schema.Schema;
import org.apache.calcite.schema.SchemaFactory;
import org.apache.calcite.schema.SchemaPlus;

/**
 * Calcite {@link SchemaFactory} entry point for model files. The operand needs {@code ledger},
 * the path of the export, and accepts the same keys as the JDBC URL.
 */
public final class FlexLedgerSchemaFactory implements SchemaFactory {

    @Override
    public Schema create(SchemaPlus parentSchema, String name, Map<String, Object> operand) {
        Objects.requireNonNull(parentSchema, "parentSchema");
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(operand, "operand");
        return new FlexLedgerSchema(operand);
    }
}
