package com.flexledger.jdbc.calcite;

import com.flexledger.jdbc.schema.TableDefinition;
import java.util.List;
import java.util.Objects;
import org.apache.calcite.DataContext;
import org.apache.calcite.linq4j.Enumerable;
import org.apache.calcite.linq4j.Linq4j;
import org.apache.calcite.rel.type.RelDataType;
import org.apache.calcite.rel.type.RelDataTypeFactory;
import org.apache.calcite.schema.ScannableTable;
import org.apache.calcite.schema.impl.AbstractTable;

/** Scannable table over rows materialized once from a run result. */
final class LedgerCalciteTable extends AbstractTable implements ScannableTable {

    private final TableDefinition definition;
    private final List<Object[]> rows;

    LedgerCalciteTable(TableDefinition definition, List<Object[]> rows) {
        this.definition = Objects.requireNonNull(definition, "definition");
        this.rows = List.copyOf(rows);
    }

    @Override
    public RelDataType getRowType(RelDataTypeFactory typeFactory) {
        return CalciteTypeMapper.toRowType(typeFactory, definition.getColumns());
    }

    @Override
    public Enumerable<Object[]> scan(DataContext root) {
        return Linq4j.asEnumerable(rows);
    }
}
