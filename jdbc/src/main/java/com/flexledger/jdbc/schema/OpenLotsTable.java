package com.flexledger.jdbc.schema;

import com.flexledger.inventory.Lot;
import java.util.ArrayList;
import java.util.List;

/** Lots still open at the end of the run, including classes left out of the holdings schedule. */
public final class OpenLotsTable {
    public static final String NAME = "open_lots";

    private static final TableDefinition DEFINITION = createDefinition();

    private OpenLotsTable() {}

    public static TableDefinition getDefinition() {
        return DEFINITION;
    }

    public static List<Object[]> materializeRows(List<Lot> lots) {
        List<Object[]> rows = new ArrayList<>(lots.size());
        for (Lot lot : lots) {
            rows.add(
                    new Object[] {
                        lot.getSymbol(),
                        lot.getInstrumentClass().getCode(),
                        Columns.epochDay(lot.getAcquiredOn()),
                        lot.getSourceLine(),
                        lot.getQuantity(),
                        lot.getCost(),
                        lot.getInstrumentClass().isInHoldingsSchedule()
                    });
        }
        return rows;
    }

    private static TableDefinition createDefinition() {
        List<ColumnDescriptor> columns = new ArrayList<>();
        columns.add(Columns.varchar("symbol", false));
        columns.add(Columns.varchar("instrument_class", false));
        columns.add(Columns.date("acquired_on"));
        columns.add(Columns.integer("source_lineno", false));
        columns.add(Columns.decimal("quantity", 20, 8, false));
        columns.add(Columns.money("cost"));
        columns.add(Columns.bool("scheduled"));
        return new TableDefinition(NAME, "Open lots", columns);
    }
}
