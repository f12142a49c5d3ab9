package com.flexledger.jdbc.schema;

import com.flexledger.trialbalance.HoldingFlag;
import com.flexledger.trialbalance.HoldingLine;
import com.flexledger.trialbalance.HoldingsSchedule;
import java.util.ArrayList;
import java.util.List;

public final class HoldingsTable {
    public static final String NAME = "holdings";

    private static final TableDefinition DEFINITION = createDefinition();

    private HoldingsTable() {}

    public static TableDefinition getDefinition() {
        return DEFINITION;
    }

    public static List<Object[]> materializeRows(HoldingsSchedule holdings) {
        List<Object[]> rows = new ArrayList<>(holdings.getLines().size());
        for (HoldingLine line : holdings.getLines()) {
            rows.add(
                    new Object[] {
                        line.getSymbol(),
                        line.getInstrumentClass().getCode(),
                        line.getQuantity(),
                        line.getCost(),
                        line.getAverageCost(),
                        line.getBrokerQuantity(),
                        line.hasFlag(HoldingFlag.SHORTFALL),
                        line.hasFlag(HoldingFlag.BROKER_MISMATCH)
                    });
        }
        return rows;
    }

    private static TableDefinition createDefinition() {
        List<ColumnDescriptor> columns = new ArrayList<>();
        columns.add(Columns.varchar("symbol", false));
        columns.add(Columns.varchar("instrument_class", false));
        columns.add(Columns.decimal("quantity", 20, 8, false));
        columns.add(Columns.money("cost"));
        columns.add(Columns.decimal("average_cost", 20, 4, false));
        columns.add(Columns.decimal("broker_quantity", 20, 8, true));
        columns.add(Columns.bool("shortfall"));
        columns.add(Columns.bool("broker_mismatch"));
        return new TableDefinition(NAME, "Open investment positions at cost", columns);
    }
}
