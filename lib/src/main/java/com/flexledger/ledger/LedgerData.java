package com.flexledger.ledger;

import java.util.List;

/** Typed records extracted from one export, in input order. */
public final class LedgerData {
    private final String sourceName;
    private final List<Trade> trades;
    private final List<CashMovement> cashMovements;
    private final List<PositionSnapshot> positions;
    private final boolean positionsReported;
    private final int corporateActionCount;

    public LedgerData(
            String sourceName,
            List<Trade> trades,
            List<CashMovement> cashMovements,
            List<PositionSnapshot> positions,
            boolean positionsReported,
            int corporateActionCount) {
        this.sourceName = sourceName;
        this.trades = List.copyOf(trades);
        this.cashMovements = List.copyOf(cashMovements);
        this.positions = List.copyOf(positions);
        this.positionsReported = positionsReported;
        this.corporateActionCount = corporateActionCount;
    }

    public String getSourceName() {
        return sourceName;
    }

    public List<Trade> getTrades() {
        return trades;
    }

    public List<CashMovement> getCashMovements() {
        return cashMovements;
    }

    public List<PositionSnapshot> getPositions() {
        return positions;
    }

    /** True when the export carried an open positions section, even an empty one. */
    public boolean isPositionsReported() {
        return positionsReported;
    }

    public int getCorporateActionCount() {
        return corporateActionCount;
    }
}
