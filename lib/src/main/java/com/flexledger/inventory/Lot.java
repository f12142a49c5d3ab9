package com.flexledger.inventory;

import com.flexledger.ledger.InstrumentClass;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.Objects;

/**
 * Open slice of an acquisition. Quantity and cost only ever shrink, and only through
 * {@link LotLedger}; callers outside the ledger see copies.
 */
public final class Lot {
    private final String symbol;
    private final InstrumentClass instrumentClass;
    private final LocalDate acquiredOn;
    private final int sourceLine;
    private BigDecimal quantity;
    private BigDecimal cost;

    Lot(
            String symbol,
            InstrumentClass instrumentClass,
            LocalDate acquiredOn,
            int sourceLine,
            BigDecimal quantity,
            BigDecimal cost) {
        this.symbol = Objects.requireNonNull(symbol, "symbol");
        this.instrumentClass = Objects.requireNonNull(instrumentClass, "instrumentClass");
        this.acquiredOn = Objects.requireNonNull(acquiredOn, "acquiredOn");
        this.sourceLine = sourceLine;
        this.quantity = Objects.requireNonNull(quantity, "quantity");
        this.cost = Objects.requireNonNull(cost, "cost");
    }

    public String getSymbol() {
        return symbol;
    }

    public InstrumentClass getInstrumentClass() {
        return instrumentClass;
    }

    public LocalDate getAcquiredOn() {
        return acquiredOn;
    }

    /** Input row of the acquisition that opened this lot. */
    public int getSourceLine() {
        return sourceLine;
    }

    public BigDecimal getQuantity() {
        return quantity;
    }

    /** Remaining cost in reporting currency, including capitalized transaction cost. */
    public BigDecimal getCost() {
        return cost;
    }

    void reduce(BigDecimal consumedQuantity, BigDecimal consumedCost) {
        this.quantity = quantity.subtract(consumedQuantity);
        this.cost = cost.subtract(consumedCost);
    }

    Lot copy() {
        return new Lot(symbol, instrumentClass, acquiredOn, sourceLine, quantity, cost);
    }
}
