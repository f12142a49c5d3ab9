package com.flexledger.trialbalance;

import com.flexledger.ledger.InstrumentClass;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Collections;
import java.util.EnumSet;
import java.util.Objects;
import java.util.Set;

public final class HoldingLine {
    private static final int AVERAGE_COST_SCALE = 4;

    private final String symbol;
    private final InstrumentClass instrumentClass;
    private final BigDecimal quantity;
    private final BigDecimal cost;
    private final BigDecimal brokerQuantity;
    private final Set<HoldingFlag> flags;

    HoldingLine(
            String symbol,
            InstrumentClass instrumentClass,
            BigDecimal quantity,
            BigDecimal cost,
            BigDecimal brokerQuantity,
            Set<HoldingFlag> flags) {
        this.symbol = Objects.requireNonNull(symbol, "symbol");
        this.instrumentClass = Objects.requireNonNull(instrumentClass, "instrumentClass");
        this.quantity = Objects.requireNonNull(quantity, "quantity");
        this.cost = Objects.requireNonNull(cost, "cost");
        this.brokerQuantity = brokerQuantity;
        this.flags = flags.isEmpty()
                ? Collections.emptySet()
                : Collections.unmodifiableSet(EnumSet.copyOf(flags));
    }

    public String getSymbol() {
        return symbol;
    }

    public InstrumentClass getInstrumentClass() {
        return instrumentClass;
    }

    public BigDecimal getQuantity() {
        return quantity;
    }

    public BigDecimal getCost() {
        return cost;
    }

    public BigDecimal getAverageCost() {
        return cost.divide(quantity, AVERAGE_COST_SCALE, RoundingMode.HALF_UP);
    }

    /** Quantity in the broker's position report, or {@code null} when not reported. */
    public BigDecimal getBrokerQuantity() {
        return brokerQuantity;
    }

    public Set<HoldingFlag> getFlags() {
        return flags;
    }

    public boolean hasFlag(HoldingFlag flag) {
        return flags.contains(flag);
    }
}
