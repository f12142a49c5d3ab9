package com.flexledger.ledger;

import java.math.BigDecimal;
import java.util.Objects;

/** Broker-reported open position at statement end. Only used to cross-check the schedule. */
public final class PositionSnapshot {
    private final String symbol;
    private final String description;
    private final BigDecimal quantity;
    private final BigDecimal costBasis;
    private final BigDecimal marketValue;
    private final String currency;

    public PositionSnapshot(
            String symbol,
            String description,
            BigDecimal quantity,
            BigDecimal costBasis,
            BigDecimal marketValue,
            String currency) {
        this.symbol = Objects.requireNonNull(symbol, "symbol");
        this.description = description == null ? "" : description;
        this.quantity = Objects.requireNonNull(quantity, "quantity");
        this.costBasis = costBasis == null ? BigDecimal.ZERO : costBasis;
        this.marketValue = marketValue == null ? BigDecimal.ZERO : marketValue;
        this.currency = currency;
    }

    public String getSymbol() {
        return symbol;
    }

    public String getDescription() {
        return description;
    }

    public BigDecimal getQuantity() {
        return quantity;
    }

    public BigDecimal getCostBasis() {
        return costBasis;
    }

    public BigDecimal getMarketValue() {
        return marketValue;
    }

    public String getCurrency() {
        return currency;
    }
}
