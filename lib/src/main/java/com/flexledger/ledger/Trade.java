package com.flexledger.ledger;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.Objects;

/**
 * One trade execution normalized from the export. Quantity, gross consideration and commission
 * are stored as magnitudes; {@link #getDirection()} carries the sign.
 */
public final class Trade {
    private final int sourceLine;
    private final LocalDate date;
    private final String symbol;
    private final String description;
    private final InstrumentClass instrumentClass;
    private final Direction direction;
    private final BigDecimal quantity;
    private final BigDecimal grossAmount;
    private final BigDecimal commission;
    private final String currency;

    public Trade(
            int sourceLine,
            LocalDate date,
            String symbol,
            String description,
            InstrumentClass instrumentClass,
            Direction direction,
            BigDecimal quantity,
            BigDecimal grossAmount,
            BigDecimal commission,
            String currency) {
        this.sourceLine = sourceLine;
        this.date = Objects.requireNonNull(date, "date");
        this.symbol = Objects.requireNonNull(symbol, "symbol");
        this.description = description == null ? "" : description;
        this.instrumentClass = Objects.requireNonNull(instrumentClass, "instrumentClass");
        this.direction = Objects.requireNonNull(direction, "direction");
        this.quantity = Objects.requireNonNull(quantity, "quantity");
        this.grossAmount = Objects.requireNonNull(grossAmount, "grossAmount");
        this.commission = Objects.requireNonNull(commission, "commission");
        this.currency = Objects.requireNonNull(currency, "currency");
        if (quantity.signum() <= 0) {
            throw new IllegalArgumentException("Trade quantity must be positive: " + quantity);
        }
        if (grossAmount.signum() < 0 || commission.signum() < 0) {
            throw new IllegalArgumentException(
                    "Trade consideration and commission must be non-negative for " + symbol);
        }
    }

    public int getSourceLine() {
        return sourceLine;
    }

    public LocalDate getDate() {
        return date;
    }

    public String getSymbol() {
        return symbol;
    }

    public String getDescription() {
        return description;
    }

    public InstrumentClass getInstrumentClass() {
        return instrumentClass;
    }

    public Direction getDirection() {
        return direction;
    }

    public boolean isAcquisition() {
        return direction == Direction.ACQUISITION;
    }

    public BigDecimal getQuantity() {
        return quantity;
    }

    public BigDecimal getGrossAmount() {
        return grossAmount;
    }

    public BigDecimal getCommission() {
        return commission;
    }

    public String getCurrency() {
        return currency;
    }

    @Override
    public String toString() {
        return date + " " + direction + " " + quantity.toPlainString() + " " + symbol
                + " (" + instrumentClass.getCode() + ")";
    }
}
