package com.flexledger.ledger;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.Objects;

/** Non-trade cash line (dividend, withholding, interest, fee, deposit...). Positive = received. */
public final class CashMovement {
    private final int sourceLine;
    private final LocalDate date;
    private final String type;
    private final CashKind kind;
    private final String symbol;
    private final String description;
    private final BigDecimal amount;
    private final String currency;

    public CashMovement(
            int sourceLine,
            LocalDate date,
            String type,
            CashKind kind,
            String symbol,
            String description,
            BigDecimal amount,
            String currency) {
        this.sourceLine = sourceLine;
        this.date = Objects.requireNonNull(date, "date");
        this.type = type == null ? "" : type;
        this.kind = Objects.requireNonNull(kind, "kind");
        this.symbol = symbol == null ? "" : symbol;
        this.description = description == null ? "" : description;
        this.amount = Objects.requireNonNull(amount, "amount");
        this.currency = Objects.requireNonNull(currency, "currency");
    }

    public int getSourceLine() {
        return sourceLine;
    }

    public LocalDate getDate() {
        return date;
    }

    public String getType() {
        return type;
    }

    public CashKind getKind() {
        return kind;
    }

    public String getSymbol() {
        return symbol;
    }

    public String getDescription() {
        return description;
    }

    public BigDecimal getAmount() {
        return amount;
    }

    public boolean isReceipt() {
        return amount.signum() > 0;
    }

    public String getCurrency() {
        return currency;
    }
}
