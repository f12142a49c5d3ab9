package com.flexledger.ledger;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.Objects;

/**
 * Pre-classified movement on the owner's loan bank account, already in reporting currency.
 */
public final class SecondaryMovement {

    public enum Flow {
        FUNDS_RECEIVED,
        FUNDS_RETURNED
    }

    private final LocalDate date;
    private final BigDecimal amount;
    private final Flow flow;
    private final String reference;

    public SecondaryMovement(LocalDate date, BigDecimal amount, Flow flow, String reference) {
        this.date = Objects.requireNonNull(date, "date");
        this.amount = Objects.requireNonNull(amount, "amount").abs();
        this.flow = Objects.requireNonNull(flow, "flow");
        this.reference = reference == null ? "" : reference;
    }

    public LocalDate getDate() {
        return date;
    }

    public BigDecimal getAmount() {
        return amount;
    }

    public Flow getFlow() {
        return flow;
    }

    public String getReference() {
        return reference;
    }
}
