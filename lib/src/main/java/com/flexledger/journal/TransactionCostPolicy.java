package com.flexledger.journal;

import java.util.Locale;

/**
 * Treatment of broker commissions on trades. {@link #CAPITALIZE} folds the commission into the
 * acquisition cost and nets it out of disposal proceeds; {@link #EXPENSE} books it to
 * {@code Broker Commissions} as incurred.
 */
public enum TransactionCostPolicy {
    CAPITALIZE,
    EXPENSE;

    public static TransactionCostPolicy fromString(String value) {
        if (value == null) {
            return null;
        }
        try {
            return TransactionCostPolicy.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException ex) {
            return null;
        }
    }
}
