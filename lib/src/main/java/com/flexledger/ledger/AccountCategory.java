package com.flexledger.ledger;

public enum AccountCategory {
    ASSET(true),
    LIABILITY(false),
    EQUITY(false),
    INCOME(false),
    EXPENSE(true);

    private final boolean debitNormal;

    AccountCategory(boolean debitNormal) {
        this.debitNormal = debitNormal;
    }

    /** Whether balances in this category are naturally debit balances. */
    public boolean isDebitNormal() {
        return debitNormal;
    }
}
