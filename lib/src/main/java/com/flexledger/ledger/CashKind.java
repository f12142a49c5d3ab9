package com.flexledger.ledger;

public enum CashKind {
    DIVIDEND,
    WITHHOLDING_TAX,
    INTEREST,
    FEE,
    CAPITAL,
    OTHER
}
