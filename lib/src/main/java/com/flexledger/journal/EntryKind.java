package com.flexledger.journal;

public enum EntryKind {
    ACQUISITION,
    DISPOSAL,
    DIVIDEND,
    WITHHOLDING_TAX,
    INTEREST,
    FEE,
    CAPITAL,
    OTHER_CASH,
    OWNERS_LOAN
}
