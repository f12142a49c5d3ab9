package com.flexledger.loader;

import java.util.Set;

/**
 * Sections of a Flex Query export, keyed by the section code in column 1 of every HEADER and DATA
 * row. {@link #UNRECOGNIZED} is an explicit variant so that a new section type is reported and
 * dropped instead of falling into another section's handler.
 */
public enum FlexSection {
    TRADES(Set.of("TRNT", "Trades")),
    CASH_TRANSACTIONS(Set.of("CTRN", "CashTransactions")),
    OPEN_POSITIONS(Set.of("POST", "OpenPositions")),
    CORPORATE_ACTIONS(Set.of("CORP", "CorporateActions")),
    UNRECOGNIZED(Set.of());

    private final Set<String> codes;

    FlexSection(Set<String> codes) {
        this.codes = codes;
    }

    public Set<String> getCodes() {
        return codes;
    }

    public static FlexSection fromCode(String code) {
        if (code == null) {
            return UNRECOGNIZED;
        }
        String trimmed = code.trim();
        for (FlexSection section : values()) {
            if (section.codes.contains(trimmed)) {
                return section;
            }
        }
        return UNRECOGNIZED;
    }
}
