package com.flexledger.ledger;

import java.util.Locale;

/**
 * Closed set of tradable instrument classes together with their posting policy: which accounts
 * take realized gains and losses, and whether open lots belong in the holdings schedule. Adding
 * a class means adding a row here; no branching on the class happens elsewhere.
 */
public enum InstrumentClass {
    EQUITY("STK", Account.REALIZED_GAINS, Account.REALIZED_LOSSES, true),
    OPTION("OPT", Account.REALIZED_GAINS, Account.REALIZED_LOSSES, true),
    CURRENCY_CONVERSION("CASH", Account.FX_GAINS, Account.FX_LOSSES, false),
    DIGITAL_ASSET("CRYPTO", Account.REALIZED_GAINS, Account.REALIZED_LOSSES, false);

    private final String code;
    private final Account gainAccount;
    private final Account lossAccount;
    private final boolean inHoldingsSchedule;

    InstrumentClass(String code, Account gainAccount, Account lossAccount, boolean inHoldingsSchedule) {
        this.code = code;
        this.gainAccount = gainAccount;
        this.lossAccount = lossAccount;
        this.inHoldingsSchedule = inHoldingsSchedule;
    }

    /** Asset class tag as it appears in the export, e.g. {@code STK}. */
    public String getCode() {
        return code;
    }

    public Account getGainAccount() {
        return gainAccount;
    }

    public Account getLossAccount() {
        return lossAccount;
    }

    public boolean isInHoldingsSchedule() {
        return inHoldingsSchedule;
    }

    /** Returns the class for an export tag, or {@code null} when the tag is blank or unknown. */
    public static InstrumentClass fromCode(String value) {
        if (value == null) {
            return null;
        }
        String normalized = value.trim().toUpperCase(Locale.ROOT);
        for (InstrumentClass instrumentClass : values()) {
            if (instrumentClass.code.equals(normalized)) {
                return instrumentClass;
            }
        }
        return null;
    }
}
