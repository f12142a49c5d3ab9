package com.flexledger.rates;

import com.flexledger.ledger.LedgerException;
import java.time.YearMonth;

/** No usable rate exists for a currency and month. Always fatal to the run. */
public final class RateUnavailableException extends LedgerException {
    private final String currency;
    private final YearMonth month;

    public RateUnavailableException(String currency, YearMonth month, String message) {
        super(message);
        this.currency = currency;
        this.month = month;
    }

    public RateUnavailableException(String currency, YearMonth month, String message, Throwable cause) {
        super(message, cause);
        this.currency = currency;
        this.month = month;
    }

    /** Currency that was requested, or {@code null} when the whole month table failed to load. */
    public String getCurrency() {
        return currency;
    }

    public YearMonth getMonth() {
        return month;
    }
}
