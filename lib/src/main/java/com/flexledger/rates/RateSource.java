package com.flexledger.rates;

import java.math.BigDecimal;
import java.time.YearMonth;
import java.util.Map;

/**
 * Upstream table of monthly rates expressed as units of each currency per one unit of the
 * source's base currency. HMRC publishes against sterling, so the base defaults to GBP.
 */
public interface RateSource {

    String HMRC_BASE_CURRENCY = "GBP";

    /**
     * Fetches every rate published for {@code month}. Implementations block until the table is
     * available and never retry; an unreachable or empty table is a {@link RateUnavailableException}.
     */
    Map<String, BigDecimal> fetchMonth(YearMonth month) throws RateUnavailableException;

    /** Currency the published rates are quoted against; it has no row of its own. */
    default String getBaseCurrency() {
        return HMRC_BASE_CURRENCY;
    }
}
