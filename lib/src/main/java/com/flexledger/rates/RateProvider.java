package com.flexledger.rates;

import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;
import java.time.LocalDate;
import java.time.YearMonth;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.logging.Logger;

/**
 * Resolves conversion rates for one run. Each month's table is fetched at most once and kept for
 * the life of this instance; nothing is persisted between runs.
 *
 * <p>Rates are foreign units per reporting unit, so converting into the reporting currency
 * divides by the rate. When the reporting currency is not the source's base currency, rates are
 * crossed through the base: {@code rate(ccy) = table[ccy] / table[reporting]}, and the base itself
 * is {@code 1 / table[reporting]}.
 */
public final class RateProvider {

    private static final Logger LOGGER = Logger.getLogger(RateProvider.class.getName());

    private final RateSource source;
    private final String reportingCurrency;
    private final String baseCurrency;
    private final int scale;
    private final Map<YearMonth, Map<String, BigDecimal>> monthTables = new ConcurrentHashMap<>();

    public RateProvider(RateSource source, String reportingCurrency, int scale) {
        this.source = Objects.requireNonNull(source, "source");
        this.reportingCurrency =
                Objects.requireNonNull(reportingCurrency, "reportingCurrency").toUpperCase(Locale.ROOT);
        this.baseCurrency = Objects.requireNonNull(source.getBaseCurrency(), "baseCurrency").toUpperCase(Locale.ROOT);
        if (scale < 0) {
            throw new IllegalArgumentException("scale must be non-negative");
        }
        this.scale = scale;
    }

    public String getReportingCurrency() {
        return reportingCurrency;
    }

    public BigDecimal rate(String currency, LocalDate date) throws RateUnavailableException {
        Objects.requireNonNull(currency, "currency");
        Objects.requireNonNull(date, "date");
        String code = currency.trim().toUpperCase(Locale.ROOT);
        if (code.equals(reportingCurrency)) {
            return BigDecimal.ONE;
        }
        YearMonth month = YearMonth.from(date);
        Map<String, BigDecimal> table = monthTable(month);
        if (reportingCurrency.equals(baseCurrency)) {
            return lookup(table, code, month);
        }
        BigDecimal reportingRate = lookup(table, reportingCurrency, month);
        BigDecimal baseRate = code.equals(baseCurrency) ? BigDecimal.ONE : lookup(table, code, month);
        return baseRate.divide(reportingRate, MathContext.DECIMAL128);
    }

    private static BigDecimal lookup(Map<String, BigDecimal> table, String code, YearMonth month)
            throws RateUnavailableException {
        BigDecimal rate = table.get(code);
        if (rate == null) {
            throw new RateUnavailableException(code, month, "No rate for " + code + " in " + month);
        }
        return rate;
    }

    public BigDecimal toReporting(BigDecimal amount, String currency, LocalDate date)
            throws RateUnavailableException {
        BigDecimal rate = rate(currency, date);
        return amount.divide(rate, scale + 10, RoundingMode.HALF_UP).setScale(scale, RoundingMode.HALF_UP);
    }

    public BigDecimal fromReporting(BigDecimal amount, String currency, LocalDate date)
            throws RateUnavailableException {
        return amount.multiply(rate(currency, date)).setScale(scale, RoundingMode.HALF_UP);
    }

    /** Number of month tables fetched so far. */
    public int cachedMonthCount() {
        return monthTables.size();
    }

    private Map<String, BigDecimal> monthTable(YearMonth month) throws RateUnavailableException {
        Map<String, BigDecimal> table = monthTables.get(month);
        if (table != null) {
            return table;
        }
        // The fetch may throw, so it stays outside computeIfAbsent.
        Map<String, BigDecimal> fetched = Map.copyOf(source.fetchMonth(month));
        LOGGER.fine(() -> "Loaded " + fetched.size() + " rates for " + month);
        Map<String, BigDecimal> existing = monthTables.putIfAbsent(month, fetched);
        return existing != null ? existing : fetched;
    }
}
