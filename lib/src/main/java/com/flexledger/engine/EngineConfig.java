package com.flexledger.engine;

import com.flexledger.inventory.BookingMethod;
import com.flexledger.journal.TransactionCostPolicy;
import com.flexledger.rates.HmrcRateSource;
import com.flexledger.rates.RateSource;
import java.math.BigDecimal;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.Locale;
import java.util.Objects;
import java.util.Properties;

/**
 * Settings for one engine run. Instances are immutable; use {@link #builder()} or
 * {@link #fromProperties(Properties)}, which reads the same keys the JDBC URL accepts.
 */
public final class EngineConfig {

    public static final String PERIOD_END = "periodEnd";
    public static final String REPORTING_CURRENCY = "reportingCurrency";
    public static final String RATE_URL_TEMPLATE = "rateUrlTemplate";
    public static final String RATE_DIRECTORY = "rateDirectory";
    public static final String TRANSACTION_COST_POLICY = "transactionCostPolicy";
    public static final String BOOKING_METHOD = "bookingMethod";
    public static final String BALANCE_TOLERANCE = "balanceTolerance";
    public static final String OWNERS_LOAN = "ownersLoan";

    private static final String RATES_URL_PROPERTY = "flexledger.rates.url";
    private static final String RATES_DIR_PROPERTY = "flexledger.rates.dir";
    /** Environment fallbacks; system properties win. */
    private static final String RATES_URL_ENV = "FLEXLEDGER_RATES_URL";
    private static final String RATES_DIR_ENV = "FLEXLEDGER_RATES_DIR";

    private final String reportingCurrency;
    private final int scale;
    private final BigDecimal balanceTolerance;
    private final LocalDate periodEnd;
    private final String rateUrlTemplate;
    private final Path rateDirectory;
    private final RateSource rateSource;
    private final Duration rateTimeout;
    private final TransactionCostPolicy transactionCostPolicy;
    private final BookingMethod bookingMethod;
    private final Path ownersLoan;

    private EngineConfig(Builder builder) {
        this.reportingCurrency = builder.reportingCurrency.trim().toUpperCase(Locale.ROOT);
        this.scale = builder.scale;
        this.balanceTolerance = builder.balanceTolerance;
        this.periodEnd = builder.periodEnd;
        this.rateUrlTemplate = builder.rateUrlTemplate;
        this.rateDirectory = builder.rateDirectory;
        this.rateSource = builder.rateSource;
        this.rateTimeout = builder.rateTimeout;
        this.transactionCostPolicy = builder.transactionCostPolicy;
        this.bookingMethod = builder.bookingMethod;
        this.ownersLoan = builder.ownersLoan;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static EngineConfig defaults() {
        return builder().build();
    }

    /**
     * Reads configuration keys from {@code properties}. When neither a rate directory nor a URL
     * template is given, the {@code flexledger.rates.dir} / {@code flexledger.rates.url} system
     * properties and then their environment variables are consulted.
     *
     * @throws IllegalArgumentException when a value cannot be parsed
     */
    public static EngineConfig fromProperties(Properties properties) {
        Properties props = properties == null ? new Properties() : properties;
        Builder builder = builder();
        String currency = trimToNull(props.getProperty(REPORTING_CURRENCY));
        if (currency != null) {
            builder.reportingCurrency(currency);
        }
        String periodEnd = trimToNull(props.getProperty(PERIOD_END));
        if (periodEnd != null) {
            try {
                builder.periodEnd(LocalDate.parse(periodEnd));
            } catch (DateTimeParseException ex) {
                throw new IllegalArgumentException("Invalid " + PERIOD_END + ": " + periodEnd, ex);
            }
        }
        String policy = trimToNull(props.getProperty(TRANSACTION_COST_POLICY));
        if (policy != null) {
            TransactionCostPolicy parsed = TransactionCostPolicy.fromString(policy);
            if (parsed == null) {
                throw new IllegalArgumentException("Invalid " + TRANSACTION_COST_POLICY + ": " + policy);
            }
            builder.transactionCostPolicy(parsed);
        }
        String booking = trimToNull(props.getProperty(BOOKING_METHOD));
        if (booking != null) {
            BookingMethod parsed = BookingMethod.fromString(booking);
            if (parsed == null) {
                throw new IllegalArgumentException("Invalid " + BOOKING_METHOD + ": " + booking);
            }
            builder.bookingMethod(parsed);
        }
        String tolerance = trimToNull(props.getProperty(BALANCE_TOLERANCE));
        if (tolerance != null) {
            try {
                builder.balanceTolerance(new BigDecimal(tolerance));
            } catch (NumberFormatException ex) {
                throw new IllegalArgumentException("Invalid " + BALANCE_TOLERANCE + ": " + tolerance, ex);
            }
        }
        String ownersLoan = trimToNull(props.getProperty(OWNERS_LOAN));
        if (ownersLoan != null) {
            builder.ownersLoan(Paths.get(ownersLoan));
        }

        String rateDirectory = trimToNull(props.getProperty(RATE_DIRECTORY));
        String rateUrl = trimToNull(props.getProperty(RATE_URL_TEMPLATE));
        if (rateDirectory == null && rateUrl == null) {
            rateDirectory = fallback(RATES_DIR_PROPERTY, RATES_DIR_ENV);
            rateUrl = fallback(RATES_URL_PROPERTY, RATES_URL_ENV);
        }
        if (rateDirectory != null) {
            builder.rateDirectory(Paths.get(rateDirectory));
        }
        if (rateUrl != null) {
            builder.rateUrlTemplate(rateUrl);
        }
        return builder.build();
    }

    private static String fallback(String property, String env) {
        String value = trimToNull(System.getProperty(property));
        if (value != null) {
            return value;
        }
        return trimToNull(System.getenv(env));
    }

    private static String trimToNull(String value) {
        if (value == null) {
            return null;
        }
        String trimmed = value.trim();
        return trimmed.isEmpty() ? null : trimmed;
    }

    public String getReportingCurrency() {
        return reportingCurrency;
    }

    /** Decimal places of every posted amount. */
    public int getScale() {
        return scale;
    }

    public BigDecimal getBalanceTolerance() {
        return balanceTolerance;
    }

    /** Inclusive cut-off date, or {@code null} to post everything. */
    public LocalDate getPeriodEnd() {
        return periodEnd;
    }

    public String getRateUrlTemplate() {
        return rateUrlTemplate;
    }

    public Path getRateDirectory() {
        return rateDirectory;
    }

    /** Explicit rate source, overriding the directory and URL settings. May be {@code null}. */
    public RateSource getRateSource() {
        return rateSource;
    }

    public Duration getRateTimeout() {
        return rateTimeout;
    }

    public TransactionCostPolicy getTransactionCostPolicy() {
        return transactionCostPolicy;
    }

    public BookingMethod getBookingMethod() {
        return bookingMethod;
    }

    public Path getOwnersLoan() {
        return ownersLoan;
    }

    public static final class Builder {
        private String reportingCurrency = "GBP";
        private int scale = 2;
        private BigDecimal balanceTolerance = new BigDecimal("0.01");
        private LocalDate periodEnd;
        private String rateUrlTemplate = HmrcRateSource.DEFAULT_URL_TEMPLATE;
        private Path rateDirectory;
        private RateSource rateSource;
        private Duration rateTimeout = Duration.ofSeconds(30);
        private TransactionCostPolicy transactionCostPolicy = TransactionCostPolicy.CAPITALIZE;
        private BookingMethod bookingMethod = BookingMethod.FIFO;
        private Path ownersLoan;

        private Builder() {}

        public Builder reportingCurrency(String reportingCurrency) {
            this.reportingCurrency = Objects.requireNonNull(reportingCurrency, "reportingCurrency");
            return this;
        }

        public Builder scale(int scale) {
            if (scale < 0) {
                throw new IllegalArgumentException("scale must be non-negative");
            }
            this.scale = scale;
            return this;
        }

        public Builder balanceTolerance(BigDecimal balanceTolerance) {
            Objects.requireNonNull(balanceTolerance, "balanceTolerance");
            if (balanceTolerance.signum() < 0) {
                throw new IllegalArgumentException("balanceTolerance must be non-negative");
            }
            this.balanceTolerance = balanceTolerance;
            return this;
        }

        public Builder periodEnd(LocalDate periodEnd) {
            this.periodEnd = periodEnd;
            return this;
        }

        public Builder rateUrlTemplate(String rateUrlTemplate) {
            this.rateUrlTemplate = Objects.requireNonNull(rateUrlTemplate, "rateUrlTemplate");
            return this;
        }

        public Builder rateDirectory(Path rateDirectory) {
            this.rateDirectory = rateDirectory;
            return this;
        }

        public Builder rateSource(RateSource rateSource) {
            this.rateSource = rateSource;
            return this;
        }

        public Builder rateTimeout(Duration rateTimeout) {
            this.rateTimeout = Objects.requireNonNull(rateTimeout, "rateTimeout");
            return this;
        }

        public Builder transactionCostPolicy(TransactionCostPolicy transactionCostPolicy) {
            this.transactionCostPolicy = Objects.requireNonNull(transactionCostPolicy, "transactionCostPolicy");
            return this;
        }

        public Builder bookingMethod(BookingMethod bookingMethod) {
            this.bookingMethod = Objects.requireNonNull(bookingMethod, "bookingMethod");
            return this;
        }

        public Builder ownersLoan(Path ownersLoan) {
            this.ownersLoan = ownersLoan;
            return this;
        }

        public EngineConfig build() {
            return new EngineConfig(this);
        }
    }
}
