package com.flexledger.rates;

import java.io.IOException;
import java.io.StringReader;
import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.YearMonth;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Logger;
import org.apache.hc.client5.http.classic.methods.HttpGet;
import org.apache.hc.client5.http.config.RequestConfig;
import org.apache.hc.client5.http.impl.classic.CloseableHttpClient;
import org.apache.hc.client5.http.impl.classic.HttpClients;
import org.apache.hc.core5.http.HttpStatus;
import org.apache.hc.core5.http.io.entity.EntityUtils;
import org.apache.hc.core5.util.Timeout;

/**
 * Fetches HMRC monthly exchange rates over HTTP, one GET per month. The URL template is expanded
 * with {@code {year}} and {@code {month}} (month not zero padded).
 */
public final class HmrcRateSource implements RateSource, AutoCloseable {

    public static final String DEFAULT_URL_TEMPLATE =
            "https://www.trade-tariff.service.gov.uk/uk/api/exchange_rates/files/monthly_csv_{year}-{month}.csv";

    private static final Logger LOGGER = Logger.getLogger(HmrcRateSource.class.getName());

    private final String urlTemplate;
    private final CloseableHttpClient httpClient;

    public HmrcRateSource() {
        this(DEFAULT_URL_TEMPLATE, Duration.ofSeconds(30));
    }

    public HmrcRateSource(String urlTemplate, Duration timeout) {
        this.urlTemplate = Objects.requireNonNull(urlTemplate, "urlTemplate");
        Objects.requireNonNull(timeout, "timeout");
        RequestConfig requestConfig =
                RequestConfig.custom()
                        .setConnectionRequestTimeout(Timeout.ofMilliseconds(timeout.toMillis()))
                        .setResponseTimeout(Timeout.ofMilliseconds(timeout.toMillis()))
                        .build();
        this.httpClient = HttpClients.custom().setDefaultRequestConfig(requestConfig).build();
    }

    static String expand(String template, YearMonth month) {
        return template.replace("{year}", Integer.toString(month.getYear()))
                .replace("{month}", Integer.toString(month.getMonthValue()));
    }

    @Override
    public Map<String, BigDecimal> fetchMonth(YearMonth month) throws RateUnavailableException {
        String url = expand(urlTemplate, month);
        LOGGER.fine(() -> "Fetching monthly rates from " + url);
        String body;
        try {
            body =
                    httpClient.execute(
                            new HttpGet(url),
                            response -> {
                                if (response.getCode() != HttpStatus.SC_OK) {
                                    throw new IOException("HTTP " + response.getCode() + " from " + url);
                                }
                                return EntityUtils.toString(response.getEntity(), StandardCharsets.UTF_8);
                            });
        } catch (IOException ex) {
            throw new RateUnavailableException(
                    null, month, "Failed to fetch rates for " + month + ": " + ex.getMessage(), ex);
        }
        Map<String, BigDecimal> rates;
        try {
            rates = MonthlyRateTable.parse(new StringReader(stripBom(body)), url);
        } catch (IOException | RuntimeException ex) {
            throw new RateUnavailableException(null, month, "Unreadable rate table at " + url, ex);
        }
        if (rates.isEmpty()) {
            throw new RateUnavailableException(null, month, "Rate table at " + url + " is empty");
        }
        return rates;
    }

    private static String stripBom(String text) {
        return !text.isEmpty() && text.charAt(0) == '\uFEFF' ? text.substring(1) : text;
    }

    @Override
    public void close() throws IOException {
        httpClient.close();
    }
}
