package com.flexledger.rates;

import java.io.IOException;
import java.io.Reader;
import java.math.BigDecimal;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.logging.Logger;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;

/**
 * Parser for the monthly exchange-rate CSV ({@code Currency Code}, {@code Currency Units per £1}).
 */
final class MonthlyRateTable {

    private static final Logger LOGGER = Logger.getLogger(MonthlyRateTable.class.getName());
    private static final String[] CODE_COLUMNS = {"Currency Code", "currency_code"};
    private static final String[] RATE_COLUMNS = {"Currency Units per £1", "rate"};

    private MonthlyRateTable() {}

    static Map<String, BigDecimal> parse(Reader reader, String origin) throws IOException {
        CSVFormat format =
                CSVFormat.DEFAULT.builder()
                        .setHeader()
                        .setSkipHeaderRecord(true)
                        .setIgnoreEmptyLines(true)
                        .setAllowMissingColumnNames(true)
                        .build();
        Map<String, BigDecimal> rates = new LinkedHashMap<>();
        try (CSVParser parser = new CSVParser(reader, format)) {
            for (CSVRecord record : parser) {
                String code = firstValue(record, CODE_COLUMNS);
                String rateText = firstValue(record, RATE_COLUMNS);
                if (code.isEmpty() || rateText.isEmpty()) {
                    continue;
                }
                BigDecimal rate;
                try {
                    rate = new BigDecimal(rateText.replace(",", ""));
                } catch (NumberFormatException ex) {
                    LOGGER.warning("Ignoring unparseable rate '" + rateText + "' for " + code + " in " + origin);
                    continue;
                }
                if (rate.signum() <= 0) {
                    LOGGER.warning("Ignoring non-positive rate " + rate + " for " + code + " in " + origin);
                    continue;
                }
                rates.put(code, rate);
            }
        }
        return rates;
    }

    private static String firstValue(CSVRecord record, String[] columns) {
        for (String column : columns) {
            if (record.isMapped(column) && record.isSet(column)) {
                String value = record.get(column);
                if (value != null && !value.isBlank()) {
                    return value.trim();
                }
            }
        }
        return "";
    }
}
