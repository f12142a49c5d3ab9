package com.flexledger.rates;

import java.io.IOException;
import java.io.Reader;
import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.YearMonth;
import java.util.Map;
import java.util.Objects;

/**
 * Reads previously downloaded monthly rate files ({@code monthly_csv_{year}-{month}.csv}) from a
 * local directory. Useful for offline runs and reproducible audits.
 */
public final class DirectoryRateSource implements RateSource {

    private final Path directory;

    public DirectoryRateSource(Path directory) {
        this.directory = Objects.requireNonNull(directory, "directory").toAbsolutePath().normalize();
    }

    public static String fileName(YearMonth month) {
        return "monthly_csv_" + month.getYear() + "-" + month.getMonthValue() + ".csv";
    }

    @Override
    public Map<String, BigDecimal> fetchMonth(YearMonth month) throws RateUnavailableException {
        Path file = directory.resolve(fileName(month));
        if (!Files.isRegularFile(file)) {
            throw new RateUnavailableException(null, month, "Rate file not found: " + file);
        }
        Map<String, BigDecimal> rates;
        try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            reader.mark(1);
            if (reader.read() != '\uFEFF') {
                reader.reset();
            }
            rates = MonthlyRateTable.parse(reader, file.toString());
        } catch (IOException | RuntimeException ex) {
            throw new RateUnavailableException(null, month, "Unreadable rate file: " + file, ex);
        }
        if (rates.isEmpty()) {
            throw new RateUnavailableException(null, month, "Rate file is empty: " + file);
        }
        return rates;
    }
}
