package com.flexledger.loader;

import com.flexledger.ledger.LedgerMessage;
import com.flexledger.ledger.SecondaryMovement;
import java.io.IOException;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.logging.Logger;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;

/**
 * Reads pre-classified owner's loan movements from a {@code Date,Amount,Direction} CSV. The
 * direction column accepts {@code IN}/{@code RECEIVED} and {@code OUT}/{@code RETURNED}; amounts
 * are already in the reporting currency.
 */
public final class SecondaryLedgerCsvLoader {

    private static final Logger LOGGER = Logger.getLogger(SecondaryLedgerCsvLoader.class.getName());

    public List<SecondaryMovement> load(Path csvPath, List<LedgerMessage> messages) throws LoaderException {
        Objects.requireNonNull(csvPath, "csvPath");
        Objects.requireNonNull(messages, "messages");
        Path file = csvPath.toAbsolutePath().normalize();
        CSVFormat format =
                CSVFormat.DEFAULT.builder()
                        .setHeader()
                        .setSkipHeaderRecord(true)
                        .setIgnoreEmptyLines(true)
                        .setTrim(true)
                        .build();
        List<SecondaryMovement> movements = new ArrayList<>();
        try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8);
                CSVParser parser = new CSVParser(reader, format)) {
            if (!parser.getHeaderMap().containsKey("Date")
                    || !parser.getHeaderMap().containsKey("Amount")
                    || !parser.getHeaderMap().containsKey("Direction")) {
                throw new LoaderException("Owner's loan file must have Date, Amount, Direction columns: " + file);
            }
            for (CSVRecord record : parser) {
                int rowNumber = Math.toIntExact(record.getRecordNumber());
                try {
                    SecondaryMovement.Flow flow = parseFlow(record.get("Direction"));
                    if (flow == null) {
                        warn(messages, "Unrecognized direction '" + record.get("Direction") + "'", file, rowNumber);
                        continue;
                    }
                    BigDecimal amount = DecimalParser.parse(record.get("Amount"));
                    if (amount.signum() == 0) {
                        continue;
                    }
                    LocalDate date = FlexDates.parse(record.get("Date"));
                    String reference = record.isMapped("Account") ? record.get("Account") : "";
                    movements.add(new SecondaryMovement(date, amount, flow, reference));
                } catch (NumberFormatException | DateTimeParseException ex) {
                    warn(messages, "Could not parse owner's loan row: " + ex.getMessage(), file, rowNumber);
                }
            }
        } catch (IOException | UncheckedIOException ex) {
            throw new LoaderException("Failed to read owner's loan file: " + file, ex);
        }
        return movements;
    }

    static SecondaryMovement.Flow parseFlow(String text) {
        if (text == null) {
            return null;
        }
        return switch (text.trim().toUpperCase(Locale.ROOT)) {
            case "IN", "RECEIVED", "FUNDS_RECEIVED" -> SecondaryMovement.Flow.FUNDS_RECEIVED;
            case "OUT", "RETURNED", "FUNDS_RETURNED" -> SecondaryMovement.Flow.FUNDS_RETURNED;
            default -> null;
        };
    }

    private static void warn(List<LedgerMessage> messages, String message, Path file, int rowNumber) {
        LOGGER.warning(message + " (" + file + " row " + rowNumber + ")");
        messages.add(LedgerMessage.warning(message, file.toString(), rowNumber));
    }
}
