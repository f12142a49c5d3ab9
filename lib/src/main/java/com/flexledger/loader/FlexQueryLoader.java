package com.flexledger.loader;

import com.flexledger.ledger.CashKind;
import com.flexledger.ledger.CashMovement;
import com.flexledger.ledger.Direction;
import com.flexledger.ledger.InstrumentClass;
import com.flexledger.ledger.LedgerData;
import com.flexledger.ledger.LedgerMessage;
import com.flexledger.ledger.PositionSnapshot;
import com.flexledger.ledger.Trade;
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
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.logging.Logger;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;

/**
 * Reads a sectioned Flex Query CSV export into typed records.
 *
 * <p>Every row names its own section: {@code "HEADER","TRNT",col,...} declares the columns of the
 * trades section and {@code "DATA","TRNT",val,...} carries one trade. Rows are routed by that
 * declared code only, never by their position in the file.
 */
public final class FlexQueryLoader {

    private static final Logger LOGGER = Logger.getLogger(FlexQueryLoader.class.getName());
    private static final Set<String> STRUCTURAL_MARKERS = Set.of("BOF", "EOF", "BOA", "EOA", "BOS", "EOS");
    private static final int FIRST_FIELD_COLUMN = 2;

    public LoaderResult load(Path exportPath) throws LoaderException {
        Objects.requireNonNull(exportPath, "exportPath");
        Path file = exportPath.toAbsolutePath().normalize();
        if (!Files.isRegularFile(file)) {
            throw new LoaderException("Export file not found: " + file);
        }
        try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            return load(reader, file.toString());
        } catch (IOException ex) {
            throw new LoaderException("Failed to read export: " + file, ex);
        }
    }

    public LoaderResult load(Reader reader, String sourceName) throws LoaderException {
        Objects.requireNonNull(reader, "reader");
        LoaderState state = new LoaderState(sourceName);
        CSVFormat format = CSVFormat.DEFAULT.builder().setIgnoreEmptyLines(true).setTrim(true).build();
        try (CSVParser parser = new CSVParser(reader, format)) {
            for (CSVRecord record : parser) {
                processRecord(record, state);
            }
        } catch (IOException | UncheckedIOException ex) {
            throw new LoaderException("Failed to parse export: " + sourceName, ex);
        }
        if (state.headers.isEmpty()) {
            throw new LoaderException(
                    "No HEADER rows found in " + sourceName + "; expected a sectioned Flex Query export");
        }
        if (!state.declaredSections.contains(FlexSection.TRADES)) {
            throw new LoaderException("Required trades section (TRNT) is missing from " + sourceName);
        }
        if (state.skippedUnrecognized > 0) {
            state.messages.add(
                    LedgerMessage.info(
                            state.skippedUnrecognized + " rows of unrecognized sections skipped"));
        }
        if (state.corporateActionCount > 0) {
            state.messages.add(
                    LedgerMessage.info(
                            state.corporateActionCount
                                    + " corporate action rows recognized but not posted"));
        }
        LedgerData data =
                new LedgerData(
                        sourceName,
                        state.trades,
                        state.cashMovements,
                        state.positions,
                        state.declaredSections.contains(FlexSection.OPEN_POSITIONS),
                        state.corporateActionCount);
        LOGGER.info(
                () ->
                        "Loaded " + data.getTrades().size() + " trades, "
                                + data.getCashMovements().size() + " cash transactions, "
                                + data.getPositions().size() + " positions from " + sourceName);
        return new LoaderResult(data, state.messages);
    }

    private void processRecord(CSVRecord record, LoaderState state) throws LoaderException {
        int rowNumber = Math.toIntExact(record.getRecordNumber());
        String lineType = stripBom(record.get(0));
        if (STRUCTURAL_MARKERS.contains(lineType)) {
            return;
        }
        if (record.size() < 3) {
            state.warn("Row has fewer than three columns", rowNumber);
            return;
        }
        String sectionCode = record.get(1);
        if ("HEADER".equals(lineType)) {
            declareHeader(sectionCode, record, rowNumber, state);
        } else if ("DATA".equals(lineType)) {
            List<String> header = state.headers.get(sectionCode);
            if (header == null) {
                throw new LoaderException(
                        "DATA row for section '" + sectionCode + "' precedes its HEADER ("
                                + state.sourceName + " row " + rowNumber + ")");
            }
            routeRow(new FlexRow(FlexSection.fromCode(sectionCode), rowNumber, toMap(header, record)), state);
        } else {
            state.warn("Unknown row type '" + lineType + "'", rowNumber);
        }
    }

    private void declareHeader(String sectionCode, CSVRecord record, int rowNumber, LoaderState state) {
        List<String> columns = new ArrayList<>();
        for (int i = FIRST_FIELD_COLUMN; i < record.size(); i++) {
            columns.add(record.get(i));
        }
        state.headers.put(sectionCode, columns);
        FlexSection section = FlexSection.fromCode(sectionCode);
        state.declaredSections.add(section);
        if (section == FlexSection.UNRECOGNIZED) {
            state.warn("Unrecognized section '" + sectionCode + "'; its rows will be skipped", rowNumber);
        }
    }

    private static Map<String, String> toMap(List<String> header, CSVRecord record) {
        Map<String, String> values = new HashMap<>();
        for (int i = 0; i < header.size(); i++) {
            int column = i + FIRST_FIELD_COLUMN;
            if (column < record.size()) {
                values.put(header.get(i), record.get(column));
            }
        }
        return values;
    }

    private void routeRow(FlexRow row, LoaderState state) {
        switch (row.getSection()) {
            case TRADES -> parseTrade(row, state);
            case CASH_TRANSACTIONS -> parseCashMovement(row, state);
            case OPEN_POSITIONS -> parsePosition(row, state);
            case CORPORATE_ACTIONS -> state.corporateActionCount++;
            case UNRECOGNIZED -> state.skippedUnrecognized++;
        }
    }

    private void parseTrade(FlexRow row, LoaderState state) {
        String symbol = row.first("Symbol", "symbol");
        if (symbol.isEmpty()) {
            state.warn("Trade without symbol skipped", row.getRowNumber());
            return;
        }
        String classTag = row.first("AssetClass", "assetClass", "Asset Category");
        InstrumentClass instrumentClass = InstrumentClass.fromCode(classTag);
        if (instrumentClass == null) {
            state.warn(
                    classTag.isEmpty()
                            ? "Trade " + symbol + " has no instrument class tag; skipped"
                            : "Trade " + symbol + " has unrecognized instrument class '" + classTag + "'; skipped",
                    row.getRowNumber());
            return;
        }
        String buySell = row.first("Buy/Sell", "BuySell", "Side");
        Direction direction = Direction.fromBuySell(buySell);
        if (direction == null) {
            state.warn("Trade " + symbol + " has unrecognized buy/sell '" + buySell + "'; skipped", row.getRowNumber());
            return;
        }
        String currency = row.first("CurrencyPrimary", "Currency", "currency");
        if (currency.isEmpty()) {
            state.warn("Trade " + symbol + " has no currency; skipped", row.getRowNumber());
            return;
        }
        String dateText = row.first("TradeDate", "Trade Date", "DateTime", "Date/Time", "Date");
        if (dateText.isEmpty()) {
            state.warn("Trade " + symbol + " has no date; skipped", row.getRowNumber());
            return;
        }
        try {
            LocalDate date = FlexDates.parse(dateText);
            BigDecimal quantity = DecimalParser.parse(row.first("Quantity", "quantity")).abs();
            if (quantity.signum() == 0) {
                state.warn("Trade " + symbol + " has zero quantity; skipped", row.getRowNumber());
                return;
            }
            BigDecimal proceeds = DecimalParser.parse(row.first("Proceeds", "proceeds")).abs();
            BigDecimal commission =
                    DecimalParser.parse(row.first("IBCommission", "Commission", "commission")).abs();
            state.trades.add(
                    new Trade(
                            row.getRowNumber(),
                            date,
                            symbol,
                            row.first("Description", "description"),
                            instrumentClass,
                            direction,
                            quantity,
                            proceeds,
                            commission,
                            currency));
        } catch (NumberFormatException | DateTimeParseException ex) {
            state.warn("Could not parse trade row: " + ex.getMessage(), row.getRowNumber());
        }
    }

    private void parseCashMovement(FlexRow row, LoaderState state) {
        String dateText = row.first("Date", "DateTime", "Date/Time", "SettleDate", "ReportDate");
        if (dateText.isEmpty()) {
            state.warn("Cash transaction has no date; skipped", row.getRowNumber());
            return;
        }
        String currency = row.first("CurrencyPrimary", "Currency", "currency");
        if (currency.isEmpty()) {
            state.warn("Cash transaction has no currency; skipped", row.getRowNumber());
            return;
        }
        try {
            LocalDate date = FlexDates.parse(dateText);
            BigDecimal amount = DecimalParser.parse(row.first("Amount", "amount"));
            if (amount.signum() == 0) {
                return;
            }
            String type = row.first("Type", "type");
            CashKind kind = CashClassifier.classify(type);
            state.cashMovements.add(
                    new CashMovement(
                            row.getRowNumber(),
                            date,
                            type,
                            kind,
                            row.first("Symbol", "symbol"),
                            row.first("Description", "description"),
                            amount,
                            currency));
        } catch (NumberFormatException | DateTimeParseException ex) {
            state.warn("Could not parse cash transaction: " + ex.getMessage(), row.getRowNumber());
        }
    }

    private void parsePosition(FlexRow row, LoaderState state) {
        String symbol = row.first("Symbol", "symbol");
        try {
            BigDecimal quantity = DecimalParser.parse(row.first("Quantity", "Position"));
            if (symbol.isEmpty() || quantity.signum() == 0) {
                return;
            }
            state.positions.add(
                    new PositionSnapshot(
                            symbol,
                            row.first("Description", "description"),
                            quantity,
                            DecimalParser.parse(row.first("CostBasisMoney", "CostBasis")),
                            DecimalParser.parse(row.first("PositionValue", "MarkToMarketValue", "MarketValue")),
                            row.first("CurrencyPrimary", "Currency")));
        } catch (NumberFormatException ex) {
            state.warn("Could not parse position: " + ex.getMessage(), row.getRowNumber());
        }
    }

    private static String stripBom(String value) {
        if (!value.isEmpty() && value.charAt(0) == '\uFEFF') {
            return value.substring(1).trim();
        }
        return value.trim();
    }

    private static final class LoaderState {
        private final String sourceName;
        private final Map<String, List<String>> headers = new HashMap<>();
        private final Set<FlexSection> declaredSections = new LinkedHashSet<>();
        private final List<Trade> trades = new ArrayList<>();
        private final List<CashMovement> cashMovements = new ArrayList<>();
        private final List<PositionSnapshot> positions = new ArrayList<>();
        private final List<LedgerMessage> messages = new ArrayList<>();
        private int corporateActionCount;
        private int skippedUnrecognized;

        LoaderState(String sourceName) {
            this.sourceName = sourceName;
        }

        void warn(String message, int rowNumber) {
            LOGGER.warning(message + " (" + sourceName + " row " + rowNumber + ")");
            messages.add(LedgerMessage.warning(message, sourceName, rowNumber));
        }
    }
}
