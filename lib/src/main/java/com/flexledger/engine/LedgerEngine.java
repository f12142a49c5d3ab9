package com.flexledger.engine;

import com.flexledger.inventory.LotLedger;
import com.flexledger.inventory.TradeSequencer;
import com.flexledger.journal.Journal;
import com.flexledger.journal.JournalEngine;
import com.flexledger.ledger.CashMovement;
import com.flexledger.ledger.LedgerData;
import com.flexledger.ledger.LedgerException;
import com.flexledger.ledger.LedgerMessage;
import com.flexledger.ledger.SecondaryMovement;
import com.flexledger.ledger.Trade;
import com.flexledger.loader.FlexQueryLoader;
import com.flexledger.loader.LoaderException;
import com.flexledger.loader.LoaderResult;
import com.flexledger.loader.SecondaryLedgerCsvLoader;
import com.flexledger.rates.DirectoryRateSource;
import com.flexledger.rates.HmrcRateSource;
import com.flexledger.rates.RateProvider;
import com.flexledger.rates.RateSource;
import com.flexledger.rates.RateUnavailableException;
import com.flexledger.trialbalance.HoldingsSchedule;
import com.flexledger.trialbalance.TrialBalance;
import com.flexledger.trialbalance.TrialBalanceAggregator;
import java.io.IOException;
import java.nio.file.Path;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.function.Function;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Runs the whole pipeline for one export: load, sequence, post, aggregate.
 *
 * <p>Each call to {@code run} starts from an empty rate cache, lot ledger and journal, so results
 * depend only on the input and the configuration. Trades are posted first, in sequenced order,
 * then cash movements and owner's loan movements, each by date with input order kept for ties.
 */
public final class LedgerEngine {

    private static final Logger LOGGER = Logger.getLogger(LedgerEngine.class.getName());

    private final EngineConfig config;
    private final FlexQueryLoader loader = new FlexQueryLoader();
    private final SecondaryLedgerCsvLoader secondaryLoader = new SecondaryLedgerCsvLoader();

    public LedgerEngine(EngineConfig config) {
        this.config = Objects.requireNonNull(config, "config");
    }

    public EngineConfig getConfig() {
        return config;
    }

    /**
     * Loads the export, and the owner's loan file when one is configured, then posts both.
     *
     * @throws LoaderException when an input cannot be read as a ledger
     * @throws RateUnavailableException when a conversion rate cannot be resolved
     */
    public RunResult run(Path exportPath) throws LedgerException {
        LoaderResult loaded = loader.load(exportPath);
        List<LedgerMessage> messages = new ArrayList<>(loaded.getMessages());
        List<SecondaryMovement> secondary = List.of();
        if (config.getOwnersLoan() != null) {
            secondary = secondaryLoader.load(config.getOwnersLoan(), messages);
        }
        return post(loaded.getLedgerData(), secondary, messages);
    }

    public RunResult run(LedgerData data) throws RateUnavailableException {
        return run(data, List.of());
    }

    public RunResult run(LedgerData data, List<SecondaryMovement> secondary) throws RateUnavailableException {
        Objects.requireNonNull(data, "data");
        Objects.requireNonNull(secondary, "secondary");
        return post(data, secondary, new ArrayList<>());
    }

    private RunResult post(LedgerData data, List<SecondaryMovement> secondary, List<LedgerMessage> messages)
            throws RateUnavailableException {
        LocalDate periodEnd = config.getPeriodEnd();
        List<Trade> trades = withinPeriod(data.getTrades(), Trade::getDate, periodEnd);
        List<CashMovement> cash = withinPeriod(data.getCashMovements(), CashMovement::getDate, periodEnd);
        List<SecondaryMovement> loans = withinPeriod(secondary, SecondaryMovement::getDate, periodEnd);
        int excluded =
                data.getTrades().size() - trades.size()
                        + data.getCashMovements().size() - cash.size()
                        + secondary.size() - loans.size();
        if (excluded > 0) {
            messages.add(LedgerMessage.info(excluded + " records dated after " + periodEnd + " excluded"));
        }
        cash.sort(Comparator.comparing(CashMovement::getDate));
        loans.sort(Comparator.comparing(SecondaryMovement::getDate));

        HmrcRateSource httpSource = null;
        RateSource source = config.getRateSource();
        if (source == null) {
            if (config.getRateDirectory() != null) {
                source = new DirectoryRateSource(config.getRateDirectory());
            } else {
                httpSource = new HmrcRateSource(config.getRateUrlTemplate(), config.getRateTimeout());
                source = httpSource;
            }
        }
        RateProvider rates = new RateProvider(source, config.getReportingCurrency(), config.getScale());
        LotLedger lots = new LotLedger(config.getBookingMethod(), config.getScale());
        Journal journal = new Journal();
        JournalEngine journalEngine =
                new JournalEngine(
                        rates,
                        lots,
                        config.getTransactionCostPolicy(),
                        journal,
                        messages,
                        data.getSourceName(),
                        config.getScale());
        try {
            for (Trade trade : TradeSequencer.sequence(trades)) {
                journalEngine.postTrade(trade);
            }
            for (CashMovement movement : cash) {
                journalEngine.postCashMovement(movement);
            }
            for (SecondaryMovement movement : loans) {
                journalEngine.postSecondary(movement);
            }
        } finally {
            if (httpSource != null) {
                closeQuietly(httpSource);
            }
        }
        LOGGER.fine(() -> "Resolved rates for " + rates.cachedMonthCount() + " months");

        TrialBalanceAggregator aggregator = new TrialBalanceAggregator(config.getBalanceTolerance());
        TrialBalance trialBalance = aggregator.aggregate(journal.getPostings());
        HoldingsSchedule holdings =
                aggregator.holdings(lots, data.getPositions(), data.isPositionsReported(), trialBalance);
        RunStatus status = assess(trialBalance, messages);
        LOGGER.info(
                () ->
                        "Posted " + journal.getEntries().size() + " entries ("
                                + journal.getPostings().size() + " postings) from " + data.getSourceName()
                                + ": " + status);
        return new RunResult(
                data.getSourceName(),
                status,
                trialBalance,
                holdings,
                journal.getEntries(),
                journal.getPostings(),
                lots.openLots(),
                messages);
    }

    /** Decides the run outcome; an unbalanced trial balance also records an ERROR message. */
    static RunStatus assess(TrialBalance trialBalance, List<LedgerMessage> messages) {
        if (trialBalance.isBalanced()) {
            return RunStatus.BALANCED;
        }
        String message =
                "Trial balance does not balance: debits " + trialBalance.getTotalDebits()
                        + ", credits " + trialBalance.getTotalCredits()
                        + ", difference " + trialBalance.getDifference();
        LOGGER.severe(message);
        messages.add(LedgerMessage.error(message));
        return RunStatus.UNBALANCED;
    }

    private static <T> List<T> withinPeriod(List<T> records, Function<T, LocalDate> date, LocalDate periodEnd) {
        List<T> kept = new ArrayList<>(records.size());
        for (T record : records) {
            if (periodEnd == null || !date.apply(record).isAfter(periodEnd)) {
                kept.add(record);
            }
        }
        return kept;
    }

    private static void closeQuietly(HmrcRateSource source) {
        try {
            source.close();
        } catch (IOException ex) {
            LOGGER.log(Level.WARNING, "Failed to close rate client", ex);
        }
    }
}
