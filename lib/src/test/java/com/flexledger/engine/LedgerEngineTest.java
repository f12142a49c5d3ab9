package com.flexledger.engine;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.flexledger.journal.Posting;
import com.flexledger.ledger.Account;
import com.flexledger.ledger.Direction;
import com.flexledger.ledger.InstrumentClass;
import com.flexledger.ledger.LedgerData;
import com.flexledger.ledger.LedgerMessage;
import com.flexledger.ledger.PositionSnapshot;
import com.flexledger.ledger.Trade;
import com.flexledger.rates.RateUnavailableException;
import com.flexledger.testing.TestResources;
import com.flexledger.trialbalance.HoldingFlag;
import com.flexledger.trialbalance.HoldingLine;
import com.flexledger.trialbalance.HoldingsSchedule;
import com.flexledger.trialbalance.TrialBalance;
import java.math.BigDecimal;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import org.junit.jupiter.api.Test;

final class LedgerEngineTest {

    @Test
    void postsSampleExportIntoBalancedTrialBalance() throws Exception {
        RunResult result = engine(EngineConfig.builder()).run(TestResources.sampleExport());

        assertEquals(RunStatus.BALANCED, result.getStatus());
        TrialBalance trialBalance = result.getTrialBalance();
        assertEquals(trialBalance.getTotalDebits(), trialBalance.getTotalCredits());
        assertEquals(new BigDecimal("-78.60"), trialBalance.netOf(Account.REALIZED_GAINS));
        assertEquals(new BigDecimal("-20.00"), trialBalance.netOf(Account.DIVIDEND_INCOME));
        assertEquals(new BigDecimal("3.00"), trialBalance.netOf(Account.WITHHOLDING_TAX));
        assertEquals(new BigDecimal("-1000.00"), trialBalance.netOf(Account.SHARE_CAPITAL));
        assertEquals(new BigDecimal("1000.00"), trialBalance.netOf(Account.CASH_REPORTING));
        assertEquals(new BigDecimal("-1505.00"), trialBalance.netOf(Account.CASH_USD));
        assertEquals(BigDecimal.ZERO, trialBalance.netOf(Account.RETAINED_EARNINGS));
        assertEquals(6, result.getEntries().size());
    }

    @Test
    void trialBalanceListsActiveAccountsInCodeOrder() throws Exception {
        RunResult result = engine(EngineConfig.builder()).run(TestResources.sampleExport());

        List<String> codes =
                result.getTrialBalance().getBalances().stream()
                        .map(balance -> balance.getAccount().getCode())
                        .collect(Collectors.toList());
        assertEquals(List.of("1100", "1101", "1200", "3000", "4000", "4200", "5000"), codes);
    }

    @Test
    void holdingsExcludeCurrencyConversionLotsButAccountKeepsThem() throws Exception {
        RunResult result = engine(EngineConfig.builder()).run(TestResources.sampleExport());

        HoldingsSchedule holdings = result.getHoldings();
        assertEquals(1, holdings.getLines().size());
        HoldingLine apple = holdings.getLines().get(0);
        assertEquals("AAPL", apple.getSymbol());
        assertEquals(0, new BigDecimal("6").compareTo(apple.getQuantity()));
        assertEquals(new BigDecimal("600.60"), apple.getCost());
        assertEquals(new BigDecimal("100.1000"), apple.getAverageCost());
        assertTrue(apple.getFlags().isEmpty());
        assertEquals(new BigDecimal("600.60"), holdings.getTotalCost());
        assertEquals(new BigDecimal("1600.60"), holdings.getInvestmentsAtCostBalance());
        assertEquals(new BigDecimal("1000.00"), holdings.getExcludedLotCost());
        assertEquals(0, holdings.getUnexplainedDifference().signum());
        assertEquals(2, result.getOpenLots().size());
    }

    @Test
    void repeatedRunsProduceIdenticalPostings() throws Exception {
        LedgerEngine engine = engine(EngineConfig.builder());
        Path export = TestResources.sampleExport();

        RunResult first = engine.run(export);
        RunResult second = engine.run(export);

        assertEquals(describe(first.getPostings()), describe(second.getPostings()));
        assertEquals(first.getTrialBalance().getTotalDebits(), second.getTrialBalance().getTotalDebits());
    }

    @Test
    void periodEndExcludesLaterRecords() throws Exception {
        Path rates = TestResources.ratesDirectory(TestResources.JANUARY_RATES);
        EngineConfig config = EngineConfig.builder().rateDirectory(rates).periodEnd(LocalDate.parse("2024-01-31")).build();

        RunResult result = new LedgerEngine(config).run(TestResources.sampleExport());

        assertEquals(RunStatus.BALANCED, result.getStatus());
        assertEquals(2, result.getEntries().size());
        assertEquals(0, new BigDecimal("10").compareTo(result.getHoldings().getLines().get(0).getQuantity()));
        assertTrue(
                result.getMessages().stream()
                        .anyMatch(message -> message.getLevel() == LedgerMessage.Level.INFO
                                && message.getMessage().contains("4 records dated after 2024-01-31")));
    }

    @Test
    void usdReportingConvertsOtherCurrenciesAtCrossRates() throws Exception {
        Path rates = TestResources.ratesDirectory(TestResources.JANUARY_RATES);
        EngineConfig config = EngineConfig.builder().rateDirectory(rates).reportingCurrency("USD").build();
        Trade sapBuy =
                new Trade(
                        1,
                        LocalDate.parse("2024-01-10"),
                        "SAP",
                        "SAP SE",
                        InstrumentClass.EQUITY,
                        Direction.ACQUISITION,
                        BigDecimal.ONE,
                        new BigDecimal("115"),
                        BigDecimal.ZERO,
                        "EUR");
        LedgerData data = new LedgerData("in-memory", List.of(sapBuy), List.of(), List.of(), false, 0);

        RunResult result = new LedgerEngine(config).run(data);

        assertEquals(new BigDecimal("125.00"), result.getTrialBalance().netOf(Account.INVESTMENTS_AT_COST));
        assertEquals(new BigDecimal("-125.00"), result.getTrialBalance().netOf(Account.CASH_OTHER_CURRENCY));
        assertTrue(result.isBalanced());
    }

    @Test
    void missingMonthAbortsTheRun() throws Exception {
        Path rates = TestResources.ratesDirectory(TestResources.JANUARY_RATES);
        EngineConfig config = EngineConfig.builder().rateDirectory(rates).build();

        RateUnavailableException ex =
                assertThrows(RateUnavailableException.class, () -> new LedgerEngine(config).run(TestResources.sampleExport()));
        assertNull(ex.getCurrency());
    }

    @Test
    void ownersLoanFileIsPostedAfterTheExport() throws Exception {
        Path loan = TestResources.copy(TestResources.OWNERS_LOAN, Files.createTempDirectory("loan"));
        RunResult result = engine(EngineConfig.builder().ownersLoan(loan)).run(TestResources.sampleExport());

        assertEquals(new BigDecimal("300.00"), result.getTrialBalance().netOf(Account.CASH_SECONDARY));
        assertEquals(new BigDecimal("-300.00"), result.getTrialBalance().netOf(Account.OWNERS_LOAN));
        assertEquals(8, result.getEntries().size());
        assertTrue(result.isBalanced());
    }

    @Test
    void shortfallAndBrokerMismatchAreFlagged() throws Exception {
        LedgerData data =
                new LedgerData(
                        "in-memory",
                        List.of(
                                trade(1, "2024-03-04", "MSFT", Direction.ACQUISITION, "10", "3000"),
                                trade(2, "2024-03-01", "MSFT", Direction.DISPOSAL, "3", "950")),
                        List.of(),
                        List.of(new PositionSnapshot("MSFT", "MICROSOFT", new BigDecimal("7"), null, null, "GBP")),
                        true,
                        0);
        EngineConfig config = EngineConfig.builder().rateSource(month -> Map.of()).build();

        RunResult result = new LedgerEngine(config).run(data);

        assertTrue(result.isBalanced());
        HoldingLine line = result.getHoldings().getLines().get(0);
        assertTrue(line.hasFlag(HoldingFlag.SHORTFALL));
        assertTrue(line.hasFlag(HoldingFlag.BROKER_MISMATCH));
        assertEquals(new BigDecimal("7"), line.getBrokerQuantity());
        assertEquals(new BigDecimal("-950.00"), result.getTrialBalance().netOf(Account.REALIZED_GAINS));
        assertEquals(1, result.getMessages().size());
        assertEquals(LedgerMessage.Level.WARNING, result.getMessages().get(0).getLevel());
    }

    @Test
    void shortfallOnClosedInstrumentIsStillListedOnTheSchedule() throws Exception {
        LedgerData data =
                new LedgerData(
                        "in-memory",
                        List.of(
                                trade(1, "2024-03-01", "MSFT", Direction.ACQUISITION, "5", "500"),
                                trade(2, "2024-03-02", "MSFT", Direction.DISPOSAL, "8", "960"),
                                trade(3, "2024-03-02", "VOD", Direction.ACQUISITION, "100", "70")),
                        List.of(),
                        List.of(),
                        false,
                        0);
        EngineConfig config = EngineConfig.builder().rateSource(month -> Map.of()).build();

        RunResult result = new LedgerEngine(config).run(data);

        HoldingsSchedule holdings = result.getHoldings();
        assertEquals(1, holdings.getLines().size());
        assertEquals("VOD", holdings.getLines().get(0).getSymbol());
        assertEquals(List.of("MSFT"), holdings.getShortfallSymbols());
    }

    @Test
    void outOfToleranceTrialBalanceIsUnbalancedWithErrorMessage() {
        TrialBalance trialBalance =
                new TrialBalance(List.of(), new BigDecimal("100.00"), new BigDecimal("100.05"), new BigDecimal("0.01"));
        List<LedgerMessage> messages = new ArrayList<>();

        assertEquals(RunStatus.UNBALANCED, LedgerEngine.assess(trialBalance, messages));

        assertEquals(1, messages.size());
        assertEquals(LedgerMessage.Level.ERROR, messages.get(0).getLevel());
        assertTrue(messages.get(0).getMessage().contains("difference -0.05"), messages.get(0).getMessage());
    }

    @Test
    void balancedTrialBalanceAddsNoMessage() {
        TrialBalance trialBalance =
                new TrialBalance(List.of(), new BigDecimal("100.00"), new BigDecimal("100.00"), new BigDecimal("0.01"));
        List<LedgerMessage> messages = new ArrayList<>();

        assertEquals(RunStatus.BALANCED, LedgerEngine.assess(trialBalance, messages));
        assertTrue(messages.isEmpty());
    }

    @Test
    void noPositionSectionMeansNoMismatchFlag() throws Exception {
        LedgerData data =
                new LedgerData(
                        "in-memory",
                        List.of(trade(1, "2024-03-04", "MSFT", Direction.ACQUISITION, "10", "3000")),
                        List.of(),
                        List.of(),
                        false,
                        0);
        EngineConfig config = EngineConfig.builder().rateSource(month -> Map.of()).build();

        RunResult result = new LedgerEngine(config).run(data);

        assertTrue(result.getHoldings().getLines().get(0).getFlags().isEmpty());
    }

    @Test
    void sameDaySaleListedFirstStillMatchesTheDaysPurchase() throws Exception {
        LedgerData data =
                new LedgerData(
                        "in-memory",
                        List.of(
                                trade(1, "2024-03-04", "NVDA", Direction.DISPOSAL, "10", "130"),
                                trade(2, "2024-03-04", "NVDA", Direction.ACQUISITION, "10", "100")),
                        List.of(),
                        List.of(),
                        false,
                        0);
        EngineConfig config = EngineConfig.builder().rateSource(month -> Map.of()).build();

        RunResult result = new LedgerEngine(config).run(data);

        assertEquals(new BigDecimal("-30.00"), result.getTrialBalance().netOf(Account.REALIZED_GAINS));
        assertTrue(result.getOpenLots().isEmpty());
        assertTrue(result.getMessages().isEmpty());
    }

    private static LedgerEngine engine(EngineConfig.Builder builder) throws Exception {
        return new LedgerEngine(builder.rateDirectory(TestResources.fullRatesDirectory()).build());
    }

    private static Trade trade(int line, String date, String symbol, Direction direction, String quantity, String gross) {
        return new Trade(
                line,
                LocalDate.parse(date),
                symbol,
                "",
                InstrumentClass.EQUITY,
                direction,
                new BigDecimal(quantity),
                new BigDecimal(gross),
                BigDecimal.ZERO,
                "GBP");
    }

    private static List<String> describe(List<Posting> postings) {
        return postings.stream()
                .map(posting -> posting.getPostingId() + " " + posting.getAccount().getCode() + " "
                        + posting.getSide() + " " + posting.getAmount().toPlainString() + " " + posting.getMemo())
                .collect(Collectors.toList());
    }
}
