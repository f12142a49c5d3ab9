package com.flexledger.journal;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.flexledger.inventory.BookingMethod;
import com.flexledger.inventory.LotLedger;
import com.flexledger.ledger.Account;
import com.flexledger.ledger.CashKind;
import com.flexledger.ledger.CashMovement;
import com.flexledger.ledger.Direction;
import com.flexledger.ledger.InstrumentClass;
import com.flexledger.ledger.LedgerMessage;
import com.flexledger.ledger.SecondaryMovement;
import com.flexledger.ledger.Trade;
import com.flexledger.rates.RateProvider;
import com.flexledger.rates.RateUnavailableException;
import com.flexledger.trialbalance.TrialBalance;
import com.flexledger.trialbalance.TrialBalanceAggregator;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

final class JournalEngineTest {

    private final Journal journal = new Journal();
    private final List<LedgerMessage> messages = new ArrayList<>();
    private final LotLedger lots = new LotLedger(BookingMethod.FIFO, 2);

    @Test
    void fifoDisposalPostsGainToRealizedGains() throws Exception {
        JournalEngine engine = engine(TransactionCostPolicy.CAPITALIZE);
        engine.postTrade(trade(1, "2024-01-02", "AAPL", InstrumentClass.EQUITY, Direction.ACQUISITION, "10", "100", "0", "GBP"));
        engine.postTrade(trade(2, "2024-01-03", "AAPL", InstrumentClass.EQUITY, Direction.ACQUISITION, "10", "300", "0", "GBP"));
        engine.postTrade(trade(3, "2024-01-04", "AAPL", InstrumentClass.EQUITY, Direction.DISPOSAL, "15", "500", "0", "GBP"));

        TrialBalance trialBalance = trialBalance();
        assertTrue(trialBalance.isBalanced());
        assertEquals(new BigDecimal("-250.00"), trialBalance.netOf(Account.REALIZED_GAINS));
        assertEquals(new BigDecimal("150.00"), trialBalance.netOf(Account.INVESTMENTS_AT_COST));
        assertEquals(new BigDecimal("100.00"), trialBalance.netOf(Account.CASH_REPORTING));
        assertTrue(messages.isEmpty());
    }

    @Test
    void lossGoesToRealizedLosses() throws Exception {
        JournalEngine engine = engine(TransactionCostPolicy.CAPITALIZE);
        engine.postTrade(trade(1, "2024-01-02", "VOD", InstrumentClass.EQUITY, Direction.ACQUISITION, "100", "100", "0", "GBP"));
        engine.postTrade(trade(2, "2024-01-05", "VOD", InstrumentClass.EQUITY, Direction.DISPOSAL, "100", "80", "0", "GBP"));

        TrialBalance trialBalance = trialBalance();
        assertEquals(new BigDecimal("20.00"), trialBalance.netOf(Account.REALIZED_LOSSES));
        assertEquals(BigDecimal.ZERO, trialBalance.netOf(Account.REALIZED_GAINS));
        assertEquals(0, trialBalance.netOf(Account.INVESTMENTS_AT_COST).signum());
    }

    @Test
    void currencyConversionRoutesToForeignExchangeAccounts() throws Exception {
        JournalEngine engine = engine(TransactionCostPolicy.CAPITALIZE);
        engine.postTrade(trade(1, "2024-01-02", "GBP.USD", InstrumentClass.CURRENCY_CONVERSION, Direction.ACQUISITION, "1000", "1250", "0", "USD"));
        engine.postTrade(trade(2, "2024-01-20", "GBP.USD", InstrumentClass.CURRENCY_CONVERSION, Direction.DISPOSAL, "1000", "1300", "0", "USD"));

        TrialBalance trialBalance = trialBalance();
        assertEquals(new BigDecimal("-40.00"), trialBalance.netOf(Account.FX_GAINS));
        assertEquals(BigDecimal.ZERO, trialBalance.netOf(Account.REALIZED_GAINS));
        assertEquals(new BigDecimal("40.00"), trialBalance.netOf(Account.CASH_USD));
    }

    @Test
    void capitalizedCommissionStaysOutOfExpenses() throws Exception {
        JournalEngine engine = engine(TransactionCostPolicy.CAPITALIZE);
        engine.postTrade(trade(1, "2024-01-02", "AAPL", InstrumentClass.EQUITY, Direction.ACQUISITION, "10", "100", "1", "GBP"));
        engine.postTrade(trade(2, "2024-01-05", "AAPL", InstrumentClass.EQUITY, Direction.DISPOSAL, "10", "150", "1", "GBP"));

        TrialBalance trialBalance = trialBalance();
        assertEquals(new BigDecimal("-48.00"), trialBalance.netOf(Account.REALIZED_GAINS));
        assertEquals(BigDecimal.ZERO, trialBalance.netOf(Account.BROKER_COMMISSIONS));
        assertEquals(new BigDecimal("48.00"), trialBalance.netOf(Account.CASH_REPORTING));
    }

    @Test
    void expensePolicyPostsCommissionSeparately() throws Exception {
        JournalEngine engine = engine(TransactionCostPolicy.EXPENSE);
        engine.postTrade(trade(1, "2024-01-02", "AAPL", InstrumentClass.EQUITY, Direction.ACQUISITION, "10", "100", "1", "GBP"));
        engine.postTrade(trade(2, "2024-01-05", "AAPL", InstrumentClass.EQUITY, Direction.DISPOSAL, "10", "150", "1", "GBP"));

        TrialBalance trialBalance = trialBalance();
        assertTrue(trialBalance.isBalanced());
        assertEquals(new BigDecimal("-50.00"), trialBalance.netOf(Account.REALIZED_GAINS));
        assertEquals(new BigDecimal("2.00"), trialBalance.netOf(Account.BROKER_COMMISSIONS));
        assertEquals(new BigDecimal("48.00"), trialBalance.netOf(Account.CASH_REPORTING));
    }

    @Test
    void shortfallDisposalWarnsAndBooksFullProceedsAsGain() throws Exception {
        JournalEngine engine = engine(TransactionCostPolicy.CAPITALIZE);
        engine.postTrade(trade(7, "2024-01-02", "ESZ4", InstrumentClass.EQUITY, Direction.DISPOSAL, "2", "90", "0", "GBP"));

        TrialBalance trialBalance = trialBalance();
        assertTrue(trialBalance.isBalanced());
        assertEquals(new BigDecimal("-90.00"), trialBalance.netOf(Account.REALIZED_GAINS));
        assertEquals(1, messages.size());
        assertEquals(LedgerMessage.Level.WARNING, messages.get(0).getLevel());
        assertEquals(7, messages.get(0).getSourceLineno());
        assertTrue(messages.get(0).getMessage().contains("zero cost"));
    }

    @Test
    void cashMovementsRouteByKindAndSign() throws Exception {
        JournalEngine engine = engine(TransactionCostPolicy.CAPITALIZE);
        engine.postCashMovement(cash(CashKind.DIVIDEND, "50", "USD"));
        engine.postCashMovement(cash(CashKind.WITHHOLDING_TAX, "-7.50", "USD"));
        engine.postCashMovement(cash(CashKind.INTEREST, "2.50", "USD"));
        engine.postCashMovement(cash(CashKind.INTEREST, "-1.25", "USD"));
        engine.postCashMovement(cash(CashKind.FEE, "-10", "GBP"));
        engine.postCashMovement(cash(CashKind.FEE, "4", "GBP"));
        engine.postCashMovement(cash(CashKind.CAPITAL, "1000", "GBP"));
        engine.postCashMovement(cash(CashKind.OTHER, "-3", "GBP"));

        TrialBalance trialBalance = trialBalance();
        assertTrue(trialBalance.isBalanced());
        assertEquals(new BigDecimal("-40.00"), trialBalance.netOf(Account.DIVIDEND_INCOME));
        assertEquals(new BigDecimal("6.00"), trialBalance.netOf(Account.WITHHOLDING_TAX));
        assertEquals(new BigDecimal("-2.00"), trialBalance.netOf(Account.INTEREST_RECEIVED));
        assertEquals(new BigDecimal("1.00"), trialBalance.netOf(Account.INTEREST_PAID));
        assertEquals(new BigDecimal("9.00"), trialBalance.netOf(Account.BROKER_FEES));
        assertEquals(new BigDecimal("-1000.00"), trialBalance.netOf(Account.SHARE_CAPITAL));
        assertEquals(new BigDecimal("35.00"), trialBalance.netOf(Account.CASH_USD));
    }

    @Test
    void unclassifiedReceiptIsIncome() {
        assertEquals(Account.INTEREST_RECEIVED, JournalEngine.counterAccount(CashKind.OTHER, true));
        assertEquals(Account.BROKER_FEES, JournalEngine.counterAccount(CashKind.OTHER, false));
    }

    @Test
    void ownersLoanMovesBetweenSecondaryCashAndLoanAccount() {
        JournalEngine engine = engine(TransactionCostPolicy.CAPITALIZE);
        engine.postSecondary(
                new SecondaryMovement(LocalDate.parse("2024-01-15"), new BigDecimal("500"), SecondaryMovement.Flow.FUNDS_RECEIVED, "Barclays"));
        engine.postSecondary(
                new SecondaryMovement(LocalDate.parse("2024-02-01"), new BigDecimal("200"), SecondaryMovement.Flow.FUNDS_RETURNED, ""));

        TrialBalance trialBalance = trialBalance();
        assertEquals(new BigDecimal("300.00"), trialBalance.netOf(Account.CASH_SECONDARY));
        assertEquals(new BigDecimal("-300.00"), trialBalance.netOf(Account.OWNERS_LOAN));
        assertTrue(journal.getEntries().get(0).getDescription().contains("Barclays"));
    }

    @Test
    void cashAccountFollowsCurrency() {
        JournalEngine engine = engine(TransactionCostPolicy.CAPITALIZE);
        assertEquals(Account.CASH_REPORTING, engine.cashAccountFor("gbp"));
        assertEquals(Account.CASH_USD, engine.cashAccountFor("USD"));
        assertEquals(Account.CASH_OTHER_CURRENCY, engine.cashAccountFor("EUR"));
    }

    @Test
    void missingRateLeavesLotsUntouched() throws Exception {
        JournalEngine engine = engine(TransactionCostPolicy.CAPITALIZE);
        engine.postTrade(trade(1, "2024-01-02", "SAP", InstrumentClass.EQUITY, Direction.ACQUISITION, "1", "100", "0", "GBP"));

        assertThrows(
                RateUnavailableException.class,
                () -> engine.postTrade(trade(2, "2024-01-03", "SAP", InstrumentClass.EQUITY, Direction.DISPOSAL, "1", "110", "0", "CHF")));
        assertEquals(1, lots.openLots().size());
        assertEquals(1, journal.getEntries().size());
    }

    private JournalEngine engine(TransactionCostPolicy policy) {
        RateProvider rates = new RateProvider(month -> Map.of("USD", new BigDecimal("1.25")), "GBP", 2);
        return new JournalEngine(rates, lots, policy, journal, messages, "export.csv", 2);
    }

    private TrialBalance trialBalance() {
        return new TrialBalanceAggregator(new BigDecimal("0.01")).aggregate(journal.getPostings());
    }

    private static Trade trade(
            int line,
            String date,
            String symbol,
            InstrumentClass instrumentClass,
            Direction direction,
            String quantity,
            String gross,
            String commission,
            String currency) {
        return new Trade(
                line,
                LocalDate.parse(date),
                symbol,
                "",
                instrumentClass,
                direction,
                new BigDecimal(quantity),
                new BigDecimal(gross),
                new BigDecimal(commission),
                currency);
    }

    private static CashMovement cash(CashKind kind, String amount, String currency) {
        return new CashMovement(
                1, LocalDate.parse("2024-01-31"), kind.name(), kind, "", "", new BigDecimal(amount), currency);
    }
}
