package com.flexledger.journal;

import com.flexledger.inventory.DisposalResult;
import com.flexledger.inventory.LotLedger;
import com.flexledger.ledger.Account;
import com.flexledger.ledger.CashKind;
import com.flexledger.ledger.CashMovement;
import com.flexledger.ledger.InstrumentClass;
import com.flexledger.ledger.LedgerMessage;
import com.flexledger.ledger.SecondaryMovement;
import com.flexledger.ledger.Trade;
import com.flexledger.rates.RateProvider;
import com.flexledger.rates.RateUnavailableException;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * Turns typed records into balanced journal entries.
 *
 * <p>Trades go through the lot ledger and post against {@link Account#INVESTMENTS_AT_COST}; the
 * gain or loss account comes from the trade's {@link InstrumentClass}. Cash movements post a
 * two-leg entry between the cash account for their currency and the account for their
 * {@link CashKind}. Every converted figure is rounded once, before it is posted, so each entry
 * balances exactly.
 */
public final class JournalEngine {

    private static final Logger LOGGER = Logger.getLogger(JournalEngine.class.getName());
    private static final String USD = "USD";

    private final RateProvider rates;
    private final LotLedger lots;
    private final TransactionCostPolicy costPolicy;
    private final Journal journal;
    private final List<LedgerMessage> messages;
    private final String sourceName;
    private final int scale;

    public JournalEngine(
            RateProvider rates,
            LotLedger lots,
            TransactionCostPolicy costPolicy,
            Journal journal,
            List<LedgerMessage> messages,
            String sourceName,
            int scale) {
        this.rates = Objects.requireNonNull(rates, "rates");
        this.lots = Objects.requireNonNull(lots, "lots");
        this.costPolicy = costPolicy != null ? costPolicy : TransactionCostPolicy.CAPITALIZE;
        this.journal = Objects.requireNonNull(journal, "journal");
        this.messages = Objects.requireNonNull(messages, "messages");
        this.sourceName = sourceName;
        this.scale = scale;
    }

    public void postTrade(Trade trade) throws RateUnavailableException {
        Objects.requireNonNull(trade, "trade");
        if (trade.isAcquisition()) {
            postAcquisition(trade);
        } else {
            postDisposal(trade);
        }
    }

    private void postAcquisition(Trade trade) throws RateUnavailableException {
        Account cash = cashAccountFor(trade.getCurrency());
        String memo = "Buy " + trade.getQuantity().toPlainString() + " " + trade.getSymbol();
        Journal.EntryBuilder entry =
                journal.begin(trade.getDate(), EntryKind.ACQUISITION, memo, sourceName, trade.getSourceLine());
        if (costPolicy == TransactionCostPolicy.CAPITALIZE) {
            BigDecimal cost =
                    rates.toReporting(
                            trade.getGrossAmount().add(trade.getCommission()), trade.getCurrency(), trade.getDate());
            lots.acquire(trade, cost);
            entry.debit(Account.INVESTMENTS_AT_COST, cost, memo).credit(cash, cost, memo);
        } else {
            BigDecimal gross = rates.toReporting(trade.getGrossAmount(), trade.getCurrency(), trade.getDate());
            BigDecimal commission = rates.toReporting(trade.getCommission(), trade.getCurrency(), trade.getDate());
            lots.acquire(trade, gross);
            entry.debit(Account.INVESTMENTS_AT_COST, gross, memo)
                    .debit(Account.BROKER_COMMISSIONS, commission, "Commission on " + trade.getSymbol())
                    .credit(cash, gross.add(commission), memo);
        }
        entry.post();
    }

    private void postDisposal(Trade trade) throws RateUnavailableException {
        Account cash = cashAccountFor(trade.getCurrency());
        InstrumentClass instrumentClass = trade.getInstrumentClass();
        String memo = "Sell " + trade.getQuantity().toPlainString() + " " + trade.getSymbol();
        // Convert before touching the lots so a missing rate leaves the ledger as it was.
        BigDecimal proceeds;
        BigDecimal commission = BigDecimal.ZERO;
        if (costPolicy == TransactionCostPolicy.CAPITALIZE) {
            proceeds =
                    rates.toReporting(
                            trade.getGrossAmount().subtract(trade.getCommission()),
                            trade.getCurrency(),
                            trade.getDate());
        } else {
            proceeds = rates.toReporting(trade.getGrossAmount(), trade.getCurrency(), trade.getDate());
            commission = rates.toReporting(trade.getCommission(), trade.getCurrency(), trade.getDate());
        }
        DisposalResult result = lots.dispose(trade);
        if (result.hasShortfall()) {
            String message =
                    "Disposal of " + trade.getQuantity().toPlainString() + " " + trade.getSymbol()
                            + " exceeds open lots by " + result.getShortfallQuantity().toPlainString()
                            + "; excess treated as zero cost";
            LOGGER.warning(message + " (" + sourceName + " row " + trade.getSourceLine() + ")");
            messages.add(LedgerMessage.warning(message, sourceName, trade.getSourceLine()));
        }
        BigDecimal cost = result.getConsumedCost().setScale(scale, RoundingMode.HALF_UP);
        BigDecimal gain = proceeds.subtract(cost);

        Journal.EntryBuilder entry =
                journal.begin(trade.getDate(), EntryKind.DISPOSAL, memo, sourceName, trade.getSourceLine());
        entry.debit(cash, proceeds.subtract(commission), memo)
                .debit(Account.BROKER_COMMISSIONS, commission, "Commission on " + trade.getSymbol())
                .credit(Account.INVESTMENTS_AT_COST, cost, "Cost of " + trade.getSymbol() + " sold");
        if (gain.signum() > 0) {
            entry.credit(instrumentClass.getGainAccount(), gain, "Gain on " + trade.getSymbol());
        } else if (gain.signum() < 0) {
            entry.debit(instrumentClass.getLossAccount(), gain.negate(), "Loss on " + trade.getSymbol());
        }
        entry.post();
    }

    public void postCashMovement(CashMovement movement) throws RateUnavailableException {
        Objects.requireNonNull(movement, "movement");
        BigDecimal amount =
                rates.toReporting(movement.getAmount().abs(), movement.getCurrency(), movement.getDate());
        Account cash = cashAccountFor(movement.getCurrency());
        boolean receipt = movement.isReceipt();
        Account counter = counterAccount(movement.getKind(), receipt);
        String memo = movement.getDescription().isEmpty() ? movement.getType() : movement.getDescription();
        Journal.EntryBuilder entry =
                journal.begin(
                        movement.getDate(),
                        entryKind(movement.getKind()),
                        memo,
                        sourceName,
                        movement.getSourceLine());
        if (receipt) {
            entry.debit(cash, amount, memo).credit(counter, amount, memo);
        } else {
            entry.debit(counter, amount, memo).credit(cash, amount, memo);
        }
        entry.post();
    }

    public void postSecondary(SecondaryMovement movement) {
        Objects.requireNonNull(movement, "movement");
        BigDecimal amount = movement.getAmount().setScale(scale, RoundingMode.HALF_UP);
        String memo =
                movement.getFlow() == SecondaryMovement.Flow.FUNDS_RECEIVED
                        ? "Owner's loan received"
                        : "Owner's loan repaid";
        if (!movement.getReference().isEmpty()) {
            memo = memo + " (" + movement.getReference() + ")";
        }
        Journal.EntryBuilder entry = journal.begin(movement.getDate(), EntryKind.OWNERS_LOAN, memo, null, 0);
        if (movement.getFlow() == SecondaryMovement.Flow.FUNDS_RECEIVED) {
            entry.debit(Account.CASH_SECONDARY, amount, memo).credit(Account.OWNERS_LOAN, amount, memo);
        } else {
            entry.debit(Account.OWNERS_LOAN, amount, memo).credit(Account.CASH_SECONDARY, amount, memo);
        }
        entry.post();
    }

    public Account cashAccountFor(String currency) {
        String code = currency == null ? "" : currency.trim().toUpperCase(Locale.ROOT);
        if (code.equals(rates.getReportingCurrency())) {
            return Account.CASH_REPORTING;
        }
        if (USD.equals(code)) {
            return Account.CASH_USD;
        }
        return Account.CASH_OTHER_CURRENCY;
    }

    /** The non-cash side of a cash movement. A payment of an income kind reverses it. */
    static Account counterAccount(CashKind kind, boolean receipt) {
        return switch (kind) {
            case DIVIDEND -> Account.DIVIDEND_INCOME;
            case WITHHOLDING_TAX -> Account.WITHHOLDING_TAX;
            case INTEREST -> receipt ? Account.INTEREST_RECEIVED : Account.INTEREST_PAID;
            case FEE -> Account.BROKER_FEES;
            case CAPITAL -> Account.SHARE_CAPITAL;
            case OTHER -> receipt ? Account.INTEREST_RECEIVED : Account.BROKER_FEES;
        };
    }

    private static EntryKind entryKind(CashKind kind) {
        return switch (kind) {
            case DIVIDEND -> EntryKind.DIVIDEND;
            case WITHHOLDING_TAX -> EntryKind.WITHHOLDING_TAX;
            case INTEREST -> EntryKind.INTEREST;
            case FEE -> EntryKind.FEE;
            case CAPITAL -> EntryKind.CAPITAL;
            case OTHER -> EntryKind.OTHER_CASH;
        };
    }
}
