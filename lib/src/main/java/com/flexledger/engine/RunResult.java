package com.flexledger.engine;

import com.flexledger.inventory.Lot;
import com.flexledger.journal.JournalEntry;
import com.flexledger.journal.Posting;
import com.flexledger.ledger.LedgerMessage;
import com.flexledger.trialbalance.HoldingsSchedule;
import com.flexledger.trialbalance.TrialBalance;
import java.util.List;
import java.util.Objects;

/** Everything one run produced. Nothing here is shared with later runs. */
public final class RunResult {
    private final String sourceName;
    private final RunStatus status;
    private final TrialBalance trialBalance;
    private final HoldingsSchedule holdings;
    private final List<JournalEntry> entries;
    private final List<Posting> postings;
    private final List<Lot> openLots;
    private final List<LedgerMessage> messages;

    public RunResult(
            String sourceName,
            RunStatus status,
            TrialBalance trialBalance,
            HoldingsSchedule holdings,
            List<JournalEntry> entries,
            List<Posting> postings,
            List<Lot> openLots,
            List<LedgerMessage> messages) {
        this.sourceName = sourceName;
        this.status = Objects.requireNonNull(status, "status");
        this.trialBalance = Objects.requireNonNull(trialBalance, "trialBalance");
        this.holdings = Objects.requireNonNull(holdings, "holdings");
        this.entries = List.copyOf(entries);
        this.postings = List.copyOf(postings);
        this.openLots = List.copyOf(openLots);
        this.messages = List.copyOf(messages);
    }

    public String getSourceName() {
        return sourceName;
    }

    public RunStatus getStatus() {
        return status;
    }

    public boolean isBalanced() {
        return status == RunStatus.BALANCED;
    }

    public TrialBalance getTrialBalance() {
        return trialBalance;
    }

    public HoldingsSchedule getHoldings() {
        return holdings;
    }

    public List<JournalEntry> getEntries() {
        return entries;
    }

    public List<Posting> getPostings() {
        return postings;
    }

    public List<Lot> getOpenLots() {
        return openLots;
    }

    public List<LedgerMessage> getMessages() {
        return messages;
    }
}
