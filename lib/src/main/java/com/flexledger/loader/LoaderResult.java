package com.flexledger.loader;

import com.flexledger.ledger.LedgerData;
import com.flexledger.ledger.LedgerMessage;
import java.util.List;

/** Container for the typed records of one export plus the diagnostics raised while reading it. */
public final class LoaderResult {
    private final LedgerData ledgerData;
    private final List<LedgerMessage> messages;

    public LoaderResult(LedgerData ledgerData, List<LedgerMessage> messages) {
        this.ledgerData = ledgerData;
        this.messages = List.copyOf(messages);
    }

    public LedgerData getLedgerData() {
        return ledgerData;
    }

    public List<LedgerMessage> getMessages() {
        return messages;
    }
}
