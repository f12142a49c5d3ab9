package com.flexledger.ledger;

/**
 * Checked exception signalling that a run had to be aborted. Subclasses distinguish ingestion
 * failures from missing conversion rates; recoverable row-level problems are reported as
 * {@link LedgerMessage}s instead.
 */
public class LedgerException extends Exception {
    public LedgerException(String message) {
        super(message);
    }

    public LedgerException(String message, Throwable cause) {
        super(message, cause);
    }
}
