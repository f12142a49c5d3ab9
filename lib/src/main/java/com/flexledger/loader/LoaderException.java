package com.flexledger.loader;

import com.flexledger.ledger.LedgerException;

/**
 * Checked exception signalling that an export could not be ingested at all: unreadable input or
 * missing/malformed section markers. Individual bad rows never raise this.
 */
public final class LoaderException extends LedgerException {
    public LoaderException(String message) {
        super(message);
    }

    public LoaderException(String message, Throwable cause) {
        super(message, cause);
    }
}
