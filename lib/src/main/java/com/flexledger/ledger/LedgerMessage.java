package com.flexledger.ledger;

import java.util.Objects;

/**
 * Diagnostic produced while loading or posting a ledger. Skipped rows, shortfall disposals and an
 * unbalanced trial balance all surface here rather than as exceptions.
 */
public final class LedgerMessage {

    public enum Level {
        INFO,
        WARNING,
        ERROR
    }

    private final Level level;
    private final String message;
    private final String sourceFilename;
    private final int sourceLineno;

    public LedgerMessage(Level level, String message, String sourceFilename, int sourceLineno) {
        this.level = Objects.requireNonNull(level, "level");
        this.message = Objects.requireNonNull(message, "message");
        this.sourceFilename = sourceFilename;
        this.sourceLineno = sourceLineno;
    }

    public static LedgerMessage info(String message) {
        return new LedgerMessage(Level.INFO, message, null, 0);
    }

    public static LedgerMessage warning(String message, String sourceFilename, int sourceLineno) {
        return new LedgerMessage(Level.WARNING, message, sourceFilename, sourceLineno);
    }

    public static LedgerMessage error(String message) {
        return new LedgerMessage(Level.ERROR, message, null, 0);
    }

    public Level getLevel() {
        return level;
    }

    public String getMessage() {
        return message;
    }

    public String getSourceFilename() {
        return sourceFilename;
    }

    public int getSourceLineno() {
        return sourceLineno;
    }

    @Override
    public String toString() {
        if (sourceFilename == null) {
            return level + ": " + message;
        }
        return level + ": " + message + " (" + sourceFilename + ":" + sourceLineno + ")";
    }
}
