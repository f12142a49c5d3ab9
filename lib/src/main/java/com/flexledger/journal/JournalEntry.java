package com.flexledger.journal;

import java.time.LocalDate;
import java.util.List;

/** A balanced group of postings traced back to the record that produced it. */
public final class JournalEntry {
    private final int entryId;
    private final LocalDate date;
    private final EntryKind kind;
    private final String description;
    private final String sourceFilename;
    private final int sourceLineno;
    private final List<Posting> postings;

    JournalEntry(
            int entryId,
            LocalDate date,
            EntryKind kind,
            String description,
            String sourceFilename,
            int sourceLineno,
            List<Posting> postings) {
        this.entryId = entryId;
        this.date = date;
        this.kind = kind;
        this.description = description;
        this.sourceFilename = sourceFilename;
        this.sourceLineno = sourceLineno;
        this.postings = List.copyOf(postings);
    }

    public int getEntryId() {
        return entryId;
    }

    public LocalDate getDate() {
        return date;
    }

    public EntryKind getKind() {
        return kind;
    }

    public String getDescription() {
        return description;
    }

    public String getSourceFilename() {
        return sourceFilename;
    }

    public int getSourceLineno() {
        return sourceLineno;
    }

    public List<Posting> getPostings() {
        return postings;
    }
}
