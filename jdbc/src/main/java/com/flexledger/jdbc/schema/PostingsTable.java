package com.flexledger.jdbc.schema;

import com.flexledger.journal.JournalEntry;
import com.flexledger.journal.Posting;
import java.util.ArrayList;
import java.util.List;

/** Every posting of the run with the entry it belongs to and the input row behind it. */
public final class PostingsTable {
    public static final String NAME = "postings";

    private static final TableDefinition DEFINITION = createDefinition();

    private PostingsTable() {}

    public static TableDefinition getDefinition() {
        return DEFINITION;
    }

    public static List<Object[]> materializeRows(List<JournalEntry> entries) {
        List<Object[]> rows = new ArrayList<>();
        for (JournalEntry entry : entries) {
            for (Posting posting : entry.getPostings()) {
                rows.add(toRow(entry, posting));
            }
        }
        return rows;
    }

    private static Object[] toRow(JournalEntry entry, Posting posting) {
        return new Object[] {
            posting.getPostingId(),
            entry.getEntryId(),
            Columns.epochDay(posting.getDate()),
            entry.getKind().name(),
            posting.getAccount().getCode(),
            posting.getAccount().getDisplayName(),
            posting.getSide().name(),
            posting.getDebit(),
            posting.getCredit(),
            posting.getMemo(),
            entry.getSourceFilename(),
            entry.getSourceLineno() > 0 ? entry.getSourceLineno() : null
        };
    }

    private static TableDefinition createDefinition() {
        List<ColumnDescriptor> columns = new ArrayList<>();
        columns.add(Columns.integer("posting_id", false));
        columns.add(Columns.integer("entry_id", false));
        columns.add(Columns.date("date"));
        columns.add(Columns.varchar("kind", false));
        columns.add(Columns.varchar("account", false));
        columns.add(Columns.varchar("account_name", false));
        columns.add(Columns.varchar("side", false));
        columns.add(Columns.money("debit"));
        columns.add(Columns.money("credit"));
        columns.add(Columns.varchar("memo", false));
        columns.add(Columns.varchar("source_filename", true));
        columns.add(Columns.integer("source_lineno", true));
        return new TableDefinition(NAME, "Journal postings", columns);
    }
}
