package com.flexledger.jdbc.schema;

import com.flexledger.ledger.LedgerMessage;
import java.util.ArrayList;
import java.util.List;

public final class MessagesTable {
    public static final String NAME = "messages";

    private static final TableDefinition DEFINITION = createDefinition();

    private MessagesTable() {}

    public static TableDefinition getDefinition() {
        return DEFINITION;
    }

    public static List<Object[]> materializeRows(List<LedgerMessage> messages) {
        List<Object[]> rows = new ArrayList<>(messages.size());
        for (LedgerMessage message : messages) {
            rows.add(
                    new Object[] {
                        message.getLevel().name(),
                        message.getMessage(),
                        message.getSourceFilename(),
                        message.getSourceFilename() != null ? message.getSourceLineno() : null
                    });
        }
        return rows;
    }

    private static TableDefinition createDefinition() {
        List<ColumnDescriptor> columns = new ArrayList<>();
        columns.add(Columns.varchar("level", false));
        columns.add(Columns.varchar("message", false));
        columns.add(Columns.varchar("source_filename", true));
        columns.add(Columns.integer("source_lineno", true));
        return new TableDefinition(NAME, "Diagnostics raised while loading and posting", columns);
    }
}
