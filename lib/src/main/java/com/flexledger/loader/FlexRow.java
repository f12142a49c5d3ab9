package com.flexledger.loader;

import java.util.Map;

/** One DATA row resolved against its section's HEADER row. */
final class FlexRow {
    private final FlexSection section;
    private final int rowNumber;
    private final Map<String, String> values;

    FlexRow(FlexSection section, int rowNumber, Map<String, String> values) {
        this.section = section;
        this.rowNumber = rowNumber;
        this.values = values;
    }

    FlexSection getSection() {
        return section;
    }

    int getRowNumber() {
        return rowNumber;
    }

    /** First non-blank value among the column aliases, or an empty string. */
    String first(String... columns) {
        for (String column : columns) {
            String value = values.get(column);
            if (value != null && !value.isBlank()) {
                return value.trim();
            }
        }
        return "";
    }
}
