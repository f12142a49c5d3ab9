package com.flexledger.loader;

import java.math.BigDecimal;

/**
 * Amount parser for export columns. Grouping commas are dropped, and blank cells or the export's
 * {@code --} placeholder read as zero. Anything else that is not a plain decimal is rejected with
 * {@link NumberFormatException} so the caller can skip the row.
 */
public final class DecimalParser {

    private DecimalParser() {}

    public static BigDecimal parse(String text) {
        if (text == null) {
            return BigDecimal.ZERO;
        }
        String trimmed = text.trim().replace(",", "");
        if (trimmed.isEmpty() || "--".equals(trimmed)) {
            return BigDecimal.ZERO;
        }
        try {
            return new BigDecimal(trimmed);
        } catch (NumberFormatException ex) {
            throw new NumberFormatException("Invalid decimal: " + text);
        }
    }
}
