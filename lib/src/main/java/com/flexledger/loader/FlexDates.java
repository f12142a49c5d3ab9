package com.flexledger.loader;

import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.List;

final class FlexDates {

    private static final List<DateTimeFormatter> FORMATS =
            List.of(
                    DateTimeFormatter.ISO_LOCAL_DATE,
                    DateTimeFormatter.BASIC_ISO_DATE,
                    DateTimeFormatter.ofPattern("dd-MM-uuuu"),
                    DateTimeFormatter.ofPattern("MM/dd/uuuu"));

    private FlexDates() {}

    /**
     * Parses the date part of a date or date-time cell. Anything after {@code ;}, {@code ,} or a
     * space is a time of day and is dropped.
     */
    static LocalDate parse(String text) {
        String datePart = text.trim().split("[;, ]", 2)[0];
        for (DateTimeFormatter format : FORMATS) {
            try {
                return LocalDate.parse(datePart, format);
            } catch (DateTimeParseException ignored) {
                // try the next layout
            }
        }
        throw new DateTimeParseException("Cannot parse date: " + text, text, 0);
    }
}
