package com.flexledger.jdbc.schema;

import java.sql.Types;
import java.time.LocalDate;

/** Shorthand for the column shapes the ledger tables use. */
final class Columns {
    static final int MONEY_PRECISION = 18;
    static final int MONEY_SCALE = 2;

    private Columns() {}

    static ColumnDescriptor integer(String name, boolean nullable) {
        return new ColumnDescriptor(name, Types.INTEGER, "INTEGER", 10, 0, nullable);
    }

    static ColumnDescriptor varchar(String name, boolean nullable) {
        return new ColumnDescriptor(name, Types.VARCHAR, "VARCHAR", 0, 0, nullable);
    }

    static ColumnDescriptor date(String name) {
        return new ColumnDescriptor(name, Types.DATE, "DATE", 0, 0, false);
    }

    static ColumnDescriptor money(String name) {
        return new ColumnDescriptor(
                name, Types.DECIMAL, "DECIMAL(18,2)", MONEY_PRECISION, MONEY_SCALE, false);
    }

    static ColumnDescriptor decimal(String name, int precision, int scale, boolean nullable) {
        return new ColumnDescriptor(
                name, Types.DECIMAL, "DECIMAL(" + precision + "," + scale + ")", precision, scale, nullable);
    }

    static ColumnDescriptor bool(String name) {
        return new ColumnDescriptor(name, Types.BOOLEAN, "BOOLEAN", 0, 0, false);
    }

    /** Calcite stores DATE values as days since the epoch. */
    static Integer epochDay(LocalDate date) {
        return date != null ? Math.toIntExact(date.toEpochDay()) : null;
    }
}
