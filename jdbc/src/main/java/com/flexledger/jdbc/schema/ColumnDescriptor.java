package com.flexledger.jdbc.schema;

import java.util.Objects;

public final class ColumnDescriptor {
    private final String name;
    private final int jdbcType;
    private final String typeName;
    private final int size;
    private final int scale;
    private final boolean nullable;

    public ColumnDescriptor(String name, int jdbcType, String typeName, int size, int scale, boolean nullable) {
        this.name = Objects.requireNonNull(name, "name");
        this.jdbcType = jdbcType;
        this.typeName = Objects.requireNonNull(typeName, "typeName");
        this.size = size;
        this.scale = scale;
        this.nullable = nullable;
    }

    public String getName() {
        return name;
    }

    public int getJdbcType() {
        return jdbcType;
    }

    public String getTypeName() {
        return typeName;
    }

    public int getSize() {
        return size;
    }

    public int getScale() {
        return scale;
    }

    public boolean isNullable() {
        return nullable;
    }
}
