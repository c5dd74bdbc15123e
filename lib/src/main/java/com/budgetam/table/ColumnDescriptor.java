package com.budgetam.table;

import java.sql.Types;
import java.util.Objects;

public final class ColumnDescriptor {
    private final String name;
    private final int jdbcType;
    private final String typeName;
    private final boolean nullable;
    private final String className;

    public ColumnDescriptor(String name, int jdbcType, String typeName, boolean nullable, String className) {
        this.name = Objects.requireNonNull(name, "name");
        this.jdbcType = jdbcType;
        this.typeName = Objects.requireNonNull(typeName, "typeName");
        this.nullable = nullable;
        this.className = Objects.requireNonNull(className, "className");
    }

    static ColumnDescriptor varchar(String name, boolean nullable) {
        return new ColumnDescriptor(name, Types.VARCHAR, "VARCHAR", nullable, String.class.getName());
    }

    static ColumnDescriptor integer(String name, boolean nullable) {
        return new ColumnDescriptor(name, Types.INTEGER, "INTEGER", nullable, Integer.class.getName());
    }

    static ColumnDescriptor doubleColumn(String name, boolean nullable) {
        return new ColumnDescriptor(name, Types.DOUBLE, "DOUBLE", nullable, Double.class.getName());
    }

    static ColumnDescriptor bool(String name, boolean nullable) {
        return new ColumnDescriptor(name, Types.BOOLEAN, "BOOLEAN", nullable, Boolean.class.getName());
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

    public boolean isNullable() {
        return nullable;
    }

    public String getClassName() {
        return className;
    }
}
