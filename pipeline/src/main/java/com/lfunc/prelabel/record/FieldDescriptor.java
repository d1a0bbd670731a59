package com.lfunc.prelabel.record;

import java.util.Objects;

public final class FieldDescriptor {
    private final String name;
    private final String sqlTypeName;
    private final FieldType type;
    private final boolean nullable;

    public FieldDescriptor(String name, String sqlTypeName, FieldType type, boolean nullable) {
        this.name = Objects.requireNonNull(name, "name");
        this.sqlTypeName = Objects.requireNonNull(sqlTypeName, "sqlTypeName");
        this.type = Objects.requireNonNull(type, "type");
        this.nullable = nullable;
    }

    public String getName() {
        return name;
    }

    public String getSqlTypeName() {
        return sqlTypeName;
    }

    public FieldType getType() {
        return type;
    }

    public boolean isNullable() {
        return nullable;
    }

    @Override
    public String toString() {
        return name + " " + sqlTypeName;
    }
}
