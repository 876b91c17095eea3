package com.adtech.common.model;

import java.io.Serializable;
import java.util.Objects;

public final class SourceColumn implements Serializable {
    private static final long serialVersionUID = 1L;

    private final String name;
    private final ColumnType type;

    public SourceColumn(String name, ColumnType type) {
        this.name = Objects.requireNonNull(name, "name");
        this.type = Objects.requireNonNull(type, "type");
    }

    public static SourceColumn of(String name, ColumnType type) {
        return new SourceColumn(name, type);
    }

    public String getName() {
        return name;
    }

    public ColumnType getType() {
        return type;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof SourceColumn)) {
            return false;
        }
        SourceColumn that = (SourceColumn) o;
        return name.equals(that.name) && type == that.type;
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, type);
    }

    @Override
    public String toString() {
        return name + ":" + type;
    }
}
