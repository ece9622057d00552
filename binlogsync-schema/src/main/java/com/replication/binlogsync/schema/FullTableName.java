package com.replication.binlogsync.schema;

import java.io.Serializable;
import java.util.Objects;

public class FullTableName implements Serializable {
    private final String database;
    private final String name;

    public FullTableName(String database, String name) {
        this.database = database;
        this.name = FullTableName.getTableName(Objects.requireNonNull(name, "table name"));
    }

    private static String getTableName(String fullName) {
        fullName = fullName.replaceAll("`", "");

        if (fullName.contains(".")) {
            return fullName.substring(fullName.lastIndexOf('.') + 1);
        }

        return fullName;
    }

    public String getDatabase() {
        return this.database;
    }

    public String getName() {
        return this.name;
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (other == null || this.getClass() != other.getClass()) {
            return false;
        }

        FullTableName that = (FullTableName) other;

        return Objects.equals(this.database, that.database) && this.name.equals(that.name);
    }

    @Override
    public int hashCode() {
        return Objects.hash(this.database, this.name);
    }

    @Override
    public String toString() {
        return (this.database != null) ? (String.format("%s.%s", this.database, this.name)) : (this.name);
    }
}
