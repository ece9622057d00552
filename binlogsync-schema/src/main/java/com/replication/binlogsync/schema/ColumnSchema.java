package com.replication.binlogsync.schema;

import java.io.Serializable;

/**
 * One row of {@code INFORMATION_SCHEMA.COLUMNS}.
 */
public class ColumnSchema implements Serializable {
    private final String name;
    private final String dataType;
    private final String columnType;
    private final boolean nullable;
    private final String key;
    private final String extra;

    private String valueDefault;
    private String collation;
    private Long charMaxLength;
    private Long numericPrecision;
    private Long numericScale;

    public ColumnSchema(String name, String dataType, String columnType, boolean nullable, String key, String extra) {
        this.name = name;
        this.dataType = dataType;
        this.columnType = columnType;
        this.nullable = nullable;
        this.key = (key != null) ? (key) : ("");
        this.extra = (extra != null) ? (extra) : ("");
    }

    public ColumnSchema setDefaultValue(String valueDefault) {
        this.valueDefault = valueDefault;
        return this;
    }

    public ColumnSchema setCollation(String collation) {
        this.collation = collation;
        return this;
    }

    public ColumnSchema setCharMaxLength(Long charMaxLength) {
        this.charMaxLength = charMaxLength;
        return this;
    }

    public ColumnSchema setNumericPrecision(Long numericPrecision) {
        this.numericPrecision = numericPrecision;
        return this;
    }

    public ColumnSchema setNumericScale(Long numericScale) {
        this.numericScale = numericScale;
        return this;
    }

    public String getName() {
        return this.name;
    }

    public String getDataType() {
        return this.dataType;
    }

    public String getColumnType() {
        return this.columnType;
    }

    public boolean isNullable() {
        return this.nullable;
    }

    public String getKey() {
        return this.key;
    }

    public String getExtra() {
        return this.extra;
    }

    public String getValueDefault() {
        return this.valueDefault;
    }

    public String getCollation() {
        return this.collation;
    }

    public Long getCharMaxLength() {
        return this.charMaxLength;
    }

    public Long getNumericPrecision() {
        return this.numericPrecision;
    }

    public Long getNumericScale() {
        return this.numericScale;
    }

    public boolean isPrimary() {
        return "PRI".equalsIgnoreCase(this.key);
    }

    public boolean isUnique() {
        return "UNI".equalsIgnoreCase(this.key);
    }

    public boolean isAutoIncrement() {
        return this.extra.toLowerCase().contains("auto_increment");
    }

    @Override
    public String toString() {
        return String.format("%s %s%s", this.name, this.columnType, (this.nullable) ? ("") : (" NOT NULL"));
    }
}
