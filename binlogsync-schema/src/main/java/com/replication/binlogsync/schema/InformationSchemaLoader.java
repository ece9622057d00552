package com.replication.binlogsync.schema;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Loads table structures of one schema from {@code INFORMATION_SCHEMA}.
 */
public class InformationSchemaLoader implements TableSchemaLoader {
    private static final Logger LOG = LogManager.getLogger(InformationSchemaLoader.class);

    static final String LIST_COLUMNS_SQL = "SELECT COLUMN_NAME, DATA_TYPE, COLUMN_TYPE, IS_NULLABLE, COLUMN_KEY, EXTRA, " +
            "COLUMN_DEFAULT, COLLATION_NAME, CHARACTER_MAXIMUM_LENGTH, NUMERIC_PRECISION, NUMERIC_SCALE " +
            "FROM INFORMATION_SCHEMA.COLUMNS WHERE TABLE_SCHEMA = ? AND TABLE_NAME = ? ORDER BY ORDINAL_POSITION";
    static final String TABLE_TYPE_SQL = "SELECT TABLE_TYPE FROM INFORMATION_SCHEMA.TABLES WHERE TABLE_SCHEMA = ? AND TABLE_NAME = ?";
    static final String SHOW_CREATE_TABLE_SQL = "SHOW CREATE TABLE %s.%s";

    private final DataSource dataSource;
    private final String schema;

    public InformationSchemaLoader(DataSource dataSource, String schema) {
        this.dataSource = Objects.requireNonNull(dataSource);
        this.schema = Objects.requireNonNull(schema, "schema");
    }

    @Override
    public TableSchema load(String tableName) throws SQLException {
        FullTableName fullTableName = new FullTableName(this.schema, tableName);

        try (Connection connection = this.dataSource.getConnection()) {
            List<ColumnSchema> columnSchemas = this.listColumns(connection, fullTableName);

            if (columnSchemas.isEmpty()) {
                throw new TableNotFoundException(fullTableName);
            }

            TableSchema tableSchema = new TableSchema(
                    fullTableName,
                    columnSchemas,
                    this.isView(connection, fullTableName),
                    this.getCreateTable(connection, fullTableName)
            );

            InformationSchemaLoader.LOG.debug("loaded table {} with {} columns", fullTableName, columnSchemas.size());

            return tableSchema;
        }
    }

    private List<ColumnSchema> listColumns(Connection connection, FullTableName tableName) throws SQLException {
        List<ColumnSchema> columnList = new ArrayList<>();

        try (PreparedStatement statement = connection.prepareStatement(InformationSchemaLoader.LIST_COLUMNS_SQL)) {
            statement.setString(1, tableName.getDatabase());
            statement.setString(2, tableName.getName());

            try (ResultSet resultSet = statement.executeQuery()) {
                while (resultSet.next()) {
                    columnList.add(new ColumnSchema(
                            resultSet.getString("COLUMN_NAME"),
                            resultSet.getString("DATA_TYPE"),
                            resultSet.getString("COLUMN_TYPE"),
                            "YES".equalsIgnoreCase(resultSet.getString("IS_NULLABLE")),
                            resultSet.getString("COLUMN_KEY"),
                            resultSet.getString("EXTRA")
                    ).setDefaultValue(resultSet.getString("COLUMN_DEFAULT"))
                            .setCollation(resultSet.getString("COLLATION_NAME"))
                            .setCharMaxLength(InformationSchemaLoader.getLong(resultSet, "CHARACTER_MAXIMUM_LENGTH"))
                            .setNumericPrecision(InformationSchemaLoader.getLong(resultSet, "NUMERIC_PRECISION"))
                            .setNumericScale(InformationSchemaLoader.getLong(resultSet, "NUMERIC_SCALE")));
                }
            }
        }

        return columnList;
    }

    private static Long getLong(ResultSet resultSet, String column) throws SQLException {
        long value = resultSet.getLong(column);
        return (resultSet.wasNull()) ? (null) : (value);
    }

    private boolean isView(Connection connection, FullTableName tableName) throws SQLException {
        try (PreparedStatement statement = connection.prepareStatement(InformationSchemaLoader.TABLE_TYPE_SQL)) {
            statement.setString(1, tableName.getDatabase());
            statement.setString(2, tableName.getName());

            try (ResultSet resultSet = statement.executeQuery()) {
                return resultSet.next() && "VIEW".equalsIgnoreCase(resultSet.getString(1));
            }
        }
    }

    private String getCreateTable(Connection connection, FullTableName tableName) {
        String query = String.format(
                InformationSchemaLoader.SHOW_CREATE_TABLE_SQL,
                InformationSchemaLoader.quote(tableName.getDatabase()),
                InformationSchemaLoader.quote(tableName.getName())
        );

        try (Statement statement = connection.createStatement();
             ResultSet resultSet = statement.executeQuery(query)) {
            return (resultSet.next()) ? (resultSet.getString(2)) : (null);
        } catch (SQLException exception) {
            InformationSchemaLoader.LOG.warn("error getting create table for {}: {}", tableName, exception.getMessage());
            return null;
        }
    }

    static String quote(String identifier) {
        return String.format("`%s`", identifier.replace("`", "``"));
    }
}
