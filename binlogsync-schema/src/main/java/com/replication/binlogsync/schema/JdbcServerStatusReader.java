package com.replication.binlogsync.schema;

import com.replication.binlogsync.commons.checkpoint.MasterStatus;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.Objects;

public class JdbcServerStatusReader implements ServerStatusReader {
    static final String SHOW_MASTER_STATUS_SQL = "SHOW MASTER STATUS";
    static final String SHOW_VARIABLES_SQL = "SHOW VARIABLES LIKE ?";

    private static final int PING_TIMEOUT_SECONDS = 5;
    private static final String EXECUTED_GTID_SET = "Executed_Gtid_Set";

    private final DataSource dataSource;

    public JdbcServerStatusReader(DataSource dataSource) {
        this.dataSource = Objects.requireNonNull(dataSource);
    }

    @Override
    public void ping() throws SQLException {
        try (Connection connection = this.dataSource.getConnection()) {
            if (!connection.isValid(JdbcServerStatusReader.PING_TIMEOUT_SECONDS)) {
                throw new SQLException("database connection is not valid");
            }
        }
    }

    @Override
    public MasterStatus readMasterStatus() throws SQLException {
        try (Connection connection = this.dataSource.getConnection();
             Statement statement = connection.createStatement();
             ResultSet resultSet = statement.executeQuery(JdbcServerStatusReader.SHOW_MASTER_STATUS_SQL)) {
            if (!resultSet.next()) {
                throw new SQLException("no master status, binary logging is disabled on the server");
            }

            String gtidSet = null;

            if (JdbcServerStatusReader.hasColumn(resultSet.getMetaData(), JdbcServerStatusReader.EXECUTED_GTID_SET)) {
                gtidSet = resultSet.getString(JdbcServerStatusReader.EXECUTED_GTID_SET);
            }

            return new MasterStatus(resultSet.getString("File"), resultSet.getLong("Position"), gtidSet);
        }
    }

    private static boolean hasColumn(ResultSetMetaData metaData, String column) throws SQLException {
        for (int index = 1; index <= metaData.getColumnCount(); index++) {
            if (column.equalsIgnoreCase(metaData.getColumnLabel(index))) {
                return true;
            }
        }
        return false;
    }

    @Override
    public String readVariable(String name) throws SQLException {
        try (Connection connection = this.dataSource.getConnection();
             PreparedStatement statement = connection.prepareStatement(JdbcServerStatusReader.SHOW_VARIABLES_SQL)) {
            statement.setString(1, name);

            try (ResultSet resultSet = statement.executeQuery()) {
                return (resultSet.next()) ? (resultSet.getString(2)) : (null);
            }
        }
    }
}
