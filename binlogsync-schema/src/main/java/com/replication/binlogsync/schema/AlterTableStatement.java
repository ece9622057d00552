package com.replication.binlogsync.schema;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Detects {@code ALTER TABLE} statements in query events.
 */
public final class AlterTableStatement {
    private static final Pattern PATTERN = Pattern.compile(
            "(?i)^ALTER\\sTABLE\\s.*?`{0,1}(.*?)`{0,1}\\.{0,1}`{0,1}([^`\\.]+?)`{0,1}\\s.*"
    );

    private AlterTableStatement() {
    }

    /**
     * @return the altered table; its database is {@code null} when the statement did not qualify the name
     */
    public static Optional<FullTableName> parse(String sql) {
        if (sql == null) {
            return Optional.empty();
        }

        Matcher matcher = AlterTableStatement.PATTERN.matcher(sql.trim());

        if (!matcher.find()) {
            return Optional.empty();
        }

        String database = matcher.group(1);
        String table = matcher.group(2);

        return Optional.of(new FullTableName((database == null || database.isEmpty()) ? (null) : (database), table));
    }
}
