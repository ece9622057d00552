package com.replication.binlogsync.commons.conf;

import java.net.URLDecoder;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * MySQL data source name in the form
 * {@code [user[:password]@][tcp[(host[:port])]]/[schema][?param=value&...]}.
 * <p>
 * Instances are mutable only through {@link #removeParameter(String)} so that
 * custom parameters can be consumed before the remainder is handed to the JDBC driver.
 */
public class MySQLDsn {
    public static final String DEFAULT_HOST = "127.0.0.1";
    public static final int DEFAULT_PORT = 3306;

    private static final String PROTOCOL_TCP = "tcp";
    private static final String JDBC_URL_FORMAT = "jdbc:mysql://%s:%d/%s";

    private final String user;
    private final String password;
    private final String host;
    private final int port;
    private final String schema;
    private final Map<String, String> parameters;

    private MySQLDsn(String user, String password, String host, int port, String schema, Map<String, String> parameters) {
        this.user = user;
        this.password = password;
        this.host = host;
        this.port = port;
        this.schema = schema;
        this.parameters = parameters;
    }

    public static MySQLDsn parse(String dsn) {
        Objects.requireNonNull(dsn, "dsn");

        String location = dsn;
        String query = null;

        int queryIndex = dsn.indexOf('?');
        if (queryIndex >= 0) {
            location = dsn.substring(0, queryIndex);
            query = dsn.substring(queryIndex + 1);
        }

        int slashIndex = location.lastIndexOf('/');
        if (slashIndex < 0) {
            throw new IllegalArgumentException("invalid DSN: missing the slash separating the schema name");
        }

        String schema = location.substring(slashIndex + 1);
        String authority = location.substring(0, slashIndex);

        String user = "";
        String password = "";

        int atIndex = authority.lastIndexOf('@');
        if (atIndex >= 0) {
            String userInfo = authority.substring(0, atIndex);
            authority = authority.substring(atIndex + 1);

            int colonIndex = userInfo.indexOf(':');
            if (colonIndex >= 0) {
                user = userInfo.substring(0, colonIndex);
                password = userInfo.substring(colonIndex + 1);
            } else {
                user = userInfo;
            }
        }

        String host = MySQLDsn.DEFAULT_HOST;
        int port = MySQLDsn.DEFAULT_PORT;

        if (!authority.isEmpty()) {
            String protocol = authority;
            String address = "";

            int openIndex = authority.indexOf('(');
            if (openIndex >= 0) {
                if (!authority.endsWith(")")) {
                    throw new IllegalArgumentException("invalid DSN: network address not terminated (missing closing brace)");
                }
                protocol = authority.substring(0, openIndex);
                address = authority.substring(openIndex + 1, authority.length() - 1);
            }

            if (!MySQLDsn.PROTOCOL_TCP.equalsIgnoreCase(protocol)) {
                throw new IllegalArgumentException(String.format("invalid DSN: unsupported protocol \"%s\", only tcp can replicate", protocol));
            }

            if (!address.isEmpty()) {
                int portIndex = address.lastIndexOf(':');

                if (address.startsWith("[")) {
                    int closeIndex = address.indexOf(']');
                    if (closeIndex < 0) {
                        throw new IllegalArgumentException("invalid DSN: unterminated IPv6 address");
                    }
                    host = address.substring(1, closeIndex);
                    portIndex = (closeIndex + 1 < address.length() && address.charAt(closeIndex + 1) == ':') ? (closeIndex + 1) : (-1);
                } else {
                    host = (portIndex >= 0) ? (address.substring(0, portIndex)) : (address);
                }

                if (portIndex >= 0) {
                    port = MySQLDsn.parsePort(address.substring(portIndex + 1));
                }
            }
        }

        return new MySQLDsn(user, password, host, port, schema, MySQLDsn.parseQuery(query));
    }

    private static int parsePort(String value) {
        try {
            int port = Integer.parseInt(value);

            if (port <= 0 || port > 65535) {
                throw new IllegalArgumentException(String.format("invalid DSN: port out of range: %d", port));
            }

            return port;
        } catch (NumberFormatException exception) {
            throw new IllegalArgumentException(String.format("invalid DSN: invalid port \"%s\"", value), exception);
        }
    }

    private static Map<String, String> parseQuery(String query) {
        Map<String, String> parameters = new LinkedHashMap<>();

        if (query == null || query.isEmpty()) {
            return parameters;
        }

        for (String pair : query.split("&")) {
            if (pair.isEmpty()) {
                continue;
            }

            int equalsIndex = pair.indexOf('=');
            if (equalsIndex <= 0) {
                throw new IllegalArgumentException(String.format("invalid DSN: invalid parameter \"%s\"", pair));
            }

            parameters.put(
                    pair.substring(0, equalsIndex),
                    URLDecoder.decode(pair.substring(equalsIndex + 1), StandardCharsets.UTF_8)
            );
        }

        return parameters;
    }

    public String getUser() {
        return this.user;
    }

    public String getPassword() {
        return this.password;
    }

    public String getHost() {
        return this.host;
    }

    public int getPort() {
        return this.port;
    }

    public String getSchema() {
        return this.schema;
    }

    public Map<String, String> getParameters() {
        return Collections.unmodifiableMap(this.parameters);
    }

    public String getParameter(String name) {
        return this.parameters.get(name);
    }

    /**
     * @return the removed value, or {@code null} if the parameter was absent
     */
    public String removeParameter(String name) {
        return this.parameters.remove(name);
    }

    public String toJdbcUrl() {
        String url = String.format(
                MySQLDsn.JDBC_URL_FORMAT,
                (this.host.indexOf(':') >= 0) ? ("[" + this.host + "]") : (this.host),
                this.port,
                this.schema
        );

        if (this.parameters.isEmpty()) {
            return url;
        }

        return url + "?" + this.parameters.entrySet().stream()
                .map(entry -> entry.getKey() + "=" + URLEncoder.encode(entry.getValue(), StandardCharsets.UTF_8))
                .collect(Collectors.joining("&"));
    }

    @Override
    public String toString() {
        StringBuilder builder = new StringBuilder();

        if (!this.user.isEmpty()) {
            builder.append(this.user);
            if (!this.password.isEmpty()) {
                builder.append(":***");
            }
            builder.append('@');
        }

        builder.append(String.format("tcp(%s:%d)/%s", this.host, this.port, this.schema));

        if (!this.parameters.isEmpty()) {
            builder.append('?').append(this.parameters.entrySet().stream()
                    .map(entry -> entry.getKey() + "=" + entry.getValue())
                    .collect(Collectors.joining("&")));
        }

        return builder.toString();
    }
}
