package com.replication.binlogsync.supplier;

import com.replication.binlogsync.commons.conf.Flavor;

import java.util.Objects;

public class BinlogConnectionConfiguration {
    public static final long DEFAULT_SERVER_ID = 100L;
    public static final long DEFAULT_CONNECT_TIMEOUT = 10000L;
    public static final long DEFAULT_HEARTBEAT_INTERVAL = 1000L;
    public static final int DEFAULT_QUEUE_SIZE = 10000;

    private final long serverId;
    private final Flavor flavor;
    private final String host;
    private final int port;
    private final String user;
    private final String password;
    private final long connectTimeout;
    private final long heartbeatInterval;
    private final int queueSize;

    private BinlogConnectionConfiguration(Builder builder) {
        this.serverId = builder.serverId;
        this.flavor = builder.flavor;
        this.host = Objects.requireNonNull(builder.host, "host");
        this.port = builder.port;
        this.user = Objects.requireNonNull(builder.user, "user");
        this.password = (builder.password != null) ? (builder.password) : ("");
        this.connectTimeout = builder.connectTimeout;
        this.heartbeatInterval = builder.heartbeatInterval;
        this.queueSize = builder.queueSize;
    }

    public static Builder builder() {
        return new Builder();
    }

    public long getServerId() {
        return this.serverId;
    }

    public Flavor getFlavor() {
        return this.flavor;
    }

    public String getHost() {
        return this.host;
    }

    public int getPort() {
        return this.port;
    }

    public String getUser() {
        return this.user;
    }

    public String getPassword() {
        return this.password;
    }

    public long getConnectTimeout() {
        return this.connectTimeout;
    }

    public long getHeartbeatInterval() {
        return this.heartbeatInterval;
    }

    public int getQueueSize() {
        return this.queueSize;
    }

    @Override
    public String toString() {
        return String.format("serverId: %d | flavor: %s | host: %s | port: %d | user: %s",
                this.serverId, this.flavor, this.host, this.port, this.user);
    }

    public static class Builder {
        private long serverId = BinlogConnectionConfiguration.DEFAULT_SERVER_ID;
        private Flavor flavor = Flavor.MYSQL;
        private String host;
        private int port = 3306;
        private String user;
        private String password;
        private long connectTimeout = BinlogConnectionConfiguration.DEFAULT_CONNECT_TIMEOUT;
        private long heartbeatInterval = BinlogConnectionConfiguration.DEFAULT_HEARTBEAT_INTERVAL;
        private int queueSize = BinlogConnectionConfiguration.DEFAULT_QUEUE_SIZE;

        public Builder serverId(long serverId) {
            this.serverId = serverId;
            return this;
        }

        public Builder flavor(Flavor flavor) {
            this.flavor = Objects.requireNonNull(flavor);
            return this;
        }

        public Builder host(String host) {
            this.host = host;
            return this;
        }

        public Builder port(int port) {
            this.port = port;
            return this;
        }

        public Builder user(String user) {
            this.user = user;
            return this;
        }

        public Builder password(String password) {
            this.password = password;
            return this;
        }

        public Builder connectTimeout(long connectTimeout) {
            this.connectTimeout = connectTimeout;
            return this;
        }

        public Builder heartbeatInterval(long heartbeatInterval) {
            this.heartbeatInterval = heartbeatInterval;
            return this;
        }

        public Builder queueSize(int queueSize) {
            if (queueSize <= 0) {
                throw new IllegalArgumentException(String.format("queue size must be positive: %d", queueSize));
            }
            this.queueSize = queueSize;
            return this;
        }

        public BinlogConnectionConfiguration build() {
            return new BinlogConnectionConfiguration(this);
        }
    }
}
