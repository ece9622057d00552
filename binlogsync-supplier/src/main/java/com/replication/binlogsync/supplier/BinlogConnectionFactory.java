package com.replication.binlogsync.supplier;

import com.replication.binlogsync.supplier.mysql.binlog.BinaryLogConnection;

@FunctionalInterface
public interface BinlogConnectionFactory {
    BinlogConnectionFactory DEFAULT = BinaryLogConnection::new;

    BinlogConnection create(BinlogConnectionConfiguration configuration);
}
