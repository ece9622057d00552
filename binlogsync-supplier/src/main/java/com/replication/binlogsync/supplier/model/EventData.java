package com.replication.binlogsync.supplier.model;

import java.io.Serializable;

public interface EventData extends Serializable {
}
