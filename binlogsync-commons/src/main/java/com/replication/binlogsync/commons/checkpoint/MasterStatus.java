package com.replication.binlogsync.commons.checkpoint;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;
import java.util.Objects;

/**
 * Replication coordinates into the binary log of the master: file name, byte
 * offset inside that file and, when the server reports one, the executed GTID set.
 */
public class MasterStatus implements Serializable, Comparable<MasterStatus> {
    /**
     * First valid event offset in every binary log file, right after the magic header.
     */
    public static final long MIN_POSITION = 4L;

    private final String file;
    private final long position;
    private final String gtidSet;

    public MasterStatus(String file, long position) {
        this(file, position, null);
    }

    @JsonCreator
    public MasterStatus(
            @JsonProperty("file") String file,
            @JsonProperty("position") long position,
            @JsonProperty("gtidSet") String gtidSet) {
        this.file = file;
        this.position = position;
        this.gtidSet = gtidSet;
    }

    public String getFile() {
        return this.file;
    }

    public long getPosition() {
        return this.position;
    }

    public String getGtidSet() {
        return this.gtidSet;
    }

    public MasterStatus withFile(String file) {
        return new MasterStatus(file, this.position, this.gtidSet);
    }

    public MasterStatus withPosition(long position) {
        return new MasterStatus(this.file, position, this.gtidSet);
    }

    public MasterStatus withGtidSet(String gtidSet) {
        return new MasterStatus(this.file, this.position, gtidSet);
    }

    @Override
    public int compareTo(MasterStatus status) {
        if (status != null) {
            if (this.file != null && status.file != null) {
                if (this.file.equals(status.file)) {
                    return Long.compare(this.position, status.position);
                } else {
                    return this.file.compareTo(status.file);
                }
            } else if (this.file != null) {
                return 1;
            } else if (status.file != null) {
                return -1;
            } else {
                return Long.compare(this.position, status.position);
            }
        } else {
            return 1;
        }
    }

    @Override
    public boolean equals(Object status) {
        if (status instanceof MasterStatus) {
            MasterStatus other = (MasterStatus) status;
            return this.compareTo(other) == 0 && Objects.equals(this.gtidSet, other.gtidSet);
        } else {
            return false;
        }
    }

    @Override
    public int hashCode() {
        return Objects.hash(this.file, this.position, this.gtidSet);
    }

    @Override
    public String toString() {
        if (this.gtidSet != null && !this.gtidSet.isEmpty()) {
            return String.format("file: %s | position: %d | gtidSet: %s", this.file, this.position, this.gtidSet);
        }
        return String.format("file: %s | position: %d", this.file, this.position);
    }
}
