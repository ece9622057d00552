package com.replication.binlogsync;

/**
 * The server runs with a setting the replication client cannot work with.
 */
public class NotSupportedException extends BinlogSyncException {
    private final String variable;
    private final String actual;
    private final String expected;

    public NotSupportedException(String variable, String actual, String expected) {
        super(String.format("server variable %s is \"%s\" but \"%s\" is required", variable, actual, expected));
        this.variable = variable;
        this.actual = actual;
        this.expected = expected;
    }

    public String getVariable() {
        return this.variable;
    }

    public String getActual() {
        return this.actual;
    }

    public String getExpected() {
        return this.expected;
    }
}
