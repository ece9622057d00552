package com.replication.binlogsync.commons.conf;

public enum Flavor {
    MYSQL("mysql"),
    MARIADB("mariadb");

    private final String code;

    Flavor(String code) {
        this.code = code;
    }

    public String getCode() {
        return this.code;
    }

    /**
     * Unknown and empty values fall back to {@link #MYSQL}.
     */
    public static Flavor of(String code) {
        if (code != null) {
            for (Flavor flavor : Flavor.values()) {
                if (flavor.code.equalsIgnoreCase(code.trim())) {
                    return flavor;
                }
            }
        }
        return Flavor.MYSQL;
    }

    @Override
    public String toString() {
        return this.code;
    }
}
