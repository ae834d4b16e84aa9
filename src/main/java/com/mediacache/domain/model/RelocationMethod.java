package com.mediacache.domain.model;

import java.util.Arrays;

/**
 * Physical strategy used to place a file in the cache. The database value is the
 * lower-case name mirrored by the schema CHECK constraint.
 */
public enum RelocationMethod {
    SYMLINK("symlink"),
    HARDLINK("hardlink"),
    COPY("copy"),
    SECURE_COPY("secure_copy");

    private final String dbValue;

    RelocationMethod(String dbValue) {
        this.dbValue = dbValue;
    }

    public String getDbValue() {
        return dbValue;
    }

    public boolean isCopy() {
        return this == COPY || this == SECURE_COPY;
    }

    public static RelocationMethod fromDbValue(String value) {
        return Arrays.stream(values())
            .filter(m -> m.dbValue.equals(value))
            .findFirst()
            .orElseThrow(() -> new IllegalArgumentException("Unknown relocation method: " + value));
    }
}
