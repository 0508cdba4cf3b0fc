package com.baskettecase.credvault.audit;

import java.util.Arrays;

/**
 * Vault operations recorded in the audit log.
 */
public enum AuditOperation {
    CREATE("create"),
    UPDATE("update"),
    DUPLICATE_CHECK("duplicate_check"),
    ACCESS("access"),
    DECRYPT("decrypt"),
    DELETE("delete");

    private final String wireName;

    AuditOperation(String wireName) {
        this.wireName = wireName;
    }

    public String getWireName() {
        return wireName;
    }

    public static AuditOperation fromWireName(String name) {
        return Arrays.stream(values())
            .filter(op -> op.wireName.equals(name))
            .findFirst()
            .orElseThrow(() -> new IllegalArgumentException("Unknown audit operation: " + name));
    }
}
