package com.baskettecase.credvault.identity;

import java.util.Arrays;
import java.util.Locale;

/**
 * Database engines a credential can point at.
 *
 * The wire name is the lowercase identifier that enters the connection fingerprint,
 * so it must never change for an existing constant.
 */
public enum EngineType {
    POSTGRESQL("postgresql"),
    MYSQL("mysql"),
    MONGODB("mongodb"),
    SQLITE("sqlite");

    private final String wireName;

    EngineType(String wireName) {
        this.wireName = wireName;
    }

    public String getWireName() {
        return wireName;
    }

    /**
     * Resolve an engine from its wire name (case-insensitive).
     *
     * @throws IllegalArgumentException if the name is not a supported engine
     */
    public static EngineType fromWireName(String name) {
        if (name == null) {
            throw new IllegalArgumentException("Engine type is required");
        }
        String normalized = name.trim().toLowerCase(Locale.ROOT);
        return Arrays.stream(values())
            .filter(type -> type.wireName.equals(normalized))
            .findFirst()
            .orElseThrow(() -> new IllegalArgumentException(
                "Database type must be one of: " + Arrays.toString(
                    Arrays.stream(values()).map(EngineType::getWireName).toArray())));
    }
}
