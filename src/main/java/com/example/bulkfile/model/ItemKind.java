package com.example.bulkfile.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Declared kind of a planned item. Clutter items are stray lock, temp and thumbnail files
 * that get allocated without a content stub.
 */
public enum ItemKind {
    FILE("File"),
    CLUTTER("Clutter");

    private final String label;

    ItemKind(String label) {
        this.label = label;
    }

    @JsonValue
    public String label() {
        return label;
    }

    @JsonCreator
    public static ItemKind fromValue(String value) {
        if (value == null || value.isBlank()) {
            return FILE;
        }
        String normalized = value.trim().toUpperCase(Locale.ROOT);
        for (ItemKind kind : values()) {
            if (kind.name().equals(normalized)) {
                return kind;
            }
        }
        throw new IllegalArgumentException("Unknown item kind: " + value);
    }
}
