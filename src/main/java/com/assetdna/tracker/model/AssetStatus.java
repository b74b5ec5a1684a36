package com.assetdna.tracker.model;

import java.util.Locale;
import java.util.Optional;

public enum AssetStatus {
    ACTIVE,
    INACTIVE,
    DEPRECATED;

    public static Optional<AssetStatus> parse(String value) {
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        try {
            return Optional.of(valueOf(value.trim().toUpperCase(Locale.ROOT)));
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
    }
}
