package com.assetdna.tracker.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

/**
 * Fixed asset type taxonomy.
 *
 * Each type carries its hierarchy rank (1 = top of the tree) and the short code used in URNs.
 * Hardware, Software and Firmware CIs share rank 6 and are interchangeable as leaves.
 * Adding a type means adding a constant here; nothing else models the hierarchy.
 */
public enum AssetType {

    DOMAIN_SYSTEM_OF_SYSTEMS("Domain / System of Systems", 1, "domain"),
    SYSTEM_ENVIRONMENT("System / Environment", 2, "sys"),
    SUBSYSTEM_SERVICE("Subsystem / Service", 3, "subsys"),
    COMPONENT_SEGMENT("Component / Segment", 4, "comp"),
    CONFIGURATION_ITEM("Configuration Item (CI)", 5, "ci"),
    HARDWARE_CI("Hardware CI", 6, "hw"),
    SOFTWARE_CI("Software CI", 6, "sw"),
    FIRMWARE_CI("Firmware CI", 6, "fw");

    public static final int LEAF_RANK = 6;

    private final String label;
    private final int rank;
    private final String code;

    AssetType(String label, int rank, String code) {
        this.label = label;
        this.rank = rank;
        this.code = code;
    }

    @JsonValue
    public String getLabel() {
        return label;
    }

    public int getRank() {
        return rank;
    }

    public String getCode() {
        return code;
    }

    public boolean isLeafVariant() {
        return rank == LEAF_RANK;
    }

    /**
     * Lenient lookup by label, constant name or URN code, ignoring case.
     * "Subsystem" is accepted as a legacy label for {@link #SUBSYSTEM_SERVICE}.
     */
    public static Optional<AssetType> fromLabel(String value) {
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        String candidate = value.trim();
        if ("subsystem".equalsIgnoreCase(candidate)) {
            return Optional.of(SUBSYSTEM_SERVICE);
        }
        String asConstant = candidate.toUpperCase(Locale.ROOT).replace(' ', '_');
        return Arrays.stream(values())
                .filter(type -> type.label.equalsIgnoreCase(candidate)
                        || type.name().equals(asConstant)
                        || type.code.equalsIgnoreCase(candidate))
                .findFirst();
    }

    @JsonCreator
    public static AssetType fromJson(String value) {
        return fromLabel(value)
                .orElseThrow(() -> new IllegalArgumentException("Unknown asset type: " + value));
    }
}
