package io.ledgerrelay.model;

import java.util.Locale;

public enum AnchorStatus {
    PENDING_USER_TRANSFER_START("pending_user_transfer_start"),
    PENDING_ANCHOR("pending_anchor"),
    PENDING_TRUST("pending_trust"),
    PENDING_STELLAR("pending_stellar"),
    COMPLETED("completed"),
    ERROR("error");

    private final String wireName;

    AnchorStatus(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    public static AnchorStatus fromString(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("status must not be blank");
        }
        String normalized = raw.trim().toLowerCase(Locale.ROOT);
        for (AnchorStatus value : values()) {
            if (value.wireName.equals(normalized) || value.name().equalsIgnoreCase(normalized)) {
                return value;
            }
        }
        throw new IllegalArgumentException("Unknown anchor status: " + raw);
    }
}
