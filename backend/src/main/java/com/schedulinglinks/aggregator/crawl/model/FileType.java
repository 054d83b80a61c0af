package com.schedulinglinks.aggregator.crawl.model;

import java.util.Locale;

public enum FileType {
    LOCATION("Location", "location_fetches", "location_state", "location_fetch_id"),
    SCHEDULE("Schedule", "schedule_fetches", "schedule_state", "schedule_fetch_id"),
    SLOT("Slot", "slot_fetches", "slot_state", "slot_fetch_id"),
    UNSUPPORTED(null, null, null, null);

    private final String manifestType;
    private final String fetchTable;
    private final String stateJoinTable;
    private final String stateJoinColumn;

    FileType(String manifestType, String fetchTable, String stateJoinTable, String stateJoinColumn) {
        this.manifestType = manifestType;
        this.fetchTable = fetchTable;
        this.stateJoinTable = stateJoinTable;
        this.stateJoinColumn = stateJoinColumn;
    }

    public static FileType fromManifestType(String value) {
        if (value == null || value.isBlank()) {
            return UNSUPPORTED;
        }
        for (FileType type : values()) {
            if (type.manifestType != null && type.manifestType.equals(value.trim())) {
                return type;
            }
        }
        return UNSUPPORTED;
    }

    public boolean isSupported() {
        return this != UNSUPPORTED;
    }

    public String manifestType() {
        return manifestType;
    }

    public String statsKey() {
        return name().toLowerCase(Locale.ROOT);
    }

    public String fetchTable() {
        requireSupported();
        return fetchTable;
    }

    public String stateJoinTable() {
        requireSupported();
        return stateJoinTable;
    }

    public String stateJoinColumn() {
        requireSupported();
        return stateJoinColumn;
    }

    private void requireSupported() {
        if (!isSupported()) {
            throw new IllegalStateException("No ledger table for unsupported file type");
        }
    }
}
