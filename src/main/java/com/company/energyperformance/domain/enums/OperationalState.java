package com.company.energyperformance.domain.enums;

public enum OperationalState {
    RUNNING("Producing under normal load"),
    IDLE("Powered but not producing"),
    MAINTENANCE("Planned maintenance"),
    FAULT("Unplanned fault"),
    OFFLINE("Powered down or disconnected");

    private final String description;

    OperationalState(String description) {
        this.description = description;
    }

    public String getDescription() {
        return description;
    }

    public static OperationalState fromString(String state) {
        if (state == null) {
            return OFFLINE;
        }
        try {
            return OperationalState.valueOf(state.toUpperCase());
        } catch (IllegalArgumentException e) {
            return OFFLINE;
        }
    }
}
