package com.company.energyperformance.domain.enums;

public enum ResolutionState {
    OPEN,
    RESOLVED;

    public static ResolutionState fromString(String state) {
        if (state == null) {
            return OPEN;
        }
        try {
            return ResolutionState.valueOf(state.toUpperCase());
        } catch (IllegalArgumentException e) {
            return OPEN;
        }
    }
}
