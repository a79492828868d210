package com.company.energyperformance.domain.enums;

public enum ChannelKind {
    RATE("Instantaneous rate, e.g. power demand"),
    INCREMENT("Per-reading increment of a cumulative quantity, e.g. energy"),
    GAUGE("Auxiliary measurement, e.g. temperature or pressure");

    private final String description;

    ChannelKind(String description) {
        this.description = description;
    }

    public String getDescription() {
        return description;
    }
}
