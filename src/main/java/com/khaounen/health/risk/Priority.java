package com.khaounen.health.risk;

import com.fasterxml.jackson.annotation.JsonValue;

public enum Priority {
    HIGH("high", "immediate"),
    MEDIUM("medium", "7 days");

    private final String label;
    private final String timeline;

    Priority(String label, String timeline) {
        this.label = label;
        this.timeline = timeline;
    }

    @JsonValue
    public String label() {
        return label;
    }

    public String timeline() {
        return timeline;
    }
}
