package com.khaounen.health.risk;

import java.util.List;

public record Recommendation(
        String factor,
        double impact,
        Priority priority,
        List<String> suggestedActions,
        String timeline
) {
    public Recommendation {
        suggestedActions = suggestedActions == null ? List.of() : List.copyOf(suggestedActions);
    }
}
