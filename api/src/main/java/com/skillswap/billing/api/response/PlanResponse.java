package com.skillswap.billing.api.response;

import com.skillswap.billing.api.model.PlanDuration;

import java.time.LocalDateTime;
import java.util.List;

public record PlanResponse(
        Long id,
        String name,
        String description,
        Long price,
        String currency,
        PlanDuration duration,
        List<Feature> features,
        Limits limits,
        boolean active,
        int sortOrder,
        LocalDateTime createdAt,
        LocalDateTime updatedAt
) {
    public record Feature(String name, String description, boolean included) {}

    public record Limits(int coursesPerMonth, int tutoringSessions, boolean premiumContent,
                         boolean aiAssistant, boolean prioritySupport) {}
}
