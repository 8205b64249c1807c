package com.skillswap.billing.model;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * Usage limits granted by a plan. {@code -1} means unlimited.
 */
@Embeddable
@Getter
@Setter
@AllArgsConstructor
@NoArgsConstructor
public class PlanLimits {

    @Column(name = "limit_courses_per_month", nullable = false)
    private int coursesPerMonth = -1;

    @Column(name = "limit_tutoring_sessions", nullable = false)
    private int tutoringSessions = 0;

    @Column(name = "limit_premium_content", nullable = false)
    private boolean premiumContent;

    @Column(name = "limit_ai_assistant", nullable = false)
    private boolean aiAssistant;

    @Column(name = "limit_priority_support", nullable = false)
    private boolean prioritySupport;
}
