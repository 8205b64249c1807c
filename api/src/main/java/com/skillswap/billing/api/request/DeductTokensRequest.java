package com.skillswap.billing.api.request;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.Size;

/**
 * Request for deducting wallet balance.
 *
 * <p>When both {@code courseId} and {@code instructorId} are present the deduction is a course
 * enrollment: the course is added to the buyer and the instructor is credited the same amount.
 *
 * @param amount       Amount in minor currency units
 * @param description  Human-readable reason
 * @param courseId     Course being purchased (optional)
 * @param instructorId Instructor to credit (optional); accepted only from a service or admin token
 */
public record DeductTokensRequest(
        @NotNull(message = "Amount is required")
        @Positive(message = "Amount must be positive")
        Long amount,

        @Size(max = 255, message = "Description must not exceed 255 characters")
        String description,

        Long courseId,

        Long instructorId
) {
}
