package com.skillswap.billing.api.request;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;

/**
 * Request to pay for a course through the payment provider.
 *
 * @param courseId    Course to enroll in
 * @param amount      Course price in minor currency units, as quoted by the catalog
 * @param currency    ISO 4217 code
 * @param redirectUrl Where the payment provider sends the user after checkout (optional)
 */
public record CourseCheckoutRequest(
        @NotNull(message = "Course ID is required")
        Long courseId,

        @NotNull(message = "Amount is required")
        @Positive(message = "Amount must be positive")
        Long amount,

        @NotBlank(message = "Currency is required")
        String currency,

        String redirectUrl
) {
}
