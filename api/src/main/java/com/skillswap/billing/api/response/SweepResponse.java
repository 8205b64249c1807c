package com.skillswap.billing.api.response;

import java.util.List;

/**
 * Outcome of one run of a billing job.
 *
 * @param job       Job name
 * @param processed Users the job acted on
 * @param succeeded Users whose step completed as intended
 * @param failed    Users whose step failed
 * @param failedUserIds IDs of the users in {@code failed}
 */
public record SweepResponse(
        String job,
        int processed,
        int succeeded,
        int failed,
        List<Long> failedUserIds
) {}
