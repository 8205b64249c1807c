package com.skillswap.billing.api;

import com.skillswap.billing.api.dto.PagedResponse;
import com.skillswap.billing.api.request.CreatePlanRequest;
import com.skillswap.billing.api.request.ResolveIssueRequest;
import com.skillswap.billing.api.request.UpdatePlanRequest;
import com.skillswap.billing.api.response.PlanResponse;
import com.skillswap.billing.api.response.ReconciliationIssueResponse;
import com.skillswap.billing.api.response.SubscriptionAnalyticsResponse;
import com.skillswap.billing.api.response.SweepResponse;
import com.skillswap.billing.api.response.WalletStatisticsResponse;
import jakarta.validation.Valid;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * Administration API. Requires the ADMIN role.
 *
 * <p>Covers:
 * <ul>
 *   <li>Plan catalog maintenance</li>
 *   <li>Manual reconciliation queue</li>
 *   <li>Subscription and wallet analytics</li>
 *   <li>Manual runs of the scheduled billing jobs</li>
 * </ul>
 */
@RequestMapping("/api/v1/admin")
public interface AdminApi {

    @GetMapping("/plans")
    ResponseEntity<List<PlanResponse>> listAllPlans();

    @PostMapping("/plans")
    ResponseEntity<PlanResponse> createPlan(@RequestBody @Valid CreatePlanRequest request);

    @PutMapping("/plans/{planId}")
    ResponseEntity<PlanResponse> updatePlan(@PathVariable("planId") Long planId,
                                            @RequestBody @Valid UpdatePlanRequest request);

    /**
     * Deactivates a plan. Existing subscribers keep it until their period ends.
     */
    @DeleteMapping("/plans/{planId}")
    ResponseEntity<PlanResponse> deactivatePlan(@PathVariable("planId") Long planId);

    /**
     * Lists reconciliation issues, oldest first.
     *
     * @param resolved filter by resolution state
     * @param page     1-based page number
     * @param size     page size, at most 100
     */
    @GetMapping("/reconciliation-issues")
    ResponseEntity<PagedResponse<ReconciliationIssueResponse>> listReconciliationIssues(
            @RequestParam(value = "resolved", defaultValue = "false") boolean resolved,
            @RequestParam(value = "page", defaultValue = "1") int page,
            @RequestParam(value = "size", defaultValue = "20") int size);

    @PostMapping("/reconciliation-issues/{issueId}/resolve")
    ResponseEntity<ReconciliationIssueResponse> resolveReconciliationIssue(
            @PathVariable("issueId") Long issueId,
            @RequestBody @Valid ResolveIssueRequest request);

    @GetMapping("/analytics/subscriptions")
    ResponseEntity<SubscriptionAnalyticsResponse> subscriptionAnalytics();

    /**
     * Wallet totals across all users and ledger counts and sums by status and by type.
     */
    @GetMapping("/analytics/wallets")
    ResponseEntity<WalletStatisticsResponse> walletStatistics();

    /**
     * Runs a billing job now instead of waiting for its schedule.
     *
     * @param job one of {@code subscription-expiry}, {@code subscription-renewal},
     *            {@code subscription-reminders}
     */
    @PostMapping("/jobs/{job}")
    ResponseEntity<SweepResponse> runJob(@PathVariable("job") String job);
}
