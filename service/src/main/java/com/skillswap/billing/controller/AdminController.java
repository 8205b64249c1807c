package com.skillswap.billing.controller;

import com.skillswap.billing.api.AdminApi;
import com.skillswap.billing.api.dto.PagedResponse;
import com.skillswap.billing.api.model.BillingJob;
import com.skillswap.billing.api.request.CreatePlanRequest;
import com.skillswap.billing.api.request.ResolveIssueRequest;
import com.skillswap.billing.api.request.UpdatePlanRequest;
import com.skillswap.billing.api.response.PlanResponse;
import com.skillswap.billing.api.response.ReconciliationIssueResponse;
import com.skillswap.billing.api.response.SubscriptionAnalyticsResponse;
import com.skillswap.billing.api.response.SweepResponse;
import com.skillswap.billing.api.response.WalletStatisticsResponse;
import com.skillswap.billing.service.ReconciliationIssueService;
import com.skillswap.billing.service.SubscriptionLifecycleManager;
import com.skillswap.billing.service.SubscriptionPlanService;
import com.skillswap.billing.service.SubscriptionService;
import com.skillswap.billing.service.TransactionHistoryService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * Administration endpoints. Access is restricted to ROLE_ADMIN in the security configuration.
 */
@RestController
@Validated
@RequiredArgsConstructor
@Slf4j
public class AdminController implements AdminApi {

    private final SubscriptionPlanService planService;
    private final ReconciliationIssueService reconciliationIssueService;
    private final SubscriptionService subscriptionService;
    private final SubscriptionLifecycleManager lifecycleManager;
    private final TransactionHistoryService transactionHistoryService;

    @Override
    public ResponseEntity<List<PlanResponse>> listAllPlans() {
        return ResponseEntity.ok(planService.listAllPlans());
    }

    @Override
    public ResponseEntity<PlanResponse> createPlan(CreatePlanRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(planService.createPlan(request));
    }

    @Override
    public ResponseEntity<PlanResponse> updatePlan(Long planId, UpdatePlanRequest request) {
        return ResponseEntity.ok(planService.updatePlan(planId, request));
    }

    @Override
    public ResponseEntity<PlanResponse> deactivatePlan(Long planId) {
        return ResponseEntity.ok(planService.deactivatePlan(planId));
    }

    @Override
    public ResponseEntity<PagedResponse<ReconciliationIssueResponse>> listReconciliationIssues(boolean resolved,
                                                                                               int page,
                                                                                               int size) {
        return ResponseEntity.ok(reconciliationIssueService.list(resolved, page, size));
    }

    @Override
    public ResponseEntity<ReconciliationIssueResponse> resolveReconciliationIssue(Long issueId,
                                                                                  ResolveIssueRequest request) {
        return ResponseEntity.ok(reconciliationIssueService.resolve(issueId, request.note()));
    }

    @Override
    public ResponseEntity<SubscriptionAnalyticsResponse> subscriptionAnalytics() {
        return ResponseEntity.ok(subscriptionService.analytics());
    }

    @Override
    public ResponseEntity<WalletStatisticsResponse> walletStatistics() {
        return ResponseEntity.ok(transactionHistoryService.getWalletStatistics());
    }

    @Override
    public ResponseEntity<SweepResponse> runJob(String job) {
        BillingJob billingJob = BillingJob.fromPathName(job);
        log.info("Manual job run requested: job={}", billingJob.getPathName());
        return ResponseEntity.ok(lifecycleManager.run(billingJob));
    }
}
