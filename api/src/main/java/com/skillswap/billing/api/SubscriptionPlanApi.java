package com.skillswap.billing.api;

import com.skillswap.billing.api.response.PlanResponse;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;

import java.util.List;

/**
 * Public plan catalog.
 */
@RequestMapping("/api/v1/subscription-plans")
public interface SubscriptionPlanApi {

    /**
     * Lists active plans ordered by sort order, then price.
     *
     * @return active plans
     */
    @GetMapping
    ResponseEntity<List<PlanResponse>> listActivePlans();
}
