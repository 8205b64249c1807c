package com.skillswap.billing.controller;

import com.skillswap.billing.api.SubscriptionPlanApi;
import com.skillswap.billing.api.response.PlanResponse;
import com.skillswap.billing.service.SubscriptionPlanService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequiredArgsConstructor
public class SubscriptionPlanController implements SubscriptionPlanApi {

    private final SubscriptionPlanService planService;

    @Override
    public ResponseEntity<List<PlanResponse>> listActivePlans() {
        return ResponseEntity.ok(planService.listActivePlans());
    }
}
