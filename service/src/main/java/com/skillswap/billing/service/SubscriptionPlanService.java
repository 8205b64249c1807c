package com.skillswap.billing.service;

import com.skillswap.billing.api.request.CreatePlanRequest;
import com.skillswap.billing.api.request.UpdatePlanRequest;
import com.skillswap.billing.api.response.PlanResponse;
import com.skillswap.billing.error.DuplicatePlanException;
import com.skillswap.billing.error.PlanNotFoundException;
import com.skillswap.billing.mapper.SubscriptionPlanMapper;
import com.skillswap.billing.model.PlanLimits;
import com.skillswap.billing.model.SubscriptionPlan;
import com.skillswap.billing.repository.SubscriptionPlanRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.cache.annotation.CacheEvict;
import org.springframework.cache.annotation.Cacheable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Plan catalog. The public list of active plans is cached and evicted on every admin write.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class SubscriptionPlanService {

    public static final String ACTIVE_PLANS_CACHE = "activePlans";

    private final SubscriptionPlanRepository planRepository;
    private final Clock clock;

    @Cacheable(ACTIVE_PLANS_CACHE)
    @Transactional(readOnly = true)
    public List<PlanResponse> listActivePlans() {
        return SubscriptionPlanMapper.INSTANCE.toResponseList(planRepository.findByActiveTrueOrderBySortOrderAscPriceAsc());
    }

    @Transactional(readOnly = true)
    public List<PlanResponse> listAllPlans() {
        return SubscriptionPlanMapper.INSTANCE.toResponseList(planRepository.findAllByOrderBySortOrderAscPriceAsc());
    }

    @Transactional(readOnly = true)
    public SubscriptionPlan getPlan(Long planId) {
        return planRepository.findById(planId)
                .orElseThrow(() -> new PlanNotFoundException("Subscription plan with ID " + planId + " not found"));
    }

    @Transactional(readOnly = true)
    public Optional<PlanResponse> findPlanResponse(Long planId) {
        if (planId == null) {
            return Optional.empty();
        }
        return planRepository.findById(planId).map(SubscriptionPlanMapper.INSTANCE::toResponse);
    }

    /**
     * @throws DuplicatePlanException if a plan with the same name (case-insensitive) exists
     */
    @CacheEvict(value = ACTIVE_PLANS_CACHE, allEntries = true)
    @Transactional
    public PlanResponse createPlan(CreatePlanRequest request) {
        String name = request.name().trim();
        if (planRepository.existsByNameIgnoreCase(name)) {
            throw new DuplicatePlanException(name);
        }

        LocalDateTime now = LocalDateTime.now(clock);
        SubscriptionPlan plan = new SubscriptionPlan();
        plan.setName(name);
        plan.setDescription(request.description());
        plan.setPrice(request.price());
        plan.setCurrency(request.currency());
        plan.setDuration(request.duration());
        plan.setFeatures(request.features() == null
                ? new ArrayList<>()
                : new ArrayList<>(SubscriptionPlanMapper.INSTANCE.toFeatures(request.features())));
        plan.setLimits(request.limits() == null ? new PlanLimits() : SubscriptionPlanMapper.INSTANCE.toLimits(request.limits()));
        plan.setActive(true);
        plan.setSortOrder(request.sortOrder() == null ? 0 : request.sortOrder());
        plan.setCreatedAt(now);
        plan.setUpdatedAt(now);
        SubscriptionPlan saved = planRepository.save(plan);

        log.info("Subscription plan created: planId={}, name={}, price={}, currency={}, duration={}",
                saved.getId(), saved.getName(), saved.getPrice(), saved.getCurrency(), saved.getDuration());
        return SubscriptionPlanMapper.INSTANCE.toResponse(saved);
    }

    /**
     * Applies the non-null fields of the request. Past transactions keep their own plan snapshot.
     */
    @CacheEvict(value = ACTIVE_PLANS_CACHE, allEntries = true)
    @Transactional
    public PlanResponse updatePlan(Long planId, UpdatePlanRequest request) {
        SubscriptionPlan plan = getPlan(planId);

        if (request.name() != null && !request.name().trim().equalsIgnoreCase(plan.getName())) {
            String name = request.name().trim();
            if (planRepository.existsByNameIgnoreCase(name)) {
                throw new DuplicatePlanException(name);
            }
            plan.setName(name);
        }
        if (request.description() != null) {
            plan.setDescription(request.description());
        }
        if (request.price() != null) {
            plan.setPrice(request.price());
        }
        if (request.currency() != null) {
            plan.setCurrency(request.currency());
        }
        if (request.duration() != null) {
            plan.setDuration(request.duration());
        }
        if (request.features() != null) {
            plan.getFeatures().clear();
            plan.getFeatures().addAll(SubscriptionPlanMapper.INSTANCE.toFeatures(request.features()));
        }
        if (request.limits() != null) {
            plan.setLimits(SubscriptionPlanMapper.INSTANCE.toLimits(request.limits()));
        }
        if (request.active() != null) {
            plan.setActive(request.active());
        }
        if (request.sortOrder() != null) {
            plan.setSortOrder(request.sortOrder());
        }
        plan.setUpdatedAt(LocalDateTime.now(clock));

        log.info("Subscription plan updated: planId={}, active={}", planId, plan.isActive());
        return SubscriptionPlanMapper.INSTANCE.toResponse(plan);
    }

    /**
     * Soft delete. Current subscribers keep access until their period ends but are not renewed.
     */
    @CacheEvict(value = ACTIVE_PLANS_CACHE, allEntries = true)
    @Transactional
    public PlanResponse deactivatePlan(Long planId) {
        SubscriptionPlan plan = getPlan(planId);
        plan.setActive(false);
        plan.setUpdatedAt(LocalDateTime.now(clock));
        log.info("Subscription plan deactivated: planId={}, name={}", planId, plan.getName());
        return SubscriptionPlanMapper.INSTANCE.toResponse(plan);
    }
}
