package com.skillswap.billing.repository;

import com.skillswap.billing.model.SubscriptionPlan;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface SubscriptionPlanRepository extends JpaRepository<SubscriptionPlan, Long> {

    List<SubscriptionPlan> findByActiveTrueOrderBySortOrderAscPriceAsc();

    List<SubscriptionPlan> findAllByOrderBySortOrderAscPriceAsc();

    boolean existsByNameIgnoreCase(String name);
}
