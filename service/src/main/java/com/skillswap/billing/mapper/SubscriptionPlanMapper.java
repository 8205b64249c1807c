package com.skillswap.billing.mapper;

import com.skillswap.billing.api.request.PlanFeatureRequest;
import com.skillswap.billing.api.request.PlanLimitsRequest;
import com.skillswap.billing.api.response.PlanResponse;
import com.skillswap.billing.model.PlanFeature;
import com.skillswap.billing.model.PlanLimits;
import com.skillswap.billing.model.SubscriptionPlan;
import org.mapstruct.Mapper;
import org.mapstruct.factory.Mappers;

import java.util.List;

/**
 * MapStruct mapper between plan entities and the plan records of the API.
 */
@Mapper
public interface SubscriptionPlanMapper {

    SubscriptionPlanMapper INSTANCE = Mappers.getMapper(SubscriptionPlanMapper.class);

    PlanResponse toResponse(SubscriptionPlan plan);

    List<PlanResponse> toResponseList(List<SubscriptionPlan> plans);

    PlanResponse.Feature toFeatureResponse(PlanFeature feature);

    PlanResponse.Limits toLimitsResponse(PlanLimits limits);

    PlanFeature toFeature(PlanFeatureRequest request);

    List<PlanFeature> toFeatures(List<PlanFeatureRequest> requests);

    PlanLimits toLimits(PlanLimitsRequest request);
}
