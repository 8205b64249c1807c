package com.skillswap.billing.controller;

import com.skillswap.billing.TestBase;
import com.skillswap.billing.api.model.PlanDuration;
import com.skillswap.billing.api.request.CreatePlanRequest;
import com.skillswap.billing.api.request.DeductTokensRequest;
import com.skillswap.billing.api.request.PlanFeatureRequest;
import com.skillswap.billing.api.request.PlanLimitsRequest;
import com.skillswap.billing.api.request.SubscribeRequest;
import com.skillswap.billing.api.request.UpdatePlanRequest;
import com.skillswap.billing.api.response.WalletStatisticsResponse;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MvcResult;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.hamcrest.Matchers.hasItem;
import static org.hamcrest.Matchers.not;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

/**
 * Plan catalog administration and analytics.
 */
public class AdminControllerTest extends TestBase {

    @Test
    void createPlan_ShouldAppearInPublicCatalogUntilDeactivated() throws Exception {
        Long planId = createPlan("Team Quarterly " + System.nanoTime(), 500_000L);

        mockMvc.perform(get("/api/v1/subscription-plans"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[*].id", hasItem(planId.intValue())));

        mockMvc.perform(delete("/api/v1/admin/plans/" + planId).with(asAdmin(1L)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.active").value(false));

        mockMvc.perform(get("/api/v1/subscription-plans"))
                .andExpect(jsonPath("$[*].id", not(hasItem(planId.intValue()))));
        mockMvc.perform(get("/api/v1/admin/plans").with(asAdmin(1L)))
                .andExpect(jsonPath("$[*].id", hasItem(planId.intValue())));
    }

    @Test
    void createPlan_WhenNameTaken_ShouldReturn409() throws Exception {
        String name = "Duplicate " + System.nanoTime();
        createPlan(name, 100_000L);

        mockMvc.perform(post("/api/v1/admin/plans").with(asAdmin(1L))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(toJson(planRequest(name.toUpperCase(), 100_000L))))
                .andExpect(status().isConflict());
    }

    @Test
    void createPlan_WhenPriceNegative_ShouldReturn400() throws Exception {
        mockMvc.perform(post("/api/v1/admin/plans").with(asAdmin(1L))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(toJson(planRequest("Broken " + System.nanoTime(), -1L))))
                .andExpect(status().isBadRequest());
    }

    @Test
    void updatePlan_ShouldChangeOnlyGivenFields() throws Exception {
        Long planId = createPlan("Editable " + System.nanoTime(), 300_000L);

        mockMvc.perform(put("/api/v1/admin/plans/" + planId).with(asAdmin(1L))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(toJson(new UpdatePlanRequest(null, "Now cheaper", 200_000L, null, null,
                                null, null, null, null))))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.price").value(200_000))
                .andExpect(jsonPath("$.description").value("Now cheaper"))
                .andExpect(jsonPath("$.duration").value("QUARTERLY"))
                .andExpect(jsonPath("$.features.length()").value(2));
    }

    @Test
    void subscribe_WhenPlanIsFree_ShouldActivateWithoutCheckout() throws Exception {
        Long planId = createPlan("Free Trial " + System.nanoTime(), 0L);
        Long userId = createUser();

        mockMvc.perform(post("/api/v1/subscriptions/subscribe").with(asUser(userId))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(toJson(new SubscribeRequest(planId, null))))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.status").value("SUCCESSFUL"))
                .andExpect(jsonPath("$.paymentLink").doesNotExist());

        mockMvc.perform(get("/api/v1/subscriptions/my-subscription").with(asUser(userId)))
                .andExpect(jsonPath("$.pro").value(true))
                .andExpect(jsonPath("$.status").value("ACTIVE"));
        verify(paymentGateway, never()).initializePayment(any());
    }

    @Test
    void subscriptionAnalytics_ShouldReportProCount() throws Exception {
        mockMvc.perform(get("/api/v1/admin/analytics/subscriptions").with(asAdmin(1L)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.proUsers").isNumber());
    }

    @Test
    void walletStatistics_ShouldCountBalancesAndLedgerByStatusAndType() throws Exception {
        WalletStatisticsResponse before = walletStatistics();

        Long buyer = createUserWithBalance(7_000L);
        mockMvc.perform(post("/api/v1/wallet/deduct").with(asUser(buyer))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(toJson(new DeductTokensRequest(2_000L, "Tutoring session", null, null))))
                .andExpect(status().isOk());

        WalletStatisticsResponse after = walletStatistics();
        assertThat(after.totalUsers() - before.totalUsers()).isEqualTo(1);
        assertThat(after.usersWithBalance() - before.usersWithBalance()).isEqualTo(1);
        assertThat(after.totalBalance() - before.totalBalance()).isEqualTo(5_000L);
        assertThat(after.totalSpent() - before.totalSpent()).isEqualTo(2_000L);

        WalletStatisticsResponse.Bucket successfulBefore = bucket(before.transactionsByStatus(), "SUCCESSFUL");
        WalletStatisticsResponse.Bucket successfulAfter = bucket(after.transactionsByStatus(), "SUCCESSFUL");
        assertThat(successfulAfter.count() - successfulBefore.count()).isEqualTo(1);
        assertThat(successfulAfter.totalAmount() - successfulBefore.totalAmount()).isEqualTo(2_000L);

        WalletStatisticsResponse.Bucket deductionsBefore = bucket(before.transactionsByType(), "DEDUCTION");
        WalletStatisticsResponse.Bucket deductionsAfter = bucket(after.transactionsByType(), "DEDUCTION");
        assertThat(deductionsAfter.count() - deductionsBefore.count()).isEqualTo(1);
    }

    @Test
    void walletStatistics_WithoutAdminRole_ShouldReturn403() throws Exception {
        mockMvc.perform(get("/api/v1/admin/analytics/wallets").with(asUser(createUser())))
                .andExpect(status().isForbidden());
    }

    @Test
    void adminEndpoints_WithoutAdminRole_ShouldReturn403() throws Exception {
        mockMvc.perform(get("/api/v1/admin/plans").with(asUser(createUser())))
                .andExpect(status().isForbidden());
    }

    private WalletStatisticsResponse walletStatistics() throws Exception {
        MvcResult result = mockMvc.perform(get("/api/v1/admin/analytics/wallets").with(asAdmin(1L)))
                .andExpect(status().isOk())
                .andReturn();
        return objectMapper.readValue(result.getResponse().getContentAsString(), WalletStatisticsResponse.class);
    }

    private static WalletStatisticsResponse.Bucket bucket(List<WalletStatisticsResponse.Bucket> buckets, String key) {
        return buckets.stream()
                .filter(bucket -> bucket.key().equals(key) && "NGN".equals(bucket.currency()))
                .findFirst()
                .orElse(new WalletStatisticsResponse.Bucket(key, "NGN", 0, 0));
    }

    private Long createPlan(String name, long price) throws Exception {
        MvcResult result = mockMvc.perform(post("/api/v1/admin/plans").with(asAdmin(1L))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(toJson(planRequest(name, price))))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.active").value(true))
                .andReturn();
        return objectMapper.readTree(result.getResponse().getContentAsString()).get("id").asLong();
    }

    private static CreatePlanRequest planRequest(String name, long price) {
        return new CreatePlanRequest(name, "Test plan", price, "NGN", PlanDuration.QUARTERLY,
                List.of(new PlanFeatureRequest("Unlimited courses", null, true),
                        new PlanFeatureRequest("1:1 tutoring", "Two sessions a month", true)),
                new PlanLimitsRequest(-1, 2, true, false, false),
                50);
    }
}
