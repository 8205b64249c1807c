package com.skillswap.billing.controller;

import com.skillswap.billing.TestBase;
import com.skillswap.billing.api.request.AddPaymentMethodRequest;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MvcResult;
import org.springframework.test.web.servlet.ResultActions;

import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

public class PaymentMethodControllerTest extends TestBase {

    @Test
    void addPaymentMethod_FirstMethodShouldBecomePrimary() throws Exception {
        Long userId = createUser();

        add(userId, "1111", false)
                .andExpect(jsonPath("$.primary").value(true))
                .andExpect(jsonPath("$.last4").value("1111"));
    }

    @Test
    void addPaymentMethod_WhenMarkedPrimary_ShouldDemoteThePreviousOne() throws Exception {
        Long userId = createUser();
        add(userId, "1111", false);
        add(userId, "2222", true);

        mockMvc.perform(get("/api/v1/payment-methods").with(asUser(userId)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.length()").value(2))
                .andExpect(jsonPath("$[0].last4").value("2222"))
                .andExpect(jsonPath("$[0].primary").value(true))
                .andExpect(jsonPath("$[1].primary").value(false));
    }

    @Test
    void removePaymentMethod_ShouldOnlyRemoveOwnMethods() throws Exception {
        Long owner = createUser();
        Long other = createUser();
        MvcResult added = add(owner, "3333", true).andReturn();
        long methodId = objectMapper.readTree(added.getResponse().getContentAsString()).get("id").asLong();

        mockMvc.perform(delete("/api/v1/payment-methods/" + methodId).with(asUser(other)))
                .andExpect(status().isNotFound());
        mockMvc.perform(delete("/api/v1/payment-methods/" + methodId).with(asUser(owner)))
                .andExpect(status().isNoContent());
        mockMvc.perform(get("/api/v1/payment-methods").with(asUser(owner)))
                .andExpect(jsonPath("$.length()").value(0));
    }

    @Test
    void addPaymentMethod_WhenLast4Invalid_ShouldReturn400() throws Exception {
        mockMvc.perform(post("/api/v1/payment-methods").with(asUser(createUser()))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(toJson(new AddPaymentMethodRequest("flutterwave", "auth-x", "visa", "12a4", false))))
                .andExpect(status().isBadRequest());
    }

    private ResultActions add(Long userId, String last4, boolean primary)
            throws Exception {
        return mockMvc.perform(post("/api/v1/payment-methods").with(asUser(userId))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(toJson(new AddPaymentMethodRequest("flutterwave", "auth-" + last4, "visa", last4, primary))))
                .andExpect(status().isCreated());
    }
}
