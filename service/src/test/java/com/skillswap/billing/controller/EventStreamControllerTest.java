package com.skillswap.billing.controller;

import com.skillswap.billing.TestBase;
import com.skillswap.billing.realtime.RealtimeEventBroker;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MvcResult;

import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.request;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

public class EventStreamControllerTest extends TestBase {

    @Autowired
    private RealtimeEventBroker broker;

    @Test
    void stream_ShouldOpenChannelForCaller() throws Exception {
        Long userId = createUser();

        MvcResult result = mockMvc.perform(get("/api/v1/events/stream").with(asUser(userId))
                        .accept(MediaType.TEXT_EVENT_STREAM))
                .andExpect(request().asyncStarted())
                .andReturn();

        assertThat(result.getResponse().getContentAsString()).contains("event:connected");
        assertThat(broker.connectionCount(userId)).isEqualTo(1);
    }

    @Test
    void stream_WithoutToken_ShouldReturn401() throws Exception {
        mockMvc.perform(get("/api/v1/events/stream"))
                .andExpect(status().isUnauthorized());
    }
}
