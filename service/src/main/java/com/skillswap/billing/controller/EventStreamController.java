package com.skillswap.billing.controller;

import com.skillswap.billing.realtime.RealtimeEventBroker;
import com.skillswap.billing.security.CurrentUserProvider;
import lombok.RequiredArgsConstructor;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

/**
 * Real-time billing events of the authenticated user as Server-Sent Events.
 */
@RestController
@RequiredArgsConstructor
public class EventStreamController {

    private final RealtimeEventBroker broker;
    private final CurrentUserProvider currentUserProvider;

    @GetMapping(path = "/api/v1/events/stream", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public SseEmitter stream() {
        return broker.subscribe(currentUserProvider.currentUserId());
    }
}
