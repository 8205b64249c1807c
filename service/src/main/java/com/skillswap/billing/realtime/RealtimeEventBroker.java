package com.skillswap.billing.realtime;

import com.skillswap.billing.event.BillingEvent;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.SmartLifecycle;
import org.springframework.stereotype.Component;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.io.IOException;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Per-user Server-Sent Events channels.
 *
 * <p>A user may hold several connections (tabs, devices); each event goes to all of them.
 * Broken connections are dropped on the first failed send. Stopping the broker completes every
 * open stream.
 */
@Component
@Slf4j
public class RealtimeEventBroker implements SmartLifecycle {

    private static final long EMITTER_TIMEOUT_MS = Duration.ofMinutes(30).toMillis();

    private final Map<Long, List<SseEmitter>> emitters = new ConcurrentHashMap<>();
    private final AtomicLong eventSequence = new AtomicLong();
    private volatile boolean running;

    /**
     * Opens a stream for the user.
     *
     * @param userId authenticated user
     * @return emitter to return from the controller
     */
    public SseEmitter subscribe(Long userId) {
        SseEmitter emitter = new SseEmitter(EMITTER_TIMEOUT_MS);
        List<SseEmitter> userEmitters = emitters.computeIfAbsent(userId, id -> new CopyOnWriteArrayList<>());
        userEmitters.add(emitter);

        emitter.onCompletion(() -> remove(userId, emitter));
        emitter.onTimeout(() -> remove(userId, emitter));
        emitter.onError(error -> remove(userId, emitter));

        try {
            emitter.send(SseEmitter.event().name("connected").data(Map.of("userId", userId)));
        } catch (IOException e) {
            log.debug("Realtime stream closed before the first event: userId={}", userId);
            remove(userId, emitter);
        }
        log.debug("Realtime stream opened: userId={}, connections={}", userId, userEmitters.size());
        return emitter;
    }

    /**
     * Sends an event to all open streams of its user.
     *
     * @param event committed billing event
     * @return number of streams the event was written to
     */
    public int publish(BillingEvent event) {
        List<SseEmitter> userEmitters = emitters.get(event.userId());
        if (userEmitters == null || userEmitters.isEmpty()) {
            return 0;
        }
        int delivered = 0;
        for (SseEmitter emitter : userEmitters) {
            try {
                emitter.send(SseEmitter.event()
                        .id(String.valueOf(eventSequence.incrementAndGet()))
                        .name(event.type())
                        .data(Map.of(
                                "type", event.type(),
                                "payload", event.payload(),
                                "occurredAt", event.occurredAt().toString())));
                delivered++;
            } catch (IOException | IllegalStateException e) {
                log.debug("Dropping broken realtime stream: userId={}, error={}", event.userId(), e.toString());
                remove(event.userId(), emitter);
            }
        }
        return delivered;
    }

    public int connectionCount(Long userId) {
        List<SseEmitter> userEmitters = emitters.get(userId);
        return userEmitters == null ? 0 : userEmitters.size();
    }

    private void remove(Long userId, SseEmitter emitter) {
        emitters.computeIfPresent(userId, (id, list) -> {
            list.remove(emitter);
            return list.isEmpty() ? null : list;
        });
    }

    @Override
    public void start() {
        running = true;
        log.info("Realtime event broker started");
    }

    @Override
    public void stop() {
        running = false;
        emitters.values().forEach(list -> list.forEach(SseEmitter::complete));
        emitters.clear();
        log.info("Realtime event broker stopped");
    }

    @Override
    public boolean isRunning() {
        return running;
    }
}
