package com.meshcontrol.dispatch.api;

import com.meshcontrol.core.events.EventBus;
import com.meshcontrol.core.events.EventFilter;
import com.meshcontrol.core.events.MeshEvent;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Serves {@code GET /mesh/events}: each client gets an {@link SseEmitter} fed by an
 * {@link EventBus} subscription with the client's {@link EventFilter}.
 * <p>
 * Every event is sent with its type as the SSE event name and a per-stream sequence
 * number as its id. Streams that sent nothing during a heartbeat interval get a
 * {@code keepalive} comment so proxies keep them open.
 */
@Service
public class MeshEventStreamService {

    private static final Logger log = LoggerFactory.getLogger(MeshEventStreamService.class);

    private static final long DEFAULT_TIMEOUT_MS = TimeUnit.MINUTES.toMillis(30);

    private static final long HEARTBEAT_INTERVAL_MS = TimeUnit.SECONDS.toMillis(30);

    private final EventBus eventBus;
    private final long timeoutMs;
    private final long heartbeatIntervalMs;

    private final CopyOnWriteArrayList<EventStream> streams = new CopyOnWriteArrayList<>();

    private final ScheduledExecutorService heartbeats = Executors.newSingleThreadScheduledExecutor(r -> {
        Thread t = new Thread(r, "mesh-events-keepalive");
        t.setDaemon(true);
        return t;
    });

    @Autowired
    public MeshEventStreamService(EventBus eventBus) {
        this(eventBus, DEFAULT_TIMEOUT_MS, HEARTBEAT_INTERVAL_MS);
    }

    MeshEventStreamService(EventBus eventBus, long timeoutMs, long heartbeatIntervalMs) {
        this.eventBus = eventBus;
        this.timeoutMs = timeoutMs;
        this.heartbeatIntervalMs = heartbeatIntervalMs;
    }

    @PostConstruct
    void startHeartbeat() {
        heartbeats.scheduleWithFixedDelay(this::keepIdleStreamsAlive,
                heartbeatIntervalMs, heartbeatIntervalMs, TimeUnit.MILLISECONDS);
    }

    @PreDestroy
    void stopHeartbeat() {
        heartbeats.shutdownNow();
        int open = streams.size();
        for (EventStream stream : streams) {
            stream.emitter().complete();
            close(stream);
        }
        log.info("Closed {} mesh event streams", open);
    }

    public SseEmitter createEmitter(EventFilter filter) {
        SseEmitter emitter = new SseEmitter(timeoutMs);
        EventStream stream = new EventStream(filter, emitter);
        stream.subscription = eventBus.subscribe(filter, event -> send(stream, event));
        streams.add(stream);

        emitter.onCompletion(() -> close(stream));
        emitter.onTimeout(() -> close(stream));
        emitter.onError(ex -> {
            log.debug("Event stream for {} failed: {}", filter.describe(), ex.getMessage());
            close(stream);
        });

        try {
            emitter.send(SseEmitter.event().comment("subscribed " + filter.describe()));
        } catch (IOException e) {
            log.debug("Event stream for {} closed before the first write", filter.describe());
            close(stream);
        }
        log.info("Event stream opened for {}", filter.describe());
        return emitter;
    }

    public int activeEmitterCount() {
        return streams.size();
    }

    void keepIdleStreamsAlive() {
        long now = System.currentTimeMillis();
        for (EventStream stream : streams) {
            if (now - stream.lastSentAt >= heartbeatIntervalMs) {
                try {
                    stream.emitter().send(SseEmitter.event().comment("keepalive"));
                    stream.lastSentAt = now;
                } catch (IOException | IllegalStateException e) {
                    close(stream);
                }
            }
        }
    }

    static Map<String, Object> body(MeshEvent event) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("kind", event.kind().name().toLowerCase(Locale.ROOT));
        if (event.serviceId() != null) {
            data.put("serviceId", event.serviceId());
        }
        if (event.endpointId() != null) {
            data.put("endpointId", event.endpointId());
        }
        data.putAll(event.payload());
        data.put("timestamp", event.timestamp().toString());
        return data;
    }

    private void send(EventStream stream, MeshEvent event) {
        try {
            stream.emitter().send(SseEmitter.event()
                    .id(Long.toString(stream.sequence.incrementAndGet()))
                    .name(event.eventType())
                    .data(body(event)));
            stream.lastSentAt = System.currentTimeMillis();
        } catch (IOException | IllegalStateException e) {
            log.debug("Dropping event stream for {}: {}", stream.filter().describe(), e.getMessage());
            close(stream);
        }
    }

    private void close(EventStream stream) {
        if (streams.remove(stream) && stream.subscription != null) {
            stream.subscription.unsubscribe();
        }
    }

    private static final class EventStream {
        private final EventFilter filter;
        private final SseEmitter emitter;
        private final AtomicLong sequence = new AtomicLong();
        private volatile EventBus.Subscription subscription;
        private volatile long lastSentAt = System.currentTimeMillis();

        EventStream(EventFilter filter, SseEmitter emitter) {
            this.filter = filter;
            this.emitter = emitter;
        }

        EventFilter filter() {
            return filter;
        }

        SseEmitter emitter() {
            return emitter;
        }
    }
}
