package com.my.inbox.adapter.in.idempotency;

import com.my.inbox.config.AppConfig;
import com.my.inbox.domain.port.out.ClockPort;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 왜: 재시작 전까지 같은 텔레그램 메시지가 다시 전달되어도 노트를 두 번 만들지 않기 위함.
 */
@ApplicationScoped
public class InMemoryIdempotencyStore implements IdempotencyStore {

    private final Duration ttl;
    private final ClockPort clockPort;
    private final Map<String, Instant> processed = new ConcurrentHashMap<>();

    @Inject
    public InMemoryIdempotencyStore(AppConfig appConfig, ClockPort clockPort) {
        this(Duration.ofHours(appConfig.idempotency().ttlHours()), clockPort);
    }

    InMemoryIdempotencyStore(Duration ttl, ClockPort clockPort) {
        this.ttl = ttl;
        this.clockPort = clockPort;
    }

    @Override
    public boolean isProcessed(String key) {
        cleanup();
        return processed.containsKey(key);
    }

    @Override
    public void markProcessed(String key) {
        cleanup();
        processed.put(key, clockPort.now());
    }

    private void cleanup() {
        Instant cutoff = clockPort.now().minus(ttl);
        processed.entrySet().removeIf(entry -> entry.getValue().isBefore(cutoff));
    }
}
