package com.quantumskylink.orchestration.repository;

import com.quantumskylink.orchestration.model.WorkflowExecutionContext;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * {@link ExecutionContextStore} backed by two ConcurrentHashMaps.
 *
 * Contexts are copied on the way in and on the way out, so the stored state
 * only changes through {@link #put} and a caller can never mutate it in place.
 * Expiry is checked lazily on every read and swept periodically by
 * {@link ExpiredContextSweeper}.
 */
@Component
public class InMemoryExecutionContextStore implements ExecutionContextStore {

    private record Entry<V>(V value, Instant expiresAt) {
        boolean expiredAt(Instant now) {
            return !now.isBefore(expiresAt);
        }
    }

    private final Map<String, Entry<WorkflowExecutionContext>> contexts = new ConcurrentHashMap<>();
    private final Map<String, Entry<String>>                   index    = new ConcurrentHashMap<>();
    private final Clock clock;

    public InMemoryExecutionContextStore(Clock clock) {
        this.clock = clock;
    }

    @Override
    public void put(String executionId, WorkflowExecutionContext context, Duration ttl) {
        contexts.put(executionId, new Entry<>(context.copy(), clock.instant().plus(ttl)));
    }

    @Override
    public Optional<WorkflowExecutionContext> get(String executionId) {
        return live(contexts, executionId).map(WorkflowExecutionContext::copy);
    }

    @Override
    public void putIndex(String secondaryKey, String executionId, Duration ttl) {
        index.put(secondaryKey, new Entry<>(executionId, clock.instant().plus(ttl)));
    }

    @Override
    public Optional<String> getByIndex(String secondaryKey) {
        return live(index, secondaryKey);
    }

    @Override
    public int purgeExpired() {
        Instant now = clock.instant();
        int before = contexts.size() + index.size();
        contexts.values().removeIf(e -> e.expiredAt(now));
        index.values().removeIf(e -> e.expiredAt(now));
        return before - (contexts.size() + index.size());
    }

    private <V> Optional<V> live(Map<String, Entry<V>> map, String key) {
        if (key == null) return Optional.empty();
        Entry<V> entry = map.get(key);
        if (entry == null) return Optional.empty();
        if (entry.expiredAt(clock.instant())) {
            // Only remove this exact entry; a concurrent put may have replaced it.
            map.remove(key, entry);
            return Optional.empty();
        }
        return Optional.of(entry.value());
    }
}
