package org.nowstart.beacon.repository;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import lombok.RequiredArgsConstructor;

@RequiredArgsConstructor
public class InMemorySignalStateStore implements SignalStateStore {

    private static final Duration PURGE_INTERVAL = Duration.ofMinutes(1);

    private final Clock clock;
    private final Map<String, StoredValue> values = new ConcurrentHashMap<>();
    private final AtomicReference<Instant> lastPurgeAt = new AtomicReference<>(Instant.MIN);

    @Override
    public <T> Optional<T> get(String key, Class<T> type) {
        StoredValue stored = values.get(key);
        if (stored == null) {
            return Optional.empty();
        }
        if (stored.isExpired(clock.instant())) {
            values.remove(key, stored);
            return Optional.empty();
        }
        if (!type.isInstance(stored.value())) {
            throw new IllegalStateException(
                    "State key " + key + " holds " + stored.value().getClass().getSimpleName()
                            + ", expected " + type.getSimpleName()
            );
        }
        return Optional.of(type.cast(stored.value()));
    }

    @Override
    public void set(String key, Object value, Duration ttl) {
        purgeExpiredIfDue();
        values.put(key, new StoredValue(value, expiry(ttl)));
    }

    @Override
    public boolean setIfAbsent(String key, Object value, Duration ttl) {
        purgeExpiredIfDue();
        AtomicBoolean claimed = new AtomicBoolean(false);
        values.compute(key, (ignored, current) -> {
            if (current != null && !current.isExpired(clock.instant())) {
                return current;
            }
            claimed.set(true);
            return new StoredValue(value, expiry(ttl));
        });
        return claimed.get();
    }

    @Override
    public void delete(String key) {
        values.remove(key);
    }

    /**
     * Drops every entry whose TTL has elapsed. Keys that are written once and never read again (dedupe claims) are
     * only released here.
     */
    public int purgeExpired() {
        Instant now = clock.instant();
        lastPurgeAt.set(now);
        int before = values.size();
        values.entrySet().removeIf(entry -> entry.getValue().isExpired(now));
        return Math.max(0, before - values.size());
    }

    int size() {
        return values.size();
    }

    // 쓰기 경로에서 최대 1분에 한 번만 정리
    private void purgeExpiredIfDue() {
        Instant now = clock.instant();
        Instant last = lastPurgeAt.get();
        if (now.isBefore(last.plus(PURGE_INTERVAL)) || !lastPurgeAt.compareAndSet(last, now)) {
            return;
        }
        values.entrySet().removeIf(entry -> entry.getValue().isExpired(now));
    }

    private Instant expiry(Duration ttl) {
        return ttl == null ? null : clock.instant().plus(ttl);
    }

    private record StoredValue(Object value, Instant expiresAt) {

        boolean isExpired(Instant now) {
            return expiresAt != null && !now.isBefore(expiresAt);
        }
    }
}
