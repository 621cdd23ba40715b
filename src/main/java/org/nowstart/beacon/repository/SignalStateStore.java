package org.nowstart.beacon.repository;

import java.time.Duration;
import java.util.Optional;

/**
 * TTL-capable key-value store holding per-symbol lifecycle state and dedupe markers.
 *
 * <p>TTL only bounds how long a value is kept. Business expiry (cooldown end, dedupe window) is stored inside
 * the value or the key itself.
 */
public interface SignalStateStore {

    <T> Optional<T> get(String key, Class<T> type);

    void set(String key, Object value, Duration ttl);

    /**
     * Atomically stores {@code value} only when {@code key} holds nothing.
     *
     * @return {@code true} when this call created the key
     */
    boolean setIfAbsent(String key, Object value, Duration ttl);

    void delete(String key);
}
