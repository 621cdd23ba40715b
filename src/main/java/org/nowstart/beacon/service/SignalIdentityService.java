package org.nowstart.beacon.service;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Duration;
import java.time.Instant;
import lombok.RequiredArgsConstructor;
import org.nowstart.beacon.data.property.SignalProperties;
import org.nowstart.beacon.data.type.TradeDirection;
import org.nowstart.beacon.repository.SignalStateStore;
import org.springframework.cloud.context.config.annotation.RefreshScope;
import org.springframework.stereotype.Service;

/**
 * Deterministic signal ids and the at-most-once emission claim.
 */
@Service
@RefreshScope
@RequiredArgsConstructor
public class SignalIdentityService {

    static final Duration TERMINAL_BUCKET = Duration.ofSeconds(60);

    private final SignalStateStore signalStateStore;
    private final SignalProperties signalProperties;

    public static String dedupeKey(String signalId) {
        return "sig:dedupe:" + signalId;
    }

    public String previewId(String symbol, TradeDirection direction, Instant now) {
        long bucket = floorBucket(now, signalProperties.dedupeScope());
        return sha1Hex("PREVIEW|" + symbol + "|" + direction + "|" + bucket);
    }

    public String confirmedId(String symbol, TradeDirection direction, Instant candleCloseTime) {
        return sha1Hex("CONFIRMED|" + symbol + "|" + direction + "|" + candleCloseTime.toEpochMilli());
    }

    public String invalidatedId(String symbol, Instant now, String reason) {
        return sha1Hex("INVALID|" + symbol + "|" + floorBucket(now, TERMINAL_BUCKET) + "|" + reason);
    }

    public String errorId(String symbol, Instant now) {
        return sha1Hex("ERR|" + symbol + "|" + floorBucket(now, TERMINAL_BUCKET));
    }

    /**
     * @return {@code false} when the id was already emitted within the dedupe window
     */
    public boolean claim(String signalId) {
        return signalStateStore.setIfAbsent(dedupeKey(signalId), 1, signalProperties.dedupeTtl());
    }

    static long floorBucket(Instant now, Duration bucket) {
        long bucketMs = Math.max(1L, bucket.toMillis());
        return Math.floorDiv(now.toEpochMilli(), bucketMs) * bucketMs;
    }

    private static String sha1Hex(String value) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-1");
            byte[] hashed = digest.digest(value.getBytes(StandardCharsets.UTF_8));
            StringBuilder sb = new StringBuilder(hashed.length * 2);
            for (byte b : hashed) {
                sb.append(String.format("%02x", b));
            }
            return sb.toString();
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-1 not available", e);
        }
    }
}
