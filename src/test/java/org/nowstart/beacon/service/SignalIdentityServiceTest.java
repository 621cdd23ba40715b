package org.nowstart.beacon.service;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.Duration;
import java.time.Instant;
import org.junit.jupiter.api.Test;
import org.nowstart.beacon.data.type.TradeDirection;
import org.nowstart.beacon.repository.InMemorySignalStateStore;
import org.nowstart.beacon.support.MutableClock;
import org.nowstart.beacon.support.SignalFixtures;

class SignalIdentityServiceTest {

    private final MutableClock clock = new MutableClock(Instant.parse("2026-03-02T10:00:10Z"));
    private final SignalIdentityService service = new SignalIdentityService(
            new InMemorySignalStateStore(clock),
            SignalFixtures.signalProperties()
    );

    @Test
    void previewId_isStableWithinDedupeBucket() {
        String first = service.previewId("BTCUSDT", TradeDirection.LONG, Instant.parse("2026-03-02T10:00:10Z"));
        String sameBucket = service.previewId("BTCUSDT", TradeDirection.LONG, Instant.parse("2026-03-02T10:01:59Z"));
        String nextBucket = service.previewId("BTCUSDT", TradeDirection.LONG, Instant.parse("2026-03-02T10:02:00Z"));

        assertThat(first).matches("[0-9a-f]{40}");
        assertThat(sameBucket).isEqualTo(first);
        assertThat(nextBucket).isNotEqualTo(first);
    }

    @Test
    void previewId_differsByDirectionAndSymbol() {
        Instant now = Instant.parse("2026-03-02T10:00:10Z");

        assertThat(service.previewId("BTCUSDT", TradeDirection.LONG, now))
                .isNotEqualTo(service.previewId("BTCUSDT", TradeDirection.SHORT, now))
                .isNotEqualTo(service.previewId("ETHUSDT", TradeDirection.LONG, now));
    }

    @Test
    void confirmedId_isDeterministicPerCandle() {
        Instant candleClose = Instant.parse("2026-03-02T10:00:00Z");

        String first = service.confirmedId("BTCUSDT", TradeDirection.LONG, candleClose);
        String second = service.confirmedId("BTCUSDT", TradeDirection.LONG, candleClose);
        String nextCandle = service.confirmedId("BTCUSDT", TradeDirection.LONG, candleClose.plus(Duration.ofHours(1)));

        assertThat(second).isEqualTo(first);
        assertThat(nextCandle).isNotEqualTo(first);
        assertThat(first).isNotEqualTo(service.previewId("BTCUSDT", TradeDirection.LONG, candleClose));
    }

    @Test
    void invalidatedId_includesReason() {
        Instant now = Instant.parse("2026-03-02T10:00:10Z");

        assertThat(service.invalidatedId("BTCUSDT", now, "CLOSE_DIRECTION_CHANGED"))
                .isEqualTo(service.invalidatedId("BTCUSDT", now.plusSeconds(30), "CLOSE_DIRECTION_CHANGED"))
                .isNotEqualTo(service.invalidatedId("BTCUSDT", now, "CLOSE_LIQ_VETO"));
    }

    @Test
    void errorId_changesEveryMinute() {
        Instant now = Instant.parse("2026-03-02T10:00:10Z");

        assertThat(service.errorId("BTCUSDT", now)).isEqualTo(service.errorId("BTCUSDT", now.plusSeconds(49)));
        assertThat(service.errorId("BTCUSDT", now)).isNotEqualTo(service.errorId("BTCUSDT", now.plusSeconds(50)));
    }

    @Test
    void claim_allowsEachIdOncePerDedupeWindow() {
        String id = service.previewId("BTCUSDT", TradeDirection.LONG, clock.instant());

        boolean first = service.claim(id);
        boolean duplicate = service.claim(id);
        clock.advance(Duration.ofSeconds(120));
        boolean afterWindow = service.claim(id);

        assertThat(first).isTrue();
        assertThat(duplicate).isFalse();
        assertThat(afterWindow).isTrue();
    }

    @Test
    void floorBucket_alignsToEpoch() {
        long bucket = SignalIdentityService.floorBucket(Instant.parse("2026-03-02T10:01:59.999Z"), Duration.ofSeconds(120));

        assertThat(Instant.ofEpochMilli(bucket)).isEqualTo(Instant.parse("2026-03-02T10:00:00Z"));
    }
}
