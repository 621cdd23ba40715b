package org.nowstart.beacon.service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.nowstart.beacon.data.dto.CooldownState;
import org.nowstart.beacon.data.dto.LastSignalPointer;
import org.nowstart.beacon.data.dto.PendingConfirmation;
import org.nowstart.beacon.data.dto.SignalStateDto;
import org.nowstart.beacon.data.property.SignalProperties;
import org.nowstart.beacon.repository.SignalStateStore;
import org.springframework.cloud.context.config.annotation.RefreshScope;
import org.springframework.stereotype.Service;

@Service
@RefreshScope
@RequiredArgsConstructor
public class SignalStateService {

    private final SignalStateStore signalStateStore;
    private final SignalProperties signalProperties;
    private final Clock clock;

    public static String cooldownKey(String symbol) {
        return "sig:cooldown:" + symbol;
    }

    public static String pendingKey(String symbol) {
        return "sig:pending:" + symbol;
    }

    public static String lastSignalKey(String symbol) {
        return "sig:lastsig:" + symbol;
    }

    public boolean isCoolingDown(String symbol, Instant now) {
        return signalStateStore.get(cooldownKey(symbol), CooldownState.class)
                .map(state -> state.isActive(now))
                .orElse(false);
    }

    public Instant armCooldown(String symbol, Duration duration) {
        Instant cooldownUntil = clock.instant().plus(duration);
        signalStateStore.set(cooldownKey(symbol), new CooldownState(cooldownUntil), signalProperties.ttlCooldown());
        return cooldownUntil;
    }

    public Optional<PendingConfirmation> findPending(String symbol) {
        return signalStateStore.get(pendingKey(symbol), PendingConfirmation.class);
    }

    public void savePending(String symbol, PendingConfirmation pending) {
        signalStateStore.set(pendingKey(symbol), pending, signalProperties.ttlPending());
    }

    public void clearPending(String symbol) {
        signalStateStore.delete(pendingKey(symbol));
    }

    public Optional<LastSignalPointer> findLastSignal(String symbol) {
        return signalStateStore.get(lastSignalKey(symbol), LastSignalPointer.class);
    }

    public void saveLastSignal(String symbol, LastSignalPointer pointer) {
        signalStateStore.set(lastSignalKey(symbol), pointer, signalProperties.ttlLastSignal());
    }

    public SignalStateDto snapshot(String symbol) {
        Instant cooldownUntil = signalStateStore.get(cooldownKey(symbol), CooldownState.class)
                .map(CooldownState::cooldownUntil)
                .orElse(null);
        return new SignalStateDto(
                symbol,
                cooldownUntil,
                findPending(symbol).orElse(null),
                findLastSignal(symbol).orElse(null)
        );
    }
}
