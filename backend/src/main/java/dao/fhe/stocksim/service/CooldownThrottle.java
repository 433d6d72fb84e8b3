package dao.fhe.stocksim.service;

import dao.fhe.stocksim.config.SimulationProperties;
import dao.fhe.stocksim.event.EventSink;
import dao.fhe.stocksim.event.SimulationEvent;
import dao.fhe.stocksim.exception.ErrorKind;
import dao.fhe.stocksim.exception.SimulationException;
import dao.fhe.stocksim.model.ActionCategory;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.EnumMap;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Per-account, per-category rate limiter. Checking and recording are separate so that an
 * operation can record only after all of its other guards passed.
 */
@Slf4j
@Service
public class CooldownThrottle {

    private final AccessControlService accessControl;
    private final EventSink events;
    private final OperationSerializer serializer;

    // key: normalized account
    private final Map<String, EnumMap<ActionCategory, Long>> lastActionAt = new HashMap<>();
    private volatile long cooldownSeconds;

    public CooldownThrottle(SimulationProperties props,
                            AccessControlService accessControl,
                            EventSink events,
                            OperationSerializer serializer) {
        if (props.getCooldownSeconds() < 0) {
            throw new IllegalStateException("simulation.cooldown-seconds must be >= 0");
        }
        this.cooldownSeconds = props.getCooldownSeconds();
        this.accessControl = accessControl;
        this.events = events;
        this.serializer = serializer;
    }

    public void setCooldownSeconds(String caller, long seconds) {
        serializer.run(() -> {
            accessControl.requireOwner(caller);
            if (seconds < 0) {
                throw new SimulationException(ErrorKind.INVALID_ARGUMENT, "Cooldown must be >= 0, got " + seconds);
            }
            long previous = cooldownSeconds;
            cooldownSeconds = seconds;
            events.emit(new SimulationEvent.CooldownChanged(previous, seconds));
        });
    }

    /**
     * Fails unless {@code now >= last + cooldownSeconds}. An account that never acted passes.
     */
    public synchronized void requireElapsed(String account, ActionCategory category, long now) {
        Long last = lastAction(account, category).orElse(null);
        if (last == null) return;
        if (now - last < cooldownSeconds) {
            log.debug("Cooldown active: account={}, category={}, last={}, now={}", account, category, last, now);
            throw new SimulationException(ErrorKind.COOLDOWN_ACTIVE, "Cooldown active for " + category);
        }
    }

    public synchronized void record(String account, ActionCategory category, long now) {
        lastActionAt.computeIfAbsent(account, a -> new EnumMap<>(ActionCategory.class)).put(category, now);
    }

    public synchronized Optional<Long> lastAction(String account, ActionCategory category) {
        EnumMap<ActionCategory, Long> byCategory = lastActionAt.get(account);
        if (byCategory == null) return Optional.empty();
        return Optional.ofNullable(byCategory.get(category));
    }

    public long getCooldownSeconds() {
        return cooldownSeconds;
    }
}
