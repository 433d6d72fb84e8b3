package dao.fhe.stocksim.service;

import dao.fhe.stocksim.event.EventSink;
import dao.fhe.stocksim.event.SimulationEvent;
import dao.fhe.stocksim.exception.ErrorKind;
import dao.fhe.stocksim.exception.SimulationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Global halt switch. Gated operations call {@link #requireNotPaused()} before anything else.
 */
@Slf4j
@Service
public class PauseControlService {

    private final AccessControlService accessControl;
    private final EventSink events;
    private final OperationSerializer serializer;

    private volatile boolean paused;

    public PauseControlService(AccessControlService accessControl, EventSink events, OperationSerializer serializer) {
        this.accessControl = accessControl;
        this.events = events;
        this.serializer = serializer;
    }

    public void pause(String caller) {
        serializer.run(() -> {
            accessControl.requireOwner(caller);
            if (paused) {
                throw new SimulationException(ErrorKind.ALREADY_PAUSED, "System is already paused");
            }
            paused = true;
            log.warn("System paused by {}", caller);
            events.emit(new SimulationEvent.Paused(AccessControlService.normalizeAccount(caller)));
        });
    }

    public void unpause(String caller) {
        serializer.run(() -> {
            accessControl.requireOwner(caller);
            if (!paused) {
                throw new SimulationException(ErrorKind.ALREADY_UNPAUSED, "System is not paused");
            }
            paused = false;
            log.info("System unpaused by {}", caller);
            events.emit(new SimulationEvent.Unpaused(AccessControlService.normalizeAccount(caller)));
        });
    }

    public void requireNotPaused() {
        if (paused) {
            throw new SimulationException(ErrorKind.SYSTEM_PAUSED, "System is paused");
        }
    }

    public boolean isPaused() {
        return paused;
    }

    public boolean isAvailable() {
        return !paused;
    }
}
