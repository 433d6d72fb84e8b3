package dao.fhe.stocksim.service;

import dao.fhe.stocksim.event.EventSink;
import dao.fhe.stocksim.event.SimulationEvent;
import dao.fhe.stocksim.exception.ErrorKind;
import dao.fhe.stocksim.exception.SimulationException;
import dao.fhe.stocksim.model.BatchState;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;

/**
 * Open/closed round state. Batch ids start at 1, increase by one per {@link #openBatch},
 * and are never reused. Opening while open is allowed and just moves to the next id.
 */
@Slf4j
@Service
public class BatchLifecycleService {

    private final AccessControlService accessControl;
    private final PauseControlService pauseControl;
    private final EventSink events;
    private final OperationSerializer serializer;
    private final Clock clock;

    private final BatchState state = new BatchState();

    public BatchLifecycleService(AccessControlService accessControl,
                                 PauseControlService pauseControl,
                                 EventSink events,
                                 OperationSerializer serializer,
                                 Clock clock) {
        this.accessControl = accessControl;
        this.pauseControl = pauseControl;
        this.events = events;
        this.serializer = serializer;
        this.clock = clock;
    }

    public long openBatch(String caller) {
        return serializer.execute(() -> {
            pauseControl.requireNotPaused();
            accessControl.requireOwner(caller);

            long next;
            synchronized (state) {
                next = state.getCurrentBatchId() + 1;
                state.setCurrentBatchId(next);
                state.setOpen(true);
                state.setOpenedAt(clock.instant().getEpochSecond());
            }

            log.info("Batch {} opened", next);
            events.emit(new SimulationEvent.BatchOpened(next));
            return next;
        });
    }

    public void closeBatch(String caller) {
        serializer.run(() -> {
            pauseControl.requireNotPaused();
            accessControl.requireOwner(caller);
            long closed;
            synchronized (state) {
                if (!state.isOpen()) {
                    throw new SimulationException(ErrorKind.BATCH_NOT_OPEN, "No batch is open");
                }
                state.setOpen(false);
                closed = state.getCurrentBatchId();
            }

            log.info("Batch {} closed", closed);
            events.emit(new SimulationEvent.BatchClosed(closed));
        });
    }

    /**
     * Returns the current batch id, failing if it is not open.
     */
    public long requireOpen() {
        synchronized (state) {
            if (!state.isOpen()) {
                throw new SimulationException(ErrorKind.BATCH_NOT_OPEN, "Batch " + state.getCurrentBatchId() + " is not open");
            }
            return state.getCurrentBatchId();
        }
    }

    public long currentBatchId() {
        synchronized (state) {
            return state.getCurrentBatchId();
        }
    }

    public boolean isOpen() {
        synchronized (state) {
            return state.isOpen();
        }
    }

    public BatchState snapshot() {
        synchronized (state) {
            BatchState copy = new BatchState();
            copy.setCurrentBatchId(state.getCurrentBatchId());
            copy.setOpen(state.isOpen());
            copy.setOpenedAt(state.getOpenedAt());
            return copy;
        }
    }
}
