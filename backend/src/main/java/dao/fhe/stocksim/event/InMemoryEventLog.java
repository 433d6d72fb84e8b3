package dao.fhe.stocksim.event;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Append-only event log. Sequence numbers start at 1 and have no gaps.
 */
@Slf4j
@Component
public class InMemoryEventLog implements EventSink {

    private final Clock clock;
    private final List<RecordedEvent> events = new ArrayList<>();

    public InMemoryEventLog(Clock clock) {
        this.clock = clock;
    }

    @Override
    public synchronized void emit(SimulationEvent event) {
        RecordedEvent recorded = new RecordedEvent(
                events.size() + 1L,
                clock.instant().getEpochSecond(),
                event.type(),
                event
        );
        events.add(recorded);
        log.info("Event #{} {}: {}", recorded.sequence(), recorded.type(), event);
    }

    public synchronized List<RecordedEvent> all() {
        return List.copyOf(events);
    }

    /**
     * Events with a sequence number strictly greater than {@code sequence}.
     */
    public synchronized List<RecordedEvent> since(long sequence) {
        return events.stream()
                .filter(e -> e.sequence() > sequence)
                .collect(Collectors.toList());
    }

    public synchronized <T extends SimulationEvent> List<T> ofType(Class<T> type) {
        return events.stream()
                .map(RecordedEvent::payload)
                .filter(type::isInstance)
                .map(type::cast)
                .collect(Collectors.toList());
    }

    public synchronized int size() {
        return events.size();
    }
}
