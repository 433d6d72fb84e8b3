package dao.fhe.stocksim.event;

import dao.fhe.stocksim.MutableClock;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class InMemoryEventLogTest {

    @Test
    void assignsSequenceAndTimestamp() {
        MutableClock clock = new MutableClock(10);
        InMemoryEventLog log = new InMemoryEventLog(clock);

        log.emit(new SimulationEvent.BatchOpened(1));
        clock.advanceSeconds(5);
        log.emit(new SimulationEvent.BatchClosed(1));

        List<RecordedEvent> all = log.all();
        assertEquals(List.of(1L, 2L), all.stream().map(RecordedEvent::sequence).collect(Collectors.toList()));
        assertEquals(10L, all.get(0).timestamp());
        assertEquals(15L, all.get(1).timestamp());
        assertEquals("BatchOpened", all.get(0).type());
    }

    @Test
    void sinceIsExclusive() {
        InMemoryEventLog log = new InMemoryEventLog(new MutableClock(0));
        log.emit(new SimulationEvent.Paused("0xa"));
        log.emit(new SimulationEvent.Unpaused("0xa"));
        log.emit(new SimulationEvent.Paused("0xa"));

        assertEquals(2, log.since(1).size());
        assertEquals(3L, log.since(2).get(0).sequence());
        assertTrue(log.since(3).isEmpty());
        assertEquals(3, log.since(0).size());
    }

    @Test
    void filtersByType() {
        InMemoryEventLog log = new InMemoryEventLog(new MutableClock(0));
        log.emit(new SimulationEvent.ProviderAdded("0xb"));
        log.emit(new SimulationEvent.BatchOpened(1));
        log.emit(new SimulationEvent.ProviderAdded("0xc"));

        assertEquals(List.of(new SimulationEvent.ProviderAdded("0xb"), new SimulationEvent.ProviderAdded("0xc")),
                log.ofType(SimulationEvent.ProviderAdded.class));
        assertEquals(3, log.size());
    }

    @Test
    void snapshotIsImmutable() {
        InMemoryEventLog log = new InMemoryEventLog(new MutableClock(0));
        log.emit(new SimulationEvent.BatchOpened(1));
        assertThrows(UnsupportedOperationException.class, () -> log.all().clear());
    }
}
