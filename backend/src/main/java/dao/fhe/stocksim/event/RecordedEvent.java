package dao.fhe.stocksim.event;

/**
 * An emitted event with its position in the log.
 */
public record RecordedEvent(
        long sequence,
        long timestamp, // unix seconds
        String type,
        SimulationEvent payload
) {}
