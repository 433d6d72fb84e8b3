package dao.fhe.stocksim.event;

import java.math.BigInteger;

/**
 * State transition notifications. Observers only; nothing in the core reads them back.
 *
 * Accounts are normalized 0x-prefixed addresses.
 */
public interface SimulationEvent {

    default String type() {
        return getClass().getSimpleName();
    }

    record OwnershipTransferred(String previousOwner, String newOwner) implements SimulationEvent {}

    record ProviderAdded(String account) implements SimulationEvent {}

    record ProviderRemoved(String account) implements SimulationEvent {}

    record CooldownChanged(long previousSeconds, long newSeconds) implements SimulationEvent {}

    record Paused(String account) implements SimulationEvent {}

    record Unpaused(String account) implements SimulationEvent {}

    record BatchOpened(long batchId) implements SimulationEvent {}

    record BatchClosed(long batchId) implements SimulationEvent {}

    record NewsSubmitted(long batchId, String provider) implements SimulationEvent {}

    record TradeSubmitted(long batchId, String trader) implements SimulationEvent {}

    record DecryptionRequested(long requestId, long batchId) implements SimulationEvent {}

    record DecryptionCompleted(
            long requestId,
            long batchId,
            BigInteger stockPrice,
            BigInteger playerBalance,
            BigInteger playerStockHolding,
            BigInteger newsImpact
    ) implements SimulationEvent {}
}
