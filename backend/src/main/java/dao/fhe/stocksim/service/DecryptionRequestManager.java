package dao.fhe.stocksim.service;

import dao.fhe.stocksim.config.OracleProperties;
import dao.fhe.stocksim.event.EventSink;
import dao.fhe.stocksim.event.SimulationEvent;
import dao.fhe.stocksim.exception.ErrorKind;
import dao.fhe.stocksim.exception.SimulationException;
import dao.fhe.stocksim.model.ActionCategory;
import dao.fhe.stocksim.model.CiphertextSlot;
import dao.fhe.stocksim.model.DecryptedState;
import dao.fhe.stocksim.model.DecryptionContext;
import dao.fhe.stocksim.model.EncryptedSlotSet;
import dao.fhe.stocksim.oracle.ConfidentialComputeOracle;
import dao.fhe.stocksim.repository.DecryptionContextRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Two-phase decryption protocol.
 *
 * Phase one snapshots a commitment to the batch's four handles and hands the handles to the
 * oracle. Phase two, triggered by the oracle, accepts the cleartexts only if the request was not
 * fulfilled before, the batch's handles still hash to the snapshot, and the proof verifies.
 * A rejected fulfillment changes nothing, so a later valid one still goes through.
 *
 * Requests never expire. A request the oracle never answers stays pending forever.
 */
@Slf4j
@Service
public class DecryptionRequestManager {

    private final DecryptionContextRepository contextRepository;
    private final EncryptedStateStore stateStore;
    private final StateCommitmentService commitment;
    private final ConfidentialComputeOracle oracle;
    private final PauseControlService pauseControl;
    private final CooldownThrottle cooldown;
    private final BatchLifecycleService batchLifecycle;
    private final EventSink events;
    private final OperationSerializer serializer;
    private final Clock clock;
    private final String callbackSelector;

    public DecryptionRequestManager(DecryptionContextRepository contextRepository,
                                    EncryptedStateStore stateStore,
                                    StateCommitmentService commitment,
                                    ConfidentialComputeOracle oracle,
                                    PauseControlService pauseControl,
                                    CooldownThrottle cooldown,
                                    BatchLifecycleService batchLifecycle,
                                    EventSink events,
                                    OperationSerializer serializer,
                                    Clock clock,
                                    OracleProperties oracleProps) {
        this.contextRepository = contextRepository;
        this.stateStore = stateStore;
        this.commitment = commitment;
        this.oracle = oracle;
        this.pauseControl = pauseControl;
        this.cooldown = cooldown;
        this.batchLifecycle = batchLifecycle;
        this.events = events;
        this.serializer = serializer;
        this.clock = clock;
        this.callbackSelector = oracleProps.getCallbackSelector();
    }

    /**
     * Request decryption of the current (open) batch. The result arrives later through
     * {@link #fulfill}.
     */
    public DecryptionContext requestBatchDecryption(String caller) {
        return serializer.execute(() -> {
            pauseControl.requireNotPaused();
            String requester = AccessControlService.normalizeAccount(caller);
            long now = clock.instant().getEpochSecond();
            cooldown.requireElapsed(requester, ActionCategory.DECRYPTION_REQUEST, now);
            long batchId = batchLifecycle.requireOpen();

            EncryptedSlotSet slots = stateStore.slots(batchId);
            String stateHash = commitment.commitHex(slots);

            long requestId = oracle.requestDecryption(words(slots), callbackSelector);

            DecryptionContext context = new DecryptionContext();
            context.setRequestId(requestId);
            context.setBatchId(batchId);
            context.setStateHash(stateHash);
            context.setProcessed(false);
            context.setRequestedBy(requester);
            context.setRequestedAt(now);
            if (!contextRepository.insert(context)) {
                log.error("Oracle issued request id {} twice", requestId);
                throw new SimulationException(ErrorKind.DUPLICATE_REQUEST_ID, "Request id already in use: " + requestId);
            }
            cooldown.record(requester, ActionCategory.DECRYPTION_REQUEST, now);

            log.info("Decryption requested: requestId={}, batch={}, stateHash={}", requestId, batchId, stateHash);
            events.emit(new SimulationEvent.DecryptionRequested(requestId, batchId));
            return context;
        });
    }

    /**
     * Oracle callback. Authenticated by the proof only, not by who calls it.
     */
    public DecryptedState fulfill(long requestId, byte[] cleartexts, byte[] proof) {
        return serializer.execute(() -> {
            DecryptionContext context = contextRepository.findByRequestId(requestId)
                    .orElseThrow(() -> reject(ErrorKind.UNKNOWN_REQUEST, requestId, "No decryption context"));

            if (context.isProcessed()) {
                throw reject(ErrorKind.REPLAY_ATTEMPT, requestId, "Request already fulfilled");
            }

            // Handles as they are now, not as they were at request time.
            EncryptedSlotSet current = stateStore.slots(context.getBatchId());
            String currentHash = commitment.commitHex(current);
            if (!currentHash.equalsIgnoreCase(context.getStateHash())) {
                throw reject(ErrorKind.STATE_MISMATCH, requestId,
                        "Batch " + context.getBatchId() + " changed since the request");
            }

            if (!oracle.verifyProof(requestId, words(current), cleartexts, proof)) {
                throw reject(ErrorKind.INVALID_PROOF, requestId, "Decryption proof rejected");
            }

            DecryptedState decrypted = CleartextDecoder.decode(cleartexts);

            context.setProcessed(true);
            context.setFulfilledAt(clock.instant().getEpochSecond());
            contextRepository.update(context);
            oracle.acknowledge(requestId);

            log.info("Decryption completed: requestId={}, batch={}", requestId, context.getBatchId());
            events.emit(new SimulationEvent.DecryptionCompleted(
                    requestId,
                    context.getBatchId(),
                    decrypted.stockPrice(),
                    decrypted.playerBalance(),
                    decrypted.playerStockHolding(),
                    decrypted.newsImpact()
            ));
            return decrypted;
        });
    }

    public Optional<DecryptionContext> context(long requestId) {
        return contextRepository.findByRequestId(requestId);
    }

    public List<DecryptionContext> contexts() {
        return contextRepository.findAll();
    }

    public List<DecryptionContext> pendingContexts() {
        return contextRepository.findPending();
    }

    private static List<byte[]> words(EncryptedSlotSet slots) {
        return slots.ordered().stream()
                .map(CiphertextSlot::toWord)
                .collect(Collectors.toList());
    }

    private static SimulationException reject(ErrorKind kind, long requestId, String message) {
        log.warn("Fulfillment rejected: requestId={}, kind={}, reason={}", requestId, kind, message);
        return new SimulationException(kind, message + " (requestId=" + requestId + ")");
    }
}
