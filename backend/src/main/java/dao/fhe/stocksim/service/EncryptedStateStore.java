package dao.fhe.stocksim.service;

import dao.fhe.stocksim.event.EventSink;
import dao.fhe.stocksim.event.SimulationEvent;
import dao.fhe.stocksim.exception.ErrorKind;
import dao.fhe.stocksim.exception.SimulationException;
import dao.fhe.stocksim.model.ActionCategory;
import dao.fhe.stocksim.model.CiphertextSlot;
import dao.fhe.stocksim.model.EncryptedSlotSet;
import dao.fhe.stocksim.model.SlotName;
import dao.fhe.stocksim.repository.SlotRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.List;

/**
 * Per-batch encrypted slots. Writes go to the currently open batch and replace whatever
 * handle the slot held; nothing is combined. Reads are open to everyone.
 */
@Slf4j
@Service
public class EncryptedStateStore {

    private final SlotRepository slotRepository;
    private final AccessControlService accessControl;
    private final PauseControlService pauseControl;
    private final CooldownThrottle cooldown;
    private final BatchLifecycleService batchLifecycle;
    private final EventSink events;
    private final OperationSerializer serializer;
    private final Clock clock;

    public EncryptedStateStore(SlotRepository slotRepository,
                               AccessControlService accessControl,
                               PauseControlService pauseControl,
                               CooldownThrottle cooldown,
                               BatchLifecycleService batchLifecycle,
                               EventSink events,
                               OperationSerializer serializer,
                               Clock clock) {
        this.slotRepository = slotRepository;
        this.accessControl = accessControl;
        this.pauseControl = pauseControl;
        this.cooldown = cooldown;
        this.batchLifecycle = batchLifecycle;
        this.events = events;
        this.serializer = serializer;
        this.clock = clock;
    }

    public long submitNews(String caller, String newsHandle) {
        return serializer.execute(() -> {
            pauseControl.requireNotPaused();
            String provider = AccessControlService.normalizeAccount(caller);
            accessControl.requireProvider(provider);
            CiphertextSlot news = parseHandle(newsHandle);
            long now = clock.instant().getEpochSecond();
            cooldown.requireElapsed(provider, ActionCategory.SUBMISSION, now);
            long batchId = batchLifecycle.requireOpen();

            EncryptedSlotSet slots = slots(batchId);
            slots.put(SlotName.NEWS_IMPACT, news);
            slotRepository.save(slots);
            cooldown.record(provider, ActionCategory.SUBMISSION, now);

            log.debug("News submitted: batch={}, provider={}", batchId, provider);
            events.emit(new SimulationEvent.NewsSubmitted(batchId, provider));
            return batchId;
        });
    }

    public long submitTrade(String caller, String balanceHandle, String holdingHandle) {
        return serializer.execute(() -> {
            pauseControl.requireNotPaused();
            String trader = AccessControlService.normalizeAccount(caller);
            CiphertextSlot balance = parseHandle(balanceHandle);
            CiphertextSlot holding = parseHandle(holdingHandle);
            long now = clock.instant().getEpochSecond();
            cooldown.requireElapsed(trader, ActionCategory.SUBMISSION, now);
            long batchId = batchLifecycle.requireOpen();

            EncryptedSlotSet slots = slots(batchId);
            slots.put(SlotName.PLAYER_BALANCE, balance);
            slots.put(SlotName.PLAYER_STOCK_HOLDING, holding);
            slotRepository.save(slots);
            cooldown.record(trader, ActionCategory.SUBMISSION, now);

            log.debug("Trade submitted: batch={}, trader={}", batchId, trader);
            events.emit(new SimulationEvent.TradeSubmitted(batchId, trader));
            return batchId;
        });
    }

    /**
     * Slots of a batch as they stand now. A batch never written to reads as four unset slots.
     */
    public EncryptedSlotSet slots(long batchId) {
        return slotRepository.findByBatchId(batchId).orElseGet(() -> new EncryptedSlotSet(batchId));
    }

    public List<CiphertextSlot> handles(long batchId) {
        return slots(batchId).ordered();
    }

    public CiphertextSlot slot(long batchId, SlotName name) {
        return slots(batchId).get(name);
    }

    private static CiphertextSlot parseHandle(String handle) {
        try {
            return CiphertextSlot.of(handle == null ? null : handle.trim());
        } catch (IllegalArgumentException e) {
            throw new SimulationException(ErrorKind.INVALID_ARGUMENT, "Malformed ciphertext handle: " + handle, e);
        }
    }
}
