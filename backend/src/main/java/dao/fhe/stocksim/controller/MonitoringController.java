package dao.fhe.stocksim.controller;

import dao.fhe.stocksim.event.InMemoryEventLog;
import dao.fhe.stocksim.event.RecordedEvent;
import dao.fhe.stocksim.model.ActionCategory;
import dao.fhe.stocksim.model.BatchState;
import dao.fhe.stocksim.model.CiphertextSlot;
import dao.fhe.stocksim.model.EncryptedSlotSet;
import dao.fhe.stocksim.model.SlotName;
import dao.fhe.stocksim.service.AccessControlService;
import dao.fhe.stocksim.service.BatchLifecycleService;
import dao.fhe.stocksim.service.CooldownThrottle;
import dao.fhe.stocksim.service.DecryptionRequestManager;
import dao.fhe.stocksim.service.EncryptedStateStore;
import dao.fhe.stocksim.service.PauseControlService;
import dao.fhe.stocksim.service.StateCommitmentService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Read-only views. Ciphertext handles are public; confidentiality is a property of the
 * ciphertext, so nothing here is access controlled.
 */
@RestController
@RequestMapping("/api/monitor")
public class MonitoringController {

    private final AccessControlService accessControl;
    private final PauseControlService pauseControl;
    private final CooldownThrottle cooldown;
    private final BatchLifecycleService batchLifecycle;
    private final EncryptedStateStore stateStore;
    private final StateCommitmentService commitment;
    private final DecryptionRequestManager decryptionManager;
    private final InMemoryEventLog eventLog;

    public MonitoringController(AccessControlService accessControl,
                                PauseControlService pauseControl,
                                CooldownThrottle cooldown,
                                BatchLifecycleService batchLifecycle,
                                EncryptedStateStore stateStore,
                                StateCommitmentService commitment,
                                DecryptionRequestManager decryptionManager,
                                InMemoryEventLog eventLog) {
        this.accessControl = accessControl;
        this.pauseControl = pauseControl;
        this.cooldown = cooldown;
        this.batchLifecycle = batchLifecycle;
        this.stateStore = stateStore;
        this.commitment = commitment;
        this.decryptionManager = decryptionManager;
        this.eventLog = eventLog;
    }

    /**
     * GET /api/monitor/state
     */
    @GetMapping("/state")
    public ResponseEntity<Map<String, Object>> getState() {
        BatchState batch = batchLifecycle.snapshot();

        Map<String, Object> response = new LinkedHashMap<>();
        response.put("status", "SUCCESS");
        response.put("owner", accessControl.owner());
        response.put("providers", accessControl.providers());
        response.put("paused", pauseControl.isPaused());
        response.put("cooldownSeconds", cooldown.getCooldownSeconds());
        response.put("currentBatchId", batch.getCurrentBatchId());
        response.put("batchOpen", batch.isOpen());
        response.put("batchOpenedAt", batch.getOpenedAt());
        response.put("pendingDecryptions", decryptionManager.pendingContexts().size());
        response.put("events", eventLog.size());
        return ResponseEntity.ok(response);
    }

    /**
     * GET /api/monitor/available
     * False while the system is paused.
     */
    @GetMapping("/available")
    public ResponseEntity<Map<String, Object>> isAvailable() {
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("status", "SUCCESS");
        response.put("available", pauseControl.isAvailable());
        return ResponseEntity.ok(response);
    }

    /**
     * GET /api/monitor/batches/{batchId}
     * Slot handles of a batch plus the commitment they currently hash to.
     */
    @GetMapping("/batches/{batchId}")
    public ResponseEntity<Map<String, Object>> getBatch(@PathVariable long batchId) {
        Map<String, Object> response = new LinkedHashMap<>();
        if (batchId < 1 || batchId > batchLifecycle.currentBatchId()) {
            response.put("status", "NOT_FOUND");
            response.put("error", "Batch not found: " + batchId);
            return ResponseEntity.status(404).body(response);
        }

        EncryptedSlotSet slots = stateStore.slots(batchId);
        Map<String, Object> slotInfo = new LinkedHashMap<>();
        for (SlotName name : SlotName.values()) {
            CiphertextSlot slot = slots.get(name);
            slotInfo.put(name.name(), slot.isSet() ? slot.handleHex() : "UNSET");
        }

        response.put("status", "SUCCESS");
        response.put("batchId", batchId);
        response.put("open", batchLifecycle.isOpen() && batchLifecycle.currentBatchId() == batchId);
        response.put("slots", slotInfo);
        response.put("stateHash", commitment.commitHex(slots));
        return ResponseEntity.ok(response);
    }

    /**
     * GET /api/monitor/accounts/{account}
     */
    @GetMapping("/accounts/{account}")
    public ResponseEntity<Map<String, Object>> getAccount(@PathVariable String account) {
        String id = AccessControlService.normalizeAccount(account);

        Map<String, Object> response = new LinkedHashMap<>();
        response.put("status", "SUCCESS");
        response.put("account", id);
        response.put("owner", accessControl.isOwner(id));
        response.put("provider", accessControl.isProvider(id));
        response.put("lastSubmissionAt", cooldown.lastAction(id, ActionCategory.SUBMISSION).orElse(null));
        response.put("lastDecryptionRequestAt", cooldown.lastAction(id, ActionCategory.DECRYPTION_REQUEST).orElse(null));
        return ResponseEntity.ok(response);
    }

    /**
     * GET /api/monitor/events?since=N
     */
    @GetMapping("/events")
    public ResponseEntity<Map<String, Object>> getEvents(@RequestParam(defaultValue = "0") long since) {
        List<RecordedEvent> events = eventLog.since(since);

        Map<String, Object> response = new LinkedHashMap<>();
        response.put("status", "SUCCESS");
        response.put("total", events.size());
        response.put("events", events);
        return ResponseEntity.ok(response);
    }
}
