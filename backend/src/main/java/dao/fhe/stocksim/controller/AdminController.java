package dao.fhe.stocksim.controller;

import dao.fhe.stocksim.model.AccountRequest;
import dao.fhe.stocksim.model.CooldownRequest;
import dao.fhe.stocksim.service.AccessControlService;
import dao.fhe.stocksim.service.BatchLifecycleService;
import dao.fhe.stocksim.service.CooldownThrottle;
import dao.fhe.stocksim.service.PauseControlService;
import jakarta.validation.Valid;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Owner-only operations: roles, cooldown, pause switch, batch open/close.
 */
@RestController
@RequestMapping("/api")
public class AdminController {

    private final AccessControlService accessControl;
    private final PauseControlService pauseControl;
    private final CooldownThrottle cooldown;
    private final BatchLifecycleService batchLifecycle;

    public AdminController(AccessControlService accessControl,
                           PauseControlService pauseControl,
                           CooldownThrottle cooldown,
                           BatchLifecycleService batchLifecycle) {
        this.accessControl = accessControl;
        this.pauseControl = pauseControl;
        this.cooldown = cooldown;
        this.batchLifecycle = batchLifecycle;
    }

    @PostMapping("/admin/ownership")
    public ResponseEntity<Map<String, Object>> transferOwnership(@RequestHeader(ApiHeaders.ACCOUNT) String caller,
                                                                 @Valid @RequestBody AccountRequest req) {
        accessControl.transferOwnership(caller, req.getAccount());
        return ok("owner", accessControl.owner());
    }

    @PostMapping("/admin/providers")
    public ResponseEntity<Map<String, Object>> addProvider(@RequestHeader(ApiHeaders.ACCOUNT) String caller,
                                                           @Valid @RequestBody AccountRequest req) {
        accessControl.addProvider(caller, req.getAccount());
        return ok("providers", accessControl.providers());
    }

    @DeleteMapping("/admin/providers/{account}")
    public ResponseEntity<Map<String, Object>> removeProvider(@RequestHeader(ApiHeaders.ACCOUNT) String caller,
                                                              @PathVariable String account) {
        accessControl.removeProvider(caller, account);
        return ok("providers", accessControl.providers());
    }

    @PutMapping("/admin/cooldown")
    public ResponseEntity<Map<String, Object>> setCooldown(@RequestHeader(ApiHeaders.ACCOUNT) String caller,
                                                           @Valid @RequestBody CooldownRequest req) {
        cooldown.setCooldownSeconds(caller, req.getSeconds());
        return ok("cooldownSeconds", cooldown.getCooldownSeconds());
    }

    @PostMapping("/admin/pause")
    public ResponseEntity<Map<String, Object>> pause(@RequestHeader(ApiHeaders.ACCOUNT) String caller) {
        pauseControl.pause(caller);
        return ok("paused", pauseControl.isPaused());
    }

    @PostMapping("/admin/unpause")
    public ResponseEntity<Map<String, Object>> unpause(@RequestHeader(ApiHeaders.ACCOUNT) String caller) {
        pauseControl.unpause(caller);
        return ok("paused", pauseControl.isPaused());
    }

    @PostMapping("/batches/open")
    public ResponseEntity<Map<String, Object>> openBatch(@RequestHeader(ApiHeaders.ACCOUNT) String caller) {
        long batchId = batchLifecycle.openBatch(caller);
        return ok("batchId", batchId);
    }

    @PostMapping("/batches/close")
    public ResponseEntity<Map<String, Object>> closeBatch(@RequestHeader(ApiHeaders.ACCOUNT) String caller) {
        batchLifecycle.closeBatch(caller);
        return ok("batchId", batchLifecycle.currentBatchId());
    }

    private static ResponseEntity<Map<String, Object>> ok(String key, Object value) {
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("status", "SUCCESS");
        response.put(key, value);
        return ResponseEntity.ok(response);
    }
}
