package dao.fhe.stocksim.controller;

import dao.fhe.stocksim.model.DecryptedState;
import dao.fhe.stocksim.model.DecryptionCallbackRequest;
import dao.fhe.stocksim.model.DecryptionContext;
import dao.fhe.stocksim.service.DecryptionRequestManager;
import dao.fhe.stocksim.util.CryptoUtil;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/decryptions")
public class DecryptionController {

    private final DecryptionRequestManager decryptionManager;

    public DecryptionController(DecryptionRequestManager decryptionManager) {
        this.decryptionManager = decryptionManager;
    }

    /**
     * POST /api/decryptions
     * Request decryption of the open batch. 202: the plaintext arrives through the callback.
     */
    @PostMapping
    public ResponseEntity<Map<String, Object>> request(@RequestHeader(ApiHeaders.ACCOUNT) String caller) {
        DecryptionContext context = decryptionManager.requestBatchDecryption(caller);

        Map<String, Object> response = new LinkedHashMap<>();
        response.put("status", "REQUESTED");
        response.put("requestId", context.getRequestId());
        response.put("batchId", context.getBatchId());
        response.put("stateHash", context.getStateHash());
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(response);
    }

    /**
     * POST /api/decryptions/callback
     * Oracle fulfillment. No caller header: the proof is the authentication.
     */
    @PostMapping("/callback")
    public ResponseEntity<Map<String, Object>> callback(@Valid @RequestBody DecryptionCallbackRequest req) {
        DecryptedState state = decryptionManager.fulfill(
                req.getRequestId(),
                CryptoUtil.fromHex(req.getCleartexts()),
                CryptoUtil.fromHex(req.getProof())
        );

        Map<String, Object> response = new LinkedHashMap<>();
        response.put("status", "FULFILLED");
        response.put("requestId", req.getRequestId());
        response.put("stockPrice", state.stockPrice());
        response.put("playerBalance", state.playerBalance());
        response.put("playerStockHolding", state.playerStockHolding());
        response.put("newsImpact", state.newsImpact());
        return ResponseEntity.ok(response);
    }

    @GetMapping("/{requestId}")
    public ResponseEntity<Map<String, Object>> get(@PathVariable long requestId) {
        Map<String, Object> response = new LinkedHashMap<>();
        return decryptionManager.context(requestId)
                .map(c -> {
                    response.put("status", "SUCCESS");
                    response.put("context", c);
                    return ResponseEntity.ok(response);
                })
                .orElseGet(() -> {
                    response.put("status", "NOT_FOUND");
                    response.put("error", "No decryption context for request " + requestId);
                    return ResponseEntity.status(HttpStatus.NOT_FOUND).body(response);
                });
    }

    @GetMapping
    public ResponseEntity<Map<String, Object>> list(@RequestParam(defaultValue = "false") boolean pending) {
        List<DecryptionContext> contexts = pending
                ? decryptionManager.pendingContexts()
                : decryptionManager.contexts();

        Map<String, Object> response = new LinkedHashMap<>();
        response.put("status", "SUCCESS");
        response.put("total", contexts.size());
        response.put("contexts", contexts);
        return ResponseEntity.ok(response);
    }
}
