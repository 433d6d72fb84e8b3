package dao.fhe.stocksim.controller;

import dao.fhe.stocksim.model.SubmitNewsRequest;
import dao.fhe.stocksim.model.SubmitTradeRequest;
import dao.fhe.stocksim.service.EncryptedStateStore;
import jakarta.validation.Valid;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.LinkedHashMap;
import java.util.Map;

@RestController
@RequestMapping("/api/submissions")
public class SubmissionController {

    private final EncryptedStateStore stateStore;

    public SubmissionController(EncryptedStateStore stateStore) {
        this.stateStore = stateStore;
    }

    @PostMapping("/news")
    public ResponseEntity<Map<String, Object>> submitNews(@RequestHeader(ApiHeaders.ACCOUNT) String caller,
                                                          @Valid @RequestBody SubmitNewsRequest req) {
        long batchId = stateStore.submitNews(caller, req.getHandle());
        return accepted(batchId);
    }

    @PostMapping("/trades")
    public ResponseEntity<Map<String, Object>> submitTrade(@RequestHeader(ApiHeaders.ACCOUNT) String caller,
                                                           @Valid @RequestBody SubmitTradeRequest req) {
        long batchId = stateStore.submitTrade(caller, req.getBalanceHandle(), req.getHoldingHandle());
        return accepted(batchId);
    }

    private static ResponseEntity<Map<String, Object>> accepted(long batchId) {
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("status", "SUCCESS");
        response.put("batchId", batchId);
        return ResponseEntity.ok(response);
    }
}
