package dao.fhe.stocksim.controller;

import dao.fhe.stocksim.oracle.KmsSignatureOracle;
import dao.fhe.stocksim.oracle.OracleRequest;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Work queue for the KMS relayer: decryptions requested but not yet fulfilled.
 */
@RestController
@RequestMapping("/api/oracle")
public class OracleController {

    private final KmsSignatureOracle oracle;

    public OracleController(KmsSignatureOracle oracle) {
        this.oracle = oracle;
    }

    @GetMapping("/requests")
    public ResponseEntity<Map<String, Object>> pendingRequests() {
        List<OracleRequest> requests = oracle.pendingRequests();
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("status", "SUCCESS");
        response.put("total", requests.size());
        response.put("requests", requests);
        return ResponseEntity.ok(response);
    }
}
