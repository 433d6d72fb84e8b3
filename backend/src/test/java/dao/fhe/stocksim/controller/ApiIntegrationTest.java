package dao.fhe.stocksim.controller;

import dao.fhe.stocksim.model.CiphertextSlot;
import dao.fhe.stocksim.oracle.DecryptionProofs;
import dao.fhe.stocksim.service.EncryptedStateStore;
import dao.fhe.stocksim.service.StateCommitmentService;
import dao.fhe.stocksim.util.CryptoUtil;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.annotation.DirtiesContext;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.ResultActions;
import org.springframework.test.web.servlet.request.MockHttpServletRequestBuilder;
import org.springframework.test.web.servlet.request.MockMvcRequestBuilders;

import java.util.List;
import java.util.stream.Collectors;

import static dao.fhe.stocksim.SimulationFixture.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@SpringBootTest(properties = {
        "simulation.owner=" + OWNER,
        "simulation.providers=" + PROVIDER,
        "simulation.cooldown-seconds=0",
        "simulation.contract-identity=" + CONTRACT,
        "oracle.signers=0x2c7536e3605d9c16a7a3d7b1898e529396a65c23",
        "oracle.first-request-id=7",
        "scheduler.pending-monitor.enabled=false"
})
@AutoConfigureMockMvc
@DirtiesContext(classMode = DirtiesContext.ClassMode.AFTER_EACH_TEST_METHOD)
class ApiIntegrationTest {

    @Autowired
    private MockMvc mvc;

    @Autowired
    private EncryptedStateStore stateStore;

    @Autowired
    private StateCommitmentService commitment;

    private ResultActions post(String path, String account, String json) throws Exception {
        MockHttpServletRequestBuilder builder = MockMvcRequestBuilders.post(path)
                .contentType(MediaType.APPLICATION_JSON);
        if (account != null) builder.header(ApiHeaders.ACCOUNT, account);
        if (json != null) builder.content(json);
        return mvc.perform(builder);
    }

    private void openBatchWithTrade() throws Exception {
        post("/api/batches/open", OWNER, null).andExpect(status().isOk());
        post("/api/submissions/news", PROVIDER, "{\"handle\":\"" + handle(1) + "\"}").andExpect(status().isOk());
        post("/api/submissions/trades", ALICE,
                "{\"balanceHandle\":\"" + handle(2) + "\",\"holdingHandle\":\"" + handle(3) + "\"}")
                .andExpect(status().isOk());
    }

    private String callbackBody(long requestId, long batchId, byte[] plain) {
        List<byte[]> handles = stateStore.handles(batchId).stream()
                .map(CiphertextSlot::toWord)
                .collect(Collectors.toList());
        byte[] digest = DecryptionProofs.digest(requestId, handles, plain, commitment.getContractIdentity());
        byte[] proof = DecryptionProofs.sign(digest, List.of(KMS_KEY));
        return "{\"requestId\":" + requestId
                + ",\"cleartexts\":\"" + CryptoUtil.toHex0x(plain) + "\""
                + ",\"proof\":\"" + CryptoUtil.toHex0x(proof) + "\"}";
    }

    @Nested
    @DisplayName("decryption flow")
    class Flow {

        @Test
        @DisplayName("request then callback publishes the plaintext")
        void requestAndFulfill() throws Exception {
            openBatchWithTrade();

            post("/api/decryptions", ALICE, null)
                    .andExpect(status().isAccepted())
                    .andExpect(jsonPath("$.status").value("REQUESTED"))
                    .andExpect(jsonPath("$.requestId").value(7))
                    .andExpect(jsonPath("$.batchId").value(1));

            mvc.perform(get("/api/oracle/requests"))
                    .andExpect(status().isOk());

            String body = callbackBody(7, 1, cleartexts(100, 500, 10, 1));
            post("/api/decryptions/callback", null, body)
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.status").value("FULFILLED"))
                    .andExpect(jsonPath("$.stockPrice").value(100))
                    .andExpect(jsonPath("$.playerBalance").value(500))
                    .andExpect(jsonPath("$.playerStockHolding").value(10))
                    .andExpect(jsonPath("$.newsImpact").value(1));

            mvc.perform(get("/api/decryptions/7"))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.context.processed").value(true));

            post("/api/decryptions/callback", null, body)
                    .andExpect(status().isUnprocessableEntity())
                    .andExpect(jsonPath("$.error").value("REPLAY_ATTEMPT"))
                    .andExpect(jsonPath("$.category").value("PROTOCOL_INTEGRITY"));
        }

        @Test
        @DisplayName("trade after the request makes the callback fail with 422 STATE_MISMATCH")
        void stateMismatch() throws Exception {
            openBatchWithTrade();
            post("/api/decryptions", ALICE, null).andExpect(status().isAccepted());
            String staleBody = callbackBody(7, 1, cleartexts(100, 500, 10, 1));

            post("/api/submissions/trades", BOB,
                    "{\"balanceHandle\":\"" + handle(4) + "\",\"holdingHandle\":\"" + handle(5) + "\"}")
                    .andExpect(status().isOk());

            post("/api/decryptions/callback", null, staleBody)
                    .andExpect(status().isUnprocessableEntity())
                    .andExpect(jsonPath("$.error").value("STATE_MISMATCH"));

            mvc.perform(get("/api/decryptions").param("pending", "true"))
                    .andExpect(jsonPath("$.total").value(1));
        }

        @Test
        @DisplayName("unknown request id is 404")
        void unknownRequest() throws Exception {
            post("/api/decryptions/callback", null, "{\"requestId\":99,\"cleartexts\":\"0x00\",\"proof\":\"0x00\"}")
                    .andExpect(status().isNotFound())
                    .andExpect(jsonPath("$.error").value("UNKNOWN_REQUEST"));
            mvc.perform(get("/api/decryptions/99"))
                    .andExpect(status().isNotFound());
        }
    }

    @Nested
    @DisplayName("error mapping")
    class Errors {

        @Test
        @DisplayName("non-owner admin call is 403")
        void forbidden() throws Exception {
            post("/api/batches/open", ALICE, null)
                    .andExpect(status().isForbidden())
                    .andExpect(jsonPath("$.error").value("PERMISSION_DENIED"))
                    .andExpect(jsonPath("$.category").value("AUTHORIZATION"));
        }

        @Test
        @DisplayName("paused system rejects submissions with 409 and reports unavailable")
        void paused() throws Exception {
            post("/api/batches/open", OWNER, null).andExpect(status().isOk());
            post("/api/admin/pause", OWNER, null).andExpect(status().isOk());

            post("/api/submissions/trades", ALICE,
                    "{\"balanceHandle\":\"" + handle(2) + "\",\"holdingHandle\":\"" + handle(3) + "\"}")
                    .andExpect(status().isConflict())
                    .andExpect(jsonPath("$.error").value("SYSTEM_PAUSED"));
            mvc.perform(get("/api/monitor/available"))
                    .andExpect(jsonPath("$.available").value(false));

            post("/api/admin/pause", OWNER, null)
                    .andExpect(status().isConflict())
                    .andExpect(jsonPath("$.error").value("ALREADY_PAUSED"));
        }

        @Test
        @DisplayName("second submission inside the cooldown is 429")
        void cooldown() throws Exception {
            mvc.perform(put("/api/admin/cooldown").header(ApiHeaders.ACCOUNT, OWNER)
                            .contentType(MediaType.APPLICATION_JSON).content("{\"seconds\":3600}"))
                    .andExpect(status().isOk());
            openBatchWithTrade();

            post("/api/submissions/trades", ALICE,
                    "{\"balanceHandle\":\"" + handle(4) + "\",\"holdingHandle\":\"" + handle(5) + "\"}")
                    .andExpect(status().isTooManyRequests())
                    .andExpect(jsonPath("$.error").value("COOLDOWN_ACTIVE"));
        }

        @Test
        @DisplayName("malformed handle and missing account header are 400")
        void validation() throws Exception {
            post("/api/batches/open", OWNER, null).andExpect(status().isOk());

            post("/api/submissions/news", PROVIDER, "{\"handle\":\"0x1234\"}")
                    .andExpect(status().isBadRequest())
                    .andExpect(jsonPath("$.error").value("INVALID_ARGUMENT"));
            post("/api/submissions/news", null, "{\"handle\":\"" + handle(1) + "\"}")
                    .andExpect(status().isBadRequest());
        }

        @Test
        @DisplayName("submission to a closed batch is 409 BATCH_NOT_OPEN")
        void batchNotOpen() throws Exception {
            post("/api/submissions/news", PROVIDER, "{\"handle\":\"" + handle(1) + "\"}")
                    .andExpect(status().isConflict())
                    .andExpect(jsonPath("$.error").value("BATCH_NOT_OPEN"));
        }
    }

    @Test
    @DisplayName("monitor shows unset slots and the commitment")
    void monitorBatch() throws Exception {
        post("/api/batches/open", OWNER, null).andExpect(status().isOk());
        post("/api/submissions/news", PROVIDER, "{\"handle\":\"" + handle(1) + "\"}").andExpect(status().isOk());

        mvc.perform(get("/api/monitor/batches/1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.slots.NEWS_IMPACT").value(handle(1)))
                .andExpect(jsonPath("$.slots.STOCK_PRICE").value("UNSET"))
                .andExpect(jsonPath("$.stateHash").value(commitment.commitHex(stateStore.slots(1))));
        mvc.perform(get("/api/monitor/batches/2"))
                .andExpect(status().isNotFound());
    }
}
