package dao.fhe.stocksim.oracle;

import dao.fhe.stocksim.config.OracleProperties;
import dao.fhe.stocksim.config.SimulationProperties;
import dao.fhe.stocksim.util.CryptoUtil;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.security.SignatureException;
import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentSkipListMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Oracle adapter for a KMS relayer: request ids come from a local sequence, pending requests
 * are queued for the relayer to pick up, and proofs are threshold ECDSA signatures from the
 * configured KMS signer set (see {@link DecryptionProofs}).
 */
@Slf4j
@Service
public class KmsSignatureOracle implements ConfidentialComputeOracle {

    private final Set<String> signers = new LinkedHashSet<>();
    private final int threshold;
    private final byte[] contractIdentity;
    private final Clock clock;

    private final AtomicLong requestIdSeq;
    // key: requestId
    private final Map<Long, OracleRequest> pending = new ConcurrentSkipListMap<>();

    public KmsSignatureOracle(OracleProperties oracleProps, SimulationProperties simulationProps, Clock clock) {
        this.clock = clock;
        this.requestIdSeq = new AtomicLong(oracleProps.getFirstRequestId());
        this.contractIdentity = CryptoUtil.fromHexExact(simulationProps.getContractIdentity().trim(), CryptoUtil.ADDRESS_SIZE);

        if (oracleProps.getSigners() != null) {
            for (String s : oracleProps.getSigners()) {
                if (s == null || s.isBlank()) continue;
                signers.add(CryptoUtil.normalizeAddress(s.trim()));
            }
        }
        if (oracleProps.getThreshold() < 1) {
            throw new IllegalStateException("oracle.threshold must be >= 1");
        }
        this.threshold = oracleProps.getThreshold();

        if (signers.size() < threshold) {
            log.warn("KmsSignatureOracle: {} signer(s) configured for threshold {}. Every proof will be rejected.",
                    signers.size(), threshold);
        }
        log.info("KmsSignatureOracle initialized: signers={}, threshold={}, firstRequestId={}",
                signers.size(), threshold, oracleProps.getFirstRequestId());
    }

    @Override
    public long requestDecryption(List<byte[]> handles, String callbackSelector) {
        long requestId = requestIdSeq.getAndIncrement();
        List<String> hexHandles = new ArrayList<>(handles.size());
        for (byte[] h : handles) {
            hexHandles.add(CryptoUtil.toHex0x(h).toLowerCase(Locale.ROOT));
        }
        pending.put(requestId, new OracleRequest(
                requestId,
                List.copyOf(hexHandles),
                callbackSelector,
                clock.instant().getEpochSecond()
        ));
        log.info("Decryption queued for relayer: requestId={}, callback={}", requestId, callbackSelector);
        return requestId;
    }

    @Override
    public boolean verifyProof(long requestId, List<byte[]> handles, byte[] cleartexts, byte[] proof) {
        byte[] digest = DecryptionProofs.digest(requestId, handles, cleartexts, contractIdentity);
        List<String> recovered;
        try {
            recovered = DecryptionProofs.recoverSigners(digest, proof);
        } catch (SignatureException | RuntimeException e) {
            log.debug("Proof for request {} could not be parsed: {}", requestId, e.getMessage());
            return false;
        }

        Set<String> distinct = new LinkedHashSet<>();
        for (String signer : recovered) {
            if (signers.contains(signer)) {
                distinct.add(signer);
            }
        }
        if (distinct.size() < threshold) {
            log.debug("Proof for request {} has {} known signer(s), need {}", requestId, distinct.size(), threshold);
            return false;
        }
        return true;
    }

    @Override
    public void acknowledge(long requestId) {
        pending.remove(requestId);
    }

    public List<OracleRequest> pendingRequests() {
        return new ArrayList<>(pending.values());
    }
}
