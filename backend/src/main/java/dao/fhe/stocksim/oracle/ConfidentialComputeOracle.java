package dao.fhe.stocksim.oracle;

import java.util.List;

/**
 * Boundary to the external confidential-compute service that decrypts handles off the
 * serialized path and later calls back with cleartexts and a proof.
 */
public interface ConfidentialComputeOracle {

    /**
     * Queue a decryption of {@code handles} (32-byte words, fixed slot order).
     *
     * @return a request id never issued before
     */
    long requestDecryption(List<byte[]> handles, String callbackSelector);

    /**
     * Check that {@code proof} attests {@code cleartexts} as the decryption of {@code handles}
     * for {@code requestId}. Malformed proofs are reported as invalid, not thrown.
     */
    boolean verifyProof(long requestId, List<byte[]> handles, byte[] cleartexts, byte[] proof);

    /**
     * Called once a fulfillment for {@code requestId} was accepted.
     */
    default void acknowledge(long requestId) {
    }
}
