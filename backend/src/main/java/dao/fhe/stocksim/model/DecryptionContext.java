package dao.fhe.stocksim.model;

import lombok.Data;

@Data
public class DecryptionContext {

    private long requestId;
    private long batchId;
    /** keccak256 over the four handles and the contract identity, 0x-prefixed. */
    private String stateHash;
    private boolean processed;
    private String requestedBy;
    private long requestedAt; // unix seconds
    private long fulfilledAt; // unix seconds, 0 while pending
}
