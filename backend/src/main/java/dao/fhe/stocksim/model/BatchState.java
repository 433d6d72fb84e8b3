package dao.fhe.stocksim.model;

import lombok.Data;

@Data
public class BatchState {

    /** 0 until the first batch is opened. */
    private long currentBatchId;
    private boolean open;
    private long openedAt; // unix seconds
}
