package dao.fhe.stocksim.repository;

import dao.fhe.stocksim.model.EncryptedSlotSet;

import java.util.List;
import java.util.Optional;

public interface SlotRepository {

    void save(EncryptedSlotSet slots);

    Optional<EncryptedSlotSet> findByBatchId(long batchId);

    List<Long> findAllBatchIds();
}
