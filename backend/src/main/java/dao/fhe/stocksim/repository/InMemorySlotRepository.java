package dao.fhe.stocksim.repository;

import dao.fhe.stocksim.model.EncryptedSlotSet;
import org.springframework.stereotype.Repository;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentSkipListMap;

@Repository
public class InMemorySlotRepository implements SlotRepository {

    // key: batchId
    private final Map<Long, EncryptedSlotSet> slotsByBatchId = new ConcurrentSkipListMap<>();

    @Override
    public void save(EncryptedSlotSet slots) {
        slotsByBatchId.put(slots.getBatchId(), slots.copy());
    }

    @Override
    public Optional<EncryptedSlotSet> findByBatchId(long batchId) {
        EncryptedSlotSet stored = slotsByBatchId.get(batchId);
        return stored == null ? Optional.empty() : Optional.of(stored.copy());
    }

    @Override
    public List<Long> findAllBatchIds() {
        return new ArrayList<>(slotsByBatchId.keySet());
    }
}
