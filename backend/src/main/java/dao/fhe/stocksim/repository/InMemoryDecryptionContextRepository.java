package dao.fhe.stocksim.repository;

import dao.fhe.stocksim.model.DecryptionContext;
import org.springframework.stereotype.Repository;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentSkipListMap;
import java.util.stream.Collectors;

@Repository
public class InMemoryDecryptionContextRepository implements DecryptionContextRepository {

    // key: requestId
    private final Map<Long, DecryptionContext> contextsByRequestId = new ConcurrentSkipListMap<>();

    @Override
    public synchronized boolean insert(DecryptionContext context) {
        if (contextsByRequestId.containsKey(context.getRequestId())) {
            return false;
        }
        contextsByRequestId.put(context.getRequestId(), copy(context));
        return true;
    }

    @Override
    public synchronized void update(DecryptionContext context) {
        if (!contextsByRequestId.containsKey(context.getRequestId())) {
            throw new IllegalStateException("No context for request " + context.getRequestId());
        }
        contextsByRequestId.put(context.getRequestId(), copy(context));
    }

    @Override
    public Optional<DecryptionContext> findByRequestId(long requestId) {
        DecryptionContext stored = contextsByRequestId.get(requestId);
        return stored == null ? Optional.empty() : Optional.of(copy(stored));
    }

    @Override
    public List<DecryptionContext> findAll() {
        return contextsByRequestId.values().stream()
                .map(InMemoryDecryptionContextRepository::copy)
                .collect(Collectors.toCollection(ArrayList::new));
    }

    @Override
    public List<DecryptionContext> findPending() {
        return contextsByRequestId.values().stream()
                .filter(c -> !c.isProcessed())
                .map(InMemoryDecryptionContextRepository::copy)
                .collect(Collectors.toCollection(ArrayList::new));
    }

    private static DecryptionContext copy(DecryptionContext c) {
        DecryptionContext out = new DecryptionContext();
        out.setRequestId(c.getRequestId());
        out.setBatchId(c.getBatchId());
        out.setStateHash(c.getStateHash());
        out.setProcessed(c.isProcessed());
        out.setRequestedBy(c.getRequestedBy());
        out.setRequestedAt(c.getRequestedAt());
        out.setFulfilledAt(c.getFulfilledAt());
        return out;
    }
}
