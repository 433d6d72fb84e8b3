package dao.fhe.stocksim.repository;

import dao.fhe.stocksim.model.DecryptionContext;

import java.util.List;
import java.util.Optional;

public interface DecryptionContextRepository {

    /**
     * Store a new context. Returns false, storing nothing, if the request id is taken.
     */
    boolean insert(DecryptionContext context);

    void update(DecryptionContext context);

    Optional<DecryptionContext> findByRequestId(long requestId);

    List<DecryptionContext> findAll();

    List<DecryptionContext> findPending();
}
