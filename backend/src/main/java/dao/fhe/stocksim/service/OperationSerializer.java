package dao.fhe.stocksim.service;

import org.springframework.stereotype.Component;

import java.util.function.Supplier;

/**
 * Runs every state-changing operation under one monitor so that no two operations interleave
 * their reads and writes. Reentrant: an operation may call another guarded method.
 */
@Component
public class OperationSerializer {

    private final Object lock = new Object();

    public <T> T execute(Supplier<T> operation) {
        synchronized (lock) {
            return operation.get();
        }
    }

    public void run(Runnable operation) {
        synchronized (lock) {
            operation.run();
        }
    }
}
