package dao.fhe.stocksim.service;

import dao.fhe.stocksim.config.SimulationProperties;
import dao.fhe.stocksim.event.EventSink;
import dao.fhe.stocksim.event.SimulationEvent;
import dao.fhe.stocksim.exception.ErrorKind;
import dao.fhe.stocksim.exception.SimulationException;
import dao.fhe.stocksim.util.CryptoUtil;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Owner and news-provider roles.
 */
@Slf4j
@Service
public class AccessControlService {

    private final EventSink events;
    private final OperationSerializer serializer;

    private String owner;
    private final Set<String> providers = new LinkedHashSet<>();

    public AccessControlService(SimulationProperties props, EventSink events, OperationSerializer serializer) {
        this.events = events;
        this.serializer = serializer;

        if (props.getOwner() == null || props.getOwner().isBlank()) {
            throw new IllegalStateException("simulation.owner must be configured");
        }
        this.owner = normalizeAccount(props.getOwner());
        if (props.getProviders() != null) {
            for (String p : props.getProviders()) {
                if (p == null || p.isBlank()) continue;
                providers.add(normalizeAccount(p.trim()));
            }
        }

        log.info("AccessControlService initialized: owner={}, providers={}", owner, providers.size());
    }

    public void transferOwnership(String caller, String newOwner) {
        serializer.run(() -> {
            requireOwner(caller);
            String next = normalizeAccount(newOwner);
            String previous;
            synchronized (this) {
                previous = owner;
                owner = next;
            }
            log.info("Ownership transferred: {} -> {}", previous, next);
            events.emit(new SimulationEvent.OwnershipTransferred(previous, next));
        });
    }

    public void addProvider(String caller, String account) {
        serializer.run(() -> {
            requireOwner(caller);
            String target = normalizeAccount(account);
            boolean added;
            synchronized (this) {
                added = providers.add(target);
            }
            if (added) {
                events.emit(new SimulationEvent.ProviderAdded(target));
            }
        });
    }

    public void removeProvider(String caller, String account) {
        serializer.run(() -> {
            requireOwner(caller);
            String target = normalizeAccount(account);
            boolean removed;
            synchronized (this) {
                removed = providers.remove(target);
            }
            if (removed) {
                events.emit(new SimulationEvent.ProviderRemoved(target));
            }
        });
    }

    public void requireOwner(String caller) {
        if (!isOwner(caller)) {
            log.debug("Owner-only operation rejected for {}", caller);
            throw new SimulationException(ErrorKind.PERMISSION_DENIED, "Caller is not the owner");
        }
    }

    public void requireProvider(String caller) {
        if (!isProvider(caller)) {
            log.debug("Provider-only operation rejected for {}", caller);
            throw new SimulationException(ErrorKind.PERMISSION_DENIED, "Caller is not a provider");
        }
    }

    public synchronized String owner() {
        return owner;
    }

    public synchronized boolean isOwner(String account) {
        return owner.equals(normalizeAccount(account));
    }

    public synchronized boolean isProvider(String account) {
        return providers.contains(normalizeAccount(account));
    }

    public synchronized List<String> providers() {
        return List.copyOf(providers);
    }

    /**
     * Canonical account id. Malformed input is a validation failure, never a silent mismatch.
     */
    public static String normalizeAccount(String account) {
        try {
            return CryptoUtil.normalizeAddress(account == null ? null : account.trim());
        } catch (IllegalArgumentException e) {
            throw new SimulationException(ErrorKind.INVALID_ARGUMENT, "Malformed account: " + account, e);
        }
    }
}
