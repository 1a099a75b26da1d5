package io.rndr.core.ledger;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Resolves a configured address to the ledger deployed there. Ledgers hold
 * addresses, never each other, and look up the capability they need per call.
 */
public final class ContractRegistry {
    private final Map<String, Object> contracts = new ConcurrentHashMap<>();

    public void register(String address, Object contract) {
        Object existing = contracts.putIfAbsent(address, contract);
        if (existing != null && existing != contract) {
            throw new IllegalStateException("Address already in use: " + address);
        }
    }

    public <T> Optional<T> resolve(String address, Class<T> capability) {
        if (address == null) {
            return Optional.empty();
        }
        Object contract = contracts.get(address);
        return capability.isInstance(contract) ? Optional.of(capability.cast(contract)) : Optional.empty();
    }

    public boolean isRegistered(String address) {
        return address != null && contracts.containsKey(address);
    }
}
