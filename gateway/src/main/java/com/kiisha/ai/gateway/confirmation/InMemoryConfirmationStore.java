package com.kiisha.ai.gateway.confirmation;

import java.util.Collection;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

public class InMemoryConfirmationStore implements ConfirmationStore {

    private final Map<String, PendingConfirmation> confirmations = new ConcurrentHashMap<>();

    @Override
    public void insert(PendingConfirmation confirmation) {
        if (confirmations.putIfAbsent(confirmation.getId(), confirmation) != null) {
            throw new IllegalStateException("Confirmation already exists: " + confirmation.getId());
        }
    }

    @Override
    public Optional<PendingConfirmation> find(String id) {
        return id == null ? Optional.empty() : Optional.ofNullable(confirmations.get(id));
    }

    @Override
    public boolean replace(PendingConfirmation current, PendingConfirmation updated) {
        return confirmations.replace(current.getId(), current, updated);
    }

    @Override
    public Collection<PendingConfirmation> findByUser(String userId) {
        return confirmations.values().stream()
                .filter(c -> c.getUserId().equals(userId))
                .toList();
    }

    @Override
    public Collection<PendingConfirmation> findPending() {
        return confirmations.values().stream()
                .filter(PendingConfirmation::isPending)
                .toList();
    }
}
