package com.kiisha.ai.gateway.confirmation;

import java.util.Collection;
import java.util.Optional;

/**
 * Persistence for confirmation records.
 */
public interface ConfirmationStore {

    void insert(PendingConfirmation confirmation);

    Optional<PendingConfirmation> find(String id);

    /**
     * Replaces {@code current} with {@code updated} only if the stored record is still
     * {@code current}. Returns false when another writer got there first.
     */
    boolean replace(PendingConfirmation current, PendingConfirmation updated);

    Collection<PendingConfirmation> findByUser(String userId);

    /**
     * Records still marked pending, whatever their expiry.
     */
    Collection<PendingConfirmation> findPending();
}
