package com.kiisha.ai.gateway.confirmation;

import com.kiisha.ai.common.AiGatewayConstants;
import com.kiisha.ai.common.model.Channel;
import com.kiisha.ai.gateway.policy.HighImpactAction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

/**
 * Holds high-impact actions until their owner confirms or declines them.
 *
 * <p>Every transition goes through {@link ConfirmationStore#replace}, so two concurrent
 * resolutions of the same record cannot both succeed. Ownership is checked before any
 * state change; a non-owner never mutates a record.</p>
 */
public class ConfirmationGate {

    private static final Logger logger = LoggerFactory.getLogger(ConfirmationGate.class);

    static final String APPROVAL_PREFIX = "[Requires approval] ";

    private final ConfirmationStore store;
    private final Clock clock;
    private final Duration defaultExpiry;

    public ConfirmationGate(ConfirmationStore store) {
        this(store, Clock.systemUTC(), Duration.ofMinutes(AiGatewayConstants.DEFAULT_CONFIRMATION_EXPIRY_MINUTES));
    }

    public ConfirmationGate(ConfirmationStore store, Clock clock, Duration defaultExpiry) {
        this.store = Objects.requireNonNull(store, "store");
        this.clock = clock;
        this.defaultExpiry = defaultExpiry;
        logger.debug("ConfirmationGate initialized (default expiry {})", defaultExpiry);
    }

    /**
     * Stores a new pending confirmation and returns the message to show its owner.
     */
    public ConfirmationResult create(ConfirmationRequest request) {
        Instant now = clock.instant();
        Duration expiry = request.getExpiresInMinutes() != null
                ? Duration.ofMinutes(request.getExpiresInMinutes())
                : defaultExpiry;

        PendingConfirmation confirmation = PendingConfirmation.builder()
                .id(UUID.randomUUID().toString())
                .userId(request.getUserId())
                .orgId(request.getOrgId())
                .channel(request.getChannel())
                .correlationId(request.getCorrelationId())
                .actionType(request.getActionType())
                .actionDescription(request.getActionDescription())
                .payload(request.getPayload())
                .status(ConfirmationStatus.PENDING)
                .createdAt(now)
                .expiresAt(now.plus(expiry))
                .build();
        store.insert(confirmation);

        logger.info("Confirmation {} created for user {}: {} (expires {})",
                confirmation.getId(), confirmation.getUserId(), confirmation.getActionType(),
                confirmation.getExpiresAt());

        return new ConfirmationResult(confirmation.getId(), ConfirmationStatus.PENDING,
                "Action requires confirmation. Reply with confirmation ID " +
                        confirmation.getId().substring(0, 8) + " to proceed.");
    }

    /**
     * Confirms a pending action and hands back its payload for execution.
     *
     * @throws ConfirmationException if the record is missing, owned by someone else,
     *                               already resolved, or expired
     */
    public Map<String, Object> confirm(String confirmationId, String userId) throws ConfirmationException {
        PendingConfirmation resolved = resolve(confirmationId, userId, ConfirmationStatus.CONFIRMED);
        return resolved.getPayload();
    }

    /**
     * @throws ConfirmationException for the same reasons as {@link #confirm}
     */
    public void decline(String confirmationId, String userId) throws ConfirmationException {
        resolve(confirmationId, userId, ConfirmationStatus.DECLINED);
    }

    private PendingConfirmation resolve(String confirmationId, String userId, ConfirmationStatus target)
            throws ConfirmationException {
        PendingConfirmation current = store.find(confirmationId)
                .orElseThrow(() -> ConfirmationException.notFound(confirmationId));

        if (!current.getUserId().equals(userId)) {
            logger.warn("User {} tried to resolve confirmation {} owned by {}",
                    userId, confirmationId, current.getUserId());
            throw ConfirmationException.wrongOwner(confirmationId);
        }
        if (current.getStatus().isTerminal()) {
            throw ConfirmationException.alreadyResolved(confirmationId, current.getStatus());
        }

        Instant now = clock.instant();
        if (current.isExpiredAt(now)) {
            store.replace(current, current.toBuilder().status(ConfirmationStatus.EXPIRED).build());
            logger.info("Confirmation {} expired at {}", confirmationId, current.getExpiresAt());
            throw ConfirmationException.expired(confirmationId);
        }

        PendingConfirmation updated = current.resolve(target, now, userId);
        if (!store.replace(current, updated)) {
            ConfirmationStatus winner = store.find(confirmationId)
                    .map(PendingConfirmation::getStatus)
                    .orElse(target);
            throw ConfirmationException.alreadyResolved(confirmationId, winner);
        }

        logger.info("Confirmation {} {} by {}", confirmationId, target, userId);
        return updated;
    }

    /**
     * Marks every pending record past its expiry as expired.
     *
     * @return number of records transitioned by this call
     */
    public int sweepExpired() {
        Instant now = clock.instant();
        int expired = 0;
        for (PendingConfirmation confirmation : store.findPending()) {
            if (confirmation.isPending() && confirmation.isExpiredAt(now)
                    && store.replace(confirmation, confirmation.toBuilder().status(ConfirmationStatus.EXPIRED).build())) {
                expired++;
            }
        }
        if (expired > 0) {
            logger.info("Expired {} pending confirmations", expired);
        }
        return expired;
    }

    public List<PendingConfirmation> getPending(String userId) {
        return getPending(userId, null);
    }

    /**
     * Live pending confirmations for a user, newest first, optionally limited to a channel.
     */
    public List<PendingConfirmation> getPending(String userId, Channel channel) {
        Instant now = clock.instant();
        return store.findByUser(userId).stream()
                .filter(PendingConfirmation::isPending)
                .filter(c -> !c.isExpiredAt(now))
                .filter(c -> channel == null || c.getChannel() == channel)
                .sorted(Comparator.comparing(PendingConfirmation::getCreatedAt).reversed())
                .toList();
    }

    /**
     * Creates a confirmation flagged as needing approval. The chain is recorded in the log;
     * the record itself is a single confirmation resolved by its owner.
     */
    public ConfirmationResult createApprovalRequest(ConfirmationRequest request, ApprovalChain approvalChain) {
        Objects.requireNonNull(approvalChain, "approvalChain");
        logger.info("Approval requested for {} by user {} ({})",
                request.getActionType(), request.getUserId(), approvalChain);
        // TODO: one approval record per approver once multi-party approval lands
        return create(request.toBuilder()
                .actionDescription(APPROVAL_PREFIX + request.getActionDescription())
                .build());
    }

    public boolean requiresConfirmation(String actionType) {
        return HighImpactAction.fromCode(actionType).isPresent();
    }

    public String getConfirmationMessage(String actionType) {
        return HighImpactAction.messageFor(actionType);
    }
}
