package com.kiisha.ai.gateway.confirmation;

import java.util.List;
import java.util.Objects;

/**
 * Approvers an organization requires for an action.
 */
public final class ApprovalChain {

    public enum ApprovalType {
        /** Any one approver suffices */
        ANY,
        /** Every approver must approve */
        ALL,
        /** Approvers approve in list order */
        SEQUENTIAL
    }

    private final List<String> requiredApprovers;
    private final ApprovalType approvalType;

    public ApprovalChain(List<String> requiredApprovers, ApprovalType approvalType) {
        this.requiredApprovers = List.copyOf(Objects.requireNonNull(requiredApprovers, "requiredApprovers"));
        this.approvalType = Objects.requireNonNull(approvalType, "approvalType");
    }

    public List<String> getRequiredApprovers() {
        return requiredApprovers;
    }

    public ApprovalType getApprovalType() {
        return approvalType;
    }

    @Override
    public String toString() {
        return "ApprovalChain{" + approvalType + " of " + requiredApprovers + '}';
    }
}
