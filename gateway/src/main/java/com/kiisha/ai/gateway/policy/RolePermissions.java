package com.kiisha.ai.gateway.policy;

import com.kiisha.ai.common.model.Role;

import java.util.Collections;
import java.util.List;

/**
 * What a role may do with platform tools, and which data clusters are hidden from it.
 */
public final class RolePermissions {

    private static final RolePermissions ADMIN = new RolePermissions(
            true, true, true, true, true, true, List.of());
    private static final RolePermissions EDITOR = new RolePermissions(
            true, true, false, false, false, true, List.of());
    private static final RolePermissions REVIEWER = new RolePermissions(
            true, false, false, false, true, true, List.of());
    private static final RolePermissions INVESTOR_VIEWER = new RolePermissions(
            true, false, false, false, false, false, List.of("financial", "compliance"));

    private final boolean canRead;
    private final boolean canWrite;
    private final boolean canDelete;
    private final boolean canShare;
    private final boolean canVerify;
    private final boolean canSeeInternal;
    private final List<String> restrictedClusters;

    private RolePermissions(boolean canRead, boolean canWrite, boolean canDelete, boolean canShare,
                            boolean canVerify, boolean canSeeInternal, List<String> restrictedClusters) {
        this.canRead = canRead;
        this.canWrite = canWrite;
        this.canDelete = canDelete;
        this.canShare = canShare;
        this.canVerify = canVerify;
        this.canSeeInternal = canSeeInternal;
        this.restrictedClusters = Collections.unmodifiableList(restrictedClusters);
    }

    /**
     * Permissions for a role; a null role gets the most restricted set.
     */
    public static RolePermissions forRole(Role role) {
        if (role == null) {
            return INVESTOR_VIEWER;
        }
        switch (role) {
            case ADMIN:
                return ADMIN;
            case EDITOR:
                return EDITOR;
            case REVIEWER:
                return REVIEWER;
            default:
                return INVESTOR_VIEWER;
        }
    }

    public boolean canRead() {
        return canRead;
    }

    public boolean canWrite() {
        return canWrite;
    }

    public boolean canDelete() {
        return canDelete;
    }

    public boolean canShare() {
        return canShare;
    }

    public boolean canVerify() {
        return canVerify;
    }

    public boolean canSeeInternal() {
        return canSeeInternal;
    }

    public List<String> getRestrictedClusters() {
        return restrictedClusters;
    }

    public boolean isClusterRestricted(String cluster) {
        return restrictedClusters.contains(cluster);
    }
}
