package com.kiisha.ai.gateway.auth;

import com.kiisha.ai.common.model.Role;

import java.util.Optional;

/**
 * The single place the gateway asks who a caller is. Implemented by the host
 * application's user layer; consulted once per call.
 */
public interface CapabilityCheck {

    /**
     * Whether the user may administer routing and budgets and override routes.
     */
    boolean isSuperuser(String userId);

    /**
     * The user's role in the organization, when the host knows it.
     */
    Optional<Role> resolveRole(String userId, String orgId);
}
