package com.kiisha.ai.gateway.auth;

import com.kiisha.ai.common.model.Role;

import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Table-backed capability check for embedding and tests. Roles are keyed by org and user.
 */
public final class StaticCapabilityCheck implements CapabilityCheck {

    private final Set<String> superusers;
    private final Map<String, Role> roles;

    private StaticCapabilityCheck(Builder builder) {
        this.superusers = Collections.unmodifiableSet(new HashSet<>(builder.superusers));
        this.roles = Collections.unmodifiableMap(new HashMap<>(builder.roles));
    }

    /**
     * A check that knows no roles and no superusers.
     */
    public static StaticCapabilityCheck empty() {
        return builder().build();
    }

    @Override
    public boolean isSuperuser(String userId) {
        return userId != null && superusers.contains(userId);
    }

    @Override
    public Optional<Role> resolveRole(String userId, String orgId) {
        return Optional.ofNullable(roles.get(key(orgId, userId)));
    }

    private static String key(String orgId, String userId) {
        return orgId + "/" + userId;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private final Set<String> superusers = new HashSet<>();
        private final Map<String, Role> roles = new HashMap<>();

        public Builder superuser(String userId) {
            superusers.add(userId);
            return this;
        }

        public Builder role(String orgId, String userId, Role role) {
            roles.put(key(orgId, userId), role);
            return this;
        }

        public StaticCapabilityCheck build() {
            return new StaticCapabilityCheck(this);
        }
    }
}
