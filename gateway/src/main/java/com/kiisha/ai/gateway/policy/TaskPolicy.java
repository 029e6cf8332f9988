package com.kiisha.ai.gateway.policy;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.kiisha.ai.common.model.AiTask;
import com.kiisha.ai.common.model.Role;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Static policy for one task: who may run it, how large a call may be,
 * how often a caller may run it, and whether a human has to confirm the result.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class TaskPolicy {

    private final AiTask task;
    private final Set<Role> allowedRoles;
    private final boolean requiresConfirmation;
    private final boolean requiresApproval;
    private final Integer maxTokensPerCall;
    private final RateLimit rateLimit;

    @JsonCreator
    public TaskPolicy(
            @JsonProperty("task") AiTask task,
            @JsonProperty("allowedRoles") Set<Role> allowedRoles,
            @JsonProperty("requiresConfirmation") boolean requiresConfirmation,
            @JsonProperty("requiresApproval") boolean requiresApproval,
            @JsonProperty("maxTokensPerCall") Integer maxTokensPerCall,
            @JsonProperty("rateLimit") RateLimit rateLimit) {
        this.task = Objects.requireNonNull(task, "task");
        this.allowedRoles = allowedRoles == null || allowedRoles.isEmpty() ?
                Collections.emptySet() : Collections.unmodifiableSet(EnumSet.copyOf(allowedRoles));
        this.requiresConfirmation = requiresConfirmation;
        this.requiresApproval = requiresApproval;
        if (maxTokensPerCall != null && maxTokensPerCall <= 0) {
            throw new IllegalArgumentException("maxTokensPerCall must be positive for " + task);
        }
        this.maxTokensPerCall = maxTokensPerCall;
        this.rateLimit = rateLimit;
    }

    public AiTask getTask() {
        return task;
    }

    public Set<Role> getAllowedRoles() {
        return allowedRoles;
    }

    public boolean isRequiresConfirmation() {
        return requiresConfirmation;
    }

    public boolean isRequiresApproval() {
        return requiresApproval;
    }

    public Optional<Integer> getMaxTokensPerCall() {
        return Optional.ofNullable(maxTokensPerCall);
    }

    public Optional<RateLimit> getRateLimit() {
        return Optional.ofNullable(rateLimit);
    }

    public boolean allows(Role role) {
        return role != null && allowedRoles.contains(role);
    }

    /**
     * Caps a requested token ceiling at this policy's per-call maximum.
     * A null request takes the policy maximum.
     */
    public Integer capMaxTokens(Integer requested) {
        if (maxTokensPerCall == null) {
            return requested;
        }
        if (requested == null) {
            return maxTokensPerCall;
        }
        return Math.min(requested, maxTokensPerCall);
    }

    @Override
    public String toString() {
        return "TaskPolicy{" +
                "task=" + task +
                ", allowedRoles=" + allowedRoles +
                ", requiresConfirmation=" + requiresConfirmation +
                ", maxTokensPerCall=" + maxTokensPerCall +
                ", rateLimit=" + rateLimit +
                '}';
    }

    public static Builder builder(AiTask task) {
        return new Builder(task);
    }

    /**
     * Per-caller call ceilings for a task.
     */
    public static final class RateLimit {
        private final int perMinute;
        private final int perHour;

        @JsonCreator
        public RateLimit(@JsonProperty("perMinute") int perMinute,
                         @JsonProperty("perHour") int perHour) {
            if (perMinute <= 0 || perHour <= 0) {
                throw new IllegalArgumentException("Rate limits must be positive");
            }
            this.perMinute = perMinute;
            this.perHour = perHour;
        }

        public int getPerMinute() {
            return perMinute;
        }

        public int getPerHour() {
            return perHour;
        }

        @Override
        public String toString() {
            return perMinute + "/min, " + perHour + "/h";
        }
    }

    public static class Builder {
        private final AiTask task;
        private final Set<Role> allowedRoles = EnumSet.noneOf(Role.class);
        private boolean requiresConfirmation;
        private boolean requiresApproval;
        private Integer maxTokensPerCall;
        private RateLimit rateLimit;

        private Builder(AiTask task) {
            this.task = task;
        }

        public Builder allow(Role... roles) {
            Collections.addAll(allowedRoles, roles);
            return this;
        }

        public Builder requiresConfirmation(boolean requiresConfirmation) {
            this.requiresConfirmation = requiresConfirmation;
            return this;
        }

        public Builder requiresApproval(boolean requiresApproval) {
            this.requiresApproval = requiresApproval;
            return this;
        }

        public Builder maxTokensPerCall(Integer maxTokensPerCall) {
            this.maxTokensPerCall = maxTokensPerCall;
            return this;
        }

        public Builder rateLimit(int perMinute, int perHour) {
            this.rateLimit = new RateLimit(perMinute, perHour);
            return this;
        }

        public TaskPolicy build() {
            return new TaskPolicy(task, allowedRoles, requiresConfirmation, requiresApproval,
                    maxTokensPerCall, rateLimit);
        }
    }
}
