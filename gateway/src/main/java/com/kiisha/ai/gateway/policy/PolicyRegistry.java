package com.kiisha.ai.gateway.policy;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.kiisha.ai.common.model.AiTask;
import com.kiisha.ai.common.model.Role;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Set;

import static com.kiisha.ai.common.model.Role.ADMIN;
import static com.kiisha.ai.common.model.Role.EDITOR;
import static com.kiisha.ai.common.model.Role.INVESTOR_VIEWER;
import static com.kiisha.ai.common.model.Role.REVIEWER;

/**
 * Lookup table from task to policy. Pure reads: nothing here is ever retried
 * and nothing mutates after construction.
 */
public class PolicyRegistry {

    private static final Logger logger = LoggerFactory.getLogger(PolicyRegistry.class);

    private final Map<AiTask, TaskPolicy> policies;

    public PolicyRegistry(Map<AiTask, TaskPolicy> policies) {
        EnumMap<AiTask, TaskPolicy> copy = new EnumMap<>(AiTask.class);
        for (Map.Entry<AiTask, TaskPolicy> entry : policies.entrySet()) {
            if (entry.getKey() != entry.getValue().getTask()) {
                throw new IllegalArgumentException("Policy for " + entry.getValue().getTask() +
                        " registered under " + entry.getKey());
            }
            copy.put(entry.getKey(), entry.getValue());
        }
        this.policies = Collections.unmodifiableMap(copy);
        logger.info("PolicyRegistry initialized with {} task policies", this.policies.size());
    }

    /**
     * Registry holding the built-in policy table.
     */
    public static PolicyRegistry defaults() {
        return new PolicyRegistry(defaultPolicies());
    }

    /**
     * Loads policies from JSON of the form {@code {"policies": [ {...}, ... ]}}.
     * Tasks the document does not mention keep their built-in policy.
     */
    public static PolicyRegistry fromJson(InputStream in) throws IOException {
        ObjectMapper mapper = new ObjectMapper();
        JsonNode root = mapper.readTree(in);
        if (root == null || !root.path("policies").isArray()) {
            throw new IOException("Policy document must contain a 'policies' array");
        }

        Map<AiTask, TaskPolicy> merged = defaultPolicies();
        for (JsonNode node : root.path("policies")) {
            TaskPolicy policy = mapper.treeToValue(node, TaskPolicy.class);
            merged.put(policy.getTask(), policy);
            logger.debug("Loaded policy override: {}", policy);
        }
        return new PolicyRegistry(merged);
    }

    /**
     * @throws UnknownTaskException if the task has no policy
     */
    public TaskPolicy getPolicy(AiTask task) {
        TaskPolicy policy = task != null ? policies.get(task) : null;
        if (policy == null) {
            throw new UnknownTaskException(String.valueOf(task));
        }
        return policy;
    }

    public boolean hasPolicy(AiTask task) {
        return task != null && policies.containsKey(task);
    }

    public boolean isAllowedForRole(AiTask task, Role role) {
        return getPolicy(task).allows(role);
    }

    public boolean requiresConfirmation(AiTask task) {
        return getPolicy(task).isRequiresConfirmation();
    }

    public boolean requiresApproval(AiTask task) {
        return getPolicy(task).isRequiresApproval();
    }

    public boolean isHighImpactAction(String actionType) {
        return HighImpactAction.fromCode(actionType).isPresent();
    }

    public RolePermissions getRolePermissions(Role role) {
        return RolePermissions.forRole(role);
    }

    /**
     * Permissions for a wire role code; unknown codes get investor_viewer permissions.
     */
    public RolePermissions getRolePermissions(String roleCode) {
        try {
            return RolePermissions.forRole(Role.fromCode(roleCode));
        } catch (IllegalArgumentException e) {
            logger.debug("Unknown role '{}', using investor_viewer permissions", roleCode);
            return RolePermissions.forRole(INVESTOR_VIEWER);
        }
    }

    public Set<AiTask> getTasks() {
        return policies.keySet();
    }

    static Map<AiTask, TaskPolicy> defaultPolicies() {
        Map<AiTask, TaskPolicy> table = new EnumMap<>(AiTask.class);

        put(table, TaskPolicy.builder(AiTask.INTENT_CLASSIFY)
                .allow(ADMIN, EDITOR, REVIEWER, INVESTOR_VIEWER)
                .maxTokensPerCall(500).rateLimit(60, 1000));
        put(table, TaskPolicy.builder(AiTask.DOC_CLASSIFY)
                .allow(ADMIN, EDITOR, REVIEWER)
                .maxTokensPerCall(1000).rateLimit(30, 500));
        // extraction proposes values, it does not commit them
        put(table, TaskPolicy.builder(AiTask.DOC_EXTRACT_FIELDS)
                .allow(ADMIN, EDITOR)
                .maxTokensPerCall(4000).rateLimit(20, 200));
        put(table, TaskPolicy.builder(AiTask.DOC_SUMMARIZE)
                .allow(ADMIN, EDITOR, REVIEWER, INVESTOR_VIEWER)
                .maxTokensPerCall(2000).rateLimit(30, 300));
        put(table, TaskPolicy.builder(AiTask.DOC_COMPARE_VERSIONS)
                .allow(ADMIN, EDITOR, REVIEWER)
                .maxTokensPerCall(3000).rateLimit(20, 200));
        put(table, TaskPolicy.builder(AiTask.LINK_SUGGEST_PRIMARY)
                .allow(ADMIN, EDITOR)
                .requiresConfirmation(true)
                .maxTokensPerCall(1000).rateLimit(30, 300));
        put(table, TaskPolicy.builder(AiTask.LINK_SUGGEST_SECONDARY)
                .allow(ADMIN, EDITOR)
                .requiresConfirmation(true)
                .maxTokensPerCall(1000).rateLimit(30, 300));
        put(table, TaskPolicy.builder(AiTask.RFI_DRAFT_RESPONSE)
                .allow(ADMIN, EDITOR, REVIEWER)
                .requiresConfirmation(true)
                .maxTokensPerCall(3000).rateLimit(20, 200));
        put(table, TaskPolicy.builder(AiTask.REQUEST_TEMPLATE_ASSIST)
                .allow(ADMIN)
                .requiresConfirmation(true)
                .maxTokensPerCall(2000).rateLimit(10, 100));
        put(table, TaskPolicy.builder(AiTask.QUALITY_SCORE)
                .allow(ADMIN, EDITOR, REVIEWER)
                .maxTokensPerCall(1500).rateLimit(30, 300));
        put(table, TaskPolicy.builder(AiTask.VALIDATE_CONSISTENCY)
                .allow(ADMIN, EDITOR, REVIEWER)
                .maxTokensPerCall(3000).rateLimit(20, 200));
        put(table, TaskPolicy.builder(AiTask.CHAT_RESPONSE)
                .allow(ADMIN, EDITOR, REVIEWER, INVESTOR_VIEWER)
                .maxTokensPerCall(4000).rateLimit(30, 500));
        put(table, TaskPolicy.builder(AiTask.OCR_EXTRACT)
                .allow(ADMIN, EDITOR)
                .maxTokensPerCall(8000).rateLimit(10, 100));
        put(table, TaskPolicy.builder(AiTask.GEO_PARSE)
                .allow(ADMIN, EDITOR)
                .maxTokensPerCall(2000).rateLimit(20, 200));

        return table;
    }

    private static void put(Map<AiTask, TaskPolicy> table, TaskPolicy.Builder builder) {
        TaskPolicy policy = builder.build();
        table.put(policy.getTask(), policy);
    }
}
