package com.kiisha.ai.gateway;

import com.kiisha.ai.common.AiGatewayConstants;
import com.kiisha.ai.common.model.AiTask;
import com.kiisha.ai.common.model.Role;
import com.kiisha.ai.gateway.audit.CorrelationContext;
import com.kiisha.ai.gateway.auth.CapabilityCheck;
import com.kiisha.ai.gateway.budget.BudgetLedger;
import com.kiisha.ai.gateway.budget.OrgBudgetStatus;
import com.kiisha.ai.gateway.policy.DomainPrompt;
import com.kiisha.ai.gateway.policy.PolicyRegistry;
import com.kiisha.ai.gateway.policy.TaskPolicy;
import com.kiisha.ai.gateway.providers.AiMessage;
import com.kiisha.ai.gateway.providers.AiProvider;
import com.kiisha.ai.gateway.providers.CompletionRequest;
import com.kiisha.ai.gateway.providers.CompletionResponse;
import com.kiisha.ai.gateway.providers.ProviderException;
import com.kiisha.ai.gateway.providers.ProviderId;
import com.kiisha.ai.gateway.providers.ProviderRegistry;
import com.kiisha.ai.gateway.providers.TokenUsage;
import com.kiisha.ai.gateway.ratelimit.RateLimitResult;
import com.kiisha.ai.gateway.ratelimit.TaskRateLimiter;
import com.kiisha.ai.gateway.routing.NoProviderAvailableException;
import com.kiisha.ai.gateway.routing.Router;
import com.kiisha.ai.gateway.routing.SelectedRoute;
import com.kiisha.ai.gateway.telemetry.PromptHasher;
import com.kiisha.ai.gateway.telemetry.TelemetryEvent;
import com.kiisha.ai.gateway.telemetry.TelemetryRecorder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Single entry point for every model call.
 *
 * <p>A call is checked against the policy registry, the caller's role, the task rate
 * limit and the organization budget before any provider is contacted. It then runs on
 * the routed provider with fallback and exponential backoff. Audit, usage and budget
 * writes run concurrently on the side-effect executor once the outcome is known, off the
 * response path and bounded by a timeout; their failures are logged and never reach the caller.</p>
 *
 * <p>{@link #runTask} never throws. Every outcome is a {@link GatewayResponse}.</p>
 */
public class AiGateway {

    private static final Logger logger = LoggerFactory.getLogger(AiGateway.class);

    static final String EVENT_COMPLETED = "TASK_COMPLETED";
    static final String EVENT_FAILED = "TASK_FAILED";
    static final String EVENT_REJECTED = "TASK_REJECTED";
    static final String EVENT_CANCELLED = "TASK_CANCELLED";

    static final String BUDGET_EXHAUSTED_MESSAGE = "AI budget exhausted. Please contact your administrator.";

    private final PolicyRegistry policies;
    private final ProviderRegistry providers;
    private final Router router;
    private final BudgetLedger budgetLedger;
    private final TelemetryRecorder telemetry;
    private final TaskRateLimiter rateLimiter;
    private final CapabilityCheck capabilityCheck;
    private final Executor sideEffectExecutor;
    private final Clock clock;
    private final Duration sideEffectTimeout;

    private AiGateway(Builder builder) {
        this.policies = Objects.requireNonNull(builder.policies, "policies");
        this.providers = Objects.requireNonNull(builder.providers, "providers");
        this.router = Objects.requireNonNull(builder.router, "router");
        this.budgetLedger = Objects.requireNonNull(builder.budgetLedger, "budgetLedger");
        this.telemetry = Objects.requireNonNull(builder.telemetry, "telemetry");
        this.capabilityCheck = Objects.requireNonNull(builder.capabilityCheck, "capabilityCheck");
        this.sideEffectExecutor = Objects.requireNonNull(builder.sideEffectExecutor, "sideEffectExecutor");
        this.clock = builder.clock != null ? builder.clock : Clock.systemUTC();
        this.rateLimiter = builder.rateLimiter != null ? builder.rateLimiter : new TaskRateLimiter(clock);
        this.sideEffectTimeout = builder.sideEffectTimeout != null ?
                builder.sideEffectTimeout : Duration.ofMillis(AiGatewayConstants.DEFAULT_SIDE_EFFECT_TIMEOUT_MS);
        logger.info("{} {} ready", AiGatewayConstants.GATEWAY_NAME, AiGatewayConstants.GATEWAY_VERSION);
    }

    /**
     * Runs one task end to end.
     */
    public GatewayResponse runTask(GatewayRequest request) {
        String correlationId = request.getCorrelationId() != null ?
                request.getCorrelationId() : CorrelationContext.newCorrelationId();
        Call call = new Call(request, correlationId, UUID.randomUUID().toString(), clock.millis());

        try (CorrelationContext.Scope ignored = CorrelationContext.bind(correlationId)) {
            logger.debug("Running {}", request);

            GatewayResponse response;
            try {
                response = execute(call);
            } catch (RuntimeException e) {
                logger.error("Unexpected failure running task {}: {}", request.getTaskName(), e.getMessage(), e);
                response = reject(call, GatewayErrorCode.INTERNAL_ERROR, "Internal gateway error: " + e.getMessage());
            }

            telemetry.recordRealtime(response.getLatencyMs(), response.isSuccess());
            return response;
        }
    }

    private GatewayResponse execute(Call call) {
        GatewayRequest request = call.request;

        // 1. Task and policy
        Optional<AiTask> task = AiTask.fromName(request.getTaskName());
        if (task.isEmpty() || !policies.hasPolicy(task.get())) {
            return reject(call, GatewayErrorCode.UNKNOWN_TASK, "Unknown task: " + request.getTaskName());
        }
        call.task = task.get();
        TaskPolicy policy = policies.getPolicy(call.task);

        // 2. Role, consulted once
        Optional<Role> role = request.getRole() != null ?
                Optional.of(request.getRole()) : capabilityCheck.resolveRole(request.getUserId(), request.getOrgId());
        if (role.isPresent() && !policy.allows(role.get())) {
            return reject(call, GatewayErrorCode.ROLE_NOT_PERMITTED,
                    "Role " + role.get().getCode() + " is not permitted to run " + call.task);
        }

        Integer maxTokens = policy.capMaxTokens(request.getMaxTokens());
        if (!Objects.equals(maxTokens, request.getMaxTokens())) {
            logger.debug("maxTokens capped from {} to {} for {}", request.getMaxTokens(), maxTokens, call.task);
        }

        // 3. Budget
        OrgBudgetStatus budget = budgetLedger.checkBudget(request.getOrgId());
        if (budget.isHardLimitReached()) {
            return reject(call, GatewayErrorCode.BUDGET_EXHAUSTED, BUDGET_EXHAUSTED_MESSAGE);
        }
        if (budget.isSoftLimitReached()) {
            logger.info("Org {} past soft budget limit: {}% used", request.getOrgId(),
                    String.format("%.1f", budget.getPercentUsed()));
        }

        // 4. Route
        SelectedRoute route;
        if (request.hasOverride()) {
            if (!capabilityCheck.isSuperuser(request.getUserId())) {
                return reject(call, GatewayErrorCode.OVERRIDE_NOT_PERMITTED,
                        "Provider and model overrides are restricted to superusers");
            }
            try {
                route = overrideRoute(call.task, request);
            } catch (NoProviderAvailableException e) {
                return reject(call, GatewayErrorCode.NO_PROVIDER_AVAILABLE, e.getMessage());
            }
            logger.info("Superuser {} overrode routing for {}: {}", request.getUserId(), call.task, route);
        } else {
            try {
                route = router.selectRoute(call.task);
            } catch (NoProviderAvailableException e) {
                return reject(call, GatewayErrorCode.NO_PROVIDER_AVAILABLE, e.getMessage());
            }
        }

        // 5. Rate limit, counted only once every other pre-flight check has passed
        RateLimitResult rateLimit = rateLimiter.tryAcquire(request.getUserId(), policy);
        if (!rateLimit.isAllowed()) {
            return reject(call, GatewayErrorCode.RATE_LIMITED, rateLimit.getMessage());
        }

        // 6. Domain scoping
        List<AiMessage> messages = DomainPrompt.apply(request.getMessages(), call.task);
        call.promptHash = PromptHasher.hash(messages);

        return executeWithFallback(call, route, messages, maxTokens);
    }

    private SelectedRoute overrideRoute(AiTask task, GatewayRequest request) throws NoProviderAvailableException {
        if (request.getProviderOverride() == null) {
            SelectedRoute routed = router.selectRoute(task);
            return new SelectedRoute(routed.getProvider(), request.getModelOverride(), false);
        }
        ProviderId provider = request.getProviderOverride();
        String model = request.getModelOverride();
        if (model == null) {
            model = providers.getProvider(provider)
                    .map(AiProvider::getAvailableModels)
                    .filter(models -> !models.isEmpty())
                    .map(models -> models.get(0))
                    .orElse("default");
        }
        return new SelectedRoute(provider, model, false);
    }

    private GatewayResponse executeWithFallback(Call call, SelectedRoute initialRoute,
                                                List<AiMessage> messages, Integer maxTokens) {
        GatewayRequest request = call.request;
        CancellationSignal signal = request.getCancellationSignal();
        int maxAttempts = router.getRoutingConfig().getRetryConfig().getMaxAttempts();
        Set<ProviderId> tried = EnumSet.noneOf(ProviderId.class);

        SelectedRoute current = initialRoute;
        Exception lastError = null;

        while (call.attempts < maxAttempts) {
            if (signal.isCancelled()) {
                return cancelled(call);
            }

            call.attempts++;
            call.provider = current.getProvider();
            call.model = current.getModel();
            tried.add(current.getProvider());

            try {
                CompletionResponse completion = attempt(current, request, messages, maxTokens, signal);
                logger.debug("Attempt {} on {} succeeded for {}", call.attempts, current.getProvider(), call.task);
                return completed(call, completion);
            } catch (ProviderException | RuntimeException e) {
                lastError = e;
                logger.warn("Attempt {} failed for {} on {}: {}", call.attempts, call.task,
                        current.getProvider(), e.getMessage());
            }

            if (call.attempts >= maxAttempts) {
                break;
            }
            Optional<SelectedRoute> fallback = router.selectFallback(call.task, current.getProvider(), tried);
            if (fallback.isEmpty()) {
                logger.debug("No fallback left for {} after {}", call.task, tried);
                break;
            }

            try {
                if (signal.await(router.backoffDelay(call.attempts))) {
                    return cancelled(call);
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                logger.warn("Interrupted during backoff for {}", call.task);
                return cancelled(call);
            }

            current = fallback.get();
            logger.info("Falling back to {}/{} for {}", current.getProvider(), current.getModel(), call.task);
        }

        String message = lastError != null ? lastError.getMessage() : "All providers failed";
        return failed(call, GatewayErrorCode.ALL_PROVIDERS_FAILED, message);
    }

    private CompletionResponse attempt(SelectedRoute route, GatewayRequest request, List<AiMessage> messages,
                                       Integer maxTokens, CancellationSignal signal) throws ProviderException {
        Optional<AiProvider> provider = providers.getProvider(route.getProvider());
        if (provider.isEmpty() || !provider.get().isAvailable()) {
            throw new ProviderException(route.getProvider(), "Provider " + route.getProvider() + " not available",
                    0, true);
        }

        CompletionRequest completionRequest = CompletionRequest.builder()
                .messages(messages)
                .tools(request.getTools())
                .toolChoice(request.getToolChoice())
                .responseFormat(request.getResponseFormat())
                .model(route.getModel())
                .maxTokens(maxTokens)
                .temperature(request.getTemperature())
                .timeout(signal.remaining().orElse(null))
                .build();

        return provider.get().complete(completionRequest);
    }

    // ========== Outcomes ==========

    private GatewayResponse completed(Call call, CompletionResponse completion) {
        TokenUsage usage = completion.getUsage();
        String model = completion.getModel() != null ? completion.getModel() : call.model;
        call.model = model;
        long latencyMs = call.elapsed();

        TelemetryEvent event = call.event(EVENT_COMPLETED, latencyMs)
                .inputTokens(usage.getPromptTokens())
                .outputTokens(usage.getCompletionTokens())
                .totalTokens(usage.getTotalTokens())
                .success(true)
                .toolCalls(completion.getToolCalls())
                .outputSummary(completion.getContent())
                .build();
        writeSideEffects(call, event, true);

        return GatewayResponse.builder()
                .success(true)
                .content(completion.getContent())
                .toolCalls(completion.getToolCalls())
                .finishReason(completion.getFinishReason())
                .usage(usage)
                .model(model)
                .provider(call.provider)
                .latencyMs(latencyMs)
                .auditId(call.auditId)
                .correlationId(call.correlationId)
                .build();
    }

    private GatewayResponse failed(Call call, GatewayErrorCode code, String message) {
        long latencyMs = call.elapsed();
        TelemetryEvent event = call.event(EVENT_FAILED, latencyMs)
                .success(false)
                .errorCode(code.name())
                .errorMessage(message)
                .build();
        writeSideEffects(call, event, true);
        return errorResponse(call, code, message, latencyMs);
    }

    private GatewayResponse cancelled(Call call) {
        String message = "Call cancelled after " + call.attempts + " attempt(s)";
        logger.info("{} for {}", message, call.request.getTaskName());
        long latencyMs = call.elapsed();
        TelemetryEvent event = call.event(EVENT_CANCELLED, latencyMs)
                .success(false)
                .errorCode(GatewayErrorCode.CANCELLED.name())
                .errorMessage(message)
                .build();
        writeSideEffects(call, event, call.attempts > 0);
        return errorResponse(call, GatewayErrorCode.CANCELLED, message, latencyMs);
    }

    /**
     * Refusal before any provider was contacted: one terminal audit entry, nothing else.
     */
    private GatewayResponse reject(Call call, GatewayErrorCode code, String message) {
        logger.info("Rejected task {} for user {}: {} ({})", call.request.getTaskName(),
                call.request.getUserId(), code, message);
        long latencyMs = call.elapsed();
        TelemetryEvent event = call.event(EVENT_REJECTED, latencyMs)
                .success(false)
                .errorCode(code.name())
                .errorMessage(message)
                .build();
        telemetry.recordAudit(event);
        return errorResponse(call, code, message, latencyMs);
    }

    private GatewayResponse errorResponse(Call call, GatewayErrorCode code, String message, long latencyMs) {
        return GatewayResponse.builder()
                .success(false)
                .error(code, message)
                .model(call.model)
                .provider(call.provider)
                .latencyMs(latencyMs)
                .auditId(call.auditId)
                .correlationId(call.correlationId)
                .build();
    }

    // ========== Side effects ==========

    /**
     * Writes the audit entry and, when a provider was reached, the usage record and budget
     * consumption. The writes run concurrently on the side-effect executor; the caller does
     * not wait for them. Failures and overruns of the side-effect timeout are logged.
     */
    private void writeSideEffects(Call call, TelemetryEvent event, boolean reachedProvider) {
        List<CompletableFuture<?>> writes = new ArrayList<>(3);
        writes.add(submit(call.correlationId, () -> telemetry.recordAudit(event)));

        if (reachedProvider) {
            writes.add(submit(call.correlationId, () -> telemetry.recordUsage(event)));
            long tokens = event.getTotalTokens();
            if (tokens > 0) {
                String orgId = call.request.getOrgId();
                writes.add(submit(call.correlationId, () -> budgetLedger.consumeBudget(orgId, tokens, call.auditId)));
            }
        }

        CompletableFuture.allOf(writes.toArray(new CompletableFuture<?>[0]))
                .orTimeout(sideEffectTimeout.toMillis(), TimeUnit.MILLISECONDS)
                .whenComplete((ignored, error) -> {
                    if (error == null) {
                        return;
                    }
                    Throwable cause = error instanceof CompletionException && error.getCause() != null ?
                            error.getCause() : error;
                    if (cause instanceof TimeoutException) {
                        logger.warn("Side-effect writes for audit {} did not finish within {}ms", call.auditId,
                                sideEffectTimeout.toMillis());
                    } else {
                        logger.warn("Side-effect write failed for audit {}: {}", call.auditId, cause.getMessage());
                    }
                });
    }

    private CompletableFuture<Void> submit(String correlationId, Runnable write) {
        try {
            return CompletableFuture.runAsync(() -> {
                try (CorrelationContext.Scope ignored = CorrelationContext.bind(correlationId)) {
                    write.run();
                }
            }, sideEffectExecutor);
        } catch (RuntimeException e) {
            // Rejected by a shut-down executor
            return CompletableFuture.failedFuture(e);
        }
    }

    public Router getRouter() {
        return router;
    }

    public TelemetryRecorder getTelemetry() {
        return telemetry;
    }

    // ========== Per-call state ==========

    private final class Call {
        final GatewayRequest request;
        final String correlationId;
        final String auditId;
        final long startMillis;

        AiTask task;
        ProviderId provider;
        String model;
        String promptHash;
        int attempts;

        Call(GatewayRequest request, String correlationId, String auditId, long startMillis) {
            this.request = request;
            this.correlationId = correlationId;
            this.auditId = auditId;
            this.startMillis = startMillis;
        }

        long elapsed() {
            return Math.max(0, clock.millis() - startMillis);
        }

        TelemetryEvent.Builder event(String eventType, long latencyMs) {
            return TelemetryEvent.builder()
                    .auditId(auditId)
                    .eventType(eventType)
                    .task(task)
                    .taskName(request.getTaskName())
                    .userId(request.getUserId())
                    .orgId(request.getOrgId())
                    .channel(request.getChannel())
                    .correlationId(correlationId)
                    .provider(provider)
                    .model(model)
                    .promptHash(promptHash)
                    .latencyMs(latencyMs);
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private PolicyRegistry policies;
        private ProviderRegistry providers;
        private Router router;
        private BudgetLedger budgetLedger;
        private TelemetryRecorder telemetry;
        private TaskRateLimiter rateLimiter;
        private CapabilityCheck capabilityCheck;
        private Executor sideEffectExecutor;
        private Clock clock;
        private Duration sideEffectTimeout;

        public Builder policies(PolicyRegistry policies) {
            this.policies = policies;
            return this;
        }

        public Builder providers(ProviderRegistry providers) {
            this.providers = providers;
            return this;
        }

        public Builder router(Router router) {
            this.router = router;
            return this;
        }

        public Builder budgetLedger(BudgetLedger budgetLedger) {
            this.budgetLedger = budgetLedger;
            return this;
        }

        public Builder telemetry(TelemetryRecorder telemetry) {
            this.telemetry = telemetry;
            return this;
        }

        public Builder rateLimiter(TaskRateLimiter rateLimiter) {
            this.rateLimiter = rateLimiter;
            return this;
        }

        public Builder capabilityCheck(CapabilityCheck capabilityCheck) {
            this.capabilityCheck = capabilityCheck;
            return this;
        }

        public Builder sideEffectExecutor(Executor sideEffectExecutor) {
            this.sideEffectExecutor = sideEffectExecutor;
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        public Builder sideEffectTimeout(Duration sideEffectTimeout) {
            this.sideEffectTimeout = sideEffectTimeout;
            return this;
        }

        public AiGateway build() {
            return new AiGateway(this);
        }
    }
}
