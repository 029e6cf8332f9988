package com.kiisha.ai.gateway;

import com.kiisha.ai.gateway.admin.GatewayAdmin;
import com.kiisha.ai.gateway.audit.AuditStore;
import com.kiisha.ai.gateway.audit.InMemoryAuditStore;
import com.kiisha.ai.gateway.auth.CapabilityCheck;
import com.kiisha.ai.gateway.budget.BudgetLedger;
import com.kiisha.ai.gateway.budget.BudgetStore;
import com.kiisha.ai.gateway.budget.InMemoryBudgetStore;
import com.kiisha.ai.gateway.config.GatewaySettings;
import com.kiisha.ai.gateway.confirmation.ConfirmationGate;
import com.kiisha.ai.gateway.confirmation.ConfirmationStore;
import com.kiisha.ai.gateway.confirmation.InMemoryConfirmationStore;
import com.kiisha.ai.gateway.policy.PolicyRegistry;
import com.kiisha.ai.gateway.providers.ProviderConfig;
import com.kiisha.ai.gateway.providers.ProviderId;
import com.kiisha.ai.gateway.providers.ProviderRegistry;
import com.kiisha.ai.gateway.ratelimit.TaskRateLimiter;
import com.kiisha.ai.gateway.routing.GlobalRoutingConfig;
import com.kiisha.ai.gateway.routing.Router;
import com.kiisha.ai.gateway.routing.RoutingConfigLoader;
import com.kiisha.ai.gateway.telemetry.CostTable;
import com.kiisha.ai.gateway.telemetry.TelemetryRecorder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.Locale;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;

/**
 * Central context for the AI gateway.
 * Builds every subsystem, owns the worker threads and provides lifecycle management.
 */
public class AiGatewayContext {

    private static final Logger logger = LoggerFactory.getLogger(AiGatewayContext.class);

    private static final long MAINTENANCE_INTERVAL_MINUTES = 10;

    private final GatewaySettings settings;
    private final PolicyRegistry policyRegistry;
    private final ProviderRegistry providerRegistry;
    private final Router router;
    private final BudgetLedger budgetLedger;
    private final ConfirmationGate confirmationGate;
    private final TelemetryRecorder telemetryRecorder;
    private final TaskRateLimiter rateLimiter;
    private final ExecutorService executorService;
    private final ScheduledExecutorService maintenanceScheduler;
    private final AiGateway gateway;
    private final GatewayTasks gatewayTasks;
    private final GatewayAdmin gatewayAdmin;

    private volatile boolean running = false;

    public AiGatewayContext(GatewaySettings settings, CapabilityCheck capabilityCheck) {
        this(settings, capabilityCheck, System::getenv, new InMemoryBudgetStore(),
                new InMemoryConfirmationStore(), new InMemoryAuditStore(), Clock.systemUTC());
    }

    /**
     * @param environment lookup for provider credentials, normally {@code System::getenv}
     */
    public AiGatewayContext(GatewaySettings settings,
                            CapabilityCheck capabilityCheck,
                            Function<String, String> environment,
                            BudgetStore budgetStore,
                            ConfirmationStore confirmationStore,
                            AuditStore auditStore,
                            Clock clock) {
        this.settings = settings;
        logger.info("Starting AI gateway context: {}", settings);

        this.policyRegistry = PolicyRegistry.defaults();
        logger.debug("Policy registry initialized");

        this.providerRegistry = new ProviderRegistry();
        registerProviders(environment);

        GlobalRoutingConfig routingConfig = new RoutingConfigLoader().load(settings.getRoutingConfigPath());
        this.router = new Router(providerRegistry, routingConfig);
        logger.debug("Router initialized");

        this.budgetLedger = new BudgetLedger(budgetStore, clock, settings.getBudgetSoftLimitPercent());
        this.confirmationGate = new ConfirmationGate(confirmationStore, clock, settings.getConfirmationExpiry());
        this.telemetryRecorder = new TelemetryRecorder(auditStore, CostTable.defaults(), clock);
        this.rateLimiter = new TaskRateLimiter(clock);

        // Worker threads for side-effect writes
        AtomicInteger threadCount = new AtomicInteger();
        this.executorService = Executors.newFixedThreadPool(
                settings.getWorkerThreads(),
                r -> {
                    Thread t = new Thread(r, "KiishaAi-Worker-" + threadCount.incrementAndGet());
                    t.setDaemon(true);
                    return t;
                }
        );

        this.gateway = AiGateway.builder()
                .policies(policyRegistry)
                .providers(providerRegistry)
                .router(router)
                .budgetLedger(budgetLedger)
                .telemetry(telemetryRecorder)
                .rateLimiter(rateLimiter)
                .capabilityCheck(capabilityCheck)
                .sideEffectExecutor(executorService)
                .clock(clock)
                .sideEffectTimeout(settings.getSideEffectTimeout())
                .build();
        this.gatewayTasks = new GatewayTasks(gateway);
        this.gatewayAdmin = new GatewayAdmin(router, budgetLedger, telemetryRecorder);

        // Periodic cleanup of expired confirmations and idle rate limit windows
        this.maintenanceScheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "KiishaAi-Maintenance");
            t.setDaemon(true);
            return t;
        });
        maintenanceScheduler.scheduleAtFixedRate(this::runMaintenance,
                MAINTENANCE_INTERVAL_MINUTES, MAINTENANCE_INTERVAL_MINUTES, TimeUnit.MINUTES);

        this.running = true;
        logger.info("AI gateway context started with {} available provider(s)",
                providerRegistry.getAvailableProviders().size());
    }

    /**
     * Registers an adapter for every provider whose API key is set. Keys are read from
     * {@code <PROVIDER>_API_KEY} and optional endpoints from {@code <PROVIDER>_API_BASE_URL}.
     */
    private void registerProviders(Function<String, String> environment) {
        for (ProviderId providerId : ProviderId.values()) {
            String prefix = providerId.name().toUpperCase(Locale.ROOT);
            String apiKey = environment.apply(prefix + "_API_KEY");
            if (apiKey == null || apiKey.isBlank()) {
                logger.debug("No API key for {}, skipping", providerId);
                continue;
            }
            providerRegistry.registerProvider(ProviderConfig.builder()
                    .providerId(providerId)
                    .apiKey(apiKey)
                    .apiBaseUrl(environment.apply(prefix + "_API_BASE_URL"))
                    .build());
        }
    }

    void runMaintenance() {
        try {
            int expired = confirmationGate.sweepExpired();
            int idle = rateLimiter.cleanupIdle();
            if (expired > 0 || idle > 0) {
                logger.debug("Maintenance: {} confirmations expired, {} idle rate windows removed", expired, idle);
            }
        } catch (RuntimeException e) {
            logger.error("Maintenance run failed: {}", e.getMessage(), e);
        }
    }

    public GatewaySettings getSettings() {
        return settings;
    }

    public PolicyRegistry getPolicyRegistry() {
        return policyRegistry;
    }

    public ProviderRegistry getProviderRegistry() {
        return providerRegistry;
    }

    public Router getRouter() {
        return router;
    }

    public BudgetLedger getBudgetLedger() {
        return budgetLedger;
    }

    public ConfirmationGate getConfirmationGate() {
        return confirmationGate;
    }

    public TelemetryRecorder getTelemetryRecorder() {
        return telemetryRecorder;
    }

    public TaskRateLimiter getRateLimiter() {
        return rateLimiter;
    }

    /**
     * Returns the executor used for side-effect writes.
     */
    public ExecutorService getExecutorService() {
        return executorService;
    }

    public AiGateway getGateway() {
        return gateway;
    }

    public GatewayTasks getGatewayTasks() {
        return gatewayTasks;
    }

    public GatewayAdmin getGatewayAdmin() {
        return gatewayAdmin;
    }

    public boolean isRunning() {
        return running;
    }

    /**
     * Shuts down the context and releases resources.
     */
    public void shutdown() {
        if (!running) {
            return;
        }

        running = false;
        logger.info("Shutting down AI gateway context...");

        maintenanceScheduler.shutdownNow();

        // Let in-flight audit and usage writes finish
        executorService.shutdown();
        try {
            if (!executorService.awaitTermination(30, TimeUnit.SECONDS)) {
                executorService.shutdownNow();
                logger.warn("Executor service did not terminate gracefully");
            }
        } catch (InterruptedException e) {
            executorService.shutdownNow();
            Thread.currentThread().interrupt();
        }

        logger.info("AI gateway context shutdown complete");
    }
}
