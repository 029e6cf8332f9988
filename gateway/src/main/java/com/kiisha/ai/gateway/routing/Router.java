package com.kiisha.ai.gateway.routing;

import com.kiisha.ai.common.model.AiTask;
import com.kiisha.ai.common.model.ValidationResult;
import com.kiisha.ai.gateway.providers.AiProvider;
import com.kiisha.ai.gateway.providers.ProviderId;
import com.kiisha.ai.gateway.providers.ProviderRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Picks provider/model routes for tasks and owns retry timing.
 *
 * <p>The routing table is an immutable {@link GlobalRoutingConfig} held in a single
 * reference. Every selection reads the reference once, so a concurrent
 * {@link #setRoutingConfig} never yields a half-updated view.</p>
 */
public class Router {

    private static final Logger logger = LoggerFactory.getLogger(Router.class);

    static final String UNKNOWN_MODEL = "default";

    private final ProviderRegistry providers;
    private final AtomicReference<GlobalRoutingConfig> config;
    private final Sleeper sleeper;

    public Router(ProviderRegistry providers, GlobalRoutingConfig initialConfig) {
        this(providers, initialConfig, Sleeper.SYSTEM);
    }

    public Router(ProviderRegistry providers, GlobalRoutingConfig initialConfig, Sleeper sleeper) {
        this.providers = providers;
        this.config = new AtomicReference<>(initialConfig);
        this.sleeper = sleeper;
        logger.info("Router initialized: {}", initialConfig);
    }

    public GlobalRoutingConfig getRoutingConfig() {
        return config.get();
    }

    /**
     * Swaps in a new routing snapshot.
     *
     * @throws IllegalArgumentException if the config does not validate
     */
    public void setRoutingConfig(GlobalRoutingConfig newConfig) {
        ValidationResult validation = newConfig.validate();
        if (!validation.isValid()) {
            throw new IllegalArgumentException("Invalid routing config: " + validation.getErrorSummary());
        }
        GlobalRoutingConfig previous = config.getAndSet(newConfig);
        logger.info("Routing config replaced: {} -> {}", previous, newConfig);
    }

    /**
     * Selects the route for a task: its first available route by priority, then the
     * default provider, then the first available provider in the fallback chain.
     */
    public SelectedRoute selectRoute(AiTask task) throws NoProviderAvailableException {
        GlobalRoutingConfig snapshot = config.get();

        Optional<TaskRoutingConfig> taskConfig = snapshot.getTaskRouting(task);
        if (taskConfig.isPresent()) {
            for (Route route : taskConfig.get().getRoutes()) {
                if (providers.isAvailable(route.getProvider())) {
                    logger.debug("Selected route {} for {}", route, task);
                    return new SelectedRoute(route.getProvider(), route.getModel(), false);
                }
            }
        }

        if (snapshot.getDefaultProvider() != null && providers.isAvailable(snapshot.getDefaultProvider())) {
            logger.debug("Selected default provider {} for {}", snapshot.getDefaultProvider(), task);
            return new SelectedRoute(snapshot.getDefaultProvider(), snapshot.getDefaultModel(), true);
        }

        for (ProviderId providerId : snapshot.getFallbackChain()) {
            if (providers.isAvailable(providerId)) {
                logger.debug("Selected fallback chain provider {} for {}", providerId, task);
                return new SelectedRoute(providerId, firstModel(providerId), true);
            }
        }

        throw new NoProviderAvailableException(task);
    }

    public Optional<SelectedRoute> selectFallback(AiTask task, ProviderId failedProvider) {
        return selectFallback(task, failedProvider, Collections.emptySet());
    }

    /**
     * Next route after {@code failedProvider} fails. Scans the task's routes past the failed
     * one, then the global chain the same way. A list that does not name the failed provider
     * yields nothing. Never returns the failed provider or one in {@code alreadyTried}.
     */
    public Optional<SelectedRoute> selectFallback(AiTask task, ProviderId failedProvider,
                                                  Set<ProviderId> alreadyTried) {
        GlobalRoutingConfig snapshot = config.get();

        Optional<TaskRoutingConfig> taskConfig = snapshot.getTaskRouting(task);
        if (taskConfig.isPresent() && taskConfig.get().isFallbackEnabled()) {
            List<Route> routes = taskConfig.get().getRoutes();
            int start = indexAfter(routes.stream().map(Route::getProvider).toList(), failedProvider);
            for (int i = start; i < routes.size(); i++) {
                Route route = routes.get(i);
                if (isCandidate(route.getProvider(), failedProvider, alreadyTried)) {
                    logger.debug("Fallback for {} after {}: {}", task, failedProvider, route);
                    return Optional.of(new SelectedRoute(route.getProvider(), route.getModel(), false));
                }
            }
        }

        List<ProviderId> chain = snapshot.getFallbackChain();
        for (int i = indexAfter(chain, failedProvider); i < chain.size(); i++) {
            ProviderId providerId = chain.get(i);
            if (isCandidate(providerId, failedProvider, alreadyTried)) {
                logger.debug("Fallback for {} after {}: chain provider {}", task, failedProvider, providerId);
                return Optional.of(new SelectedRoute(providerId, firstModel(providerId), true));
            }
        }

        logger.debug("No fallback left for {} after {} (tried {})", task, failedProvider, alreadyTried);
        return Optional.empty();
    }

    /**
     * Runs {@code operation} up to {@code maxRetries + 1} times, sleeping the backoff delay
     * between attempts. The last failure is rethrown once attempts run out.
     */
    public <T> T withRetry(Callable<T> operation, RetryObserver observer) throws Exception {
        RetryConfig retry = config.get().getRetryConfig();
        Exception lastError = null;

        for (int attempt = 0; attempt <= retry.getMaxRetries(); attempt++) {
            try {
                return operation.call();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw e;
            } catch (Exception e) {
                lastError = e;
                if (attempt < retry.getMaxRetries()) {
                    int retryNumber = attempt + 1;
                    observer.onRetry(retryNumber, e);
                    sleeper.sleep(retry.delayForRetry(retryNumber));
                }
            }
        }

        throw lastError;
    }

    /**
     * Backoff delay before retry {@code attempt} (1-based) under the current config.
     */
    public long backoffDelay(int attempt) {
        return config.get().getRetryConfig().delayForRetry(attempt);
    }

    private boolean isCandidate(ProviderId candidate, ProviderId failedProvider, Set<ProviderId> alreadyTried) {
        return candidate != failedProvider
                && !alreadyTried.contains(candidate)
                && providers.isAvailable(candidate);
    }

    /**
     * Index just past the failed provider, or the list size when it is not listed.
     */
    private static int indexAfter(List<ProviderId> ordered, ProviderId failedProvider) {
        int index = ordered.indexOf(failedProvider);
        return index < 0 ? ordered.size() : index + 1;
    }

    private String firstModel(ProviderId providerId) {
        Optional<AiProvider> provider = providers.getProvider(providerId);
        if (provider.isEmpty()) {
            return UNKNOWN_MODEL;
        }
        List<String> models = provider.get().getAvailableModels();
        return models == null || models.isEmpty() ? UNKNOWN_MODEL : models.get(0);
    }
}
