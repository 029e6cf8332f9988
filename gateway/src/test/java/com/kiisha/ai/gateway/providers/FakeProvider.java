package com.kiisha.ai.gateway.providers;

import com.kiisha.ai.common.model.ValidationResult;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Scriptable adapter for tests. Queued outcomes are consumed in order; once the queue is
 * empty every call answers with the default response.
 */
public class FakeProvider implements AiProvider {

    private final ProviderId providerId;
    private final List<String> models;
    private final Deque<Object> outcomes = new ArrayDeque<>();
    private final List<CompletionRequest> requests = new ArrayList<>();
    private final AtomicInteger calls = new AtomicInteger();
    private volatile boolean available = true;
    private volatile CompletionResponse defaultResponse;
    private volatile String failureMessage;

    public FakeProvider(ProviderId providerId, String... models) {
        this.providerId = providerId;
        this.models = List.of(models);
        this.defaultResponse = CompletionResponse.builder()
                .content("ok from " + providerId)
                .usage(TokenUsage.of(10, 5))
                .model(models.length > 0 ? models[0] : "default")
                .build();
    }

    public FakeProvider available(boolean available) {
        this.available = available;
        return this;
    }

    public FakeProvider respondWith(CompletionResponse response) {
        this.defaultResponse = response;
        return this;
    }

    public FakeProvider thenReturn(CompletionResponse response) {
        outcomes.add(response);
        return this;
    }

    public FakeProvider thenFail(ProviderException error) {
        outcomes.add(error);
        return this;
    }

    public FakeProvider alwaysFail(String message) {
        this.defaultResponse = null;
        this.failureMessage = message;
        return this;
    }

    public int getCallCount() {
        return calls.get();
    }

    public synchronized List<CompletionRequest> getRequests() {
        return new ArrayList<>(requests);
    }

    public synchronized CompletionRequest lastRequest() {
        return requests.isEmpty() ? null : requests.get(requests.size() - 1);
    }

    @Override
    public ProviderId getProviderId() {
        return providerId;
    }

    @Override
    public boolean isAvailable() {
        return available;
    }

    @Override
    public List<String> getAvailableModels() {
        return models;
    }

    @Override
    public synchronized CompletionResponse complete(CompletionRequest request) throws ProviderException {
        calls.incrementAndGet();
        requests.add(request);
        Object next = outcomes.poll();
        if (next instanceof ProviderException) {
            throw (ProviderException) next;
        }
        if (next instanceof CompletionResponse) {
            return (CompletionResponse) next;
        }
        if (defaultResponse == null) {
            throw ProviderException.serverError(providerId, failureMessage);
        }
        return defaultResponse;
    }

    @Override
    public ValidationResult validateConfig(ProviderConfig config) {
        return ValidationResult.valid();
    }
}
