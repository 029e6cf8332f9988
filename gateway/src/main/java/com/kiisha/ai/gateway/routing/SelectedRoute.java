package com.kiisha.ai.gateway.routing;

import com.kiisha.ai.gateway.providers.ProviderId;

import java.util.Objects;

/**
 * Outcome of route selection. {@code isDefault} is set when the route came from the
 * default provider or the global fallback chain rather than the task's own routes.
 */
public final class SelectedRoute {

    private final ProviderId provider;
    private final String model;
    private final boolean isDefault;

    public SelectedRoute(ProviderId provider, String model, boolean isDefault) {
        this.provider = Objects.requireNonNull(provider, "provider");
        this.model = Objects.requireNonNull(model, "model");
        this.isDefault = isDefault;
    }

    public ProviderId getProvider() {
        return provider;
    }

    public String getModel() {
        return model;
    }

    public boolean isDefault() {
        return isDefault;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof SelectedRoute)) return false;
        SelectedRoute that = (SelectedRoute) o;
        return isDefault == that.isDefault && provider == that.provider && model.equals(that.model);
    }

    @Override
    public int hashCode() {
        return Objects.hash(provider, model, isDefault);
    }

    @Override
    public String toString() {
        return provider + "/" + model + (isDefault ? " (default)" : "");
    }
}
