package com.kiisha.ai.gateway.routing;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.kiisha.ai.gateway.providers.ProviderId;

import java.util.Comparator;
import java.util.Objects;

/**
 * A provider/model pair with a priority. Lower priority values are tried first.
 */
public final class Route {

    public static final Comparator<Route> BY_PRIORITY = Comparator.comparingInt(Route::getPriority);

    private final ProviderId provider;
    private final String model;
    private final int priority;

    @JsonCreator
    public Route(@JsonProperty("provider") ProviderId provider,
                 @JsonProperty("model") String model,
                 @JsonProperty("priority") int priority) {
        this.provider = Objects.requireNonNull(provider, "provider");
        this.model = Objects.requireNonNull(model, "model");
        this.priority = priority;
    }

    public static Route of(ProviderId provider, String model, int priority) {
        return new Route(provider, model, priority);
    }

    @JsonProperty("provider")
    public ProviderId getProvider() {
        return provider;
    }

    @JsonProperty("model")
    public String getModel() {
        return model;
    }

    @JsonProperty("priority")
    public int getPriority() {
        return priority;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Route)) return false;
        Route route = (Route) o;
        return priority == route.priority && provider == route.provider && model.equals(route.model);
    }

    @Override
    public int hashCode() {
        return Objects.hash(provider, model, priority);
    }

    @Override
    public String toString() {
        return provider + "/" + model + "@" + priority;
    }
}
