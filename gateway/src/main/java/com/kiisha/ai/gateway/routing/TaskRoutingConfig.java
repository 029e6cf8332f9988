package com.kiisha.ai.gateway.routing;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.kiisha.ai.common.model.AiTask;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Ordered routes for one task. Routes are kept sorted by priority; ties keep declaration order.
 */
public final class TaskRoutingConfig {

    private final AiTask task;
    private final List<Route> routes;
    private final boolean fallbackEnabled;

    @JsonCreator
    public TaskRoutingConfig(@JsonProperty("task") AiTask task,
                             @JsonProperty("routes") List<Route> routes,
                             @JsonProperty("fallbackEnabled") boolean fallbackEnabled) {
        this.task = Objects.requireNonNull(task, "task");
        List<Route> sorted = routes != null ? new ArrayList<>(routes) : new ArrayList<>();
        sorted.sort(Route.BY_PRIORITY);
        this.routes = Collections.unmodifiableList(sorted);
        this.fallbackEnabled = fallbackEnabled;
    }

    public static TaskRoutingConfig of(AiTask task, boolean fallbackEnabled, Route... routes) {
        return new TaskRoutingConfig(task, List.of(routes), fallbackEnabled);
    }

    @JsonProperty("task")
    public AiTask getTask() {
        return task;
    }

    /**
     * Routes sorted ascending by priority
     */
    @JsonProperty("routes")
    public List<Route> getRoutes() {
        return routes;
    }

    @JsonProperty("fallbackEnabled")
    public boolean isFallbackEnabled() {
        return fallbackEnabled;
    }

    @JsonIgnore
    public boolean hasRoutes() {
        return !routes.isEmpty();
    }

    @Override
    public String toString() {
        return "TaskRoutingConfig{task=" + task + ", routes=" + routes + ", fallbackEnabled=" + fallbackEnabled + '}';
    }
}
