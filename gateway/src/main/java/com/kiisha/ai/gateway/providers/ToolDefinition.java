package com.kiisha.ai.gateway.providers;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A function the model may call. Parameters are a JSON Schema object.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class ToolDefinition {

    private final String name;
    private final String description;
    private final Map<String, Object> parameters;

    private ToolDefinition(Builder builder) {
        this.name = builder.name;
        this.description = builder.description;
        this.parameters = builder.parameters != null ?
                Collections.unmodifiableMap(new LinkedHashMap<>(builder.parameters)) : null;
    }

    public String getName() {
        return name;
    }

    public String getDescription() {
        return description;
    }

    public Map<String, Object> getParameters() {
        return parameters;
    }

    @Override
    public String toString() {
        return "ToolDefinition{name='" + name + "'}";
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String name;
        private String description;
        private Map<String, Object> parameters;

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder parameters(Map<String, Object> parameters) {
            this.parameters = parameters;
            return this;
        }

        public ToolDefinition build() {
            if (name == null || name.isEmpty()) {
                throw new IllegalStateException("Tool name is required");
            }
            return new ToolDefinition(this);
        }
    }
}
