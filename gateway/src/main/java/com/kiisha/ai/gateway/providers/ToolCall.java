package com.kiisha.ai.gateway.providers;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * A function call requested by the model.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class ToolCall {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final String id;
    private final String name;
    private final String arguments;

    private ToolCall(Builder builder) {
        this.id = builder.id;
        this.name = builder.name;
        this.arguments = builder.arguments;
    }

    /**
     * Unique ID for this call (used to correlate the tool result)
     */
    public String getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    /**
     * JSON string of the call arguments
     */
    public String getArguments() {
        return arguments;
    }

    /**
     * Parses the arguments as a JSON tree; malformed JSON yields an empty object.
     */
    @JsonIgnore
    public JsonNode getArgumentsAsJson() {
        if (arguments == null || arguments.isBlank()) {
            return MAPPER.createObjectNode();
        }
        try {
            return MAPPER.readTree(arguments);
        } catch (Exception e) {
            return MAPPER.createObjectNode();
        }
    }

    @Override
    public String toString() {
        return "ToolCall{" +
                "id='" + id + '\'' +
                ", name='" + name + '\'' +
                ", arguments='" + (arguments != null && arguments.length() > 100 ?
                        arguments.substring(0, 100) + "..." : arguments) + '\'' +
                '}';
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String id;
        private String name;
        private String arguments;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder arguments(String arguments) {
            this.arguments = arguments;
            return this;
        }

        public ToolCall build() {
            return new ToolCall(this);
        }
    }
}
