package com.kiisha.ai.gateway.providers;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Structured-output constraint: the response must match a named JSON schema.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class ResponseFormat {

    private final String name;
    private final boolean strict;
    private final Map<String, Object> schema;

    private ResponseFormat(String name, boolean strict, Map<String, Object> schema) {
        this.name = Objects.requireNonNull(name, "name");
        this.strict = strict;
        this.schema = schema != null ?
                Collections.unmodifiableMap(new LinkedHashMap<>(schema)) : Collections.emptyMap();
    }

    public static ResponseFormat jsonSchema(String name, boolean strict, Map<String, Object> schema) {
        return new ResponseFormat(name, strict, schema);
    }

    public String getType() {
        return "json_schema";
    }

    public String getName() {
        return name;
    }

    public boolean isStrict() {
        return strict;
    }

    public Map<String, Object> getSchema() {
        return schema;
    }
}
