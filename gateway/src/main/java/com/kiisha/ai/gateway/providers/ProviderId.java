package com.kiisha.ai.gateway.providers;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Identifiers of the providers the gateway can route to.
 */
public enum ProviderId {
    OPENAI("openai", "OpenAI"),
    ANTHROPIC("anthropic", "Anthropic Claude"),
    FORGE("forge", "Forge"),
    AZURE_OPENAI("azure_openai", "Azure OpenAI"),
    GEMINI("gemini", "Google Gemini"),
    DEEPSEEK("deepseek", "DeepSeek");

    private final String code;
    private final String displayName;

    ProviderId(String code, String displayName) {
        this.code = code;
        this.displayName = displayName;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    public String getDisplayName() {
        return displayName;
    }

    @JsonCreator
    public static ProviderId fromCode(String code) {
        for (ProviderId id : values()) {
            if (id.code.equalsIgnoreCase(code)) {
                return id;
            }
        }
        throw new IllegalArgumentException("Unknown provider: " + code);
    }

    @Override
    public String toString() {
        return code;
    }
}
