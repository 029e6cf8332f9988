package com.kiisha.ai.gateway.providers;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Normalized reason a generation stopped.
 */
public enum FinishReason {
    STOP("stop"),
    LENGTH("length"),
    TOOL_CALLS("tool_calls"),
    CONTENT_FILTER("content_filter"),
    ERROR("error");

    private final String code;

    FinishReason(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    /**
     * Maps a vendor stop reason onto the normalized set.
     * A missing reason counts as a normal stop; an unrecognized one as an error.
     */
    public static FinishReason fromVendor(String vendorReason) {
        if (vendorReason == null) {
            return STOP;
        }
        switch (vendorReason) {
            case "stop":
            case "end_turn":
            case "stop_sequence":
                return STOP;
            case "length":
            case "max_tokens":
                return LENGTH;
            case "tool_calls":
            case "tool_use":
            case "function_call":
                return TOOL_CALLS;
            case "content_filter":
            case "refusal":
                return CONTENT_FILTER;
            default:
                return ERROR;
        }
    }
}
