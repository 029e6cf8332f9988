package com.kiisha.ai.common.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Surface a request arrived through.
 */
public enum Channel {
    WEB("web"),
    WHATSAPP("whatsapp"),
    EMAIL("email"),
    API("api");

    private final String code;

    Channel(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    @JsonCreator
    public static Channel fromCode(String code) {
        for (Channel channel : values()) {
            if (channel.code.equalsIgnoreCase(code)) {
                return channel;
            }
        }
        throw new IllegalArgumentException("Unknown channel: " + code);
    }

    @Override
    public String toString() {
        return code;
    }
}
