package com.flplatform.common.protocol;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum FLMessageType {
    JOIN_REQUEST,
    JOIN_RESPONSE,
    ROUND_START,
    LOCAL_UPDATE,
    GLOBAL_MODEL,
    ROUND_END,
    HEARTBEAT,
    ERROR;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static FLMessageType fromWireName(String value) {
        return valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
