package com.queryinsight.ask.dto.stream;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * 스트림 이벤트 타입.
 * 순서: MESSAGE_START → (STATE | CONTENT_BLOCK_START → CONTENT_BLOCK_DELTA* → CONTENT_BLOCK_STOP)* → ERROR? → MESSAGE_STOP
 */
public enum StreamEventType {
    MESSAGE_START,
    STATE,
    CONTENT_BLOCK_START,
    CONTENT_BLOCK_DELTA,
    CONTENT_BLOCK_STOP,
    ERROR,
    MESSAGE_STOP;

    @JsonValue
    public String toValue() {
        return name().toLowerCase(Locale.ROOT);
    }
}
