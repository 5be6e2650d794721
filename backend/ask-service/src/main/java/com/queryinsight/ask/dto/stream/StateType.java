package com.queryinsight.ask.dto.stream;

import com.fasterxml.jackson.annotation.JsonValue;
import com.queryinsight.ask.dto.ai.AskResultStatus;

import java.util.Locale;

/**
 * 클라이언트에 전달되는 진행 상태.
 */
public enum StateType {
    SQL_GENERATION_START,
    SQL_GENERATION_UNDERSTANDING,
    SQL_GENERATION_SEARCHING,
    SQL_GENERATION_PLANNING,
    SQL_GENERATION_GENERATING,
    SQL_GENERATION_CORRECTING,
    SQL_GENERATION_FINISHED,
    SQL_GENERATION_FAILED,
    SQL_GENERATION_STOPPED,
    SQL_GENERATION_SUCCESS,
    SQL_EXECUTION_START,
    SQL_EXECUTION_END;

    @JsonValue
    public String toValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * AI 서비스 작업 상태를 클라이언트 상태로 변환
     */
    public static StateType fromAskStatus(AskResultStatus status) {
        return switch (status) {
            case UNDERSTANDING -> SQL_GENERATION_UNDERSTANDING;
            case SEARCHING -> SQL_GENERATION_SEARCHING;
            case PLANNING -> SQL_GENERATION_PLANNING;
            case GENERATING -> SQL_GENERATION_GENERATING;
            case CORRECTING -> SQL_GENERATION_CORRECTING;
            case FINISHED -> SQL_GENERATION_FINISHED;
            case FAILED -> SQL_GENERATION_FAILED;
            case STOPPED -> SQL_GENERATION_STOPPED;
        };
    }
}
