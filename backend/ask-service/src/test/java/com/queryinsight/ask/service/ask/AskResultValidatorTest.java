package com.queryinsight.ask.service.ask;

import com.queryinsight.ask.dto.ai.AiError;
import com.queryinsight.ask.dto.ai.AskResult;
import com.queryinsight.ask.dto.ai.AskResultStatus;
import com.queryinsight.ask.dto.ai.AskResultType;
import com.queryinsight.ask.exception.ApiException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowableOfType;

/**
 * AskResultValidator 단위 테스트
 */
class AskResultValidatorTest {

    private final AskResultValidator validator = new AskResultValidator();

    @Test
    @DisplayName("완료된 결과의 첫 번째 SQL 반환")
    void returnsFirstSql() {
        AskResult result = AskResult.builder()
                .status(AskResultStatus.FINISHED)
                .type(AskResultType.NORMAL)
                .response(List.of(
                        new AskResult.AskResponse("SELECT count(*) FROM orders", "llm"),
                        new AskResult.AskResponse("SELECT 1", "llm")))
                .build();

        assertThat(validator.validate(result, "q-1")).isEqualTo("SELECT count(*) FROM orders");
    }

    @Test
    @DisplayName("업스트림 에러는 메시지, 코드, invalidSql을 그대로 전달")
    void upstreamErrorTakesPrecedence() {
        AskResult result = AskResult.builder()
                .status(AskResultStatus.FAILED)
                .type(AskResultType.GENERAL)
                .error(new AiError("NO_RELEVANT_SQL", "Generated SQL is invalid"))
                .invalidSql("SELEC * FROM orders")
                .build();

        ApiException ex = catchThrowableOfType(() -> validator.validate(result, "q-1"), ApiException.class);

        assertThat(ex.getStatus()).isEqualTo(HttpStatus.BAD_REQUEST);
        assertThat(ex.getCode()).isEqualTo("NO_RELEVANT_SQL");
        assertThat(ex.getMessage()).isEqualTo("Generated SQL is invalid");
        assertThat(ex.getAdditionalData()).containsEntry(ApiException.INVALID_SQL, "SELEC * FROM orders");
    }

    @Test
    @DisplayName("코드 없는 업스트림 에러는 INTERNAL_SERVER_ERROR")
    void upstreamErrorWithoutCode() {
        AskResult result = AskResult.builder()
                .status(AskResultStatus.FAILED)
                .error(new AiError(null, null))
                .build();

        ApiException ex = catchThrowableOfType(() -> validator.validate(result, "q-1"), ApiException.class);

        assertThat(ex.getCode()).isEqualTo("INTERNAL_SERVER_ERROR");
        assertThat(ex.getStatusCode()).isEqualTo(400);
        assertThat(ex.getAdditionalData()).isEmpty();
    }

    @Test
    @DisplayName("MISLEADING_QUERY는 NON_SQL_QUERY, 설명 작업 ID 없음")
    void misleadingQuery() {
        AskResult result = AskResult.builder()
                .status(AskResultStatus.FINISHED)
                .type(AskResultType.MISLEADING_QUERY)
                .intentReasoning("The question is about the weather")
                .build();

        ApiException ex = catchThrowableOfType(() -> validator.validate(result, "q-1"), ApiException.class);

        assertThat(ex.getCode()).isEqualTo("NON_SQL_QUERY");
        assertThat(ex.getMessage()).isEqualTo("The question is about the weather");
        assertThat(ex.getExplanationQueryId()).isNull();
    }

    @Test
    @DisplayName("GENERAL은 NON_SQL_QUERY와 explanationQueryId")
    void generalQueryCarriesExplanationQueryId() {
        AskResult result = AskResult.builder()
                .status(AskResultStatus.FINISHED)
                .type(AskResultType.GENERAL)
                .build();

        ApiException ex = catchThrowableOfType(() -> validator.validate(result, "q-42"), ApiException.class);

        assertThat(ex.getCode()).isEqualTo("NON_SQL_QUERY");
        assertThat(ex.getMessage()).isEqualTo(AskResultValidator.DEFAULT_NON_SQL_MESSAGE);
        assertThat(ex.getExplanationQueryId()).isEqualTo("q-42");
    }

    @Test
    @DisplayName("에러 없이 STOPPED")
    void stoppedWithoutError() {
        AskResult result = AskResult.builder()
                .status(AskResultStatus.STOPPED)
                .type(AskResultType.NORMAL)
                .build();

        ApiException ex = catchThrowableOfType(() -> validator.validate(result, "q-1"), ApiException.class);

        assertThat(ex.getMessage()).isEqualTo("SQL generation stopped");
        assertThat(ex.getCode()).isEqualTo("INTERNAL_SERVER_ERROR");
        assertThat(ex.getStatusCode()).isEqualTo(400);
    }

    @Test
    @DisplayName("완료되었지만 SQL이 비어 있음")
    void finishedWithoutSql() {
        AskResult result = AskResult.builder()
                .status(AskResultStatus.FINISHED)
                .type(AskResultType.NORMAL)
                .response(List.of(new AskResult.AskResponse(" ", "llm")))
                .build();

        ApiException ex = catchThrowableOfType(() -> validator.validate(result, "q-1"), ApiException.class);

        assertThat(ex.getMessage()).isEqualTo(AskResultValidator.NO_SQL_MESSAGE);
        assertThat(ex.getCode()).isEqualTo("INTERNAL_SERVER_ERROR");
    }
}
