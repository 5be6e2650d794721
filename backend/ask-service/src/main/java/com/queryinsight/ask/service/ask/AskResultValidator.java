package com.queryinsight.ask.service.ask;

import com.queryinsight.ask.dto.ai.AiError;
import com.queryinsight.ask.dto.ai.AskResult;
import com.queryinsight.ask.dto.ai.AskResultStatus;
import com.queryinsight.ask.dto.ai.AskResultType;
import com.queryinsight.ask.exception.ApiException;
import org.springframework.stereotype.Component;

/**
 * Classifies a finished SQL generation result.
 * Returns the generated SQL, or throws an {@link ApiException} describing why there is none.
 */
@Component
public class AskResultValidator {

    static final String DEFAULT_NON_SQL_MESSAGE = "The question cannot be answered with SQL from the current data model";
    static final String NO_SQL_MESSAGE = "No SQL generated";

    public String validate(AskResult result, String queryId) {
        if (result.hasError()) {
            AiError error = result.getError();
            String message = error.message() != null ? error.message() : "SQL generation failed";
            throw ApiException.upstream(message, error.code(), result.getInvalidSql());
        }

        if (result.getType() == AskResultType.MISLEADING_QUERY) {
            throw ApiException.nonSqlQuery(reasoningOrDefault(result));
        }

        if (result.getType() == AskResultType.GENERAL) {
            throw ApiException.generalQuery(reasoningOrDefault(result), queryId);
        }

        if (result.getStatus() == AskResultStatus.FAILED || result.getStatus() == AskResultStatus.STOPPED) {
            throw ApiException.contractViolation("SQL generation " + result.getStatus().toValue());
        }

        String sql = firstSql(result);
        if (sql == null || sql.isBlank()) {
            throw ApiException.contractViolation(NO_SQL_MESSAGE);
        }
        return sql;
    }

    private static String firstSql(AskResult result) {
        if (result.getResponse() == null || result.getResponse().isEmpty()) {
            return null;
        }
        AskResult.AskResponse first = result.getResponse().get(0);
        return first != null ? first.getSql() : null;
    }

    private static String reasoningOrDefault(AskResult result) {
        String reasoning = result.getIntentReasoning();
        return reasoning != null && !reasoning.isBlank() ? reasoning : DEFAULT_NON_SQL_MESSAGE;
    }
}
