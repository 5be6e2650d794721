package com.queryinsight.ask.service.ask;

import com.queryinsight.ask.entity.history.ApiType;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.Setter;
import lombok.extern.slf4j.Slf4j;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Mutable state of one ask request. Never shared between requests.
 */
@Slf4j
@Getter
class AskContext {

    private static final Set<String> EXCLUDED_HEADERS = Set.of("authorization", "cookie", "proxy-authorization");

    private final ApiType apiType;
    private final String threadId;
    private final boolean newThread;
    private final Map<String, Object> requestPayload;
    private final Map<String, String> headers;
    private final long startedAt;

    private volatile AskTaskState state = AskTaskState.STARTED;

    @Setter
    private volatile Long projectId;

    @Setter
    private volatile String sqlQueryId;

    @Getter(AccessLevel.NONE)
    private final AtomicBoolean recorded = new AtomicBoolean(false);

    private AskContext(ApiType apiType, String threadId, boolean newThread,
                       Map<String, Object> requestPayload, Map<String, String> headers) {
        this.apiType = apiType;
        this.threadId = threadId;
        this.newThread = newThread;
        this.requestPayload = requestPayload;
        this.headers = headers;
        this.startedAt = System.currentTimeMillis();
    }

    /**
     * @param threadId caller supplied thread, or null to start a new one
     */
    static AskContext start(ApiType apiType, String threadId,
                            Map<String, Object> requestPayload, Map<String, String> headers) {
        boolean newThread = threadId == null || threadId.isBlank();
        String resolvedThreadId = newThread ? UUID.randomUUID().toString() : threadId;

        Map<String, String> recordedHeaders = new LinkedHashMap<>();
        if (headers != null) {
            headers.forEach((name, value) -> {
                if (!EXCLUDED_HEADERS.contains(name.toLowerCase(Locale.ROOT))) {
                    recordedHeaders.put(name, value);
                }
            });
        }
        return new AskContext(apiType, resolvedThreadId, newThread, requestPayload, recordedHeaders);
    }

    void transition(AskTaskState next) {
        log.debug("[{}] {} {} -> {}", threadId, apiType, state, next);
        state = next;
    }

    boolean isSqlJobInFlight() {
        return sqlQueryId != null && state.isSqlJobInFlight();
    }

    /**
     * First caller wins; every later call returns false.
     */
    boolean markRecorded() {
        return recorded.compareAndSet(false, true);
    }

    long elapsedMs() {
        return System.currentTimeMillis() - startedAt;
    }
}
