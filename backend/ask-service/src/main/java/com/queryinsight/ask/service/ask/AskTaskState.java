package com.queryinsight.ask.service.ask;

/**
 * 질의 요청 전체의 진행 상태.
 * FAILED는 어느 상태에서나, CANCELLED는 클라이언트 연결 종료 시 진입합니다.
 */
public enum AskTaskState {
    STARTED,
    SQL_SUBMITTED,
    SQL_POLLING,
    SQL_DONE_GENERAL,
    SQL_DONE_SQL,
    EXECUTING_SQL,
    SUMMARY_SUBMITTED,
    SUMMARY_POLLING,
    STREAMING_SUMMARY,
    COMPLETED,
    FAILED,
    CANCELLED;

    /**
     * SQL 생성 작업이 AI 서비스에서 아직 실행 중인 상태
     */
    public boolean isSqlJobInFlight() {
        return this == SQL_SUBMITTED || this == SQL_POLLING;
    }
}
