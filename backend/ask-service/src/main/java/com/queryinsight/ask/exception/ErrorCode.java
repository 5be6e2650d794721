package com.queryinsight.ask.exception;

/**
 * 오케스트레이터가 직접 발생시키는 에러 코드.
 * AI 서비스가 보고한 작업 에러 코드(예: NO_RELEVANT_DATA)는 문자열 그대로 전달됩니다.
 */
public enum ErrorCode {
    /** 잘못된 메서드 또는 요청 본문 */
    VALIDATION,

    /** 현재 프로젝트에 성공한 배포가 없음 */
    NO_DEPLOYMENT_FOUND,

    /** 단계별 폴링 마감 시간 초과 */
    POLLING_TIMEOUT,

    /** SQL로 답할 수 없는 질문 (일반 질의 또는 오해의 소지가 있는 질의) */
    NON_SQL_QUERY,

    /** 생성된 SQL 실행 실패 */
    SQL_EXECUTION_ERROR,

    /** 예상하지 못한 오류 */
    INTERNAL_SERVER_ERROR
}
