package com.queryinsight.ask;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * QueryInsight Ask Service Application
 *
 * Spring Boot 기반의 질의 오케스트레이션 서비스
 * - 자연어 질문을 AI 서비스에 제출하여 SQL 생성 작업을 폴링
 * - 생성된 SQL을 쿼리 엔진에서 샘플 실행
 * - 요약 답변을 SSE로 스트리밍
 * - 모든 요청을 API 히스토리로 감사 기록
 */
@SpringBootApplication
public class AskServiceApplication {

    public static void main(String[] args) {
        SpringApplication.run(AskServiceApplication.class, args);
    }
}
