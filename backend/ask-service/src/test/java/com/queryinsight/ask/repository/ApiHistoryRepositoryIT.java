package com.queryinsight.ask.repository;

import com.queryinsight.ask.entity.history.ApiHistory;
import com.queryinsight.ask.entity.history.ApiType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.jdbc.AutoConfigureTestDatabase;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.util.List;
import java.util.Map;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * ApiHistoryRepository 통합 테스트 (Testcontainers 사용)
 * 실제 PostgreSQL 컨테이너에서 jsonb 컬럼 저장/조회를 확인합니다.
 */
@DataJpaTest
@AutoConfigureTestDatabase(replace = AutoConfigureTestDatabase.Replace.NONE)
@Testcontainers
@ActiveProfiles("test")
class ApiHistoryRepositoryIT {

    @Container
    static PostgreSQLContainer<?> postgres = new PostgreSQLContainer<>("postgres:15-alpine")
            .withDatabaseName("testdb")
            .withUsername("test")
            .withPassword("test");

    @DynamicPropertySource
    static void configureProperties(DynamicPropertyRegistry registry) {
        registry.add("spring.datasource.url", postgres::getJdbcUrl);
        registry.add("spring.datasource.username", postgres::getUsername);
        registry.add("spring.datasource.password", postgres::getPassword);
        registry.add("spring.datasource.driver-class-name", () -> "org.postgresql.Driver");
        registry.add("spring.jpa.hibernate.ddl-auto", () -> "create-drop");
    }

    @Autowired
    private ApiHistoryRepository apiHistoryRepository;

    @Test
    @DisplayName("감사 기록 저장 및 JSON 페이로드 조회")
    void saveAndFindWithJsonPayload() {
        // given
        ApiHistory history = history("thread-1", 200, "How many orders?", Map.of("sql", "SELECT count(*) FROM orders"));

        // when
        apiHistoryRepository.saveAndFlush(history);
        ApiHistory found = apiHistoryRepository.findById(history.getId()).orElseThrow();

        // then
        assertThat(found.getCreatedAt()).isNotNull();
        assertThat(found.getRequestPayload()).containsEntry("question", "How many orders?");
        assertThat(found.getResponsePayload()).containsEntry("sql", "SELECT count(*) FROM orders");
        assertThat(found.getHeaders()).containsEntry("user-agent", "it-test");
    }

    @Test
    @DisplayName("스레드별 기록은 생성 순서대로 조회")
    void findAllByThreadIdInCreationOrder() {
        // given
        apiHistoryRepository.saveAndFlush(history("thread-2", 200, "first", Map.of("sql", "SELECT 1")));
        apiHistoryRepository.saveAndFlush(history("thread-2", 400, "second", Map.of("error", "bad")));
        apiHistoryRepository.saveAndFlush(history("other", 200, "unrelated", Map.of("sql", "SELECT 2")));

        // when
        List<ApiHistory> turns = apiHistoryRepository.findAllByThreadIdOrderByCreatedAtAsc("thread-2");

        // then
        assertThat(turns).extracting(turn -> turn.getRequestPayload().get("question"))
                .containsExactly("first", "second");
        assertThat(apiHistoryRepository.findAll())
                .filteredOn(ApiHistory::isSuccessful)
                .hasSize(2);
    }

    private static ApiHistory history(String threadId, int statusCode, String question, Map<String, Object> response) {
        return ApiHistory.builder()
                .id(UUID.randomUUID().toString())
                .projectId(1L)
                .apiType(ApiType.STREAM_ASK)
                .threadId(threadId)
                .headers(Map.of("user-agent", "it-test"))
                .requestPayload(Map.of("question", question))
                .responsePayload(response)
                .statusCode(statusCode)
                .durationMs(10L)
                .build();
    }
}
