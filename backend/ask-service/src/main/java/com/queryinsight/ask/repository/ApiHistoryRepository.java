package com.queryinsight.ask.repository;

import com.queryinsight.ask.entity.history.ApiHistory;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

/**
 * Repository for ApiHistory entity.
 * Append-only: records are created once and never updated.
 */
@Repository
public interface ApiHistoryRepository extends JpaRepository<ApiHistory, String> {

    /**
     * Turns of a conversation thread, oldest first
     */
    List<ApiHistory> findAllByThreadIdOrderByCreatedAtAsc(String threadId);
}
