package com.queryinsight.ask.repository;

import com.queryinsight.ask.entity.project.Project;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;

/**
 * Repository for Project entity.
 */
@Repository
public interface ProjectRepository extends JpaRepository<Project, Long> {

    /**
     * The workspace holds a single active project: the most recently created one
     */
    Optional<Project> findFirstByOrderByIdDesc();
}
