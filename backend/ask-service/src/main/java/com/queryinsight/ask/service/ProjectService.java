package com.queryinsight.ask.service;

import com.queryinsight.ask.entity.project.Project;
import com.queryinsight.ask.repository.ProjectRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

/**
 * Resolves the project questions are asked against.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ProjectService {

    private final ProjectRepository projectRepository;

    /**
     * Current project, or empty when none has been created yet.
     */
    public Mono<Project> getCurrentProject() {
        return Mono.fromCallable(projectRepository::findFirstByOrderByIdDesc)
                .subscribeOn(Schedulers.boundedElastic())
                .flatMap(Mono::justOrEmpty)
                .doOnNext(project -> log.debug("Current project: id={}, type={}", project.getId(), project.getType()));
    }
}
