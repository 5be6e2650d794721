package com.queryinsight.ask.service;

import com.queryinsight.ask.entity.deploy.Deployment;
import com.queryinsight.ask.exception.ApiException;
import com.queryinsight.ask.repository.DeploymentRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

/**
 * Read access to deployment bookkeeping.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class DeployService {

    private final DeploymentRepository deploymentRepository;

    /**
     * Latest successful deployment of the project.
     * Fails with {@code NO_DEPLOYMENT_FOUND} when the project was never deployed successfully.
     */
    public Mono<Deployment> getLastDeployment(Long projectId) {
        return Mono.fromCallable(() -> deploymentRepository.findFirstByProjectIdAndStatusOrderByIdDesc(
                        projectId, Deployment.DeployStatus.SUCCESS))
                .subscribeOn(Schedulers.boundedElastic())
                .flatMap(Mono::justOrEmpty)
                .switchIfEmpty(Mono.error(ApiException::noDeploymentFound))
                .doOnNext(deployment -> log.debug("Using deployment: projectId={}, hash={}", projectId, deployment.getHash()));
    }
}
