package com.queryinsight.ask.service;

import com.queryinsight.ask.entity.deploy.Deployment;
import com.queryinsight.ask.exception.ApiException;
import com.queryinsight.ask.repository.DeploymentRepository;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import reactor.test.StepVerifier;

import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.when;

/**
 * DeployService 단위 테스트
 */
@ExtendWith(MockitoExtension.class)
class DeployServiceTest {

    @Mock
    private DeploymentRepository deploymentRepository;

    @InjectMocks
    private DeployService deployService;

    @Test
    @DisplayName("최근 성공 배포 조회")
    void returnsLatestSuccessfulDeployment() {
        Deployment deployment = Deployment.builder()
                .id(3L)
                .projectId(1L)
                .hash("abc123")
                .status(Deployment.DeployStatus.SUCCESS)
                .build();
        when(deploymentRepository.findFirstByProjectIdAndStatusOrderByIdDesc(1L, Deployment.DeployStatus.SUCCESS))
                .thenReturn(Optional.of(deployment));

        StepVerifier.create(deployService.getLastDeployment(1L))
                .assertNext(found -> assertThat(found.getHash()).isEqualTo("abc123"))
                .verifyComplete();
    }

    @Test
    @DisplayName("성공 배포가 없으면 NO_DEPLOYMENT_FOUND")
    void failsWithoutDeployment() {
        when(deploymentRepository.findFirstByProjectIdAndStatusOrderByIdDesc(1L, Deployment.DeployStatus.SUCCESS))
                .thenReturn(Optional.empty());

        StepVerifier.create(deployService.getLastDeployment(1L))
                .expectErrorSatisfies(e -> {
                    assertThat(e).isInstanceOf(ApiException.class);
                    assertThat(((ApiException) e).getCode()).isEqualTo("NO_DEPLOYMENT_FOUND");
                    assertThat(((ApiException) e).getStatusCode()).isEqualTo(400);
                })
                .verify();
    }
}
