package com.queryinsight.ask.repository;

import com.queryinsight.ask.entity.deploy.Deployment;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface DeploymentRepository extends JpaRepository<Deployment, Long> {

    Optional<Deployment> findFirstByProjectIdAndStatusOrderByIdDesc(Long projectId, Deployment.DeployStatus status);
}
