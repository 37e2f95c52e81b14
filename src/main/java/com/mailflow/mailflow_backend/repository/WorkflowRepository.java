package com.mailflow.mailflow_backend.repository;

import com.mailflow.mailflow_backend.model.domain.Workflow;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.UUID;

public interface WorkflowRepository extends JpaRepository<Workflow, UUID> {
    List<Workflow> findByUserIdAndEnabledTrue(String userId);
}
