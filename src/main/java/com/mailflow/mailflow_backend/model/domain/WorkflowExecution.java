package com.mailflow.mailflow_backend.model.domain;

import com.mailflow.mailflow_backend.model.result.NodeExecutionResult;
import com.mailflow.mailflow_backend.model.trigger.TriggerContext;
import jakarta.persistence.*;
import lombok.Data;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;

@Entity
@Table(name = "workflow_executions")
@Data
public class WorkflowExecution {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "workflow_id", nullable = false)
    private UUID workflowId;

    @Column(name = "thread_id")
    private String threadId;

    @Enumerated(EnumType.STRING)
    private ExecutionStatus status = ExecutionStatus.PENDING;

    // Event snapshot the run is evaluated against
    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "trigger_data")
    private TriggerContext triggerData;

    @Column(name = "trigger_node_id")
    private String triggerNodeId;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "node_results")
    private Map<String, NodeExecutionResult> nodeResults;

    @Column(columnDefinition = "text")
    private String error;

    @Column(name = "started_at")
    private Instant startedAt = Instant.now();

    @Column(name = "completed_at")
    private Instant completedAt;

    @Column(name = "updated_at")
    private Instant updatedAt = Instant.now();

    @PreUpdate
    public void onUpdate() {
        updatedAt = Instant.now();
    }
}
