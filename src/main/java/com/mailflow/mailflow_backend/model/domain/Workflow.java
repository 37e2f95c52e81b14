package com.mailflow.mailflow_backend.model.domain;

import com.mailflow.mailflow_backend.model.dto.WorkflowConnections;
import jakarta.persistence.*;
import lombok.Data;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

@Entity
@Table(name = "workflows")
@Data
public class Workflow {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "user_id", nullable = false)
    private String userId;

    /** Mail connection the workflow listens on. Null means every connection of the user. */
    @Column(name = "connection_id")
    private String connectionId;

    @Column(nullable = false)
    private String name;

    private String description;

    @Column(nullable = false)
    private boolean enabled = true;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "nodes")
    private List<WorkflowNode> nodes = new ArrayList<>();

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "connections")
    private WorkflowConnections connections = new WorkflowConnections();

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "settings")
    private WorkflowSettings settings;

    @Column(name = "created_at")
    private Instant createdAt = Instant.now();

    @Column(name = "updated_at")
    private Instant updatedAt = Instant.now();

    @PreUpdate
    public void onUpdate() {
        updatedAt = Instant.now();
    }
}
