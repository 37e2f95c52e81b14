package com.mailflow.mailflow_backend.service;

import com.mailflow.mailflow_backend.config.MailflowProperties;
import com.mailflow.mailflow_backend.repository.WorkflowExecutionRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;

/** Deletes execution records older than mailflow.executions.retention-days. */
@Slf4j
@Component
@RequiredArgsConstructor
public class ExecutionCleanupJob {

    private final WorkflowExecutionRepository executionRepository;
    private final MailflowProperties          properties;

    @Scheduled(cron = "${mailflow.executions.cleanup-cron:0 30 3 * * *}")
    public void scheduledCleanup() {
        deleteExpired(Instant.now());
    }

    public long deleteExpired(Instant now) {
        int retentionDays = properties.getExecutions().getRetentionDays();
        Instant cutoff = now.minus(Duration.ofDays(retentionDays));
        long deleted = executionRepository.deleteByStartedAtBefore(cutoff);
        log.info("[ExecutionCleanup] Deleted {} execution(s) started before {} ({} day retention)",
                deleted, cutoff, retentionDays);
        return deleted;
    }
}
