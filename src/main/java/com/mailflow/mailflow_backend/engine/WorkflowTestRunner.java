package com.mailflow.mailflow_backend.engine;

import com.mailflow.mailflow_backend.config.MailflowProperties;
import com.mailflow.mailflow_backend.executor.ActionContext;
import com.mailflow.mailflow_backend.mail.UnavailableMailDriver;
import com.mailflow.mailflow_backend.model.domain.NodeCategory;
import com.mailflow.mailflow_backend.model.domain.WorkflowNode;
import com.mailflow.mailflow_backend.model.result.TestWorkflowResult;
import com.mailflow.mailflow_backend.model.trigger.TriggerData;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;

/**
 * Walks an unsaved workflow against a sample event. Actions run in dry-run mode and nothing
 * is persisted.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class WorkflowTestRunner {

    private final BranchWalker       branchWalker;
    private final MailflowProperties properties;

    public TestWorkflowResult testWorkflow(TestWorkflowOptions options) {
        List<WorkflowNode> nodes = options.nodes() != null ? options.nodes() : List.of();
        WorkflowNode trigger = nodes.stream()
                .filter(n -> n.getCategory() == NodeCategory.TRIGGER)
                .findFirst()
                .orElse(null);
        if (trigger == null) {
            return new TestWorkflowResult(false, Map.of(), List.of(), "No trigger found in workflow");
        }

        TriggerData triggerData = TriggerData.from(options.triggerContext());
        ActionContext actionContext = ActionContext.builder()
                .connectionId(options.connectionId())
                .triggerData(triggerData)
                .dryRun(true)
                .envVars(options.envVars() != null ? options.envVars() : properties.getEnv())
                .mailDriver(new UnavailableMailDriver("Dry runs do not reach the mailbox"))
                .build();

        ExecutionRun run = new ExecutionRun(nodes, options.connections(), triggerData, actionContext,
                options.userId(), NodeListener.NONE);
        try {
            branchWalker.walk(run, trigger.getId()).join();
            return new TestWorkflowResult(true, run.orderedResults(), run.executionPath(), null);
        } catch (Exception e) {
            String error = BranchWalker.messageOf(e);
            log.error("[WorkflowTestRunner] Test run failed: {}", error, e);
            return new TestWorkflowResult(false, run.orderedResults(), run.executionPath(), error);
        }
    }
}
