package com.mailflow.mailflow_backend.engine;

import com.mailflow.mailflow_backend.config.MailflowProperties;
import com.mailflow.mailflow_backend.executor.llm.AiClientException;
import com.mailflow.mailflow_backend.executor.llm.AiClientResolver;
import com.mailflow.mailflow_backend.mail.MailDriver;
import com.mailflow.mailflow_backend.mail.MailDriverResolver;
import com.mailflow.mailflow_backend.model.domain.ExecutionStatus;
import com.mailflow.mailflow_backend.model.domain.LabelInfo;
import com.mailflow.mailflow_backend.model.domain.Workflow;
import com.mailflow.mailflow_backend.model.domain.WorkflowExecution;
import com.mailflow.mailflow_backend.model.domain.WorkflowNode;
import com.mailflow.mailflow_backend.model.dto.WorkflowConnections;
import com.mailflow.mailflow_backend.model.result.ExecutionResult;
import com.mailflow.mailflow_backend.model.result.NodeExecutionResult;
import com.mailflow.mailflow_backend.model.trigger.Sender;
import com.mailflow.mailflow_backend.model.trigger.ThreadSnapshot;
import com.mailflow.mailflow_backend.model.trigger.TriggerContext;
import com.mailflow.mailflow_backend.model.trigger.TriggerEvent;
import com.mailflow.mailflow_backend.repository.WorkflowExecutionRepository;
import com.mailflow.mailflow_backend.repository.WorkflowRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

import static com.mailflow.mailflow_backend.engine.Nodes.action;
import static com.mailflow.mailflow_backend.engine.Nodes.condition;
import static com.mailflow.mailflow_backend.engine.Nodes.trigger;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class WorkflowExecutorTest {

    private static final UUID EXECUTION_ID = UUID.randomUUID();
    private static final UUID WORKFLOW_ID = UUID.randomUUID();
    private static final String CONNECTION_ID = "conn-1";

    @Mock private WorkflowExecutionRepository executionRepository;
    @Mock private WorkflowRepository workflowRepository;
    @Mock private MailDriverResolver mailDriverResolver;
    @Mock private MailDriver mailDriver;
    @Mock private ExecutionEventPublisher eventPublisher;
    @Mock private AiClientResolver aiClientResolver;

    private WorkflowExecutor executor;
    private WorkflowExecution execution;

    @BeforeEach
    void setUp() {
        executor = new WorkflowExecutor(executionRepository, workflowRepository,
                TestWalkers.branchWalker(aiClientResolver), mailDriverResolver, eventPublisher, new MailflowProperties());

        ThreadSnapshot thread = new ThreadSnapshot("thread-1", "PR merged",
                new Sender("GitHub", "notifications@github.com"),
                List.of(new LabelInfo("INBOX", "Inbox"), new LabelInfo("UNREAD", "Unread")),
                "2024-05-01T10:00:00Z", true, "Your pull request was merged");
        execution = new WorkflowExecution();
        execution.setId(EXECUTION_ID);
        execution.setWorkflowId(WORKFLOW_ID);
        execution.setThreadId("thread-1");
        execution.setTriggerData(TriggerContext.of(TriggerEvent.EMAIL_RECEIVED, thread, null));
    }

    private Workflow workflow(List<WorkflowNode> nodes, WorkflowConnections connections) {
        Workflow workflow = new Workflow();
        workflow.setId(WORKFLOW_ID);
        workflow.setUserId("user-1");
        workflow.setConnectionId(CONNECTION_ID);
        workflow.setName("GitHub triage");
        workflow.setNodes(new ArrayList<>(nodes));
        workflow.setConnections(connections);
        return workflow;
    }

    private void givenWorkflow(Workflow workflow) {
        when(executionRepository.findById(EXECUTION_ID)).thenReturn(Optional.of(execution));
        when(workflowRepository.findById(WORKFLOW_ID)).thenReturn(Optional.of(workflow));
        when(mailDriverResolver.forConnection(CONNECTION_ID)).thenReturn(mailDriver);
    }

    @Nested
    @DisplayName("End-to-end runs")
    class EndToEnd {

        @Test
        @DisplayName("trigger -> sender_match -> mark_read removes UNREAD from the thread")
        void marksMatchingSenderAsRead() {
            givenWorkflow(workflow(
                    List.of(trigger("t", "email_received", Map.of()),
                            condition("c", "sender_match", Map.of("pattern", "*@github.com")),
                            action("a", "mark_read", Map.of())),
                    new WorkflowConnections().connect("t", 0, "c").connect("c", 0, "a")));

            ExecutionResult result = executor.execute(EXECUTION_ID);

            assertThat(result.success()).isTrue();
            assertThat(result.status()).isEqualTo(ExecutionStatus.COMPLETED);
            assertThat(result.nodeResults()).containsOnlyKeys("t", "c", "a");
            assertThat(result.nodeResults().get("a").isPassed()).isTrue();
            verify(mailDriver).modifyThread("thread-1", List.of(), List.of(MailDriver.LABEL_UNREAD));

            assertThat(execution.getStatus()).isEqualTo(ExecutionStatus.COMPLETED);
            assertThat(execution.getNodeResults()).containsOnlyKeys("t", "c", "a");
            assertThat(execution.getCompletedAt()).isNotNull();
            verify(eventPublisher).executionFinished(EXECUTION_ID, ExecutionStatus.COMPLETED, null);
        }

        @Test
        void failedConditionEndsTheBranch() {
            givenWorkflow(workflow(
                    List.of(trigger("t", "email_received", Map.of()),
                            condition("c", "sender_match", Map.of("pattern", "*@gitlab.com")),
                            action("a", "mark_read", Map.of())),
                    new WorkflowConnections().connect("t", 0, "c").connect("c", 0, "a")));

            ExecutionResult result = executor.execute(EXECUTION_ID);

            assertThat(result.status()).isEqualTo(ExecutionStatus.COMPLETED);
            assertThat(result.nodeResults()).containsOnlyKeys("t", "c");
            assertThat(result.nodeResults().get("c").isPassed()).isFalse();
            verify(mailDriver, never()).modifyThread(any(), anyList(), anyList());
        }

        @Test
        void nodeReachableFromTwoBranchesRunsOnce() {
            givenWorkflow(workflow(
                    List.of(trigger("t", "email_received", Map.of()),
                            condition("left", "subject_match", Map.of("pattern", "PR *")),
                            condition("right", "keyword_match", Map.of("keywords", List.of("merged"))),
                            action("join", "archive", Map.of())),
                    new WorkflowConnections()
                            .connect("t", 0, "left").connect("t", 0, "right")
                            .connect("left", 0, "join").connect("right", 0, "join")));

            ExecutionResult result = executor.execute(EXECUTION_ID);

            assertThat(result.nodeResults()).containsOnlyKeys("t", "left", "right", "join");
            verify(mailDriver, times(1)).modifyThread("thread-1", List.of(), List.of(MailDriver.LABEL_INBOX));
        }

        @Test
        void disabledNodeIsSkippedAndTheWalkContinues() {
            WorkflowNode parked = action("parked", "mark_unread", Map.of());
            parked.setDisabled(true);
            givenWorkflow(workflow(
                    List.of(trigger("t", "email_received", Map.of()), parked, action("a", "archive", Map.of())),
                    new WorkflowConnections().connect("t", 0, "parked").connect("parked", 0, "a")));

            ExecutionResult result = executor.execute(EXECUTION_ID);

            NodeExecutionResult skipped = result.nodeResults().get("parked");
            assertThat(skipped.isExecuted()).isFalse();
            assertThat(skipped.isPassed()).isTrue();
            assertThat(result.nodeResults()).containsKey("a");
            verify(mailDriver).modifyThread("thread-1", List.of(), List.of(MailDriver.LABEL_INBOX));
            verify(mailDriver, never()).modifyThread("thread-1", List.of(MailDriver.LABEL_UNREAD), List.of());
        }

        @Test
        void failedActionEndsItsBranchButTheRunCompletes() {
            when(mailDriver.getLabels()).thenReturn(List.of(new LabelInfo("Label_1", "Work")));
            givenWorkflow(workflow(
                    List.of(trigger("t", "email_received", Map.of()),
                            action("label", "add_label", Map.of("label", "Receipts")),
                            action("after", "archive", Map.of())),
                    new WorkflowConnections().connect("t", 0, "label").connect("label", 0, "after")));

            ExecutionResult result = executor.execute(EXECUTION_ID);

            assertThat(result.status()).isEqualTo(ExecutionStatus.COMPLETED);
            assertThat(result.nodeResults().get("label").getError()).isEqualTo("Label 'Receipts' not found");
            assertThat(result.nodeResults()).doesNotContainKey("after");
        }

        @Test
        void unknownCategoryIsRecordedAsNotExecuted() {
            givenWorkflow(workflow(
                    List.of(trigger("t", "email_received", Map.of()),
                            Nodes.node("odd", null, "mystery", Map.of())),
                    new WorkflowConnections().connect("t", 0, "odd")));

            ExecutionResult result = executor.execute(EXECUTION_ID);

            NodeExecutionResult odd = result.nodeResults().get("odd");
            assertThat(odd.isExecuted()).isFalse();
            assertThat(odd.isPassed()).isFalse();
            assertThat(odd.getError()).isEqualTo("Unknown node type: null");
        }
    }

    @Nested
    @DisplayName("AI classification routing")
    class AiRouting {

        private Workflow classifierWorkflow() {
            return workflow(
                    List.of(trigger("t", "email_received", Map.of()),
                            condition("ai", "ai_classification", Map.of("categories", List.of("urgent", "newsletter"))),
                            action("read", "mark_read", Map.of()),
                            action("archive", "archive", Map.of()),
                            action("flag", "mark_unread", Map.of())),
                    new WorkflowConnections()
                            .connect("t", 0, "ai")
                            .connect("ai", 0, "read")
                            .connect("ai", 1, "archive")
                            .connect("ai", 2, "flag"));
        }

        @Test
        void followsThePortOfTheChosenCategory() {
            when(aiClientResolver.resolve("user-1")).thenReturn((system, prompt) -> "  Newsletter \n");
            givenWorkflow(classifierWorkflow());

            ExecutionResult result = executor.execute(EXECUTION_ID);

            NodeExecutionResult ai = result.nodeResults().get("ai");
            assertThat(ai.getOutputIndex()).isEqualTo(1);
            assertThat(ai.getCategory()).isEqualTo("newsletter");
            assertThat(result.nodeResults()).containsOnlyKeys("t", "ai", "archive");
        }

        @Test
        void providerErrorsRouteToOther() {
            when(aiClientResolver.resolve("user-1")).thenThrow(new AiClientException("No AI provider configured"));
            givenWorkflow(classifierWorkflow());

            ExecutionResult result = executor.execute(EXECUTION_ID);

            NodeExecutionResult ai = result.nodeResults().get("ai");
            assertThat(ai.isPassed()).isTrue();
            assertThat(ai.getOutputIndex()).isEqualTo(2);
            assertThat(ai.getCategory()).isEqualTo("other");
            assertThat(result.nodeResults()).containsOnlyKeys("t", "ai", "flag");
        }
    }

    @Nested
    @DisplayName("Record lifecycle")
    class Lifecycle {

        @Test
        void missingExecutionPersistsNothing() {
            when(executionRepository.findById(EXECUTION_ID)).thenReturn(Optional.empty());

            ExecutionResult result = executor.execute(EXECUTION_ID);

            assertThat(result.success()).isFalse();
            assertThat(result.status()).isEqualTo(ExecutionStatus.FAILED);
            assertThat(result.error()).isEqualTo("Execution " + EXECUTION_ID + " not found");
            verify(executionRepository, never()).save(any());
        }

        @Test
        @DisplayName("re-running a terminal execution is a no-op")
        void terminalExecutionIsSkipped() {
            execution.setStatus(ExecutionStatus.COMPLETED);
            when(executionRepository.findById(EXECUTION_ID)).thenReturn(Optional.of(execution));

            ExecutionResult result = executor.execute(EXECUTION_ID);

            assertThat(result.success()).isTrue();
            assertThat(result.skipped()).isTrue();
            assertThat(result.status()).isEqualTo(ExecutionStatus.COMPLETED);
            verifyNoInteractions(workflowRepository, mailDriverResolver);
            verify(executionRepository, never()).save(any());
        }

        @Test
        void missingWorkflowFailsTheRecord() {
            when(executionRepository.findById(EXECUTION_ID)).thenReturn(Optional.of(execution));
            when(workflowRepository.findById(WORKFLOW_ID)).thenReturn(Optional.empty());

            ExecutionResult result = executor.execute(EXECUTION_ID);

            assertThat(result.error()).isEqualTo("Workflow " + WORKFLOW_ID + " not found");
            assertThat(execution.getStatus()).isEqualTo(ExecutionStatus.FAILED);
            assertThat(execution.getError()).isEqualTo(result.error());
        }

        @Test
        void workflowWithoutTriggerFails() {
            when(executionRepository.findById(EXECUTION_ID)).thenReturn(Optional.of(execution));
            when(workflowRepository.findById(WORKFLOW_ID)).thenReturn(Optional.of(
                    workflow(List.of(action("a", "archive", Map.of())), new WorkflowConnections())));

            ExecutionResult result = executor.execute(EXECUTION_ID);

            assertThat(result.error()).isEqualTo("No trigger found in workflow");
            assertThat(execution.getStatus()).isEqualTo(ExecutionStatus.FAILED);
            verifyNoInteractions(mailDriverResolver);
        }

        @Test
        void startsFromTheRecordedTrigger() {
            execution.setTriggerNodeId("second");
            givenWorkflow(workflow(
                    List.of(trigger("first", "email_received", Map.of()),
                            trigger("second", "email_received", Map.of()),
                            action("a", "mark_read", Map.of()),
                            action("b", "archive", Map.of())),
                    new WorkflowConnections().connect("first", 0, "a").connect("second", 0, "b")));

            ExecutionResult result = executor.execute(EXECUTION_ID);

            assertThat(result.nodeResults()).containsOnlyKeys("second", "b");
        }

        @Test
        void fallsBackToTheFirstTriggerWhenTheRecordedOneIsGone() {
            List<WorkflowNode> nodes = List.of(
                    trigger("first", "email_received", Map.of()),
                    trigger("second", "email_received", Map.of()));

            assertThat(WorkflowExecutor.findStartTrigger(nodes, "deleted").getId()).isEqualTo("first");
            assertThat(WorkflowExecutor.findStartTrigger(nodes, null).getId()).isEqualTo("first");
        }

        @Test
        @DisplayName("an error outside node handling fails the run and keeps partial results")
        void fatalErrorKeepsPartialResults() {
            givenWorkflow(workflow(
                    List.of(trigger("t", "email_received", Map.of()),
                            condition("c", "sender_match", Map.of("pattern", "*@github.com")),
                            action("a", "mark_read", Map.of())),
                    new WorkflowConnections().connect("t", 0, "c").connect("c", 0, "a")));
            when(eventPublisher.listenerFor(EXECUTION_ID)).thenReturn(new NodeListener() {
                @Override
                public void nodeStarted(String nodeId) {
                    if (nodeId.equals("a")) {
                        throw new IllegalStateException("broker down");
                    }
                }
            });

            ExecutionResult result = executor.execute(EXECUTION_ID);

            assertThat(result.success()).isFalse();
            assertThat(result.error()).isEqualTo("broker down");
            assertThat(result.nodeResults()).containsOnlyKeys("t", "c");
            assertThat(execution.getStatus()).isEqualTo(ExecutionStatus.FAILED);
            assertThat(execution.getNodeResults()).containsOnlyKeys("t", "c");
            verify(mailDriver, never()).modifyThread(any(), anyList(), anyList());
            verify(eventPublisher).executionFinished(eq(EXECUTION_ID), eq(ExecutionStatus.FAILED), eq("broker down"));
        }
    }
}
