package com.mailflow.mailflow_backend.engine;

import com.mailflow.mailflow_backend.executor.MessageInterpolator;
import com.mailflow.mailflow_backend.model.domain.NodeCategory;
import com.mailflow.mailflow_backend.model.domain.WorkflowNode;
import com.mailflow.mailflow_backend.model.dto.WorkflowConnections;
import com.mailflow.mailflow_backend.model.dto.WorkflowDefinitionNode;
import com.mailflow.mailflow_backend.model.result.ParsedNodeType;
import com.mailflow.mailflow_backend.model.result.ValidationResult;
import com.mailflow.mailflow_backend.model.trigger.TriggerData;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

class WorkflowEngineTest {

    private WorkflowEngine engine;

    @BeforeEach
    void setUp() {
        engine = new WorkflowEngine(new MessageInterpolator());
    }

    private static WorkflowDefinitionNode node(String id, String type, Map<String, Object> parameters) {
        return new WorkflowDefinitionNode(id, null, type, 1, List.of(0.0, 0.0), parameters, null);
    }

    private static WorkflowDefinitionNode disabled(String id, String type, Map<String, Object> parameters) {
        return new WorkflowDefinitionNode(id, id, type, 1, List.of(0.0, 0.0), parameters, true);
    }

    @Nested
    @DisplayName("parseNodeType")
    class ParseNodeType {

        @Test
        void resolvesKnownQualifiedNames() {
            assertThat(engine.parseNodeType("zero:emailReceived"))
                    .isEqualTo(new ParsedNodeType(NodeCategory.TRIGGER, "email_received"));
            assertThat(engine.parseNodeType("zero:aiClassification"))
                    .isEqualTo(new ParsedNodeType(NodeCategory.CONDITION, "ai_classification"));
            assertThat(engine.parseNodeType("zero:sendNotification"))
                    .isEqualTo(new ParsedNodeType(NodeCategory.ACTION, "send_notification"));
        }

        @Test
        void unknownTypeIsNotAnError() {
            assertThat(engine.parseNodeType("zero:teleport"))
                    .isEqualTo(new ParsedNodeType(NodeCategory.UNKNOWN, "zero:teleport"));
        }

        @Test
        void categoryPredicatesFollowTheTable() {
            assertThat(engine.isTriggerNode("zero:schedule")).isTrue();
            assertThat(engine.isConditionNode("zero:labelMatch")).isTrue();
            assertThat(engine.isActionNode("zero:archive")).isTrue();
            assertThat(engine.isActionNode("zero:labelMatch")).isFalse();
        }
    }

    @Nested
    @DisplayName("getExecutionOrder")
    class ExecutionOrder {

        @Test
        @DisplayName("every edge between active nodes points forward in the order")
        void ordersDiamondTopologically() {
            List<WorkflowDefinitionNode> nodes = List.of(
                    node("t", "zero:emailReceived", Map.of()),
                    node("a", "zero:markRead", Map.of()),
                    node("b", "zero:archive", Map.of()),
                    node("join", "zero:markUnread", Map.of()));
            WorkflowConnections connections = new WorkflowConnections()
                    .connect("t", 0, "a")
                    .connect("t", 0, "b")
                    .connect("a", 0, "join")
                    .connect("b", 0, "join");

            List<String> order = engine.getExecutionOrder(nodes, connections);

            assertThat(order).containsExactly("t", "a", "b", "join");
        }

        @Test
        void disabledNodesAndTheirEdgesAreIgnored() {
            List<WorkflowDefinitionNode> nodes = List.of(
                    node("t", "zero:emailReceived", Map.of()),
                    disabled("off", "zero:markRead", Map.of()),
                    node("after", "zero:archive", Map.of()));
            WorkflowConnections connections = new WorkflowConnections()
                    .connect("t", 0, "off")
                    .connect("off", 0, "after")
                    .connect("ghost", 0, "after");

            assertThat(engine.getExecutionOrder(nodes, connections)).containsExactly("t", "after");
        }

        @Test
        void nodesOnACycleAreLeftOut() {
            List<WorkflowDefinitionNode> nodes = List.of(
                    node("t", "zero:emailReceived", Map.of()),
                    node("x", "zero:markRead", Map.of()),
                    node("y", "zero:archive", Map.of()));
            WorkflowConnections connections = new WorkflowConnections()
                    .connect("x", 0, "y")
                    .connect("y", 0, "x");

            assertThat(engine.getExecutionOrder(nodes, connections)).containsExactly("t");
        }
    }

    @Nested
    @DisplayName("validateWorkflow")
    class Validate {

        @Test
        void validWorkflowHasNoErrors() {
            List<WorkflowDefinitionNode> nodes = List.of(
                    node("t", "zero:emailReceived", Map.of()),
                    node("c", "zero:senderMatch", Map.of("pattern", "*@github.com")),
                    node("a", "zero:markRead", Map.of()));
            WorkflowConnections connections = new WorkflowConnections()
                    .connect("t", 0, "c")
                    .connect("c", 0, "a");

            ValidationResult result = engine.validateWorkflow(nodes, connections);

            assertThat(result.valid()).isTrue();
            assertThat(result.errors()).isEmpty();
            assertThat(result.warnings()).isEmpty();
        }

        @Test
        void missingTriggerIsAlwaysAnError() {
            ValidationResult result = engine.validateWorkflow(
                    List.of(node("a", "zero:markRead", Map.of())), new WorkflowConnections());

            assertThat(result.valid()).isFalse();
            assertThat(result.errors()).contains("Workflow must have at least one trigger node");
        }

        @Test
        void reportsMissingTargetsUnknownSourcesAndOrphans() {
            List<WorkflowDefinitionNode> nodes = List.of(
                    node("t", "zero:emailReceived", Map.of()),
                    node("lonely", "zero:archive", Map.of()),
                    disabled("parked", "zero:markRead", Map.of()));
            WorkflowConnections connections = new WorkflowConnections()
                    .connect("t", 0, "nowhere")
                    .connect("ghost", 0, "t");

            ValidationResult result = engine.validateWorkflow(nodes, connections);

            assertThat(result.errors()).containsExactlyInAnyOrder(
                    "Connection target 'nowhere' does not exist",
                    "Node 'lonely' is orphaned/unreachable");
            assertThat(result.warnings()).containsExactly("Connection source 'ghost' does not exist");
        }

        @Test
        void rejectsUnknownTypesAndBadParameters() {
            List<WorkflowDefinitionNode> nodes = List.of(
                    node("t", "zero:emailReceived", Map.of()),
                    node("c", "zero:labelMatch", Map.of("labels", List.of(), "mode", "most")),
                    node("x", "zero:teleport", Map.of()));
            WorkflowConnections connections = new WorkflowConnections()
                    .connect("t", 0, "c")
                    .connect("c", 0, "x");

            ValidationResult result = engine.validateWorkflow(nodes, connections);

            assertThat(result.errors()).containsExactlyInAnyOrder(
                    "Node 'c': labels must not be empty",
                    "Node 'c': mode must be 'any' or 'all'",
                    "Node 'x' has unknown type 'zero:teleport'");
        }
    }

    @Test
    void convertsDefinitionsToInternalNodes() {
        List<WorkflowNode> nodes = engine.convertDefinitionToInternal(List.of(
                node("c1", "zero:subjectMatch", Map.of("pattern", "Invoice*")),
                disabled("a1", "zero:archive", null)));

        assertThat(nodes).hasSize(2);
        WorkflowNode condition = nodes.get(0);
        assertThat(condition.getCategory()).isEqualTo(NodeCategory.CONDITION);
        assertThat(condition.getNodeType()).isEqualTo("subject_match");
        assertThat(condition.getName()).isEqualTo("c1");
        assertThat(condition.getParameters()).containsEntry("pattern", "Invoice*");
        assertThat(nodes.get(1).isDisabled()).isTrue();
        assertThat(nodes.get(1).getParameters()).isEmpty();
    }

    @Test
    void downstreamNodesAreFoundBreadthFirstOverEveryPort() {
        WorkflowConnections connections = new WorkflowConnections()
                .connect("ai", 0, "urgent")
                .connect("ai", 1, "other")
                .connect("urgent", 0, "notify")
                .connect("other", 0, "missing");

        List<String> downstream = engine.getDownstreamNodes("ai", connections,
                Set.of("ai", "urgent", "other", "notify"));

        assertThat(downstream).containsExactly("urgent", "other", "notify");
    }

    @Test
    void interpolatesTriggerAndEnvTokens() {
        TriggerData data = TriggerData.builder().subject("Build failed").sender("ci@github.com").build();

        String message = engine.interpolateMessage(
                "{{$trigger.subject}} from {{$trigger.sender}} [{{$env.TEAM}}] {{$env.MISSING}}{{$foo.bar}}",
                data, Map.of("TEAM", "infra"));

        assertThat(message).isEqualTo("Build failed from ci@github.com [infra] ");
    }
}
