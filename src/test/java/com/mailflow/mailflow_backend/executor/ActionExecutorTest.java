package com.mailflow.mailflow_backend.executor;

import com.mailflow.mailflow_backend.executor.action.AddLabelAction;
import com.mailflow.mailflow_backend.executor.action.ArchiveAction;
import com.mailflow.mailflow_backend.executor.action.GenerateDraftAction;
import com.mailflow.mailflow_backend.executor.action.MarkReadAction;
import com.mailflow.mailflow_backend.executor.action.MarkUnreadAction;
import com.mailflow.mailflow_backend.executor.action.RemoveLabelAction;
import com.mailflow.mailflow_backend.executor.action.RunSkillAction;
import com.mailflow.mailflow_backend.mail.MailDriver;
import com.mailflow.mailflow_backend.model.domain.LabelInfo;
import com.mailflow.mailflow_backend.model.result.ActionResult;
import com.mailflow.mailflow_backend.model.trigger.TriggerData;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ActionExecutorTest {

    @Mock private MailDriver mailDriver;

    private ActionExecutor executor;
    private ActionContext context;

    @BeforeEach
    void setUp() {
        executor = new ActionExecutor(List.of(
                new MarkReadAction(), new MarkUnreadAction(), new ArchiveAction(),
                new AddLabelAction(), new RemoveLabelAction(),
                new GenerateDraftAction(), new RunSkillAction()));
        context = ActionContext.builder()
                .connectionId("conn-1")
                .triggerData(TriggerData.builder().threadId("thread-1").build())
                .mailDriver(mailDriver)
                .build();
    }

    private ActionContext dryRun() {
        return context.toBuilder().dryRun(true).build();
    }

    @Nested
    @DisplayName("Mailbox actions")
    class Mailbox {

        @Test
        void markReadRemovesUnread() {
            ActionResult result = executor.execute("mark_read", context, Map.of());

            assertThat(result.isSuccess()).isTrue();
            verify(mailDriver).modifyThread("thread-1", List.of(), List.of("UNREAD"));
        }

        @Test
        void markUnreadAddsUnread() {
            executor.execute("mark_unread", context, Map.of());
            verify(mailDriver).modifyThread("thread-1", List.of("UNREAD"), List.of());
        }

        @Test
        void archiveRemovesInbox() {
            executor.execute("archive", context, Map.of());
            verify(mailDriver).modifyThread("thread-1", List.of(), List.of("INBOX"));
        }

        @Test
        void addLabelResolvesTheNameIgnoringCase() {
            when(mailDriver.getLabels()).thenReturn(List.of(
                    new LabelInfo("Label_1", "Work"), new LabelInfo("Label_2", "Receipts")));

            ActionResult result = executor.execute("add_label", context, Map.of("label", "receipts"));

            assertThat(result.isSuccess()).isTrue();
            assertThat(result.getOutput()).isEqualTo(Map.of("labelId", "Label_2"));
            verify(mailDriver).modifyThread("thread-1", List.of("Label_2"), List.of());
        }

        @Test
        void removeLabelUsesTheResolvedId() {
            when(mailDriver.getLabels()).thenReturn(List.of(new LabelInfo("Label_1", "Work")));

            executor.execute("remove_label", context, Map.of("label", "Work"));

            verify(mailDriver).modifyThread("thread-1", List.of(), List.of("Label_1"));
        }

        @Test
        void unknownLabelFails() {
            when(mailDriver.getLabels()).thenReturn(List.of(new LabelInfo("Label_1", "Work")));

            ActionResult result = executor.execute("add_label", context, Map.of("label", "Travel"));

            assertThat(result.isSuccess()).isFalse();
            assertThat(result.getError()).isEqualTo("Label 'Travel' not found");
        }

        @Test
        void driverExceptionsBecomeFailures() {
            doThrow(new IllegalStateException("token expired"))
                    .when(mailDriver).modifyThread("thread-1", List.of(), List.of("INBOX"));

            ActionResult result = executor.execute("archive", context, Map.of());

            assertThat(result.isSuccess()).isFalse();
            assertThat(result.getError()).isEqualTo("token expired");
        }
    }

    @Nested
    @DisplayName("Dry run")
    class DryRun {

        @Test
        void describesWithoutTouchingTheMailbox() {
            assertThat(executor.execute("mark_read", dryRun(), Map.of()).getOutput()).isEqualTo("Would mark as read");
            assertThat(executor.execute("mark_unread", dryRun(), Map.of()).getOutput()).isEqualTo("Would mark as unread");
            assertThat(executor.execute("archive", dryRun(), Map.of()).getOutput()).isEqualTo("Would archive");
            assertThat(executor.execute("add_label", dryRun(), Map.of("label", "Work")).getOutput())
                    .isEqualTo("Would add label: Work");
            assertThat(executor.execute("remove_label", dryRun(), Map.of("label", "Work")).getOutput())
                    .isEqualTo("Would remove label: Work");

            ActionResult result = executor.execute("archive", dryRun(), Map.of());
            assertThat(result.isSuccess()).isTrue();
            assertThat(result.getDryRun()).isTrue();
            verifyNoInteractions(mailDriver);
        }

        @Test
        void describesSkillActions() {
            assertThat(executor.execute("generate_draft", dryRun(), Map.of()).getOutput())
                    .isEqualTo("Would generate draft using skill: default");
            assertThat(executor.execute("generate_draft", dryRun(), Map.of("skillId", "polite-reply")).getOutput())
                    .isEqualTo("Would generate draft using skill: polite-reply");
            assertThat(executor.execute("run_skill", dryRun(), Map.of("skillId", "summarize")).getOutput())
                    .isEqualTo("Would run skill: summarize");
        }
    }

    @Test
    void skillActionsAreNotImplementedYet() {
        assertThat(executor.execute("generate_draft", context, Map.of()).getError())
                .isEqualTo("Generate draft action not yet implemented");
        assertThat(executor.execute("run_skill", context, Map.of("skillId", "x")).getError())
                .isEqualTo("Run skill action not yet implemented");
    }

    @Test
    void unknownActionTypeFailsEvenInDryRun() {
        assertThat(executor.execute("teleport", context, Map.of()).getError()).isEqualTo("Unknown action type: teleport");
        assertThat(executor.execute("teleport", dryRun(), Map.of()).getError()).isEqualTo("Unknown action type: teleport");
        assertThat(executor.execute("sender_match", context, Map.of()).isSuccess()).isFalse();
    }
}
