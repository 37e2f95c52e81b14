package com.mailflow.mailflow_backend.model.domain;

import com.mailflow.mailflow_backend.model.params.AiClassificationParams;
import com.mailflow.mailflow_backend.model.params.EmailLabeledParams;
import com.mailflow.mailflow_backend.model.params.EmailReceivedParams;
import com.mailflow.mailflow_backend.model.params.EmptyParams;
import com.mailflow.mailflow_backend.model.params.GenerateDraftParams;
import com.mailflow.mailflow_backend.model.params.KeywordMatchParams;
import com.mailflow.mailflow_backend.model.params.LabelMatchParams;
import com.mailflow.mailflow_backend.model.params.LabelParams;
import com.mailflow.mailflow_backend.model.params.NodeParameters;
import com.mailflow.mailflow_backend.model.params.PatternParams;
import com.mailflow.mailflow_backend.model.params.RunSkillParams;
import com.mailflow.mailflow_backend.model.params.ScheduleParams;
import com.mailflow.mailflow_backend.model.params.SendNotificationParams;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Every node kind a workflow can contain.
 *
 * The qualified name is what the editor and the import/export format use
 * ("zero:senderMatch"); the internal name is what stored nodes carry in
 * their nodeType field ("sender_match"). Both tables must stay stable.
 */
public enum NodeType {

    // Triggers
    EMAIL_RECEIVED("zero:emailReceived", NodeCategory.TRIGGER, "email_received", EmailReceivedParams.class),
    EMAIL_LABELED("zero:emailLabeled", NodeCategory.TRIGGER, "email_labeled", EmailLabeledParams.class),
    SCHEDULE("zero:schedule", NodeCategory.TRIGGER, "schedule", ScheduleParams.class),

    // Conditions
    SENDER_MATCH("zero:senderMatch", NodeCategory.CONDITION, "sender_match", PatternParams.class),
    SUBJECT_MATCH("zero:subjectMatch", NodeCategory.CONDITION, "subject_match", PatternParams.class),
    LABEL_MATCH("zero:labelMatch", NodeCategory.CONDITION, "label_match", LabelMatchParams.class),
    AI_CLASSIFICATION("zero:aiClassification", NodeCategory.CONDITION, "ai_classification", AiClassificationParams.class),
    KEYWORD_MATCH("zero:keywordMatch", NodeCategory.CONDITION, "keyword_match", KeywordMatchParams.class),

    // Actions
    MARK_READ("zero:markRead", NodeCategory.ACTION, "mark_read", EmptyParams.class),
    MARK_UNREAD("zero:markUnread", NodeCategory.ACTION, "mark_unread", EmptyParams.class),
    ADD_LABEL("zero:addLabel", NodeCategory.ACTION, "add_label", LabelParams.class),
    REMOVE_LABEL("zero:removeLabel", NodeCategory.ACTION, "remove_label", LabelParams.class),
    ARCHIVE("zero:archive", NodeCategory.ACTION, "archive", EmptyParams.class),
    GENERATE_DRAFT("zero:generateDraft", NodeCategory.ACTION, "generate_draft", GenerateDraftParams.class),
    SEND_NOTIFICATION("zero:sendNotification", NodeCategory.ACTION, "send_notification", SendNotificationParams.class),
    RUN_SKILL("zero:runSkill", NodeCategory.ACTION, "run_skill", RunSkillParams.class);

    private static final Map<String, NodeType> BY_QUALIFIED_NAME = new HashMap<>();
    private static final Map<String, NodeType> BY_INTERNAL_NAME = new HashMap<>();

    static {
        for (NodeType type : values()) {
            BY_QUALIFIED_NAME.put(type.qualifiedName, type);
            BY_INTERNAL_NAME.put(type.internalName, type);
        }
    }

    private final String qualifiedName;
    private final NodeCategory category;
    private final String internalName;
    private final Class<? extends NodeParameters> parametersType;

    NodeType(String qualifiedName, NodeCategory category, String internalName,
             Class<? extends NodeParameters> parametersType) {
        this.qualifiedName = qualifiedName;
        this.category = category;
        this.internalName = internalName;
        this.parametersType = parametersType;
    }

    public String getQualifiedName()  { return qualifiedName; }
    public NodeCategory getCategory() { return category; }
    public String getInternalName()   { return internalName; }
    public Class<? extends NodeParameters> getParametersType() { return parametersType; }

    public static Optional<NodeType> fromQualifiedName(String qualifiedName) {
        return Optional.ofNullable(qualifiedName).map(BY_QUALIFIED_NAME::get);
    }

    public static Optional<NodeType> fromInternalName(String internalName) {
        return Optional.ofNullable(internalName).map(BY_INTERNAL_NAME::get);
    }
}
