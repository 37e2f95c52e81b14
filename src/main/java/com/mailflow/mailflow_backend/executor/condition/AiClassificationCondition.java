package com.mailflow.mailflow_backend.executor.condition;

import com.mailflow.mailflow_backend.config.AsyncConfig;
import com.mailflow.mailflow_backend.executor.llm.AiClientResolver;
import com.mailflow.mailflow_backend.executor.llm.TextCompletion;
import com.mailflow.mailflow_backend.model.params.AiClassificationParams;
import com.mailflow.mailflow_backend.model.result.ConditionResult;
import com.mailflow.mailflow_backend.model.trigger.TriggerData;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * ai_classification: asks the user's LLM to pick one of the configured categories.
 *
 * The result always passes. Category N routes to output port N; no match, a missing user
 * or any provider error routes to port categories.size(), the trailing "other" port.
 */
@Slf4j
@Component
public class AiClassificationCondition {

    public static final String OTHER = "other";

    private final AiClientResolver clientResolver;
    private final Executor         executor;

    public AiClassificationCondition(AiClientResolver clientResolver,
                                     @Qualifier(AsyncConfig.WORKFLOW_EXECUTOR) Executor executor) {
        this.clientResolver = clientResolver;
        this.executor = executor;
    }

    public CompletableFuture<ConditionResult> classify(TriggerData triggerData,
                                                       AiClassificationParams params,
                                                       String userId) {
        List<String> categories = params.categories();
        if (userId == null || userId.isBlank()) {
            log.warn("[AIClassification] Missing userId, routing to \"{}\"", OTHER);
            return CompletableFuture.completedFuture(other(categories));
        }

        return CompletableFuture
                .supplyAsync(() -> {
                    TextCompletion completion = clientResolver.resolve(userId);
                    String answer = completion.complete(systemPrompt(categories), userPrompt(triggerData));
                    return route(answer, categories);
                }, executor)
                .exceptionally(ex -> {
                    Throwable cause = ex.getCause() != null ? ex.getCause() : ex;
                    log.error("[AIClassification] Error: {}", cause.getMessage(), cause);
                    return other(categories);
                });
    }

    static ConditionResult route(String answer, List<String> categories) {
        String category = answer != null ? answer.trim().toLowerCase() : "";
        for (int i = 0; i < categories.size(); i++) {
            if (categories.get(i).toLowerCase().equals(category)) {
                log.info("[AIClassification] Classified as \"{}\" (outputIndex: {})", categories.get(i), i);
                return ConditionResult.routed(i, categories.get(i));
            }
        }
        log.info("[AIClassification] Classified as \"{}\" (outputIndex: {})", OTHER, categories.size());
        return other(categories);
    }

    static String systemPrompt(List<String> categories) {
        return "You are an email classifier. Classify the email into exactly one of these categories: "
                + String.join(", ", categories) + ", or \"other\" if none fit well.\n"
                + "\n"
                + "Rules:\n"
                + "- Output ONLY the category name, nothing else\n"
                + "- Use lowercase\n"
                + "- If the email clearly fits one category, choose it\n"
                + "- If unsure or no good fit, output \"other\"";
    }

    static String userPrompt(TriggerData data) {
        return "Subject: " + orDefault(data.subject(), "(no subject)") + "\n"
                + "From: " + orDefault(data.sender(), "(unknown sender)") + "\n"
                + "Body: " + orDefault(data.snippet(), "(no content)");
    }

    private static ConditionResult other(List<String> categories) {
        return ConditionResult.routed(categories.size(), OTHER);
    }

    private static String orDefault(String value, String fallback) {
        return value == null || value.isEmpty() ? fallback : value;
    }
}
