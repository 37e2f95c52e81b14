package com.mailflow.mailflow_backend.model.domain;

/**
 * LLM providers the AI classification condition can talk to.
 * Each provider maps to a concrete LlmClient implementation.
 */
public enum LlmProvider {

    ANTHROPIC("Anthropic Claude",  "https://api.anthropic.com/v1/messages"),
    OPENAI("OpenAI GPT",           "https://api.openai.com/v1/chat/completions"),
    GEMINI("Google Gemini",        "https://generativelanguage.googleapis.com/v1beta/models/{model}:generateContent"),
    GROQ("Groq",                   "https://api.groq.com/openai/v1/chat/completions"),
    MISTRAL("Mistral AI",          "https://api.mistral.ai/v1/chat/completions"),
    CUSTOM("Custom / Self-hosted", "");  // endpoint comes from the config row

    private final String displayName;
    private final String defaultEndpoint;

    LlmProvider(String displayName, String defaultEndpoint) {
        this.displayName     = displayName;
        this.defaultEndpoint = defaultEndpoint;
    }

    public String getDisplayName()     { return displayName; }
    public String getDefaultEndpoint() { return defaultEndpoint; }
}
