package com.mailflow.mailflow_backend.model.llm;

/**
 * Provider-agnostic response returned by every LlmClient.
 */
public class LlmResponse {

    private boolean success;
    private String  rawText;       // exact text the model returned
    private String  errorMessage;  // populated if success = false
    private int     inputTokens;
    private int     outputTokens;
    private String  model;         // model the provider reports, may differ from the requested one

    public LlmResponse() {}

    public static LlmResponse ok(String rawText, String model, int in, int out) {
        LlmResponse r = new LlmResponse();
        r.success      = true;
        r.rawText      = rawText;
        r.model        = model;
        r.inputTokens  = in;
        r.outputTokens = out;
        return r;
    }

    public static LlmResponse error(String message) {
        LlmResponse r = new LlmResponse();
        r.success      = false;
        r.errorMessage = message;
        return r;
    }

    public boolean isSuccess()           { return success; }
    public String getRawText()           { return rawText; }
    public String getErrorMessage()      { return errorMessage; }
    public int getInputTokens()          { return inputTokens; }
    public int getOutputTokens()         { return outputTokens; }
    public String getModel()             { return model; }

    public void setSuccess(boolean b)    { this.success = b; }
    public void setRawText(String s)     { this.rawText = s; }
    public void setErrorMessage(String s){ this.errorMessage = s; }
    public void setInputTokens(int n)    { this.inputTokens = n; }
    public void setOutputTokens(int n)   { this.outputTokens = n; }
    public void setModel(String m)       { this.model = m; }
}
