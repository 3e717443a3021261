package com.privatedocs.qa.service.synthesis;

public record LlmResponse(String answer, String guardrailAction) {
    public static LlmResponse allow(String answer) {
        return new LlmResponse(answer, "ALLOW");
    }

    public boolean blocked() {
        return "BLOCKED".equals(guardrailAction);
    }
}
