package com.privatedocs.qa.service.synthesis;

import com.privatedocs.qa.model.RetrievedChunk;

import java.util.ArrayList;
import java.util.List;

public class ContextBudgetGuard {

    private final int maxChars;

    public ContextBudgetGuard(int maxChars) {
        this.maxChars = maxChars;
    }

    /**
     * Keeps whole chunks in rank order until the next one would exceed the budget.
     */
    public GuardedChunks enforce(List<RetrievedChunk> chunks) {
        if (chunks == null || chunks.isEmpty()) {
            return new GuardedChunks(List.of(), false);
        }
        int budget = maxChars;
        List<RetrievedChunk> accepted = new ArrayList<>();
        boolean truncated = false;
        for (RetrievedChunk chunk : chunks) {
            int length = chunk.text() == null ? 0 : chunk.text().length();
            if (length > budget) {
                truncated = true;
                break;
            }
            budget -= length;
            accepted.add(chunk);
        }
        return new GuardedChunks(List.copyOf(accepted), truncated);
    }

    public record GuardedChunks(List<RetrievedChunk> chunks, boolean truncated) {}
}
