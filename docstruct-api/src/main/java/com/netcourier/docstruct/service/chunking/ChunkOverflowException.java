package com.netcourier.docstruct.service.chunking;

import com.netcourier.docstruct.model.ChunkOverflow;

/**
 * Raised when a unit that must not be split (a table row) is larger than the token budget on its own.
 */
public class ChunkOverflowException extends RuntimeException {

    private static final int PREVIEW_LENGTH = 80;

    private final int unitIndex;
    private final int estimatedTokens;
    private final int tokenBudget;
    private final String unitText;

    public ChunkOverflowException(int unitIndex, int estimatedTokens, int tokenBudget, String unitText) {
        super("Unit " + unitIndex + " needs " + estimatedTokens + " tokens but the budget is " + tokenBudget);
        this.unitIndex = unitIndex;
        this.estimatedTokens = estimatedTokens;
        this.tokenBudget = tokenBudget;
        this.unitText = unitText == null ? "" : unitText;
    }

    public int unitIndex() {
        return unitIndex;
    }

    public int estimatedTokens() {
        return estimatedTokens;
    }

    public int tokenBudget() {
        return tokenBudget;
    }

    public ChunkOverflow toOverflow() {
        String preview = unitText.length() <= PREVIEW_LENGTH
                ? unitText
                : unitText.substring(0, PREVIEW_LENGTH - 3) + "...";
        return new ChunkOverflow(unitIndex, estimatedTokens, tokenBudget, preview);
    }
}
