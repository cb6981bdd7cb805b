package com.hybridsearch.model;

/**
 * Outcome of the semantic initialization step. Ranking consults this instead of probing the
 * embedding model per request.
 */
public record SemanticCapability(
    boolean available,
    String reason
) {
    public static SemanticCapability ready() {
        return new SemanticCapability(true, "ready");
    }

    public static SemanticCapability unavailable(String reason) {
        return new SemanticCapability(false, reason);
    }
}
