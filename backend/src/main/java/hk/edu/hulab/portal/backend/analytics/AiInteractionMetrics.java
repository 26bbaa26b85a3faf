package hk.edu.hulab.portal.backend.analytics;

public record AiInteractionMetrics(long queries, long totalTokens, double averageTokensPerQuery,
        Double averageRating) {
}
