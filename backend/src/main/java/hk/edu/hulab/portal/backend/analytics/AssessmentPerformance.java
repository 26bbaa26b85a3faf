package hk.edu.hulab.portal.backend.analytics;

/**
 * @param averageScaledScore mean of {@code result.score.scaled}, null when no statement carried a score
 */
public record AssessmentPerformance(long assessed, long completed, long passed, Double averageScaledScore) {
}
