package hk.edu.hulab.portal.backend.analytics;

public record UserCollaborationMetrics(long collaborations, long shares, long comments, int uniquePartners) {
}
