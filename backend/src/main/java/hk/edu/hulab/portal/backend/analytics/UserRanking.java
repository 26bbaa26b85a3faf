package hk.edu.hulab.portal.backend.analytics;

public record UserRanking(int rank, String user, long activities) {
}
