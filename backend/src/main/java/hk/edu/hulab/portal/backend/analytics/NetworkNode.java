package hk.edu.hulab.portal.backend.analytics;

/**
 * @param centrality degree divided by the number of other nodes
 */
public record NetworkNode(String id, long activityCount, int degree, double centrality) {
}
