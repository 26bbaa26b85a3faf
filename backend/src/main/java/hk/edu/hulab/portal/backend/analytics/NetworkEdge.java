package hk.edu.hulab.portal.backend.analytics;

/**
 * Undirected edge; {@code source} sorts before {@code target}.
 */
public record NetworkEdge(String source, String target, long weight) {
}
