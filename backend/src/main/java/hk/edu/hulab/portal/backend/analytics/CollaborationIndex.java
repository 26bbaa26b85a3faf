package hk.edu.hulab.portal.backend.analytics;

/**
 * @param score          share of collaboration statements in the window, 0 to 100
 * @param interactions   number of collaborated, shared and commented statements
 * @param uniquePartners distinct team members seen on those statements
 */
public record CollaborationIndex(double score, long interactions, int uniquePartners) {
}
