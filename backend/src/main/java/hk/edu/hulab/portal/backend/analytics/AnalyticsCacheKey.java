package hk.edu.hulab.portal.backend.analytics;

/**
 * @param subjectKey agent e-mail, project id or {@code all}
 */
record AnalyticsCacheKey(String metricSet, String subjectKey, String timeRangeKey) {
}
