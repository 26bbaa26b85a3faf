package hk.edu.hulab.portal.backend.analytics;

public record VerbCount(String verb, long count) {
}
