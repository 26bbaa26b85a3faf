package hk.edu.hulab.portal.backend.analytics;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record AnalyticsHealth(String status, String state, long cacheSize, String error, Instant timestamp) {
}
