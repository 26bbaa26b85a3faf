package hk.edu.hulab.portal.backend.controller;

import hk.edu.hulab.portal.backend.analytics.AnalyticsAggregator;
import hk.edu.hulab.portal.backend.analytics.AnalyticsHealth;
import hk.edu.hulab.portal.backend.analytics.AnalyticsOptions;
import hk.edu.hulab.portal.backend.analytics.CollaborationAnalytics;
import hk.edu.hulab.portal.backend.analytics.OverviewMetrics;
import hk.edu.hulab.portal.backend.analytics.RealtimeMetrics;
import hk.edu.hulab.portal.backend.analytics.UserAnalytics;
import hk.edu.hulab.portal.backend.config.PortalPrincipal;
import hk.edu.hulab.portal.backend.exception.PermissionDeniedException;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.*;

import java.util.Map;

@RestController
@RequestMapping("/api/analytics")
@Tag(name = "Analytics", description = "Time-windowed learning analytics")
public class AnalyticsController {

    private final AnalyticsAggregator analyticsAggregator;

    public AnalyticsController(AnalyticsAggregator analyticsAggregator) {
        this.analyticsAggregator = analyticsAggregator;
    }

    @GetMapping("/dashboard")
    @Operation(summary = "Dashboard overview", description = "Platform-wide for admins, otherwise the caller's own activity")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Overview computed"),
            @ApiResponse(responseCode = "400", description = "Unknown time range"),
            @ApiResponse(responseCode = "504", description = "Scan timed out")
    })
    public ResponseEntity<OverviewMetrics> dashboard(
            @AuthenticationPrincipal PortalPrincipal principal,
            @Parameter(description = "Time range preset, default last30days") @RequestParam(required = false) String timeRange) {

        String subject = principal.isAdmin() ? null : principal.email();
        return ResponseEntity.ok(analyticsAggregator.overview(subject, timeRange));
    }

    @GetMapping("/user")
    @Operation(summary = "User analytics", description = "Admins may ask for another user")
    public ResponseEntity<UserAnalytics> user(
            @AuthenticationPrincipal PortalPrincipal principal,
            @RequestParam(required = false) String email,
            @RequestParam(required = false) String timeRange) {

        String subject = email == null || email.isBlank() ? principal.email() : email;
        if (!subject.equalsIgnoreCase(principal.email()) && !principal.isAdmin()) {
            throw new PermissionDeniedException("Only admins can view another user's analytics");
        }
        return ResponseEntity.ok(analyticsAggregator.userAnalytics(subject, timeRange));
    }

    @GetMapping("/collaboration")
    @Operation(summary = "Collaboration analytics")
    public ResponseEntity<CollaborationAnalytics> collaboration(
            @RequestParam(required = false) String timeRange,
            @RequestParam(required = false) String projectId) {

        return ResponseEntity.ok(analyticsAggregator.collaborationAnalytics(timeRange, projectId));
    }

    @GetMapping("/realtime")
    @Operation(summary = "Realtime activity", description = "Admins, educators and instructors only")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Metrics over the last minutes"),
            @ApiResponse(responseCode = "400", description = "Window outside 1 to 1440 minutes"),
            @ApiResponse(responseCode = "403", description = "Caller may not monitor the platform")
    })
    public ResponseEntity<RealtimeMetrics> realtime(
            @Parameter(description = "Window length in minutes, default 5") @RequestParam(required = false) Integer windowMinutes) {

        return ResponseEntity.ok(analyticsAggregator.realtime(windowMinutes));
    }

    @GetMapping("/options")
    @Operation(summary = "Available options", description = "Metric sets, time range presets and cache info")
    public ResponseEntity<AnalyticsOptions> options() {
        return ResponseEntity.ok(analyticsAggregator.availableOptions());
    }

    @DeleteMapping("/cache")
    @Operation(summary = "Clear cache", description = "Admin only")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Cache cleared"),
            @ApiResponse(responseCode = "403", description = "Caller is not an admin")
    })
    public ResponseEntity<Map<String, Object>> clearCache() {
        return ResponseEntity.ok(analyticsAggregator.clearCache());
    }

    @GetMapping("/health")
    @Operation(summary = "Analytics health")
    public ResponseEntity<AnalyticsHealth> health() {
        AnalyticsHealth health = analyticsAggregator.health();
        HttpStatus status = "healthy".equals(health.status()) ? HttpStatus.OK : HttpStatus.SERVICE_UNAVAILABLE;
        return ResponseEntity.status(status).body(health);
    }
}
