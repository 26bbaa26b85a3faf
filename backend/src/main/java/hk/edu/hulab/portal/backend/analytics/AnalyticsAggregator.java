package hk.edu.hulab.portal.backend.analytics;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import hk.edu.hulab.portal.backend.exception.PortalException;
import hk.edu.hulab.portal.backend.exception.ScanTimeoutException;
import hk.edu.hulab.portal.backend.exception.UpstreamException;
import hk.edu.hulab.portal.backend.exception.ValidationException;
import hk.edu.hulab.portal.backend.lrs.EventLogClient;
import hk.edu.hulab.portal.backend.lrs.StatementQuery;
import hk.edu.hulab.portal.backend.model.Actor;
import hk.edu.hulab.portal.backend.model.DocumentType;
import hk.edu.hulab.portal.backend.model.Statement;
import hk.edu.hulab.portal.backend.model.Vocabulary;
import io.github.resilience4j.timelimiter.TimeLimiter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Supplier;
import java.util.stream.Stream;

/**
 * Read-only reporting over the statement stream. Each report is a bounded scan followed by pure
 * reductions in {@link MetricsCalculator}; results are cached per (metric set, subject, time range)
 * for a fixed time-to-live and recomputed on the calling thread after expiry.
 */
@Service
public class AnalyticsAggregator {

    private static final Logger log = LoggerFactory.getLogger(AnalyticsAggregator.class);

    static final String OVERVIEW = "overview";
    static final String USER = "user";
    static final String PROJECT = "project";
    static final String COLLABORATION = "collaboration";
    static final String REALTIME = "realtime";
    private static final String ALL_SUBJECTS = "all";

    static final int DEFAULT_REALTIME_MINUTES = 5;
    static final int MAX_REALTIME_MINUTES = 1440;

    private static final Map<String, String> METRIC_SETS = metricSets();

    public enum State {
        UNINITIALIZED,
        READY
    }

    private final EventLogClient eventLog;
    private final Clock clock;
    private final ExecutorService executor;
    private final TimeLimiter timeLimiter;
    private final int maxEvents;
    private final ZoneId zone;
    private final Duration cacheTtl;
    private final Cache<AnalyticsCacheKey, Object> cache;
    private final AtomicReference<State> state = new AtomicReference<>(State.UNINITIALIZED);

    public AnalyticsAggregator(EventLogClient eventLog,
            Clock clock,
            @Qualifier("analyticsExecutor") ExecutorService executor,
            @Qualifier("analyticsTimeLimiter") TimeLimiter timeLimiter,
            @Value("${portal.analytics.max-events:10000}") int maxEvents,
            @Value("${portal.analytics.cache-ttl-ms:300000}") long cacheTtlMs,
            @Value("${portal.analytics.zone:UTC}") String zone) {
        this.eventLog = eventLog;
        this.clock = clock;
        this.executor = executor;
        this.timeLimiter = timeLimiter;
        this.maxEvents = maxEvents;
        this.zone = ZoneId.of(zone);
        this.cacheTtl = Duration.ofMillis(cacheTtlMs);
        // expiry runs on the injected clock
        this.cache = Caffeine.newBuilder()
                .expireAfterWrite(cacheTtl)
                .ticker(() -> TimeUnit.MILLISECONDS.toNanos(clock.millis()))
                .maximumSize(1_000)
                .build();
    }

    public State getState() {
        return state.get();
    }

    /**
     * Dashboard overview for one agent, or for the whole platform when {@code subject} is null.
     */
    public OverviewMetrics overview(String subject, String preset) {
        TimeRangePreset rangePreset = TimeRangePreset.fromKey(preset);
        String subjectKey = subject == null || subject.isBlank() ? ALL_SUBJECTS : Actor.ofEmail(subject).email();
        return cached(new AnalyticsCacheKey(OVERVIEW, subjectKey, rangePreset.key()), () -> {
            TimeRange range = resolve(rangePreset);
            StatementQuery.StatementQueryBuilder query = window(range);
            if (!ALL_SUBJECTS.equals(subjectKey)) {
                query.agent(subjectKey);
            }
            Scan scan = scan(query.build(), "overview of " + subjectKey);
            List<Statement> statements = scan.statements();
            return OverviewMetrics.builder()
                    .subject(ALL_SUBJECTS.equals(subjectKey) ? null : subjectKey)
                    .totalActivities(statements.size())
                    .uniqueUsers(MetricsCalculator.uniqueUsers(statements))
                    .activeProjects(MetricsCalculator.activeProjects(statements))
                    .completionRate(MetricsCalculator.completionRate(statements))
                    .engagementScore(MetricsCalculator.engagementScore(statements, clock.instant(), zone))
                    .collaborationIndex(MetricsCalculator.collaborationIndex(statements))
                    .topActivities(MetricsCalculator.topActivities(statements, 5))
                    .recentActivities(MetricsCalculator.recentActivities(statements, 10))
                    .timeDistribution(MetricsCalculator.timeDistribution(statements, zone))
                    .userRankings(ALL_SUBJECTS.equals(subjectKey) ? MetricsCalculator.userRankings(statements, 10) : null)
                    .timeRange(range.key())
                    .since(range.since())
                    .until(range.until())
                    .generatedAt(clock.instant())
                    .partial(scan.partial())
                    .build();
        });
    }

    public UserAnalytics userAnalytics(String email, String preset) {
        if (email == null || email.isBlank()) {
            throw new ValidationException("User email is required");
        }
        TimeRangePreset rangePreset = TimeRangePreset.fromKey(preset);
        String subjectKey = Actor.ofEmail(email).email();
        return cached(new AnalyticsCacheKey(USER, subjectKey, rangePreset.key()), () -> {
            TimeRange range = resolve(rangePreset);
            Scan scan = scan(window(range).agent(subjectKey).build(), "user analytics of " + subjectKey);
            List<Statement> statements = scan.statements();
            return UserAnalytics.builder()
                    .user(subjectKey)
                    .timeRange(range.key())
                    .totalActivities(statements.size())
                    .activityBreakdown(MetricsCalculator.activityBreakdown(statements))
                    .collaborationMetrics(MetricsCalculator.userCollaboration(subjectKey, statements))
                    .assessmentPerformance(MetricsCalculator.assessmentPerformance(statements))
                    .aiInteractionMetrics(MetricsCalculator.aiInteraction(statements))
                    .activityPatterns(MetricsCalculator.activityPatterns(statements, zone))
                    .completionRate(MetricsCalculator.completionRate(statements))
                    .engagementScore(MetricsCalculator.engagementScore(statements, clock.instant(), zone))
                    .generatedAt(clock.instant())
                    .partial(scan.partial())
                    .build();
        });
    }

    /**
     * Project report; the preset defaults to {@code all}.
     */
    public ProjectAnalytics projectAnalytics(String projectId, String preset) {
        if (projectId == null || projectId.isBlank()) {
            throw new ValidationException("Project id is required");
        }
        TimeRangePreset rangePreset = preset == null || preset.isBlank()
                ? TimeRangePreset.ALL
                : TimeRangePreset.fromKey(preset);
        return cached(new AnalyticsCacheKey(PROJECT, projectId, rangePreset.key()), () -> {
            TimeRange range = resolve(rangePreset);
            String address = DocumentType.PROJECT.address(projectId);
            Scan scan = scan(window(range).activity(address).relatedActivities(true).build(),
                    "project analytics of " + projectId);
            List<Statement> statements = scan.statements();
            return ProjectAnalytics.builder()
                    .projectId(projectId)
                    .timeRange(range.key())
                    .totalActivities(statements.size())
                    .uniqueContributors(MetricsCalculator.uniqueUsers(statements))
                    .phaseBreakdown(MetricsCalculator.phaseBreakdown(statements))
                    .phaseTransitions(MetricsCalculator.phaseTransitions(statements))
                    .contributorMetrics(MetricsCalculator.contributorMetrics(statements))
                    .collaborationNetwork(MetricsCalculator.collaborationNetwork(statements))
                    .activityTimeline(MetricsCalculator.dailyTimeline(statements, zone))
                    .generatedAt(clock.instant())
                    .partial(scan.partial())
                    .build();
        });
    }

    /**
     * Collaboration report over {@code collaborated} statements, optionally narrowed to one project.
     */
    public CollaborationAnalytics collaborationAnalytics(String preset, String projectId) {
        TimeRangePreset rangePreset = TimeRangePreset.fromKey(preset);
        String subjectKey = projectId == null || projectId.isBlank() ? ALL_SUBJECTS : projectId;
        return cached(new AnalyticsCacheKey(COLLABORATION, subjectKey, rangePreset.key()), () -> {
            TimeRange range = resolve(rangePreset);
            Scan scan = scan(window(range).verb(Vocabulary.COLLABORATED).build(),
                    "collaboration analytics of " + subjectKey);
            List<Statement> statements = scan.statements();
            if (!ALL_SUBJECTS.equals(subjectKey)) {
                String address = DocumentType.PROJECT.address(subjectKey);
                statements = statements.stream()
                        .filter(s -> s.getObject() != null && address.equals(s.getObject().getId()))
                        .toList();
            }
            long activeProjects = statements.stream()
                    .map(s -> s.getObject() != null ? s.getObject().getId() : null)
                    .filter(MetricsCalculator::isProjectAddress)
                    .distinct()
                    .count();
            CollaborationNetwork network = MetricsCalculator.collaborationNetwork(statements);
            return CollaborationAnalytics.builder()
                    .projectId(ALL_SUBJECTS.equals(subjectKey) ? null : subjectKey)
                    .timeRange(range.key())
                    .totalCollaborations(statements.size())
                    .uniqueCollaborators(network.nodes().size())
                    .activeProjects(activeProjects)
                    .collaborationFrequency(MetricsCalculator.dailyTimeline(statements, zone))
                    .network(network)
                    .peakCollaborationHours(MetricsCalculator.peakHours(statements, zone, 3))
                    .generatedAt(clock.instant())
                    .partial(scan.partial())
                    .build();
        });
    }

    /**
     * Activity rate, active users and failures over the last {@code windowMinutes} minutes, computed
     * on every call.
     *
     * @param windowMinutes 1 to 1440, null for {@value #DEFAULT_REALTIME_MINUTES}
     */
    public RealtimeMetrics realtime(Integer windowMinutes) {
        int minutes = windowMinutes == null ? DEFAULT_REALTIME_MINUTES : windowMinutes;
        if (minutes < 1 || minutes > MAX_REALTIME_MINUTES) {
            throw new ValidationException("Window must be between 1 and " + MAX_REALTIME_MINUTES + " minutes");
        }
        Instant now = clock.instant();
        TimeRange range = new TimeRange(REALTIME, now.minus(Duration.ofMinutes(minutes)), now.plusMillis(1));
        Scan scan = scan(window(range).build(), "realtime window of " + minutes + " min");
        List<Statement> statements = scan.statements();
        List<Statement> failures = MetricsCalculator.failures(statements);
        List<String> activeUsers = MetricsCalculator.activeUsers(statements);
        return RealtimeMetrics.builder()
                .windowMinutes(minutes)
                .since(range.since())
                .until(now)
                .totalActivities(statements.size())
                .activityRate(MetricsCalculator.ratio(statements.size(), minutes))
                .activityBreakdown(MetricsCalculator.activityBreakdown(statements))
                .activeUsers(activeUsers.size())
                .activeUserList(activeUsers)
                .errorCount(failures.size())
                .errorRate(MetricsCalculator.ratio(failures.size(), statements.size()))
                .errorTypes(MetricsCalculator.activityBreakdown(failures))
                .generatedAt(now)
                .partial(scan.partial())
                .build();
    }

    public Map<String, Object> clearCache() {
        long removed = cache.estimatedSize();
        cache.invalidateAll();
        log.info("Analytics cache cleared ({} entries)", removed);
        Map<String, Object> result = new LinkedHashMap<>();
        result.put("cleared", true);
        result.put("entriesRemoved", removed);
        result.put("timestamp", clock.instant());
        return result;
    }

    public AnalyticsOptions availableOptions() {
        return new AnalyticsOptions(METRIC_SETS, TimeRangePreset.keys(true), cache.estimatedSize(),
                cacheTtl.toMillis());
    }

    public AnalyticsHealth health() {
        try {
            eventLog.ping();
            if (state.compareAndSet(State.UNINITIALIZED, State.READY)) {
                log.info("Analytics ready");
            }
            return new AnalyticsHealth("healthy", state.get().name(), cache.estimatedSize(), null, clock.instant());
        } catch (PortalException e) {
            log.warn("Analytics health check failed: {}", e.getMessage());
            return new AnalyticsHealth("unhealthy", state.get().name(), cache.estimatedSize(), e.getMessage(),
                    clock.instant());
        }
    }

    @SuppressWarnings("unchecked")
    private <T> T cached(AnalyticsCacheKey key, Supplier<T> compute) {
        Object hit = cache.getIfPresent(key);
        if (hit != null) {
            log.debug("Analytics cache hit {}", key);
            return (T) hit;
        }
        T value = compute.get();
        cache.put(key, value);
        return value;
    }

    private TimeRange resolve(TimeRangePreset preset) {
        return preset.resolve(clock.instant(), zone);
    }

    private StatementQuery.StatementQueryBuilder window(TimeRange range) {
        // one past the bound marks a truncated scan
        return StatementQuery.builder()
                .since(range.since())
                .until(range.until())
                .limit(maxEvents + 1);
    }

    private Scan scan(StatementQuery query, String description) {
        ensureReady();
        Supplier<Future<List<Statement>>> task = () -> executor.submit(() -> {
            try (Stream<Statement> stream = eventLog.query(query)) {
                return stream.toList();
            }
        });
        List<Statement> fetched;
        try {
            fetched = timeLimiter.executeFutureSupplier(task);
        } catch (TimeoutException e) {
            log.warn("Statement scan for {} exceeded {} ms", description,
                    timeLimiter.getTimeLimiterConfig().getTimeoutDuration().toMillis());
            throw new ScanTimeoutException("Statement scan for " + description + " timed out", e);
        } catch (CancellationException e) {
            throw new ScanTimeoutException("Statement scan for " + description + " was cancelled", e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ScanTimeoutException("Interrupted while waiting for " + description, e);
        } catch (RuntimeException e) {
            throw e;
        } catch (Exception e) {
            log.error("Statement scan for {} failed: {}", description, e.getMessage());
            throw new UpstreamException("Statement scan for " + description + " failed", e);
        }

        boolean partial = fetched.size() > maxEvents;
        if (partial) {
            log.warn("Statement scan for {} hit the {} event bound, reporting partial figures", description, maxEvents);
            fetched = new ArrayList<>(fetched.subList(0, maxEvents));
        }
        log.debug("Scanned {} statements for {}", fetched.size(), description);
        return new Scan(fetched, partial);
    }

    private void ensureReady() {
        if (state.get() == State.READY) {
            return;
        }
        eventLog.ping();
        if (state.compareAndSet(State.UNINITIALIZED, State.READY)) {
            log.info("Analytics ready");
        }
    }

    private static Map<String, String> metricSets() {
        Map<String, String> sets = new LinkedHashMap<>();
        sets.put(OVERVIEW, "Platform or per-user dashboard overview");
        sets.put(USER, "Per-user activity, collaboration, assessment and AI interaction metrics");
        sets.put(PROJECT, "Per-project phases, contributors, network and timeline");
        sets.put(COLLABORATION, "Collaboration frequency, network and peak hours");
        sets.put(REALTIME, "Activity rate, active users and error rate over the last minutes");
        return Collections.unmodifiableMap(sets);
    }

    private record Scan(List<Statement> statements, boolean partial) {
    }
}
