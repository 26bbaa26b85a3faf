package hk.edu.hulab.portal.backend.analytics;

import com.fasterxml.jackson.databind.ObjectMapper;
import hk.edu.hulab.portal.backend.MutableClock;
import hk.edu.hulab.portal.backend.exception.ScanTimeoutException;
import hk.edu.hulab.portal.backend.lrs.Blob;
import hk.edu.hulab.portal.backend.lrs.BlobKey;
import hk.edu.hulab.portal.backend.lrs.EventLogClient;
import hk.edu.hulab.portal.backend.lrs.InMemoryEventLogClient;
import hk.edu.hulab.portal.backend.lrs.StatementQuery;
import hk.edu.hulab.portal.backend.model.Activity;
import hk.edu.hulab.portal.backend.model.Actor;
import hk.edu.hulab.portal.backend.model.Statement;
import hk.edu.hulab.portal.backend.model.Vocabulary;
import io.github.resilience4j.timelimiter.TimeLimiter;
import io.github.resilience4j.timelimiter.TimeLimiterConfig;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Scan bounds of the aggregator, wired by hand around a store that can be made slow.
 */
class AnalyticsAggregatorScanTest {

    private static final Instant START = Instant.parse("2026-05-13T09:00:00Z");

    private MutableClock clock;
    private InMemoryEventLogClient store;
    private ExecutorService executor;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(START);
        store = new InMemoryEventLogClient(new ObjectMapper().findAndRegisterModules(), clock);
        executor = Executors.newSingleThreadExecutor();
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    private AnalyticsAggregator aggregator(EventLogClient eventLog, long timeoutMs, int maxEvents) {
        TimeLimiter timeLimiter = TimeLimiter.of("analytics-test", TimeLimiterConfig.custom()
                .timeoutDuration(Duration.ofMillis(timeoutMs))
                .cancelRunningFuture(true)
                .build());
        return new AnalyticsAggregator(eventLog, clock, executor, timeLimiter, maxEvents, 300_000, "UTC");
    }

    private void record(String actor) {
        store.append(Statement.builder()
                .actor(Actor.ofEmail(actor))
                .verb(Vocabulary.EXPERIENCED)
                .object(Activity.of(Vocabulary.address("resource", "r-1")))
                .build());
        clock.advance(Duration.ofSeconds(1));
    }

    @Test
    void shouldTimeOutAndCancelSlowScan() throws InterruptedException {
        CountDownLatch started = new CountDownLatch(1);
        CountDownLatch interrupted = new CountDownLatch(1);
        EventLogClient slow = new DelegatingEventLogClient(store) {
            @Override
            public Stream<Statement> query(StatementQuery query) {
                started.countDown();
                try {
                    Thread.sleep(10_000);
                } catch (InterruptedException e) {
                    interrupted.countDown();
                    Thread.currentThread().interrupt();
                }
                return Stream.empty();
            }
        };
        AnalyticsAggregator aggregator = aggregator(slow, 50, 10_000);

        ScanTimeoutException thrown = assertThrows(ScanTimeoutException.class,
                () -> aggregator.overview(null, "last7days"));

        assertEquals(504, thrown.status().value());
        assertTrue(started.await(1, TimeUnit.SECONDS));
        assertTrue(interrupted.await(5, TimeUnit.SECONDS), "timed out scan should be interrupted");
    }

    @Test
    void shouldReportPartialFiguresWhenEventBoundIsHit() {
        record("alice@polyu.edu.hk");
        record("bob@polyu.edu.hk");
        AnalyticsAggregator bounded = aggregator(store, 5_000, 2);

        assertFalse(bounded.overview(null, "last7days").isPartial());

        record("carol@polyu.edu.hk");
        bounded.clearCache();
        OverviewMetrics overview = bounded.overview(null, "last7days");

        assertTrue(overview.isPartial());
        assertEquals(2, overview.getTotalActivities());
        assertEquals(2, overview.getUniqueUsers());
    }

    /**
     * Forwards everything to another client; tests override the calls they need to slow down.
     */
    private static class DelegatingEventLogClient implements EventLogClient {

        private final EventLogClient delegate;

        DelegatingEventLogClient(EventLogClient delegate) {
            this.delegate = delegate;
        }

        @Override
        public String append(Statement statement) {
            return delegate.append(statement);
        }

        @Override
        public List<String> appendAll(List<Statement> statements) {
            return delegate.appendAll(statements);
        }

        @Override
        public Stream<Statement> query(StatementQuery query) {
            return delegate.query(query);
        }

        @Override
        public Optional<Blob> getBlob(BlobKey key) {
            return delegate.getBlob(key);
        }

        @Override
        public void putBlob(BlobKey key, byte[] content) {
            delegate.putBlob(key, content);
        }

        @Override
        public void putBlob(BlobKey key, byte[] content, String expectedEtag) {
            delegate.putBlob(key, content, expectedEtag);
        }

        @Override
        public void ping() {
            delegate.ping();
        }
    }
}
