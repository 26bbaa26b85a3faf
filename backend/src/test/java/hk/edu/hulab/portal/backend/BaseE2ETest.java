package hk.edu.hulab.portal.backend;

import hk.edu.hulab.portal.backend.analytics.AnalyticsAggregator;
import hk.edu.hulab.portal.backend.config.PortalPrincipal;
import hk.edu.hulab.portal.backend.lrs.InMemoryEventLogClient;
import org.junit.jupiter.api.BeforeEach;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Import;
import org.springframework.context.annotation.Primary;

import java.time.Duration;
import java.time.Instant;

/**
 * Base class for E2E tests against the in-memory learning record store.
 * Every test starts on an empty store with the clock at {@link #START}.
 */
@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT)
@Import(BaseE2ETest.TestClockConfiguration.class)
public abstract class BaseE2ETest {

    /**
     * A Wednesday, mid-quarter.
     */
    protected static final Instant START = Instant.parse("2026-05-13T09:00:00Z");

    protected static final PortalPrincipal ALICE = new PortalPrincipal("alice@polyu.edu.hk", "student");
    protected static final PortalPrincipal BOB = new PortalPrincipal("bob@polyu.edu.hk", "student");
    protected static final PortalPrincipal CAROL = new PortalPrincipal("carol@polyu.edu.hk", "student");
    protected static final PortalPrincipal ADMIN = new PortalPrincipal("root@polyu.edu.hk", PortalPrincipal.ADMIN);

    @Autowired
    protected MutableClock clock;

    @Autowired
    protected InMemoryEventLogClient eventLog;

    @Autowired
    protected AnalyticsAggregator analyticsAggregator;

    @BeforeEach
    void resetStore() {
        clock.set(START);
        eventLog.reset();
        analyticsAggregator.clearCache();
    }

    /**
     * Move the clock forward so that consecutive writes get distinct timestamps.
     */
    protected void tick() {
        clock.advance(Duration.ofSeconds(1));
    }

    @TestConfiguration
    static class TestClockConfiguration {

        @Bean
        @Primary
        MutableClock testClock() {
            return new MutableClock(START);
        }
    }
}
