package hk.edu.hulab.portal.backend.config;

import io.github.resilience4j.timelimiter.TimeLimiter;
import io.github.resilience4j.timelimiter.TimeLimiterConfig;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

@Configuration
public class AnalyticsConfig {

    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService analyticsExecutor(@Value("${portal.analytics.scan-threads:4}") int threads) {
        AtomicInteger counter = new AtomicInteger();
        return Executors.newFixedThreadPool(threads, runnable -> {
            Thread thread = new Thread(runnable, "analytics-scan-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
    }

    /**
     * Upper bound for one statement scan. The running scan is cancelled (interrupted) on timeout.
     */
    @Bean
    public TimeLimiter analyticsTimeLimiter(@Value("${portal.analytics.scan-timeout-ms:10000}") long timeoutMs) {
        return TimeLimiter.of("analytics", TimeLimiterConfig.custom()
                .timeoutDuration(Duration.ofMillis(timeoutMs))
                .cancelRunningFuture(true)
                .build());
    }
}
