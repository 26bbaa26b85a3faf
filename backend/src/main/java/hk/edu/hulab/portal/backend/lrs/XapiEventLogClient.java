package hk.edu.hulab.portal.backend.lrs;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import hk.edu.hulab.portal.backend.exception.ConflictException;
import hk.edu.hulab.portal.backend.exception.PortalException;
import hk.edu.hulab.portal.backend.exception.UpstreamException;
import hk.edu.hulab.portal.backend.exception.ValidationException;
import hk.edu.hulab.portal.backend.model.Actor;
import hk.edu.hulab.portal.backend.model.Statement;
import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.function.Supplier;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * {@link EventLogClient} for an xAPI 1.0.3 learning record store reached over HTTP.
 */
@Component
@ConditionalOnProperty(name = "portal.lrs.mode", havingValue = "http", matchIfMissing = true)
public class XapiEventLogClient implements EventLogClient {

    private static final Logger log = LoggerFactory.getLogger(XapiEventLogClient.class);

    private static final String XAPI_VERSION_HEADER = "X-Experience-API-Version";
    private static final String XAPI_VERSION = "1.0.3";

    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final URI endpoint;
    private final String authorization;
    private final Duration requestTimeout;
    private final Retry retry;

    public XapiEventLogClient(ObjectMapper objectMapper,
            Clock clock,
            @Value("${portal.lrs.endpoint}") String endpoint,
            @Value("${portal.lrs.username:}") String username,
            @Value("${portal.lrs.password:}") String password,
            @Value("${portal.lrs.request-timeout-ms:10000}") long requestTimeoutMs,
            @Value("${portal.lrs.retry.max-attempts:3}") int maxAttempts,
            @Value("${portal.lrs.retry.initial-backoff-ms:200}") long initialBackoffMs) {
        this.objectMapper = objectMapper;
        this.clock = clock;
        this.endpoint = URI.create(endpoint.endsWith("/") ? endpoint : endpoint + "/");
        this.authorization = username == null || username.isBlank()
                ? null
                : "Basic " + Base64.getEncoder()
                        .encodeToString((username + ":" + password).getBytes(StandardCharsets.UTF_8));
        this.requestTimeout = Duration.ofMillis(requestTimeoutMs);
        this.httpClient = HttpClient.newBuilder()
                .connectTimeout(requestTimeout)
                .build();

        RetryConfig retryConfig = RetryConfig.custom()
                .maxAttempts(Math.max(1, maxAttempts))
                .intervalFunction(IntervalFunction.ofExponentialBackoff(Math.max(1, initialBackoffMs), 2.0))
                .retryOnException(e -> e instanceof UpstreamException upstream && upstream.isRetryable())
                .build();
        this.retry = Retry.of("lrs", retryConfig);
        this.retry.getEventPublisher().onRetry(event -> log.warn("Retrying LRS call (attempt {}): {}",
                event.getNumberOfRetryAttempts(),
                event.getLastThrowable() != null ? event.getLastThrowable().getMessage() : "unknown"));
    }

    @Override
    public String append(Statement statement) {
        Statement complete = StatementDefaults.complete(statement, clock);
        String body = toJson(complete);
        withRetry(() -> {
            HttpResponse<String> response = send("append statement", request("statements")
                    .header("Content-Type", "application/json")
                    .POST(HttpRequest.BodyPublishers.ofString(body))
                    .build());
            if (response.statusCode() != 200 && response.statusCode() != 204) {
                throw failure("append statement", response);
            }
            return null;
        });
        log.debug("Appended statement {} ({} {})", complete.getId(),
                complete.getVerb().getId(), complete.getObject().getId());
        return complete.getId();
    }

    @Override
    public List<String> appendAll(List<Statement> statements) {
        if (statements == null || statements.isEmpty()) {
            return List.of();
        }
        List<Statement> complete = statements.stream()
                .map(s -> StatementDefaults.complete(s, clock))
                .toList();
        String body = toJson(complete);
        withRetry(() -> {
            HttpResponse<String> response = send("append statements", request("statements")
                    .header("Content-Type", "application/json")
                    .POST(HttpRequest.BodyPublishers.ofString(body))
                    .build());
            if (response.statusCode() != 200 && response.statusCode() != 204) {
                throw failure("append statements", response);
            }
            return null;
        });
        return complete.stream().map(Statement::getId).toList();
    }

    @Override
    public Stream<Statement> query(StatementQuery query) {
        String firstPage = "statements?" + encodeParams(queryParams(query));
        PagedStatementSpliterator spliterator = new PagedStatementSpliterator(
                more -> fetchPage(more == null ? endpoint.resolve(firstPage) : resolveMore(more)),
                query.getLimit(),
                query.getUntil());
        return StreamSupport.stream(spliterator, false);
    }

    @Override
    public Optional<Blob> getBlob(BlobKey key) {
        return withRetry(() -> {
            HttpResponse<byte[]> response = sendBytes("read " + describe(key), request(blobPath(key))
                    .GET()
                    .build());
            if (response.statusCode() == 404) {
                return Optional.<Blob>empty();
            }
            if (response.statusCode() != 200) {
                throw failure("read " + describe(key), response.statusCode(),
                        new String(response.body(), StandardCharsets.UTF_8));
            }
            String etag = response.headers().firstValue("ETag").orElse(null);
            return Optional.of(new Blob(response.body(), etag));
        });
    }

    @Override
    public void putBlob(BlobKey key, byte[] content) {
        put(key, content, builder -> builder);
    }

    @Override
    public void putBlob(BlobKey key, byte[] content, String expectedEtag) {
        if (expectedEtag == null) {
            put(key, content, builder -> builder.header("If-None-Match", "*"));
        } else {
            put(key, content, builder -> builder.header("If-Match", expectedEtag));
        }
    }

    @Override
    public void ping() {
        try (Stream<Statement> first = query(StatementQuery.builder().limit(1).build())) {
            first.findFirst();
        }
    }

    private void put(BlobKey key, byte[] content,
            java.util.function.UnaryOperator<HttpRequest.Builder> preconditions) {
        withRetry(() -> {
            HttpRequest.Builder builder = request(blobPath(key))
                    .header("Content-Type", "application/json")
                    .PUT(HttpRequest.BodyPublishers.ofByteArray(content));
            HttpResponse<String> response = send("write " + describe(key), preconditions.apply(builder).build());
            if (response.statusCode() != 204 && response.statusCode() != 200) {
                throw failure("write " + describe(key), response);
            }
            return null;
        });
    }

    private PagedStatementSpliterator.StatementPage fetchPage(URI uri) {
        return withRetry(() -> {
            HttpResponse<String> response = send("query statements", HttpRequest.newBuilder(uri)
                    .timeout(requestTimeout)
                    .header(XAPI_VERSION_HEADER, XAPI_VERSION)
                    .header("Accept", "application/json")
                    .headers(authHeaders())
                    .GET()
                    .build());
            if (response.statusCode() != 200) {
                throw failure("query statements", response);
            }
            try {
                JsonNode root = objectMapper.readTree(response.body());
                List<Statement> statements = new ArrayList<>();
                for (JsonNode node : root.path("statements")) {
                    statements.add(objectMapper.treeToValue(node, Statement.class));
                }
                String more = root.path("more").asText(null);
                log.debug("Fetched {} statements from {}", statements.size(), uri);
                return new PagedStatementSpliterator.StatementPage(statements, more);
            } catch (JsonProcessingException e) {
                throw new UpstreamException("Unreadable statement page from LRS: " + e.getOriginalMessage(), 200, false);
            }
        });
    }

    private URI resolveMore(String more) {
        URI moreUri = URI.create(more);
        return moreUri.isAbsolute() ? moreUri : endpoint.resolve(moreUri);
    }

    private Map<String, String> queryParams(StatementQuery query) {
        Map<String, String> params = new LinkedHashMap<>();
        if (query.getAgent() != null) {
            params.put("agent", agentJson(query.getAgent()));
        }
        if (query.getVerb() != null) {
            params.put("verb", query.getVerb());
        }
        if (query.getActivity() != null) {
            params.put("activity", query.getActivity());
        }
        if (query.getSince() != null) {
            params.put("since", query.getSince().toString());
        }
        if (query.getUntil() != null) {
            params.put("until", query.getUntil().toString());
        }
        params.put("limit", String.valueOf(query.getLimit()));
        params.put("ascending", String.valueOf(query.isAscending()));
        if (query.isRelatedActivities()) {
            params.put("related_activities", "true");
        }
        if (query.isRelatedAgents()) {
            params.put("related_agents", "true");
        }
        return params;
    }

    private String blobPath(BlobKey key) {
        Map<String, String> params = new LinkedHashMap<>();
        if (key.namespace() == BlobNamespace.AGENT_PROFILE) {
            params.put("agent", agentJson(key.agent()));
            params.put("profileId", key.key());
            return "agents/profile?" + encodeParams(params);
        }
        params.put("activityId", key.activityId());
        params.put("agent", agentJson(key.agent()));
        params.put("stateId", key.key());
        return "activities/state?" + encodeParams(params);
    }

    private String agentJson(String email) {
        Actor actor = Actor.ofEmail(email);
        return toJson(Map.of("objectType", "Agent", "mbox", actor.getMbox()));
    }

    private static String encodeParams(Map<String, String> params) {
        return params.entrySet().stream()
                .map(e -> e.getKey() + "=" + URLEncoder.encode(e.getValue(), StandardCharsets.UTF_8))
                .collect(Collectors.joining("&"));
    }

    private HttpRequest.Builder request(String path) {
        return HttpRequest.newBuilder(endpoint.resolve(path))
                .timeout(requestTimeout)
                .header(XAPI_VERSION_HEADER, XAPI_VERSION)
                .headers(authHeaders());
    }

    private String[] authHeaders() {
        return authorization == null ? new String[0] : new String[] {"Authorization", authorization};
    }

    private HttpResponse<String> send(String operation, HttpRequest request) {
        try {
            return httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (IOException e) {
            log.error("LRS transport failure during {}: {}", operation, e.getMessage());
            throw new UpstreamException("LRS unreachable during " + operation, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CancellationException("Interrupted during " + operation);
        }
    }

    private HttpResponse<byte[]> sendBytes(String operation, HttpRequest request) {
        try {
            return httpClient.send(request, HttpResponse.BodyHandlers.ofByteArray());
        } catch (IOException e) {
            log.error("LRS transport failure during {}: {}", operation, e.getMessage());
            throw new UpstreamException("LRS unreachable during " + operation, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CancellationException("Interrupted during " + operation);
        }
    }

    private PortalException failure(String operation, HttpResponse<String> response) {
        return failure(operation, response.statusCode(), response.body());
    }

    private PortalException failure(String operation, int status, String body) {
        log.error("LRS error during {}: {} - {}", operation, status, body);
        if (status == 400) {
            return new ValidationException("LRS rejected " + operation + ": " + body);
        }
        if (status == 409 || status == 412) {
            return new ConflictException("Concurrent modification during " + operation);
        }
        boolean retryable = status >= 500 || status == 408 || status == 429;
        return new UpstreamException("LRS error during " + operation + ": " + status, status, retryable);
    }

    private <T> T withRetry(Supplier<T> call) {
        return Retry.decorateSupplier(retry, call).get();
    }

    private String toJson(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new ValidationException("Cannot serialize " + value.getClass().getSimpleName() + ": "
                    + e.getOriginalMessage());
        }
    }

    private static String describe(BlobKey key) {
        return key.namespace().wireName() + " " + key.key() + " of " + key.agent();
    }
}
