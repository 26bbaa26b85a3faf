package hk.edu.hulab.portal.backend.lrs;

import com.fasterxml.jackson.databind.ObjectMapper;
import hk.edu.hulab.portal.backend.MutableClock;
import hk.edu.hulab.portal.backend.exception.ConflictException;
import hk.edu.hulab.portal.backend.exception.ValidationException;
import hk.edu.hulab.portal.backend.model.Activity;
import hk.edu.hulab.portal.backend.model.Actor;
import hk.edu.hulab.portal.backend.model.Statement;
import hk.edu.hulab.portal.backend.model.StatementContext;
import hk.edu.hulab.portal.backend.model.Verb;
import hk.edu.hulab.portal.backend.model.Vocabulary;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.CancellationException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

class InMemoryEventLogClientTest {

    private static final Instant START = Instant.parse("2026-05-13T09:00:00Z");
    private static final String PROJECT = Vocabulary.address("project", "p-1");

    private MutableClock clock;
    private InMemoryEventLogClient client;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(START);
        client = new InMemoryEventLogClient(new ObjectMapper().findAndRegisterModules(), clock);
    }

    private String append(String actor, Verb verb, String objectId) {
        String id = client.append(Statement.builder()
                .actor(Actor.ofEmail(actor))
                .verb(verb)
                .object(Activity.of(objectId))
                .build());
        clock.advance(Duration.ofSeconds(1));
        return id;
    }

    @Test
    void shouldAssignIdAndTimestampOnAppend() {
        String id = append("alice@polyu.edu.hk", Vocabulary.CREATED, PROJECT);

        Statement stored = client.query(StatementQuery.builder().build()).findFirst().orElseThrow();

        assertEquals(id, stored.getId());
        assertEquals(START, stored.getTimestamp());
        assertEquals(1, client.statementCount());
    }

    @Test
    void shouldRejectIncompleteStatement() {
        assertThrows(ValidationException.class, () -> client.append(Statement.builder()
                .actor(Actor.ofEmail("alice@polyu.edu.hk"))
                .object(Activity.of(PROJECT))
                .build()));
    }

    @Test
    void shouldFollowPagesUpToLimit() {
        for (int i = 0; i < InMemoryEventLogClient.PAGE_SIZE * 2 + 5; i++) {
            append("alice@polyu.edu.hk", Vocabulary.EXPERIENCED, PROJECT);
        }

        assertThat(client.query(StatementQuery.builder().limit(1_000).build()).toList())
                .hasSize(InMemoryEventLogClient.PAGE_SIZE * 2 + 5);
        assertThat(client.query(StatementQuery.builder().limit(7).build()).toList()).hasSize(7);
    }

    @Test
    void shouldOrderByTimestamp() {
        String first = append("alice@polyu.edu.hk", Vocabulary.CREATED, PROJECT);
        String second = append("alice@polyu.edu.hk", Vocabulary.UPDATED, PROJECT);

        assertThat(client.query(StatementQuery.builder().build()).map(Statement::getId).toList())
                .containsExactly(second, first);
        assertThat(client.query(StatementQuery.builder().ascending(true).build()).map(Statement::getId).toList())
                .containsExactly(first, second);
    }

    @Test
    void shouldBreakTimestampTiesByInsertionOrder() {
        String first = client.append(Statement.builder()
                .actor(Actor.ofEmail("alice@polyu.edu.hk"))
                .verb(Vocabulary.CREATED)
                .object(Activity.of(PROJECT))
                .build());
        String second = client.append(Statement.builder()
                .actor(Actor.ofEmail("alice@polyu.edu.hk"))
                .verb(Vocabulary.UPDATED)
                .object(Activity.of(PROJECT))
                .build());
        String third = client.append(Statement.builder()
                .actor(Actor.ofEmail("alice@polyu.edu.hk"))
                .verb(Vocabulary.DELETED)
                .object(Activity.of(PROJECT))
                .build());

        assertThat(client.query(StatementQuery.builder().build()).map(Statement::getId).toList())
                .containsExactly(third, second, first);
        assertThat(client.query(StatementQuery.builder().ascending(true).build()).map(Statement::getId).toList())
                .containsExactly(first, second, third);
    }

    @Test
    void shouldIgnoreRepeatedStatementWithSameContent() {
        Statement statement = Statement.builder()
                .id("0f9b3c1e-7d2a-4a52-9c1b-3e1f0a6d2b11")
                .actor(Actor.ofEmail("alice@polyu.edu.hk"))
                .verb(Vocabulary.CREATED)
                .object(Activity.of(PROJECT))
                .build();

        assertEquals(statement.getId(), client.append(statement));
        clock.advance(Duration.ofSeconds(5));
        assertEquals(statement.getId(), client.append(statement));
        assertEquals(List.of(statement.getId()), client.appendAll(List.of(statement)));

        assertEquals(1, client.statementCount());
        Statement stored = client.query(StatementQuery.builder().build()).findFirst().orElseThrow();
        assertEquals(START, stored.getTimestamp());
    }

    @Test
    void shouldRejectDifferentContentUnderExistingId() {
        Statement statement = Statement.builder()
                .id("0f9b3c1e-7d2a-4a52-9c1b-3e1f0a6d2b11")
                .actor(Actor.ofEmail("alice@polyu.edu.hk"))
                .verb(Vocabulary.CREATED)
                .object(Activity.of(PROJECT))
                .build();
        client.append(statement);

        assertThrows(ConflictException.class,
                () -> client.append(statement.toBuilder().verb(Vocabulary.UPDATED).build()));
        assertThrows(ConflictException.class, () -> client.appendAll(List.of(
                Statement.builder()
                        .actor(Actor.ofEmail("bob@polyu.edu.hk"))
                        .verb(Vocabulary.CREATED)
                        .object(Activity.of(PROJECT))
                        .build(),
                statement.toBuilder().actor(Actor.ofEmail("bob@polyu.edu.hk")).build())));

        assertEquals(1, client.statementCount());
        assertThat(client.query(StatementQuery.builder().build()).map(s -> s.getVerb().getId()).toList())
                .containsExactly(Vocabulary.CREATED.getId());
    }

    @Test
    void shouldFilterByAgentVerbActivityAndWindow() {
        String created = append("alice@polyu.edu.hk", Vocabulary.CREATED, PROJECT);
        String bobs = append("bob@polyu.edu.hk", Vocabulary.CREATED, Vocabulary.address("project", "p-2"));
        String updated = append("alice@polyu.edu.hk", Vocabulary.UPDATED, PROJECT);

        assertThat(client.query(StatementQuery.builder().agent("Alice@PolyU.edu.hk").build())
                .map(Statement::getId).toList()).containsExactly(updated, created);
        assertThat(client.query(StatementQuery.builder().verb(Vocabulary.CREATED).build())
                .map(Statement::getId).toList()).containsExactly(bobs, created);
        assertThat(client.query(StatementQuery.builder().activity(PROJECT).build())
                .map(Statement::getId).toList()).containsExactly(updated, created);
        assertThat(client.query(StatementQuery.builder()
                .since(START.plusSeconds(1))
                .until(START.plusSeconds(2))
                .build()).map(Statement::getId).toList()).containsExactly(bobs);
    }

    @Test
    void shouldMatchRelatedAgentsAndActivitiesOnlyWhenAsked() {
        String id = client.append(Statement.builder()
                .actor(Actor.ofEmail("alice@polyu.edu.hk"))
                .verb(Vocabulary.ACCEPTED)
                .object(Activity.of(Vocabulary.address("invitation", "i-1")))
                .context(StatementContext.builder()
                        .team(List.of(Actor.ofEmail("bob@polyu.edu.hk")))
                        .contextActivities(StatementContext.ContextActivities.builder()
                                .parent(List.of(Activity.of(PROJECT)))
                                .build())
                        .build())
                .build());

        assertThat(client.query(StatementQuery.builder().agent("bob@polyu.edu.hk").build()).toList()).isEmpty();
        assertThat(client.query(StatementQuery.builder().agent("bob@polyu.edu.hk").relatedAgents(true).build())
                .map(Statement::getId).toList()).containsExactly(id);
        assertThat(client.query(StatementQuery.builder().activity(PROJECT).build()).toList()).isEmpty();
        assertThat(client.query(StatementQuery.builder().activity(PROJECT).relatedActivities(true).build())
                .map(Statement::getId).toList()).containsExactly(id);
    }

    @Test
    void shouldEnforceBlobPreconditions() {
        BlobKey key = BlobKey.state("alice@polyu.edu.hk", PROJECT, "project-data");
        byte[] first = "{\"v\":1}".getBytes(StandardCharsets.UTF_8);

        client.putBlob(key, first, null);
        Blob stored = client.getBlob(key).orElseThrow();

        assertThrows(ConflictException.class, () -> client.putBlob(key, first, null));
        client.putBlob(key, "{\"v\":2}".getBytes(StandardCharsets.UTF_8), stored.etag());
        assertThrows(ConflictException.class,
                () -> client.putBlob(key, "{\"v\":3}".getBytes(StandardCharsets.UTF_8), stored.etag()));
        assertEquals("{\"v\":2}", new String(client.getBlob(key).orElseThrow().content(), StandardCharsets.UTF_8));
        assertTrue(client.getBlob(BlobKey.state("bob@polyu.edu.hk", PROJECT, "project-data")).isEmpty());
    }

    @Test
    void shouldStopScanningWhenInterrupted() {
        append("alice@polyu.edu.hk", Vocabulary.CREATED, PROJECT);

        Thread.currentThread().interrupt();
        try {
            assertThrows(CancellationException.class,
                    () -> client.query(StatementQuery.builder().build()).toList());
        } finally {
            Thread.interrupted();
        }
    }

    @Test
    void shouldDropEverythingOnReset() {
        append("alice@polyu.edu.hk", Vocabulary.CREATED, PROJECT);
        client.putBlob(BlobKey.userProfile("alice@polyu.edu.hk"), new byte[] {'{', '}'});

        client.reset();

        assertEquals(0, client.statementCount());
        assertTrue(client.getBlob(BlobKey.userProfile("alice@polyu.edu.hk")).isEmpty());
    }
}
