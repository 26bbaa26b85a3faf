package hk.edu.hulab.portal.backend.lrs;

import hk.edu.hulab.portal.backend.model.Statement;

import java.util.List;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * Typed access to the learning record store: an append-only statement log plus two keyed blob namespaces.
 * No other component talks to the store directly.
 */
public interface EventLogClient {

    /**
     * Append a statement. Assigns an id and timestamp when absent; the id is fixed before the first
     * attempt so that retries of the same call never create duplicate ledger entries.
     *
     * @return the statement id
     */
    String append(Statement statement);

    /**
     * Append several statements in one request.
     */
    List<String> appendAll(List<Statement> statements);

    /**
     * Query statements. The returned stream is lazy, bounded by {@link StatementQuery#getLimit()}, and can
     * only be consumed once. Callers should close it (try-with-resources) when they stop early.
     */
    Stream<Statement> query(StatementQuery query);

    Optional<Blob> getBlob(BlobKey key);

    /**
     * Unconditional overwrite.
     */
    void putBlob(BlobKey key, byte[] content);

    /**
     * Overwrite only if the stored blob still carries {@code expectedEtag}.
     *
     * @throws hk.edu.hulab.portal.backend.exception.ConflictException if the blob changed in the meantime
     */
    void putBlob(BlobKey key, byte[] content, String expectedEtag);

    /**
     * Cheap connectivity check.
     */
    void ping();
}
