package hk.edu.hulab.portal.backend.lrs;

import hk.edu.hulab.portal.backend.model.Statement;

import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.concurrent.CancellationException;
import java.util.function.Consumer;
import java.util.function.Function;

/**
 * Pulls statement pages on demand by following the store's {@code more} link.
 * Stops at the query limit, when the store runs out of pages, or when the consuming thread is interrupted.
 */
final class PagedStatementSpliterator extends Spliterators.AbstractSpliterator<Statement> {

    private final Function<String, StatementPage> pageFetcher;
    private final int limit;
    private final Instant until;
    private final Deque<Statement> buffer = new ArrayDeque<>();

    private String nextPage;
    private boolean started;
    private int emitted;

    /**
     * @param pageFetcher fetches the first page for a null argument and follow-up pages for a {@code more} link
     */
    PagedStatementSpliterator(Function<String, StatementPage> pageFetcher, int limit, Instant until) {
        super(limit, Spliterator.ORDERED | Spliterator.NONNULL);
        this.pageFetcher = pageFetcher;
        this.limit = limit;
        this.until = until;
    }

    @Override
    public boolean tryAdvance(Consumer<? super Statement> action) {
        if (emitted >= limit) {
            return false;
        }
        while (buffer.isEmpty()) {
            if (started && (nextPage == null || nextPage.isBlank())) {
                return false;
            }
            if (Thread.currentThread().isInterrupted()) {
                throw new CancellationException("Statement scan cancelled after " + emitted + " statements");
            }
            StatementPage page = pageFetcher.apply(started ? nextPage : null);
            started = true;
            nextPage = page.more();
            for (Statement statement : page.statements()) {
                if (until == null || statement.getTimestamp() == null || statement.getTimestamp().isBefore(until)) {
                    buffer.add(statement);
                }
            }
        }
        emitted++;
        action.accept(buffer.poll());
        return true;
    }

    record StatementPage(List<Statement> statements, String more) {
    }
}
