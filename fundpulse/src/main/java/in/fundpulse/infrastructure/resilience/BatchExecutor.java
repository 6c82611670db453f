package in.fundpulse.infrastructure.resilience;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicReferenceArray;
import java.util.function.Function;

/**
 * Runs independent asynchronous operations with a fixed concurrency ceiling.
 *
 * Items are split into consecutive chunks of {@code concurrency}. A chunk runs
 * concurrently and the next chunk starts only after every operation of the
 * previous one has completed, so at most {@code concurrency} operations are in
 * flight at any time. {@code results.get(i)} always belongs to {@code items.get(i)}.
 *
 * A failed operation does not cancel its siblings. If any operation fails, the
 * returned future fails once that chunk has settled and later chunks are not
 * started; callers that need per-item degradation map failures to a value
 * before handing the operation in.
 */
public final class BatchExecutor {
    private static final Logger log = LoggerFactory.getLogger(BatchExecutor.class);

    public static final int DEFAULT_CONCURRENCY = 5;

    public <T, R> CompletableFuture<List<R>> execute(
        List<T> items,
        Function<? super T, CompletableFuture<R>> operation,
        int concurrency
    ) {
        if (concurrency < 1) {
            throw new IllegalArgumentException("Concurrency must be at least 1, got " + concurrency);
        }
        if (items.isEmpty()) {
            return CompletableFuture.completedFuture(List.of());
        }

        List<T> snapshot = new ArrayList<>(items);
        AtomicReferenceArray<R> results = new AtomicReferenceArray<>(snapshot.size());

        CompletableFuture<Void> chain = CompletableFuture.completedFuture(null);
        for (int start = 0; start < snapshot.size(); start += concurrency) {
            int from = start;
            int to = Math.min(start + concurrency, snapshot.size());
            chain = chain.thenCompose(ignored -> runChunk(snapshot, from, to, operation, results));
        }

        log.debug("[Batch] Scheduled {} operations in chunks of {}", snapshot.size(), concurrency);

        return chain.thenApply(ignored -> {
            List<R> ordered = new ArrayList<>(snapshot.size());
            for (int i = 0; i < snapshot.size(); i++) {
                ordered.add(results.get(i));
            }
            return Collections.unmodifiableList(ordered);
        });
    }

    private <T, R> CompletableFuture<Void> runChunk(
        List<T> items,
        int from,
        int to,
        Function<? super T, CompletableFuture<R>> operation,
        AtomicReferenceArray<R> results
    ) {
        CompletableFuture<?>[] chunk = new CompletableFuture<?>[to - from];
        for (int i = from; i < to; i++) {
            int index = i;
            CompletableFuture<R> call;
            try {
                call = operation.apply(items.get(index));
            } catch (RuntimeException e) {
                call = CompletableFuture.failedFuture(e);
            }
            chunk[index - from] = call.thenAccept(value -> results.set(index, value));
        }
        return CompletableFuture.allOf(chunk);
    }
}
