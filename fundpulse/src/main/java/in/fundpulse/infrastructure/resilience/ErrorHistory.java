package in.fundpulse.infrastructure.resilience;

import in.fundpulse.domain.error.ErrorState;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Optional;

/**
 * Bounded, append-only log of terminal failures. Oldest entries are evicted first.
 */
public final class ErrorHistory {

    public static final int DEFAULT_CAPACITY = 100;

    private final int capacity;
    private final Deque<ErrorState> entries = new ArrayDeque<>();

    public ErrorHistory() {
        this(DEFAULT_CAPACITY);
    }

    public ErrorHistory(int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("Capacity must be positive");
        }
        this.capacity = capacity;
    }

    public synchronized void record(ErrorState state) {
        entries.addLast(state);
        while (entries.size() > capacity) {
            entries.removeFirst();
        }
    }

    /**
     * Oldest first.
     */
    public synchronized List<ErrorState> snapshot() {
        return List.copyOf(entries);
    }

    public synchronized Optional<ErrorState> last() {
        return Optional.ofNullable(entries.peekLast());
    }

    public synchronized void clear() {
        entries.clear();
    }

    public synchronized int size() {
        return entries.size();
    }
}
