package in.fundpulse.transport.event;

import in.fundpulse.application.port.output.ValuationListener;
import in.fundpulse.domain.fund.Fund;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Keeps the latest terminal error notice so the HTTP API can serve it.
 * A successful update clears it.
 */
public final class LatestValuationView implements ValuationListener {

    private final Clock clock;
    private final AtomicReference<Notice> lastError = new AtomicReference<>();

    public LatestValuationView(Clock clock) {
        this.clock = clock;
    }

    @Override
    public void onValuationUpdated(List<Fund> updated) {
        lastError.set(null);
    }

    @Override
    public void onError(String message) {
        lastError.set(new Notice(message, clock.instant()));
    }

    public Optional<Notice> getLastError() {
        return Optional.ofNullable(lastError.get());
    }

    public record Notice(String message, Instant at) {}
}
