package in.fundpulse.domain.error;

import java.time.Instant;

/**
 * Diagnostic record of a terminal failure.
 */
public record ErrorState(
    ErrorKind kind,
    String message,
    boolean retryable,
    Instant timestamp,
    int retryCount
) {}
