package in.fundpulse.domain.error;

import java.time.Instant;

/**
 * Classified failure of a provider or storage operation.
 */
public class FetchException extends RuntimeException {

    private final ErrorKind kind;
    private final boolean retryable;

    public FetchException(ErrorKind kind, String message) {
        this(kind, kind.isRetryable(), message, null);
    }

    public FetchException(ErrorKind kind, String message, Throwable cause) {
        this(kind, kind.isRetryable(), message, cause);
    }

    public FetchException(ErrorKind kind, boolean retryable, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
        this.retryable = retryable;
    }

    public ErrorKind getKind() {
        return kind;
    }

    public boolean isRetryable() {
        return retryable;
    }

    public ErrorState toErrorState(Instant timestamp, int retryCount) {
        return new ErrorState(kind, getMessage(), retryable, timestamp, retryCount);
    }
}
