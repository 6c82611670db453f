package in.fundpulse.domain.error;

/**
 * Failure taxonomy used by the retry policy.
 */
public enum ErrorKind {
    NETWORK(true),
    PARSE(false),
    STORAGE(true),
    NOT_FOUND(false),
    UNKNOWN(false);

    private final boolean retryable;

    ErrorKind(boolean retryable) {
        this.retryable = retryable;
    }

    public boolean isRetryable() {
        return retryable;
    }
}
