package in.fundpulse.infrastructure.resilience;

import in.fundpulse.domain.error.FetchException;

/**
 * Outcome of a retried operation: either a value or the terminal classified error.
 *
 * @param attempts number of times the operation was invoked
 */
public record RetryResult<T>(T value, FetchException error, int attempts) {

    public static <T> RetryResult<T> success(T value, int attempts) {
        return new RetryResult<>(value, null, attempts);
    }

    public static <T> RetryResult<T> failure(FetchException error, int attempts) {
        return new RetryResult<>(null, error, attempts);
    }

    public boolean isSuccess() {
        return error == null;
    }
}
