package in.fundpulse.domain.error;

/**
 * Exception thrown when the fund store cannot be read or written.
 */
public class StorageException extends FetchException {

    public StorageException(String message, Throwable cause) {
        super(ErrorKind.STORAGE, message, cause);
    }
}
