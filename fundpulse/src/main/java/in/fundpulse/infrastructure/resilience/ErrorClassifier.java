package in.fundpulse.infrastructure.resilience;

import in.fundpulse.domain.error.ErrorKind;
import in.fundpulse.domain.error.FetchException;

import java.util.List;
import java.util.Locale;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

/**
 * Maps raw failures onto the {@link ErrorKind} taxonomy.
 *
 * Classification is a substring heuristic over the lowercase message and
 * exception type names of the failure and its causes. Anything that does not
 * match is UNKNOWN and therefore not retried.
 *
 * Already classified failures ({@link FetchException}) pass through unchanged,
 * so classifying twice yields the same instance.
 */
public final class ErrorClassifier {

    private static final int MAX_CAUSE_DEPTH = 5;

    private static final List<String> NETWORK_MARKERS = List.of(
        "network", "timeout", "timed out", "econnrefused", "connection refused",
        "enotfound", "unknownhost", "host not found", "socket", "fetch", "connect"
    );
    private static final List<String> PARSE_MARKERS = List.of("parse", "json", "syntax");
    private static final List<String> STORAGE_MARKERS = List.of("storage", "file", "permission");
    private static final List<String> NOT_FOUND_MARKERS = List.of("not found", "未找到");

    /**
     * Classify a failure.
     *
     * @param failure any throwable, possibly wrapped by CompletableFuture plumbing
     * @return the classified failure, never null
     */
    public FetchException classify(Throwable failure) {
        Throwable root = unwrap(failure);
        if (root instanceof FetchException classified) {
            return classified;
        }

        String originalMessage = root == null || root.getMessage() == null
            ? "Unknown error"
            : root.getMessage();
        String text = describe(root);

        if (containsAny(text, NETWORK_MARKERS)) {
            return new FetchException(ErrorKind.NETWORK, networkMessage(text), root);
        }
        if (containsAny(text, PARSE_MARKERS)) {
            return new FetchException(ErrorKind.PARSE, "Failed to parse data", root);
        }
        if (containsAny(text, STORAGE_MARKERS)) {
            return new FetchException(ErrorKind.STORAGE, "Storage operation failed", root);
        }
        if (containsAny(text, NOT_FOUND_MARKERS)) {
            return new FetchException(ErrorKind.NOT_FOUND, originalMessage, root);
        }
        return new FetchException(ErrorKind.UNKNOWN, originalMessage, root);
    }

    /**
     * Strip CompletionException / ExecutionException wrappers.
     */
    static Throwable unwrap(Throwable failure) {
        Throwable current = failure;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
            && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    private static String describe(Throwable failure) {
        StringBuilder text = new StringBuilder();
        Throwable current = failure;
        int depth = 0;
        while (current != null && depth < MAX_CAUSE_DEPTH) {
            text.append(current.getClass().getSimpleName()).append(' ');
            if (current.getMessage() != null) {
                text.append(current.getMessage()).append(' ');
            }
            current = current.getCause();
            depth++;
        }
        return text.toString().toLowerCase(Locale.ROOT);
    }

    private static boolean containsAny(String text, List<String> markers) {
        for (String marker : markers) {
            if (text.contains(marker)) {
                return true;
            }
        }
        return false;
    }

    private static String networkMessage(String text) {
        if (text.contains("timeout") || text.contains("timed out")) {
            return "Network connection timed out, check your network";
        }
        if (text.contains("econnrefused") || text.contains("connection refused")) {
            return "Unable to connect to server, retry later";
        }
        if (text.contains("enotfound") || text.contains("unknownhost")) {
            return "Unable to resolve server address, check your network connection";
        }
        return "Network connection error, check your network";
    }
}
