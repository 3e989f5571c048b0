package com.cgraph.e2ee.client.error;

/**
 * The key directory could not be reached or answered with an error.
 *
 * Network failures and 5xx answers are {@link #isRetryable() retryable}; a 4xx
 * answer means the request itself was rejected and retrying cannot help.
 */
public class DirectoryException extends E2eeException {

    private final int statusCode;
    private final boolean retryable;

    public DirectoryException(String message, Throwable cause, int statusCode, boolean retryable) {
        super(message, cause);
        this.statusCode = statusCode;
        this.retryable = retryable;
    }

    /** HTTP status of the failed call, or {@code 0} when no response was received. */
    public int getStatusCode() {
        return statusCode;
    }

    public boolean isRetryable() {
        return retryable;
    }

    public boolean isNotFound() {
        return statusCode == 404;
    }
}
