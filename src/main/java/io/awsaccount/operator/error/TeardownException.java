package io.awsaccount.operator.error;

/**
 * Teardown of provider objects could not complete; the finalizer must stay in place.
 */
public class TeardownException extends RuntimeException {

    public TeardownException(String message) {
        super(message);
    }

    public TeardownException(String message, Throwable cause) {
        super(message, cause);
    }
}
