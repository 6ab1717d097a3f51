package io.awsaccount.operator.client;

import software.amazon.awssdk.awscore.exception.AwsServiceException;

/**
 * Helpers for inspecting provider errors.
 */
public final class AwsErrors {

    private AwsErrors() {
    }

    public static String errorCode(Throwable e) {
        if (e instanceof AwsServiceException && ((AwsServiceException) e).awsErrorDetails() != null) {
            return ((AwsServiceException) e).awsErrorDetails().errorCode();
        }
        return null;
    }

    /**
     * Formats an error for logs, with the error code and request id when the provider sent them.
     */
    public static String describe(Throwable e) {
        if (e instanceof AwsServiceException) {
            AwsServiceException ase = (AwsServiceException) e;
            String code = errorCode(ase);
            String message = ase.awsErrorDetails() != null ? ase.awsErrorDetails().errorMessage() : ase.getMessage();
            return String.format("%s: %s (request id %s)", code != null ? code : ase.statusCode(), message, ase.requestId());
        }
        return e.getClass().getSimpleName() + ": " + e.getMessage();
    }
}
