package io.awsaccount.operator.error;

/**
 * A provisioning step for a federated access request failed. The message is written to the
 * request's Failed condition.
 */
public class FederatedAccessException extends RuntimeException {

    public FederatedAccessException(String message, Throwable cause) {
        super(message, cause);
    }

    public FederatedAccessException(String message) {
        super(message);
    }
}
