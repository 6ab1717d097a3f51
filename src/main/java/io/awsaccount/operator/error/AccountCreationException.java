package io.awsaccount.operator.error;

import lombok.Getter;

/**
 * Classified failure of an account creation request.
 */
@Getter
public class AccountCreationException extends RuntimeException {

    public enum Reason {
        ACCOUNT_LIMIT_EXCEEDED,
        INTERNAL_FAILURE,
        TOO_MANY_REQUESTS,
        FAILED_CREATE_ACCOUNT
    }

    private final Reason reason;

    public AccountCreationException(Reason reason, String message) {
        super(message);
        this.reason = reason;
    }

    public AccountCreationException(Reason reason, String message, Throwable cause) {
        super(message, cause);
        this.reason = reason;
    }
}
