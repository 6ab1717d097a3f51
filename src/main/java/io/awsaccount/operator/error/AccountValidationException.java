package io.awsaccount.operator.error;

import lombok.Getter;

/**
 * Failure of one of the pool account checks, carrying the check that failed.
 */
@Getter
public class AccountValidationException extends RuntimeException {

    public enum Reason {
        INVALID_ACCOUNT,
        MISSING_AWS_ACCOUNT,
        ACCOUNT_MOVE_FAILED,
        MISSING_OWNER_TAG,
        INCORRECT_OWNER_TAG,
        ACCOUNT_TAG_FAILED,
        MALFORMED_HIERARCHY
    }

    private final Reason reason;

    public AccountValidationException(Reason reason, String message) {
        super(message);
        this.reason = reason;
    }

    public AccountValidationException(Reason reason, String message, Throwable cause) {
        super(message, cause);
        this.reason = reason;
    }

    public boolean isTagFailure() {
        return reason == Reason.MISSING_OWNER_TAG
                || reason == Reason.INCORRECT_OWNER_TAG
                || reason == Reason.ACCOUNT_TAG_FAILED;
    }
}
