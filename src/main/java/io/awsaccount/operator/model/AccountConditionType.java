package io.awsaccount.operator.model;

/**
 * Condition types written to an Account's status.
 */
public final class AccountConditionType {
    public static final String CREATING = "Creating";
    public static final String READY = "Ready";
    public static final String FAILED = "Failed";
    public static final String CLAIMED = "Claimed";
    public static final String ACCOUNT_LIMIT_EXCEEDED = "AccountLimitExceeded";

    private AccountConditionType() {
    }
}
