package io.awsaccount.operator.model;

/**
 * Condition types written by the federated role and federated access reconcilers.
 */
public final class FederatedConditionType {
    public static final String VALID = "Valid";
    public static final String INVALID = "Invalid";
    public static final String READY = "Ready";
    public static final String FAILED = "Failed";

    private FederatedConditionType() {
    }
}
