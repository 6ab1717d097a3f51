package io.awsaccount.operator.service;

import io.awsaccount.operator.model.FederatedRoleState;
import lombok.Value;

/**
 * Result of validating a role template, written to its status as-is.
 */
@Value
public class RoleValidationOutcome {
    public static final String REASON_NO_POLICIES = "NoAWSCustomPolicyOrAWSManagedPolicies";
    public static final String REASON_INVALID_CUSTOM_POLICY = "InvalidCustomerPolicy";
    public static final String REASON_INVALID_MANAGED_POLICY = "InvalidManagedPolicy";
    public static final String REASON_ALL_VALID = "AllPoliciesValid";

    FederatedRoleState state;
    String reason;
    String message;

    public static RoleValidationOutcome valid() {
        return new RoleValidationOutcome(FederatedRoleState.VALID, REASON_ALL_VALID,
                "All managed and custom policies are validated");
    }

    public static RoleValidationOutcome invalid(String reason, String message) {
        return new RoleValidationOutcome(FederatedRoleState.INVALID, reason, message);
    }

    public boolean isValid() {
        return state == FederatedRoleState.VALID;
    }
}
