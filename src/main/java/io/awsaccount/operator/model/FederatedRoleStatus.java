package io.awsaccount.operator.model;

import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * Status for an AWSFederatedRole. A null state means the template has not been validated yet.
 */
@Data
public class FederatedRoleStatus {
    private FederatedRoleState state;
    private List<Condition> conditions = new ArrayList<>();
}
