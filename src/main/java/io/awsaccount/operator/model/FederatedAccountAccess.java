package io.awsaccount.operator.model;

import io.kubernetes.client.common.KubernetesObject;
import io.kubernetes.client.openapi.models.V1ObjectMeta;
import lombok.Data;

/**
 * Represents an AWSFederatedAccountAccess custom resource: a request to grant an external
 * principal a role, built from a {@link FederatedRole} template, in a target account.
 */
@Data
public class FederatedAccountAccess implements KubernetesObject {
    public static final String KIND = "AWSFederatedAccountAccess";
    public static final String PLURAL = "awsfederatedaccountaccesses";

    private String apiVersion;
    private String kind;
    private V1ObjectMeta metadata;
    private FederatedAccountAccessSpec spec;
    private FederatedAccountAccessStatus status;
}
