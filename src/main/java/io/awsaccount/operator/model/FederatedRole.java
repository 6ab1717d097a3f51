package io.awsaccount.operator.model;

import io.kubernetes.client.common.KubernetesObject;
import io.kubernetes.client.openapi.models.V1ObjectMeta;
import lombok.Data;

/**
 * Represents an AWSFederatedRole custom resource, a template for roles granted through
 * {@link FederatedAccountAccess} requests.
 */
@Data
public class FederatedRole implements KubernetesObject {
    public static final String KIND = "AWSFederatedRole";
    public static final String PLURAL = "awsfederatedroles";

    private String apiVersion;
    private String kind;
    private V1ObjectMeta metadata;
    private FederatedRoleSpec spec;
    private FederatedRoleStatus status;
}
