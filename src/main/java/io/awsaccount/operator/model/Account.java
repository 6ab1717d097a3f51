package io.awsaccount.operator.model;

import io.kubernetes.client.common.KubernetesObject;
import io.kubernetes.client.openapi.models.V1ObjectMeta;
import lombok.Data;

/**
 * Represents an Account custom resource.
 */
@Data
public class Account implements KubernetesObject {
    public static final String KIND = "Account";
    public static final String PLURAL = "accounts";

    private String apiVersion;
    private String kind;
    private V1ObjectMeta metadata;
    private AccountSpec spec;
    private AccountStatus status;
}
