package io.awsaccount.operator.model;

import com.google.gson.annotations.SerializedName;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Specification for an AWSFederatedRole custom resource.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class FederatedRoleSpec {
    private String roleDisplayName;
    private String roleDescription;

    @SerializedName("awsCustomPolicy")
    private CustomPolicy awsCustomPolicy;

    @SerializedName("awsManagedPolicies")
    private List<String> awsManagedPolicies;
}
