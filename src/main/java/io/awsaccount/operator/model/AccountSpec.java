package io.awsaccount.operator.model;

import com.google.gson.annotations.SerializedName;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Specification for an Account custom resource.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AccountSpec {
    @SerializedName("awsAccountID")
    private String awsAccountId;

    @SerializedName("byoc")
    private boolean byoc;

    private String claimLink;
    private String claimLinkNamespace;

    // Name of the pool that owns this account, empty for accounts created outside a pool
    private String accountPool;
}
