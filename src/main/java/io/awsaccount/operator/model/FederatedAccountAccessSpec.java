package io.awsaccount.operator.model;

import com.google.gson.annotations.SerializedName;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class FederatedAccountAccessSpec {
    @SerializedName("externalCustomerAWSIAMARN")
    private String externalCustomerAwsIamArn;

    @SerializedName("awsCustomerCredentialSecret")
    private ResourceReference awsCustomerCredentialSecret;

    @SerializedName("awsFederatedRole")
    private ResourceReference awsFederatedRole;
}
