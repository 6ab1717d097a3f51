package io.awsaccount.operator.config;

import lombok.Builder;
import lombok.Value;
import software.amazon.awssdk.regions.Region;

/**
 * Dynamic settings read from the operator ConfigMap for a single reconcile pass.
 */
@Value
@Builder
public class OperatorConfig {
    boolean fedramp;
    boolean moveAccountEnabled;
    boolean tagAccountEnabled;
    String rootOuId;
    String shardName;

    public Region defaultRegion() {
        return fedramp ? Region.US_GOV_EAST_1 : Region.US_EAST_1;
    }

    public String partition() {
        return fedramp ? "aws-us-gov" : "aws";
    }

    public String managedPolicyArn(String policyName) {
        return String.format("arn:%s:iam::aws:policy/%s", partition(), policyName);
    }

    public String customerPolicyArn(String accountId, String policyName) {
        return String.format("arn:%s:iam::%s:policy/%s", partition(), accountId, policyName);
    }

    public String roleArn(String accountId, String roleName) {
        return String.format("arn:%s:iam::%s:role/%s", partition(), accountId, roleName);
    }

    public boolean hasRootOu() {
        return rootOuId != null && !rootOuId.isEmpty();
    }

    public boolean hasShardName() {
        return shardName != null && !shardName.isEmpty();
    }
}
