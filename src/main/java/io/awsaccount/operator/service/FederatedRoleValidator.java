package io.awsaccount.operator.service;

import io.awsaccount.operator.client.AwsClient;
import io.awsaccount.operator.client.AwsErrors;
import io.awsaccount.operator.config.OperatorConfig;
import io.awsaccount.operator.model.CustomPolicy;
import io.awsaccount.operator.model.FederatedRole;
import io.awsaccount.operator.model.FederatedRoleSpec;
import io.awsaccount.operator.model.policy.PolicyDocument;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import software.amazon.awssdk.services.iam.model.CreatePolicyRequest;
import software.amazon.awssdk.services.iam.model.CreatePolicyResponse;
import software.amazon.awssdk.services.iam.model.DeletePolicyRequest;
import software.amazon.awssdk.services.iam.model.EntityAlreadyExistsException;
import software.amazon.awssdk.services.iam.model.ListPoliciesRequest;
import software.amazon.awssdk.services.iam.model.ListPoliciesResponse;
import software.amazon.awssdk.services.iam.model.MalformedPolicyDocumentException;
import software.amazon.awssdk.services.iam.model.Policy;
import software.amazon.awssdk.services.iam.model.PolicyScopeType;
import software.amazon.awssdk.services.sts.model.GetCallerIdentityRequest;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Validates the policies declared on a role template against the provider.
 */
@Slf4j
@Component
public class FederatedRoleValidator {

    public RoleValidationOutcome validate(AwsClient client, FederatedRole role, OperatorConfig config) {
        FederatedRoleSpec spec = role.getSpec() != null ? role.getSpec() : new FederatedRoleSpec();
        boolean hasCustomPolicy = hasCustomPolicy(spec);
        List<String> managedPolicies = spec.getAwsManagedPolicies() != null ? spec.getAwsManagedPolicies() : List.of();

        if (!hasCustomPolicy && managedPolicies.isEmpty()) {
            log.warn("Role template {} declares no custom or managed policies", role.getMetadata().getName());
            return RoleValidationOutcome.invalid(RoleValidationOutcome.REASON_NO_POLICIES,
                    "AWSCustomPolicy and/or AWSManagedPolicies do not exist");
        }

        if (hasCustomPolicy) {
            log.info("Validating custom policy {}", spec.getAwsCustomPolicy().getName());
            try {
                trialCreate(client, spec.getAwsCustomPolicy(), config);
            } catch (MalformedPolicyDocumentException e) {
                log.error("Custom policy {} is malformed: {}", spec.getAwsCustomPolicy().getName(),
                        AwsErrors.describe(e));
                return RoleValidationOutcome.invalid(RoleValidationOutcome.REASON_INVALID_CUSTOM_POLICY,
                        "Custom Policy is malformed");
            }
        }

        if (!managedPolicies.isEmpty()) {
            log.info("Validating managed policies {}", managedPolicies);
            Set<String> catalog = listManagedPolicyNames(client);
            for (String policyName : managedPolicies) {
                if (!catalog.contains(policyName)) {
                    log.error("Managed policy {} does not exist", policyName);
                    return RoleValidationOutcome.invalid(RoleValidationOutcome.REASON_INVALID_MANAGED_POLICY,
                            "Managed policy does not exist");
                }
            }
        }

        return RoleValidationOutcome.valid();
    }

    static boolean hasCustomPolicy(FederatedRoleSpec spec) {
        CustomPolicy policy = spec.getAwsCustomPolicy();
        return policy != null && policy.getName() != null && !policy.getName().isEmpty();
    }

    /**
     * Creates the policy to let the provider check its shape, then deletes it again.
     * A leftover policy of the same name is removed and creation retried once.
     */
    private void trialCreate(AwsClient client, CustomPolicy policy, OperatorConfig config) {
        CreatePolicyRequest request = CreatePolicyRequest.builder()
                .policyName(policy.getName())
                .description(policy.getDescription())
                .policyDocument(PolicyDocument.fromCustomPolicy(policy).toJson())
                .build();

        CreatePolicyResponse created;
        try {
            created = client.getIam().createPolicy(request);
        } catch (EntityAlreadyExistsException e) {
            String accountId = client.getSts()
                    .getCallerIdentity(GetCallerIdentityRequest.builder().build()).account();
            String leftoverArn = config.customerPolicyArn(accountId, policy.getName());
            log.info("Removing leftover validation policy {}", leftoverArn);
            client.getIam().deletePolicy(DeletePolicyRequest.builder().policyArn(leftoverArn).build());
            created = client.getIam().createPolicy(request);
        }

        client.getIam().deletePolicy(DeletePolicyRequest.builder().policyArn(created.policy().arn()).build());
        log.debug("Validated custom policy {}", policy.getName());
    }

    private Set<String> listManagedPolicyNames(AwsClient client) {
        Set<String> names = new HashSet<>();
        String marker = null;
        while (true) {
            ListPoliciesResponse response = client.getIam().listPolicies(ListPoliciesRequest.builder()
                    .scope(PolicyScopeType.AWS)
                    .marker(marker)
                    .build());
            for (Policy policy : response.policies()) {
                names.add(policy.policyName());
            }
            if (!Boolean.TRUE.equals(response.isTruncated())) {
                return names;
            }
            marker = response.marker();
        }
    }
}
