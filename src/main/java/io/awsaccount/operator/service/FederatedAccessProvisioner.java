package io.awsaccount.operator.service;

import io.awsaccount.operator.client.AwsClient;
import io.awsaccount.operator.client.AwsClientFactory;
import io.awsaccount.operator.client.AwsErrors;
import io.awsaccount.operator.config.OperatorConfig;
import io.awsaccount.operator.error.FederatedAccessException;
import io.awsaccount.operator.error.TeardownException;
import io.awsaccount.operator.model.Conditions;
import io.awsaccount.operator.model.FederatedAccountAccess;
import io.awsaccount.operator.model.FederatedAccountAccessSpec;
import io.awsaccount.operator.model.FederatedAccountAccessState;
import io.awsaccount.operator.model.FederatedAccountAccessStatus;
import io.awsaccount.operator.model.FederatedConditionType;
import io.awsaccount.operator.model.FederatedRole;
import io.awsaccount.operator.model.Labels;
import io.awsaccount.operator.model.policy.PolicyDocument;
import io.awsaccount.operator.store.ResourceStore;
import io.kubernetes.client.openapi.ApiException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.services.iam.IamClient;
import software.amazon.awssdk.services.iam.model.AttachRolePolicyRequest;
import software.amazon.awssdk.services.iam.model.AttachedPolicy;
import software.amazon.awssdk.services.iam.model.CreatePolicyRequest;
import software.amazon.awssdk.services.iam.model.CreateRoleRequest;
import software.amazon.awssdk.services.iam.model.DeletePolicyRequest;
import software.amazon.awssdk.services.iam.model.DeleteRoleRequest;
import software.amazon.awssdk.services.iam.model.DetachRolePolicyRequest;
import software.amazon.awssdk.services.iam.model.EntityAlreadyExistsException;
import software.amazon.awssdk.services.iam.model.ListAttachedRolePoliciesRequest;
import software.amazon.awssdk.services.iam.model.ListAttachedRolePoliciesResponse;
import software.amazon.awssdk.services.iam.model.ListPoliciesRequest;
import software.amazon.awssdk.services.iam.model.ListPoliciesResponse;
import software.amazon.awssdk.services.iam.model.NoSuchEntityException;
import software.amazon.awssdk.services.iam.model.Policy;
import software.amazon.awssdk.services.iam.model.PolicyScopeType;
import software.amazon.awssdk.services.iam.model.Role;
import software.amazon.awssdk.services.sts.model.GetCallerIdentityRequest;

import java.security.SecureRandom;
import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Predicate;

/**
 * Creates the IAM role and policies requested by a {@link FederatedAccountAccess} in the target
 * account, and removes them again when the request is deleted.
 *
 * <p>Every provider object is named with the request's {@code uid} label as a suffix, so requests
 * sharing one template never collide. All steps create or replace, so an interrupted pass can
 * simply run again from the top.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class FederatedAccessProvisioner {
    static final String CONSOLE_URL_FORMAT = "https://signin.aws.amazon.com/switchrole?account=%s&roleName=%s";
    static final String ORGANIZATION_ACCESS_ROLE = "OrganizationAccountAccessRole";
    static final String BYOC_ADMIN_ACCESS_ROLE = "BYOCAdminAccess";
    static final String CLEANUP_SESSION_NAME = "FederatedRoleCleanup";

    static final String UID_ALPHABET = "bcdfghjklmnpqrstvwxz2456789";
    static final int UID_LENGTH = 6;

    private static final SecureRandom RANDOM = new SecureRandom();

    private final AwsClientFactory clientFactory;
    private final ResourceStore<FederatedAccountAccess> accessStore;
    private final Clock clock;

    /**
     * Runs one provisioning pass. The request ends the pass either Ready or Failed, with the outcome
     * persisted to its status; store errors and unclassified provider errors propagate.
     */
    public void provision(FederatedAccountAccess access, FederatedRole role, OperatorConfig config)
            throws ApiException {
        String namespace = access.getMetadata().getNamespace();
        String name = access.getMetadata().getName();

        if (access.getStatus() == null) {
            access.setStatus(new FederatedAccountAccessStatus());
        }
        String uid = ensureUid(access);
        FederatedAccountAccessSpec spec = access.getSpec();

        try (AwsClient client = clientFactory.fromSecret(spec.getAwsCustomerCredentialSecret().getNamespace(),
                spec.getAwsCustomerCredentialSecret().getName(), config)) {

            String accountId = discoverAccountId(client, access);

            String roleName = roleName(access, uid);
            List<String> policyArns = new ArrayList<>();
            if (role.getSpec().getAwsManagedPolicies() != null) {
                role.getSpec().getAwsManagedPolicies().forEach(p -> policyArns.add(config.managedPolicyArn(p)));
            }

            if (FederatedRoleValidator.hasCustomPolicy(role.getSpec())) {
                String policyArn = createOrReplacePolicy(client.getIam(), role, uid, roleName, accountId, config);
                policyArns.add(policyArn);
            }

            Role created = createOrReplaceRole(client.getIam(), role, access, roleName);
            access.getStatus().setConsoleUrl(String.format(CONSOLE_URL_FORMAT, accountId, created.roleName()));

            attachPolicies(client.getIam(), roleName, policyArns);

            setState(access, FederatedAccountAccessState.READY, FederatedConditionType.READY, "Account Access Ready");
            log.info("Federated access {}/{} ready, role {} in account {}", namespace, name, roleName, accountId);
        } catch (FederatedAccessException e) {
            log.error("Provisioning federated access {}/{} failed: {}", namespace, name, e.getMessage());
            setState(access, FederatedAccountAccessState.FAILED, FederatedConditionType.FAILED, e.getMessage());
        }
        accessStore.updateStatus(access);
    }

    /**
     * Removes every provider object created for the request.
     *
     * @throws TeardownException when the request reached Ready but is missing its labels, or no
     *                           role in the target account could be assumed
     */
    public void teardown(FederatedAccountAccess access, FederatedRole role, OperatorConfig config)
            throws ApiException {
        String namespace = access.getMetadata().getNamespace();
        String name = access.getMetadata().getName();
        String uid = Labels.get(access, Labels.UID);
        String accountId = Labels.get(access, Labels.AWS_ACCOUNT_ID);
        boolean ready = access.getStatus() != null
                && access.getStatus().getState() == FederatedAccountAccessState.READY;

        if (uid == null || accountId == null) {
            if (!ready) {
                log.info("Federated access {}/{} was never provisioned, nothing to clean up", namespace, name);
                return;
            }
            throw new TeardownException(String.format("Federated access %s/%s is Ready but missing its %s label",
                    namespace, name, uid == null ? Labels.UID : Labels.AWS_ACCOUNT_ID));
        }

        String roleName = roleName(access, uid);
        Predicate<String> ownedPolicy = ownedPolicyMatcher(role, uid);

        try (AwsClient root = clientFactory.fromOperatorSecret(config);
             AwsClient target = assumeCleanupRole(root, accountId, uid, config)) {
            log.info("Cleaning up role {} in account {} for {}/{}", roleName, accountId, namespace, name);
            cleanup(target.getIam(), roleName, ownedPolicy);
        }
    }

    /**
     * Detaches and deletes everything named for one request. Missing objects count as already removed.
     */
    void cleanup(IamClient iam, String roleName, Predicate<String> ownedPolicy) {
        boolean roleMissing = false;
        List<AttachedPolicy> attached = new ArrayList<>();
        try {
            attached = listAttachedPolicies(iam, roleName);
        } catch (NoSuchEntityException e) {
            log.info("Role {} does not exist", roleName);
            roleMissing = true;
        }

        for (AttachedPolicy policy : attached) {
            detachIgnoringMissing(iam, roleName, policy.policyArn());
            if (ownedPolicy.test(policy.policyName())) {
                deletePolicyIgnoringMissing(iam, policy.policyArn());
            }
        }

        for (Policy policy : listLocalPolicies(iam)) {
            if (ownedPolicy.test(policy.policyName())) {
                log.info("Deleting unattached policy {}", policy.arn());
                deletePolicyIgnoringMissing(iam, policy.arn());
            }
        }

        if (!roleMissing) {
            try {
                iam.deleteRole(DeleteRoleRequest.builder().roleName(roleName).build());
                log.info("Deleted role {}", roleName);
            } catch (NoSuchEntityException e) {
                log.debug("Role {} already deleted", roleName);
            }
        }
    }

    static String generateUid() {
        StringBuilder uid = new StringBuilder(UID_LENGTH);
        for (int i = 0; i < UID_LENGTH; i++) {
            uid.append(UID_ALPHABET.charAt(RANDOM.nextInt(UID_ALPHABET.length())));
        }
        return uid.toString();
    }

    static String roleName(FederatedAccountAccess access, String uid) {
        return suffixed(access.getSpec().getAwsFederatedRole().getName(), uid);
    }

    static String customPolicyName(FederatedRole role, String uid) {
        return suffixed(role.getSpec().getAwsCustomPolicy().getName(), uid);
    }

    private static String suffixed(String name, String uid) {
        String suffix = "-" + uid;
        return name.endsWith(suffix) ? name : name + suffix;
    }

    private static Predicate<String> ownedPolicyMatcher(FederatedRole role, String uid) {
        if (role != null && role.getSpec() != null && FederatedRoleValidator.hasCustomPolicy(role.getSpec())) {
            String policyName = customPolicyName(role, uid);
            return policyName::equals;
        }
        // Template gone or without a custom policy: fall back to the request suffix.
        String suffix = "-" + uid;
        return policyName -> policyName != null && policyName.endsWith(suffix);
    }

    private String ensureUid(FederatedAccountAccess access) throws ApiException {
        String uid = Labels.get(access, Labels.UID);
        if (uid != null) {
            return uid;
        }
        uid = generateUid();
        log.info("Adding uid {} to federated access {}/{}", uid,
                access.getMetadata().getNamespace(), access.getMetadata().getName());
        Labels.put(access, Labels.UID, uid);
        accessStore.update(access);
        return uid;
    }

    private String discoverAccountId(AwsClient client, FederatedAccountAccess access) throws ApiException {
        String accountId;
        try {
            accountId = client.getSts().getCallerIdentity(GetCallerIdentityRequest.builder().build()).account();
        } catch (SdkException e) {
            log.error("Failed to get account id for {}: {}", access.getMetadata().getName(), AwsErrors.describe(e));
            throw new FederatedAccessException("Failed to get account ID information", e);
        }

        if (!Labels.has(access, Labels.AWS_ACCOUNT_ID)) {
            log.info("Adding awsAccountID {} to federated access {}/{}", accountId,
                    access.getMetadata().getNamespace(), access.getMetadata().getName());
            Labels.put(access, Labels.AWS_ACCOUNT_ID, accountId);
            accessStore.update(access);
        }
        return accountId;
    }

    private String createOrReplacePolicy(IamClient iam, FederatedRole role, String uid, String roleName,
                                         String accountId, OperatorConfig config) {
        String policyName = customPolicyName(role, uid);
        String policyArn = config.customerPolicyArn(accountId, policyName);
        CreatePolicyRequest request = CreatePolicyRequest.builder()
                .policyName(policyName)
                .description(role.getSpec().getAwsCustomPolicy().getDescription())
                .policyDocument(PolicyDocument.fromCustomPolicy(role.getSpec().getAwsCustomPolicy()).toJson())
                .build();
        try {
            try {
                iam.createPolicy(request);
            } catch (EntityAlreadyExistsException e) {
                log.info("Policy {} already exists, replacing it", policyName);
                detachIgnoringMissing(iam, roleName, policyArn);
                iam.deletePolicy(DeletePolicyRequest.builder().policyArn(policyArn).build());
                iam.createPolicy(request);
            }
        } catch (SdkException e) {
            log.error("Unable to create policy {}: {}", policyName, AwsErrors.describe(e));
            throw new FederatedAccessException("Failed to create custom policy", e);
        }
        return policyArn;
    }

    private Role createOrReplaceRole(IamClient iam, FederatedRole role, FederatedAccountAccess access,
                                     String roleName) {
        CreateRoleRequest request = CreateRoleRequest.builder()
                .roleName(roleName)
                .description(role.getSpec().getRoleDescription())
                .assumeRolePolicyDocument(PolicyDocument
                        .assumeRoleTrust(access.getSpec().getExternalCustomerAwsIamArn()).toJson())
                .build();
        try {
            try {
                return iam.createRole(request).role();
            } catch (EntityAlreadyExistsException e) {
                log.info("Role {} already exists, replacing it", roleName);
                for (AttachedPolicy policy : listAttachedPolicies(iam, roleName)) {
                    detachIgnoringMissing(iam, roleName, policy.policyArn());
                }
                iam.deleteRole(DeleteRoleRequest.builder().roleName(roleName).build());
                return iam.createRole(request).role();
            }
        } catch (SdkException e) {
            log.error("Unable to create role {}: {}", roleName, AwsErrors.describe(e));
            throw new FederatedAccessException("Failed to create role", e);
        }
    }

    private void attachPolicies(IamClient iam, String roleName, List<String> policyArns) {
        for (String policyArn : policyArns) {
            try {
                iam.attachRolePolicy(AttachRolePolicyRequest.builder()
                        .roleName(roleName)
                        .policyArn(policyArn)
                        .build());
            } catch (SdkException e) {
                log.error("Unable to attach {} to role {}: {}", policyArn, roleName, AwsErrors.describe(e));
                throw new FederatedAccessException("Failed to attach policies to role", e);
            }
        }
    }

    private AwsClient assumeCleanupRole(AwsClient root, String accountId, String uid, OperatorConfig config) {
        String organizationRoleArn = config.roleArn(accountId, ORGANIZATION_ACCESS_ROLE);
        try {
            return clientFactory.assumeRole(root, organizationRoleArn, CLEANUP_SESSION_NAME, config);
        } catch (SdkException e) {
            log.info("Unable to assume {}, trying {}: {}", organizationRoleArn, BYOC_ADMIN_ACCESS_ROLE,
                    AwsErrors.describe(e));
        }

        String byocRoleArn = config.roleArn(accountId, BYOC_ADMIN_ACCESS_ROLE + "-" + uid);
        try {
            return clientFactory.assumeRole(root, byocRoleArn, CLEANUP_SESSION_NAME, config);
        } catch (SdkException e) {
            throw new TeardownException("Unable to assume a cleanup role in account " + accountId, e);
        }
    }

    private List<AttachedPolicy> listAttachedPolicies(IamClient iam, String roleName) {
        List<AttachedPolicy> policies = new ArrayList<>();
        String marker = null;
        while (true) {
            ListAttachedRolePoliciesResponse response = iam.listAttachedRolePolicies(
                    ListAttachedRolePoliciesRequest.builder()
                            .roleName(roleName)
                            .marker(marker)
                            .build());
            policies.addAll(response.attachedPolicies());
            if (!Boolean.TRUE.equals(response.isTruncated())) {
                return policies;
            }
            marker = response.marker();
        }
    }

    private List<Policy> listLocalPolicies(IamClient iam) {
        List<Policy> policies = new ArrayList<>();
        String marker = null;
        while (true) {
            ListPoliciesResponse response = iam.listPolicies(ListPoliciesRequest.builder()
                    .scope(PolicyScopeType.LOCAL)
                    .marker(marker)
                    .build());
            policies.addAll(response.policies());
            if (!Boolean.TRUE.equals(response.isTruncated())) {
                return policies;
            }
            marker = response.marker();
        }
    }

    private void detachIgnoringMissing(IamClient iam, String roleName, String policyArn) {
        try {
            iam.detachRolePolicy(DetachRolePolicyRequest.builder()
                    .roleName(roleName)
                    .policyArn(policyArn)
                    .build());
        } catch (NoSuchEntityException e) {
            log.debug("Policy {} not attached to role {}", policyArn, roleName);
        }
    }

    private void deletePolicyIgnoringMissing(IamClient iam, String policyArn) {
        try {
            iam.deletePolicy(DeletePolicyRequest.builder().policyArn(policyArn).build());
            log.info("Deleted policy {}", policyArn);
        } catch (NoSuchEntityException e) {
            log.debug("Policy {} already deleted", policyArn);
        }
    }

    private void setState(FederatedAccountAccess access, FederatedAccountAccessState state, String conditionType,
                          String message) {
        FederatedAccountAccessStatus status = access.getStatus();
        if (status.getConditions() == null) {
            status.setConditions(new ArrayList<>());
        }
        status.setState(state);
        Conditions.set(status.getConditions(), conditionType, true,
                conditionType, message, OffsetDateTime.now(clock));
    }
}
