package io.awsaccount.operator.controller;

import io.awsaccount.operator.client.AwsClient;
import io.awsaccount.operator.client.AwsClientFactory;
import io.awsaccount.operator.client.AwsErrors;
import io.awsaccount.operator.config.OperatorConfig;
import io.awsaccount.operator.config.OperatorConfigLoader;
import io.awsaccount.operator.config.OperatorProperties;
import io.awsaccount.operator.error.OperatorConfigurationException;
import io.awsaccount.operator.model.Conditions;
import io.awsaccount.operator.model.FederatedAccountAccess;
import io.awsaccount.operator.model.FederatedConditionType;
import io.awsaccount.operator.model.FederatedRole;
import io.awsaccount.operator.model.FederatedRoleStatus;
import io.awsaccount.operator.model.ResourceReference;
import io.awsaccount.operator.service.FederatedRoleValidator;
import io.awsaccount.operator.service.FinalizerManager;
import io.awsaccount.operator.service.RoleValidationOutcome;
import io.awsaccount.operator.store.ResourceStore;
import io.kubernetes.client.extended.controller.reconciler.Reconciler;
import io.kubernetes.client.extended.controller.reconciler.Request;
import io.kubernetes.client.extended.controller.reconciler.Result;
import io.kubernetes.client.openapi.ApiException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Component;
import software.amazon.awssdk.core.exception.SdkException;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.Objects;
import java.util.Optional;

/**
 * Reconciler for AWSFederatedRole resources.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class FederatedRoleReconciler implements Reconciler {
    static final String CONTROLLER_NAME = "awsfederatedrole";

    private final ResourceStore<FederatedRole> roleStore;
    private final ResourceStore<FederatedAccountAccess> accessStore;
    private final OperatorConfigLoader configLoader;
    private final AwsClientFactory clientFactory;
    private final FederatedRoleValidator roleValidator;
    private final FinalizerManager finalizerManager;
    private final OperatorProperties properties;
    private final Clock clock;

    @Override
    public Result reconcile(Request request) {
        MDC.put("controller", CONTROLLER_NAME);
        MDC.put("namespace", request.getNamespace());
        MDC.put("name", request.getName());
        log.info("Reconciling AWSFederatedRole {}/{}", request.getNamespace(), request.getName());

        try {
            OperatorConfig config = configLoader.load();
            if (config.isFedramp()) {
                log.info("Running in FedRAMP mode, skipping AWSFederatedRole {}/{}",
                        request.getNamespace(), request.getName());
                return new Result(false);
            }

            Optional<FederatedRole> found = roleStore.get(request.getNamespace(), request.getName());
            if (found.isEmpty()) {
                log.info("AWSFederatedRole {}/{} not found", request.getNamespace(), request.getName());
                return new Result(false);
            }
            FederatedRole role = found.get();

            if (finalizerManager.finalizeIfDeleting(role, roleStore, () -> deleteAccessRequests(role))) {
                return new Result(false);
            }
            if (finalizerManager.addIfMissing(role, roleStore)) {
                return new Result(true);
            }

            if (role.getStatus() == null) {
                role.setStatus(new FederatedRoleStatus());
            }
            if (role.getStatus().getState() != null) {
                log.debug("AWSFederatedRole {}/{} already {}", request.getNamespace(), request.getName(),
                        role.getStatus().getState());
                return new Result(false);
            }

            RoleValidationOutcome outcome;
            try (AwsClient client = clientFactory.fromOperatorSecret(config)) {
                outcome = roleValidator.validate(client, role, config);
            }
            applyOutcome(role, outcome);
            roleStore.updateStatus(role);
            log.info("AWSFederatedRole {}/{} is {}: {}", request.getNamespace(), request.getName(),
                    outcome.getState(), outcome.getMessage());
            return new Result(false);
        } catch (OperatorConfigurationException e) {
            log.error("Invalid operator configuration: {}", e.getMessage());
            return new Result(true, properties.getConfigErrorBackoff());
        } catch (ApiException e) {
            log.error("Error reconciling AWSFederatedRole {}/{}: {} {}",
                    request.getNamespace(), request.getName(), e.getCode(), e.getMessage());
            return new Result(true);
        } catch (SdkException e) {
            log.error("AWS error reconciling AWSFederatedRole {}/{}: {}",
                    request.getNamespace(), request.getName(), AwsErrors.describe(e));
            return new Result(true);
        } catch (RuntimeException e) {
            log.error("Unexpected error reconciling AWSFederatedRole {}/{}",
                    request.getNamespace(), request.getName(), e);
            return new Result(true);
        } finally {
            MDC.remove("controller");
            MDC.remove("namespace");
            MDC.remove("name");
        }
    }

    private void applyOutcome(FederatedRole role, RoleValidationOutcome outcome) {
        FederatedRoleStatus status = role.getStatus();
        if (status.getConditions() == null) {
            status.setConditions(new ArrayList<>());
        }
        status.setState(outcome.getState());
        Conditions.set(status.getConditions(),
                outcome.isValid() ? FederatedConditionType.VALID : FederatedConditionType.INVALID,
                true, outcome.getReason(), outcome.getMessage(), OffsetDateTime.now(clock));
    }

    /**
     * Deletes every access request built from the role; their own finalizers clean up AWS.
     */
    private void deleteAccessRequests(FederatedRole role) throws ApiException {
        String namespace = role.getMetadata().getNamespace();
        String name = role.getMetadata().getName();
        for (FederatedAccountAccess access : accessStore.list(null)) {
            ResourceReference reference = access.getSpec() != null ? access.getSpec().getAwsFederatedRole() : null;
            if (reference != null && Objects.equals(reference.getName(), name)
                    && Objects.equals(reference.getNamespace(), namespace)) {
                log.info("Deleting AWSFederatedAccountAccess {}/{} for role {}/{}",
                        access.getMetadata().getNamespace(), access.getMetadata().getName(), namespace, name);
                accessStore.delete(access.getMetadata().getNamespace(), access.getMetadata().getName());
            }
        }
    }
}
