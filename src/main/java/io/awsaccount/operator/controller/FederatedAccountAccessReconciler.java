package io.awsaccount.operator.controller;

import io.awsaccount.operator.client.AwsErrors;
import io.awsaccount.operator.config.OperatorConfig;
import io.awsaccount.operator.config.OperatorConfigLoader;
import io.awsaccount.operator.config.OperatorProperties;
import io.awsaccount.operator.error.OperatorConfigurationException;
import io.awsaccount.operator.error.TeardownException;
import io.awsaccount.operator.model.Conditions;
import io.awsaccount.operator.model.FederatedAccountAccess;
import io.awsaccount.operator.model.FederatedAccountAccessState;
import io.awsaccount.operator.model.FederatedAccountAccessStatus;
import io.awsaccount.operator.model.FederatedConditionType;
import io.awsaccount.operator.model.FederatedRole;
import io.awsaccount.operator.model.FederatedRoleState;
import io.awsaccount.operator.model.ResourceReference;
import io.awsaccount.operator.service.FederatedAccessProvisioner;
import io.awsaccount.operator.service.FinalizerManager;
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
import java.util.Optional;

/**
 * Reconciler for AWSFederatedAccountAccess resources.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class FederatedAccountAccessReconciler implements Reconciler {
    static final String CONTROLLER_NAME = "awsfederatedaccountaccess";

    private final ResourceStore<FederatedAccountAccess> accessStore;
    private final ResourceStore<FederatedRole> roleStore;
    private final OperatorConfigLoader configLoader;
    private final FederatedAccessProvisioner accessProvisioner;
    private final FinalizerManager finalizerManager;
    private final OperatorProperties properties;
    private final Clock clock;

    @Override
    public Result reconcile(Request request) {
        MDC.put("controller", CONTROLLER_NAME);
        MDC.put("namespace", request.getNamespace());
        MDC.put("name", request.getName());
        log.info("Reconciling AWSFederatedAccountAccess {}/{}", request.getNamespace(), request.getName());

        try {
            Optional<FederatedAccountAccess> found = accessStore.get(request.getNamespace(), request.getName());
            if (found.isEmpty()) {
                log.info("AWSFederatedAccountAccess {}/{} not found", request.getNamespace(), request.getName());
                return new Result(false);
            }
            return reconcileAccess(found.get());
        } catch (OperatorConfigurationException e) {
            log.error("Invalid operator configuration: {}", e.getMessage());
            return new Result(true, properties.getConfigErrorBackoff());
        } catch (TeardownException e) {
            log.error("Teardown of AWSFederatedAccountAccess {}/{} failed: {}",
                    request.getNamespace(), request.getName(), e.getMessage());
            return new Result(true);
        } catch (ApiException e) {
            log.error("Error reconciling AWSFederatedAccountAccess {}/{}: {} {}",
                    request.getNamespace(), request.getName(), e.getCode(), e.getMessage());
            return new Result(true);
        } catch (SdkException e) {
            log.error("AWS error reconciling AWSFederatedAccountAccess {}/{}: {}",
                    request.getNamespace(), request.getName(), AwsErrors.describe(e));
            return new Result(true);
        } catch (RuntimeException e) {
            log.error("Unexpected error reconciling AWSFederatedAccountAccess {}/{}",
                    request.getNamespace(), request.getName(), e);
            return new Result(true);
        } finally {
            MDC.remove("controller");
            MDC.remove("namespace");
            MDC.remove("name");
        }
    }

    private Result reconcileAccess(FederatedAccountAccess access) throws ApiException {
        if (access.getStatus() == null) {
            access.setStatus(new FederatedAccountAccessStatus());
        }
        if (access.getStatus().getConditions() == null) {
            access.getStatus().setConditions(new ArrayList<>());
        }

        OperatorConfig config = configLoader.load();
        ResourceReference roleReference = access.getSpec().getAwsFederatedRole();
        FederatedRole role = roleStore.get(roleReference.getNamespace(), roleReference.getName()).orElse(null);

        if (role == null && !finalizerManager.isDeleting(access)) {
            log.error("Requested role {}/{} not found", roleReference.getNamespace(), roleReference.getName());
            if (access.getStatus().getState() != FederatedAccountAccessState.FAILED) {
                markFailed(access, "Requested role does not exist");
                accessStore.updateStatus(access);
            }
            return new Result(false);
        }

        if (finalizerManager.finalizeIfDeleting(access, accessStore,
                () -> accessProvisioner.teardown(access, role, config))) {
            return new Result(false);
        }
        if (finalizerManager.addIfMissing(access, accessStore)) {
            return new Result(true);
        }

        FederatedAccountAccessState state = access.getStatus().getState();
        if (state == FederatedAccountAccessState.READY || state == FederatedAccountAccessState.FAILED) {
            return new Result(false);
        }

        FederatedRoleState roleState = role.getStatus() != null ? role.getStatus().getState() : null;
        // FedRAMP mode never validates templates.
        if (roleState == null && !config.isFedramp()) {
            log.info("Role {}/{} not validated yet, retrying in {}", roleReference.getNamespace(),
                    roleReference.getName(), properties.getRequeueInterval());
            return new Result(true, properties.getRequeueInterval());
        }
        if (roleState == FederatedRoleState.INVALID) {
            markFailed(access, "Requested role is invalid");
            accessStore.updateStatus(access);
            return new Result(false);
        }

        accessProvisioner.provision(access, role, config);
        return new Result(false);
    }

    private void markFailed(FederatedAccountAccess access, String message) {
        access.getStatus().setState(FederatedAccountAccessState.FAILED);
        Conditions.set(access.getStatus().getConditions(), FederatedConditionType.FAILED, true,
                FederatedConditionType.FAILED, message, OffsetDateTime.now(clock));
    }
}
