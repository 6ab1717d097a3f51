package io.awsaccount.operator.controller;

import io.awsaccount.operator.client.AwsClient;
import io.awsaccount.operator.client.AwsClientFactory;
import io.awsaccount.operator.client.AwsErrors;
import io.awsaccount.operator.config.OperatorConfig;
import io.awsaccount.operator.config.OperatorConfigLoader;
import io.awsaccount.operator.config.OperatorProperties;
import io.awsaccount.operator.error.AccountValidationException;
import io.awsaccount.operator.error.OperatorConfigurationException;
import io.awsaccount.operator.model.Account;
import io.awsaccount.operator.service.AccountValidationService;
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

import java.util.Optional;

/**
 * Reconciler keeping pool accounts under the configured OU and tagged with their owner.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class AccountValidationReconciler implements Reconciler {
    static final String CONTROLLER_NAME = "accountvalidation";

    private final ResourceStore<Account> accountStore;
    private final OperatorConfigLoader configLoader;
    private final AwsClientFactory clientFactory;
    private final AccountValidationService validationService;
    private final OperatorProperties properties;

    @Override
    public Result reconcile(Request request) {
        MDC.put("controller", CONTROLLER_NAME);
        MDC.put("namespace", request.getNamespace());
        MDC.put("name", request.getName());
        log.info("Validating Account {}/{}", request.getNamespace(), request.getName());

        try {
            Optional<Account> found = accountStore.get(request.getNamespace(), request.getName());
            if (found.isEmpty()) {
                log.info("Account {}/{} not found", request.getNamespace(), request.getName());
                return new Result(false);
            }
            Account account = found.get();

            validationService.validatePreconditions(account);

            OperatorConfig config = configLoader.load();
            log.debug("Account moving enabled: {}, tagging enabled: {}",
                    config.isMoveAccountEnabled(), config.isTagAccountEnabled());
            try (AwsClient client = clientFactory.fromOperatorSecret(config)) {
                validationService.validatePlacement(client, account, config);
            }
            return new Result(false);
        } catch (AccountValidationException e) {
            return handleValidationFailure(request, e);
        } catch (OperatorConfigurationException e) {
            log.error("Invalid operator configuration: {}", e.getMessage());
            return new Result(true, properties.getConfigErrorBackoff());
        } catch (ApiException e) {
            log.error("Error validating Account {}/{}: {} {}",
                    request.getNamespace(), request.getName(), e.getCode(), e.getMessage());
            return new Result(true);
        } catch (SdkException e) {
            log.error("AWS error validating Account {}/{}: {}",
                    request.getNamespace(), request.getName(), AwsErrors.describe(e));
            return new Result(true);
        } catch (RuntimeException e) {
            log.error("Unexpected error validating Account {}/{}", request.getNamespace(), request.getName(), e);
            return new Result(true);
        } finally {
            MDC.remove("controller");
            MDC.remove("namespace");
            MDC.remove("name");
        }
    }

    private Result handleValidationFailure(Request request, AccountValidationException e) {
        switch (e.getReason()) {
            case INVALID_ACCOUNT:
            case MISSING_AWS_ACCOUNT:
                log.info("Skipping validation of Account {}/{}: {}",
                        request.getNamespace(), request.getName(), e.getMessage());
                return new Result(false);
            case ACCOUNT_MOVE_FAILED:
                log.error("Could not move Account {}/{}, retrying in {}: {}",
                        request.getNamespace(), request.getName(), properties.getMoveWaitTime(), e.getMessage());
                return new Result(true, properties.getMoveWaitTime());
            default:
                if (e.isTagFailure()) {
                    log.error("Owner tag check of Account {}/{} failed: {}",
                            request.getNamespace(), request.getName(), e.getMessage());
                } else {
                    log.error("Validation of Account {}/{} failed ({}): {}",
                            request.getNamespace(), request.getName(), e.getReason(), e.getMessage());
                }
                return new Result(true);
        }
    }
}
