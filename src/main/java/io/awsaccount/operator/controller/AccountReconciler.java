package io.awsaccount.operator.controller;

import io.awsaccount.operator.client.AwsClient;
import io.awsaccount.operator.client.AwsClientFactory;
import io.awsaccount.operator.client.AwsErrors;
import io.awsaccount.operator.config.OperatorConfig;
import io.awsaccount.operator.config.OperatorConfigLoader;
import io.awsaccount.operator.config.OperatorProperties;
import io.awsaccount.operator.error.AccountCreationException;
import io.awsaccount.operator.error.OperatorConfigurationException;
import io.awsaccount.operator.model.Account;
import io.awsaccount.operator.model.AccountConditionType;
import io.awsaccount.operator.model.AccountSpec;
import io.awsaccount.operator.model.AccountState;
import io.awsaccount.operator.model.AccountStatus;
import io.awsaccount.operator.model.Conditions;
import io.awsaccount.operator.service.AccountProvisioner;
import io.awsaccount.operator.service.AccountStateEvaluator;
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
import software.amazon.awssdk.services.organizations.model.CreateAccountState;
import software.amazon.awssdk.services.organizations.model.CreateAccountStatus;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.Optional;

/**
 * Reconciler for Account resources.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class AccountReconciler implements Reconciler {
    static final String CONTROLLER_NAME = "account";

    private final ResourceStore<Account> accountStore;
    private final OperatorConfigLoader configLoader;
    private final AwsClientFactory clientFactory;
    private final AccountProvisioner accountProvisioner;
    private final FinalizerManager finalizerManager;
    private final OperatorProperties properties;
    private final Clock clock;

    @Override
    public Result reconcile(Request request) {
        MDC.put("controller", CONTROLLER_NAME);
        MDC.put("namespace", request.getNamespace());
        MDC.put("name", request.getName());
        log.info("Reconciling Account {}/{}", request.getNamespace(), request.getName());

        try {
            Optional<Account> found = accountStore.get(request.getNamespace(), request.getName());
            if (found.isEmpty()) {
                log.info("Account {}/{} not found", request.getNamespace(), request.getName());
                return new Result(false);
            }
            return reconcileAccount(found.get());
        } catch (OperatorConfigurationException e) {
            log.error("Invalid operator configuration: {}", e.getMessage());
            return new Result(true, properties.getConfigErrorBackoff());
        } catch (ApiException e) {
            log.error("Error reconciling Account {}/{}: {} {}",
                    request.getNamespace(), request.getName(), e.getCode(), e.getMessage());
            return new Result(true);
        } catch (SdkException e) {
            log.error("AWS error reconciling Account {}/{}: {}",
                    request.getNamespace(), request.getName(), AwsErrors.describe(e));
            return new Result(true);
        } catch (RuntimeException e) {
            log.error("Unexpected error reconciling Account {}/{}", request.getNamespace(), request.getName(), e);
            return new Result(true);
        } finally {
            MDC.remove("controller");
            MDC.remove("namespace");
            MDC.remove("name");
        }
    }

    private Result reconcileAccount(Account account) throws ApiException {
        if (account.getSpec() == null) {
            account.setSpec(new AccountSpec());
        }
        if (account.getStatus() == null) {
            account.setStatus(new AccountStatus());
        }
        if (account.getStatus().getConditions() == null) {
            account.getStatus().setConditions(new ArrayList<>());
        }

        if (AccountStateEvaluator.isBYOCPendingDeletionWithFinalizer(account)) {
            log.info("Releasing BYOC account {} pending deletion", account.getMetadata().getName());
            finalizerManager.removeFinalizer(account, accountStore);
            return new Result(false);
        }
        if (AccountStateEvaluator.isPendingDeletion(account)) {
            // Pool accounts are returned to the organization, not closed, so there is nothing to tear down.
            finalizerManager.removeFinalizer(account, accountStore);
            return new Result(false);
        }
        if (finalizerManager.addIfMissing(account, accountStore)) {
            return new Result(true);
        }

        if (AccountStateEvaluator.isReadyUnclaimedAndHasClaimLink(account)) {
            log.info("Marking account {} claimed by {}/{}", account.getMetadata().getName(),
                    account.getSpec().getClaimLinkNamespace(), account.getSpec().getClaimLink());
            account.getStatus().setClaimed(true);
            setCondition(account, AccountConditionType.CLAIMED, "AccountClaimed",
                    "Account claimed by " + account.getSpec().getClaimLink());
            accountStore.updateStatus(account);
            return new Result(false);
        }

        if (AccountStateEvaluator.isFailed(account)) {
            log.debug("Account {} is failed, nothing to do", account.getMetadata().getName());
            return new Result(false);
        }

        if (AccountStateEvaluator.readyForInitialization(account)) {
            return initialize(account);
        }

        if (AccountStateEvaluator.isUnclaimedAndHasNoState(account) && !AccountStateEvaluator.isBYOC(account)) {
            log.info("Starting creation of account {}", account.getMetadata().getName());
            account.getStatus().setState(AccountState.CREATING);
            setCondition(account, AccountConditionType.CREATING, "AccountCreating", "Attempting to create account");
            accountStore.updateStatus(account);
            return new Result(true);
        }

        return new Result(false);
    }

    private Result initialize(Account account) throws ApiException {
        String name = account.getMetadata().getName();

        if (AccountStateEvaluator.isBYOC(account)) {
            if (!AccountStateEvaluator.hasAccountID(account)) {
                markFailed(account, "MissingAccountID", "BYOC account has no AWS account id");
            } else {
                markReady(account, "BYOC account is ready");
            }
            accountStore.updateStatus(account);
            return new Result(false);
        }

        OffsetDateTime now = OffsetDateTime.now(clock);
        if (hasCreateRequest(account)
                && AccountStateEvaluator.creationStuck(account, properties.getCreationTimeout(), now)) {
            log.error("Account {} has been creating for longer than {}", name, properties.getCreationTimeout());
            markFailed(account, "CreationTimeout",
                    "Account creation did not complete within " + properties.getCreationTimeout());
            accountStore.updateStatus(account);
            return new Result(false);
        }

        OperatorConfig config = configLoader.load();
        try (AwsClient client = clientFactory.fromOperatorSecret(config)) {
            if (!AccountStateEvaluator.hasAccountID(account)) {
                Optional<String> accountId = createOrCheck(client, account);
                if (accountId.isEmpty()) {
                    accountStore.updateStatus(account);
                    return new Result(true, properties.getRequeueInterval());
                }
                account.getSpec().setAwsAccountId(accountId.get());
                accountStore.update(account);
            }

            if (config.hasShardName()) {
                accountProvisioner.tagAccount(client, account.getSpec().getAwsAccountId(), config.getShardName());
            }
        } catch (AccountCreationException e) {
            return handleCreationFailure(account, e);
        }

        account.getStatus().setCreateAccountRequestId(null);
        markReady(account, "Account is ready");
        accountStore.updateStatus(account);
        log.info("Account {} is ready with AWS account {}", name, account.getSpec().getAwsAccountId());
        return new Result(false);
    }

    /**
     * Issues the create request, or checks on the one already in flight. A new request id is written
     * to the status before its first status check, so a failed check never leads to a second create.
     * Each new request restarts the creation timeout.
     *
     * @return the new AWS account id, or empty while creation is still in progress
     */
    private Optional<String> createOrCheck(AwsClient client, Account account) throws ApiException {
        String name = account.getMetadata().getName();
        String requestId = account.getStatus().getCreateAccountRequestId();

        if (!hasCreateRequest(account)) {
            String email = String.format(properties.getAccountEmailTemplate(), name);
            log.info("Creating AWS account for {} with e-mail {}", name, email);
            setCondition(account, AccountConditionType.CREATING, "AccountCreating", "Attempting to create account");
            requestId = accountProvisioner.requestAccountCreation(client, name, email);
            account.getStatus().setCreateAccountRequestId(requestId);
            accountStore.updateStatus(account);
        } else {
            log.info("Checking creation request {} for account {}", requestId, name);
        }

        CreateAccountStatus status = accountProvisioner.checkCreateAccountStatus(client, requestId)
                .createAccountStatus();
        if (status.state() != CreateAccountState.SUCCEEDED) {
            log.info("Creation request {} for account {} is {}", requestId, name, status.stateAsString());
            return Optional.empty();
        }
        return Optional.of(status.accountId());
    }

    private static boolean hasCreateRequest(Account account) {
        String requestId = account.getStatus().getCreateAccountRequestId();
        return requestId != null && !requestId.isEmpty();
    }

    private Result handleCreationFailure(Account account, AccountCreationException e) throws ApiException {
        account.getStatus().setCreateAccountRequestId(null);
        switch (e.getReason()) {
            case ACCOUNT_LIMIT_EXCEEDED:
                log.error("Account limit exceeded creating {}, retrying in {}",
                        account.getMetadata().getName(), properties.getAccountLimitBackoff());
                setCondition(account, AccountConditionType.ACCOUNT_LIMIT_EXCEEDED, "AccountLimitExceeded",
                        e.getMessage());
                accountStore.updateStatus(account);
                return new Result(true, properties.getAccountLimitBackoff());
            case FAILED_CREATE_ACCOUNT:
                markFailed(account, "FailedCreateAccount", e.getMessage());
                accountStore.updateStatus(account);
                return new Result(false);
            default:
                log.warn("Account creation for {} interrupted: {}", account.getMetadata().getName(), e.getMessage());
                return new Result(true);
        }
    }

    private void markReady(Account account, String message) {
        account.getStatus().setState(AccountState.READY);
        setCondition(account, AccountConditionType.READY, "AccountReady", message);
    }

    private void markFailed(Account account, String reason, String message) {
        account.getStatus().setState(AccountState.FAILED);
        setCondition(account, AccountConditionType.FAILED, reason, message);
    }

    private void setCondition(Account account, String type, String reason, String message) {
        Conditions.set(account.getStatus().getConditions(), type, true, reason, message, OffsetDateTime.now(clock));
    }
}
