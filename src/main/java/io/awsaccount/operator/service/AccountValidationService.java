package io.awsaccount.operator.service;

import io.awsaccount.operator.client.AwsClient;
import io.awsaccount.operator.config.OperatorConfig;
import io.awsaccount.operator.error.AccountValidationException;
import io.awsaccount.operator.model.Account;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Runs the pool account checks in order: origin, account id, OU placement, owner tag.
 * The first failing check throws and the rest are skipped.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class AccountValidationService {
    private final OrganizationalUnitValidator organizationalUnitValidator;
    private final AccountTagValidator accountTagValidator;

    /**
     * Checks that need no provider call.
     */
    public void validatePreconditions(Account account) {
        validateOrigin(account);
        validateAwsAccountId(account);
    }

    public void validateOrigin(Account account) {
        if (AccountStateEvaluator.isBYOC(account)) {
            throw new AccountValidationException(AccountValidationException.Reason.INVALID_ACCOUNT,
                    "Account is a BYOC account");
        }
        if (!AccountStateEvaluator.isOwnedByAccountPool(account)) {
            throw new AccountValidationException(AccountValidationException.Reason.INVALID_ACCOUNT,
                    "Account is not in an account pool");
        }
        if (!AccountStateEvaluator.isReady(account)) {
            throw new AccountValidationException(AccountValidationException.Reason.INVALID_ACCOUNT,
                    "Account is not in a ready state");
        }
    }

    public void validateAwsAccountId(Account account) {
        if (!AccountStateEvaluator.hasAccountID(account)) {
            throw new AccountValidationException(AccountValidationException.Reason.MISSING_AWS_ACCOUNT,
                    "Account has no associated AWS account");
        }
    }

    /**
     * Places the account under the configured root OU and checks its owner tag.
     * Callers must have passed {@link #validatePreconditions(Account)}.
     */
    public void validatePlacement(AwsClient client, Account account, OperatorConfig config) {
        String accountId = account.getSpec().getAwsAccountId();

        if (config.hasRootOu()) {
            organizationalUnitValidator.moveIfNeeded(client, accountId, config.getRootOuId(),
                    config.isMoveAccountEnabled());
        } else {
            log.info("No root OU configured, skipping OU validation for account {}", accountId);
        }

        if (config.hasShardName()) {
            accountTagValidator.validateOwnerTag(client, accountId, config.getShardName(),
                    config.isTagAccountEnabled());
        } else {
            log.info("No shard name configured, skipping owner tag validation for account {}", accountId);
        }
    }
}
