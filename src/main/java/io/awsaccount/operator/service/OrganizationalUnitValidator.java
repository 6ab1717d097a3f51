package io.awsaccount.operator.service;

import io.awsaccount.operator.client.AwsClient;
import io.awsaccount.operator.client.AwsErrors;
import io.awsaccount.operator.error.AccountValidationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import software.amazon.awssdk.services.organizations.model.ListParentsRequest;
import software.amazon.awssdk.services.organizations.model.MoveAccountRequest;
import software.amazon.awssdk.services.organizations.model.OrganizationsException;
import software.amazon.awssdk.services.organizations.model.Parent;
import software.amazon.awssdk.services.organizations.model.ParentType;

import java.util.List;
import java.util.function.Predicate;

/**
 * Checks an account's place in the organization tree and moves it under the target OU.
 */
@Slf4j
@Component
public class OrganizationalUnitValidator {

    /**
     * Deepest possible parent chain: five OU levels under the root.
     */
    static final int MAX_DEPTH = 6;

    /**
     * Walks the parent chain of {@code accountId} until {@code predicate} matches a parent.
     *
     * @return true when a parent on the chain matches; false when the chain ends first
     * @throws AccountValidationException with {@code MALFORMED_HIERARCHY} when a hop has more
     *                                    than one parent or the chain is deeper than the organization allows
     */
    public boolean isInTargetOU(AwsClient client, String accountId, Predicate<String> predicate) {
        String childId = accountId;
        for (int depth = 0; depth < MAX_DEPTH; depth++) {
            List<Parent> parents = listParents(client, childId);
            if (parents.isEmpty()) {
                log.info("No parent found for {}, account {} is outside the target OU", childId, accountId);
                return false;
            }
            if (parents.size() > 1) {
                throw new AccountValidationException(AccountValidationException.Reason.MALFORMED_HIERARCHY,
                        String.format("More than one parent found for %s", childId));
            }

            Parent parent = parents.get(0);
            if (predicate.test(parent.id())) {
                log.debug("Account {} found under {} after {} hops", accountId, parent.id(), depth + 1);
                return true;
            }
            if (parent.type() == ParentType.ROOT) {
                log.info("Reached organization root {} without finding the target OU for account {}",
                        parent.id(), accountId);
                return false;
            }
            childId = parent.id();
        }
        throw new AccountValidationException(AccountValidationException.Reason.MALFORMED_HIERARCHY,
                String.format("Parent chain of account %s is deeper than %d levels", accountId, MAX_DEPTH));
    }

    /**
     * Moves the account under {@code targetOu} unless it already sits beneath it.
     * With {@code moveEnabled} off the move is only logged.
     *
     * @return true when a move was issued
     */
    public boolean moveIfNeeded(AwsClient client, String accountId, String targetOu, boolean moveEnabled) {
        if (isInTargetOU(client, accountId, targetOu::equals)) {
            log.info("Account {} is already in OU {}", accountId, targetOu);
            return false;
        }

        List<Parent> parents;
        try {
            parents = listParents(client, accountId);
        } catch (OrganizationsException e) {
            throw new AccountValidationException(AccountValidationException.Reason.ACCOUNT_MOVE_FAILED,
                    "Unable to find parent of account " + accountId, e);
        }
        if (parents.isEmpty()) {
            throw new AccountValidationException(AccountValidationException.Reason.ACCOUNT_MOVE_FAILED,
                    "Account " + accountId + " has no parent to move from");
        }
        String currentOu = parents.get(0).id();

        if (!moveEnabled) {
            log.info("Not moving account {} from {} to {} (dry run)", accountId, currentOu, targetOu);
            return false;
        }

        log.info("Moving account {} from {} to {}", accountId, currentOu, targetOu);
        try {
            client.getOrganizations().moveAccount(MoveAccountRequest.builder()
                    .accountId(accountId)
                    .sourceParentId(currentOu)
                    .destinationParentId(targetOu)
                    .build());
        } catch (OrganizationsException e) {
            log.error("Could not move account {} to {}: {}", accountId, targetOu, AwsErrors.describe(e));
            throw new AccountValidationException(AccountValidationException.Reason.ACCOUNT_MOVE_FAILED,
                    "Could not move account " + accountId + " to " + targetOu, e);
        }
        return true;
    }

    private List<Parent> listParents(AwsClient client, String childId) {
        return client.getOrganizations()
                .listParents(ListParentsRequest.builder().childId(childId).build())
                .parents();
    }
}
