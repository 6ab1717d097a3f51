package io.awsaccount.operator.service;

import io.awsaccount.operator.model.Account;
import io.awsaccount.operator.model.AccountConditionType;
import io.awsaccount.operator.model.AccountSpec;
import io.awsaccount.operator.model.AccountState;
import io.awsaccount.operator.model.AccountStatus;
import io.awsaccount.operator.model.Conditions;

import java.time.Duration;
import java.time.OffsetDateTime;
import java.util.List;

/**
 * Predicates over an {@link Account} snapshot that decide which lifecycle step is due.
 * A missing spec or status reads as all fields unset.
 */
public final class AccountStateEvaluator {
    public static final String FINALIZER = FinalizerManager.FINALIZER;

    private AccountStateEvaluator() {
    }

    public static boolean hasState(Account account) {
        return state(account) != null;
    }

    public static boolean isPendingVerification(Account account) {
        return state(account) == AccountState.PENDING_VERIFICATION;
    }

    public static boolean isReady(Account account) {
        return state(account) == AccountState.READY;
    }

    public static boolean isFailed(Account account) {
        return state(account) == AccountState.FAILED;
    }

    public static boolean isCreating(Account account) {
        return state(account) == AccountState.CREATING;
    }

    public static boolean isClaimed(Account account) {
        return status(account).isClaimed();
    }

    public static boolean hasClaimLink(Account account) {
        return notEmpty(spec(account).getClaimLink());
    }

    public static boolean isPendingDeletion(Account account) {
        return account.getMetadata() != null && account.getMetadata().getDeletionTimestamp() != null;
    }

    public static boolean isBYOC(Account account) {
        return spec(account).isByoc();
    }

    public static boolean hasFinalizer(Account account) {
        if (account.getMetadata() == null) {
            return false;
        }
        List<String> finalizers = account.getMetadata().getFinalizers();
        return finalizers != null && finalizers.contains(FINALIZER);
    }

    public static boolean hasAccountID(Account account) {
        return notEmpty(spec(account).getAwsAccountId());
    }

    public static boolean hasSupportCaseID(Account account) {
        return notEmpty(status(account).getSupportCaseId());
    }

    public static boolean isOwnedByAccountPool(Account account) {
        return notEmpty(spec(account).getAccountPool());
    }

    public static boolean isReadyUnclaimedAndHasClaimLink(Account account) {
        return isReady(account) && !isClaimed(account) && hasClaimLink(account);
    }

    public static boolean isBYOCPendingDeletionWithFinalizer(Account account) {
        return isBYOC(account) && isPendingDeletion(account) && hasFinalizer(account);
    }

    public static boolean isBYOCAndNotReady(Account account) {
        return isBYOC(account) && !isReady(account);
    }

    public static boolean readyForInitialization(Account account) {
        return (isBYOC(account) && !hasState(account)) || isUnclaimedAndIsCreating(account);
    }

    public static boolean isUnclaimedAndHasNoState(Account account) {
        return !isClaimed(account) && !hasState(account);
    }

    public static boolean isUnclaimedAndIsCreating(Account account) {
        return !isClaimed(account) && isCreating(account);
    }

    /**
     * True when a Creating condition exists and was last probed more than {@code threshold} before {@code now}.
     */
    public static boolean creationStuck(Account account, Duration threshold, OffsetDateTime now) {
        return Conditions.find(status(account).getConditions(), AccountConditionType.CREATING)
                .map(c -> c.getLastProbeTime() != null
                        && Duration.between(c.getLastProbeTime(), now).compareTo(threshold) > 0)
                .orElse(false);
    }

    public static boolean isCreatingTooLong(Account account, Duration threshold, OffsetDateTime now) {
        return isCreating(account) && creationStuck(account, threshold, now);
    }

    private static AccountState state(Account account) {
        return status(account).getState();
    }

    private static AccountStatus status(Account account) {
        return account.getStatus() != null ? account.getStatus() : new AccountStatus();
    }

    private static AccountSpec spec(Account account) {
        return account.getSpec() != null ? account.getSpec() : new AccountSpec();
    }

    private static boolean notEmpty(String value) {
        return value != null && !value.isEmpty();
    }
}
