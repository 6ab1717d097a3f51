package io.awsaccount.operator.service;

import io.awsaccount.operator.model.Account;
import io.awsaccount.operator.model.AccountConditionType;
import io.awsaccount.operator.model.AccountSpec;
import io.awsaccount.operator.model.AccountState;
import io.awsaccount.operator.model.AccountStatus;
import io.awsaccount.operator.model.Condition;
import io.kubernetes.client.openapi.models.V1ObjectMeta;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;

import java.time.Duration;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class AccountStateEvaluatorTest {
    private static final OffsetDateTime NOW = OffsetDateTime.of(2024, 6, 1, 10, 0, 0, 0, ZoneOffset.UTC);
    private static final Duration TIMEOUT = Duration.ofMinutes(10);

    static Stream<Arguments> snapshots() {
        List<Arguments> rows = new ArrayList<>();
        List<AccountState> states = new ArrayList<>();
        states.add(null);
        states.addAll(List.of(AccountState.values()));
        for (AccountState state : states) {
            for (boolean byoc : new boolean[]{false, true}) {
                for (boolean claimed : new boolean[]{false, true}) {
                    for (boolean claimLink : new boolean[]{false, true}) {
                        for (boolean deleting : new boolean[]{false, true}) {
                            for (boolean finalizer : new boolean[]{false, true}) {
                                rows.add(Arguments.of(state, byoc, claimed, claimLink, deleting, finalizer));
                            }
                        }
                    }
                }
            }
        }
        return rows.stream();
    }

    @ParameterizedTest(name = "state={0} byoc={1} claimed={2} claimLink={3} deleting={4} finalizer={5}")
    @MethodSource("snapshots")
    public void compositePredicatesFollowTheirDefinitions(AccountState state, boolean byoc, boolean claimed,
                                                          boolean claimLink, boolean deleting, boolean finalizer) {
        Account account = account(state, byoc, claimed, claimLink, deleting, finalizer);

        boolean hasState = state != null;
        boolean ready = state == AccountState.READY;
        boolean creating = state == AccountState.CREATING;

        assertEquals(hasState, AccountStateEvaluator.hasState(account));
        assertEquals(ready, AccountStateEvaluator.isReady(account));
        assertEquals(creating, AccountStateEvaluator.isCreating(account));
        assertEquals(state == AccountState.FAILED, AccountStateEvaluator.isFailed(account));
        assertEquals(state == AccountState.PENDING_VERIFICATION, AccountStateEvaluator.isPendingVerification(account));
        assertEquals(claimed, AccountStateEvaluator.isClaimed(account));
        assertEquals(claimLink, AccountStateEvaluator.hasClaimLink(account));
        assertEquals(deleting, AccountStateEvaluator.isPendingDeletion(account));
        assertEquals(byoc, AccountStateEvaluator.isBYOC(account));
        assertEquals(finalizer, AccountStateEvaluator.hasFinalizer(account));

        assertEquals(ready && !claimed && claimLink, AccountStateEvaluator.isReadyUnclaimedAndHasClaimLink(account));
        assertEquals(byoc && deleting && finalizer, AccountStateEvaluator.isBYOCPendingDeletionWithFinalizer(account));
        assertEquals(byoc && !ready, AccountStateEvaluator.isBYOCAndNotReady(account));
        assertEquals((byoc && !hasState) || (!claimed && creating),
                AccountStateEvaluator.readyForInitialization(account));
        assertEquals(!claimed && !hasState, AccountStateEvaluator.isUnclaimedAndHasNoState(account));
        assertEquals(!claimed && creating, AccountStateEvaluator.isUnclaimedAndIsCreating(account));
    }

    @Test
    public void missingSpecAndStatusReadAsUnset() {
        Account account = new Account();
        account.setMetadata(new V1ObjectMeta().name("bare"));

        assertFalse(AccountStateEvaluator.hasState(account));
        assertFalse(AccountStateEvaluator.isBYOC(account));
        assertFalse(AccountStateEvaluator.hasAccountID(account));
        assertFalse(AccountStateEvaluator.hasClaimLink(account));
        assertFalse(AccountStateEvaluator.hasFinalizer(account));
        assertTrue(AccountStateEvaluator.isUnclaimedAndHasNoState(account));
        assertFalse(AccountStateEvaluator.creationStuck(account, TIMEOUT, NOW));
    }

    @Test
    public void accountIdAndPoolOwnership() {
        Account account = account(AccountState.READY, false, false, false, false, false);
        assertFalse(AccountStateEvaluator.hasAccountID(account));
        assertFalse(AccountStateEvaluator.isOwnedByAccountPool(account));
        assertFalse(AccountStateEvaluator.hasSupportCaseID(account));

        account.getSpec().setAwsAccountId("123456789012");
        account.getSpec().setAccountPool("default");
        account.getStatus().setSupportCaseId("case-1");

        assertTrue(AccountStateEvaluator.hasAccountID(account));
        assertTrue(AccountStateEvaluator.isOwnedByAccountPool(account));
        assertTrue(AccountStateEvaluator.hasSupportCaseID(account));
    }

    @Test
    public void creationStuckOnlyPastThreshold() {
        assertFalse(AccountStateEvaluator.creationStuck(creatingSince(NOW.minus(TIMEOUT)), TIMEOUT, NOW));
        assertFalse(AccountStateEvaluator.creationStuck(creatingSince(NOW.minusMinutes(1)), TIMEOUT, NOW));
        assertTrue(AccountStateEvaluator.creationStuck(
                creatingSince(NOW.minus(TIMEOUT).minusSeconds(1)), TIMEOUT, NOW));
        assertTrue(AccountStateEvaluator.creationStuck(
                creatingSince(NOW.minus(TIMEOUT).minusMinutes(1)), TIMEOUT, NOW));
    }

    @Test
    public void creationStuckNeedsCreatingCondition() {
        Account account = account(AccountState.CREATING, false, false, false, false, false);
        account.getStatus().getConditions().add(Condition.builder()
                .type(AccountConditionType.READY)
                .status(true)
                .lastProbeTime(NOW.minusHours(1))
                .build());

        assertFalse(AccountStateEvaluator.creationStuck(account, TIMEOUT, NOW));
    }

    @Test
    public void creatingTooLongRequiresCreatingState() {
        Account stale = creatingSince(NOW.minus(TIMEOUT).minusMinutes(1));
        assertTrue(AccountStateEvaluator.isCreatingTooLong(stale, TIMEOUT, NOW));

        stale.getStatus().setState(AccountState.READY);
        assertFalse(AccountStateEvaluator.isCreatingTooLong(stale, TIMEOUT, NOW));

        assertFalse(AccountStateEvaluator.isCreatingTooLong(creatingSince(NOW), TIMEOUT, NOW));
    }

    private static Account creatingSince(OffsetDateTime probeTime) {
        Account account = account(AccountState.CREATING, false, false, false, false, false);
        account.getStatus().getConditions().add(Condition.builder()
                .type(AccountConditionType.CREATING)
                .status(true)
                .lastProbeTime(probeTime)
                .lastTransitionTime(probeTime)
                .build());
        return account;
    }

    static Account account(AccountState state, boolean byoc, boolean claimed, boolean claimLink,
                           boolean deleting, boolean finalizer) {
        V1ObjectMeta metadata = new V1ObjectMeta().name("test-account").namespace("aws-account-operator");
        if (deleting) {
            metadata.setDeletionTimestamp(NOW);
        }
        if (finalizer) {
            metadata.setFinalizers(new ArrayList<>(List.of(FinalizerManager.FINALIZER)));
        }

        AccountStatus status = new AccountStatus();
        status.setState(state);
        status.setClaimed(claimed);

        Account account = new Account();
        account.setMetadata(metadata);
        account.setSpec(AccountSpec.builder()
                .byoc(byoc)
                .claimLink(claimLink ? "claim" : null)
                .build());
        account.setStatus(status);
        return account;
    }
}
