package io.awsaccount.operator.controller;

import io.awsaccount.operator.client.AwsClient;
import io.awsaccount.operator.client.AwsClientFactory;
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
import io.awsaccount.operator.model.Condition;
import io.awsaccount.operator.model.Conditions;
import io.awsaccount.operator.service.AccountProvisioner;
import io.awsaccount.operator.service.FinalizerManager;
import io.awsaccount.operator.store.InMemoryResourceStore;
import io.kubernetes.client.extended.controller.reconciler.Request;
import io.kubernetes.client.extended.controller.reconciler.Result;
import io.kubernetes.client.openapi.ApiException;
import io.kubernetes.client.openapi.models.V1ObjectMeta;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import software.amazon.awssdk.services.organizations.model.CreateAccountState;
import software.amazon.awssdk.services.organizations.model.CreateAccountStatus;
import software.amazon.awssdk.services.organizations.model.DescribeCreateAccountStatusResponse;
import software.amazon.awssdk.services.organizations.model.ServiceException;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
public class AccountReconcilerTest {
    private static final String NAMESPACE = "aws-account-operator";
    private static final String NAME = "osd-creds-mgmt-abc123";
    private static final Instant NOW = Instant.parse("2024-05-01T10:00:00Z");
    private static final OperatorConfig CONFIG = OperatorConfig.builder().shardName("shard-a").build();

    @Mock
    private OperatorConfigLoader configLoader;
    @Mock
    private AwsClientFactory clientFactory;
    @Mock
    private AccountProvisioner accountProvisioner;

    private final InMemoryResourceStore<Account> store = new InMemoryResourceStore<>();
    private final OperatorProperties properties = new OperatorProperties();
    private final AwsClient client = mock(AwsClient.class);
    private AccountReconciler reconciler;

    @BeforeEach
    public void setUp() {
        reconciler = new AccountReconciler(store, configLoader, clientFactory, accountProvisioner,
                new FinalizerManager(), properties, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    public void missingAccountIsIgnored() {
        Result result = reconciler.reconcile(new Request(NAMESPACE, NAME));

        assertFalse(result.isRequeue());
    }

    @Test
    public void freshAccountGainsFinalizerBeforeCreation() throws ApiException {
        Account account = account(null);
        account.getMetadata().setFinalizers(null);
        store(account);

        Result first = reconciler.reconcile(new Request(NAMESPACE, NAME));

        assertTrue(first.isRequeue());
        assertTrue(account.getMetadata().getFinalizers().contains(FinalizerManager.FINALIZER));
        assertNull(account.getStatus().getState());
        assertEquals(1, store.getUpdates());
        verifyNoInteractions(accountProvisioner, clientFactory);

        reconciler.reconcile(new Request(NAMESPACE, NAME));
        assertEquals(AccountState.CREATING, account.getStatus().getState());

        stubClient();
        when(accountProvisioner.requestAccountCreation(any(), any(), any())).thenAnswer(invocation -> {
            assertTrue(account.getMetadata().getFinalizers().contains(FinalizerManager.FINALIZER));
            return "car-1";
        });
        when(accountProvisioner.checkCreateAccountStatus(client, "car-1"))
                .thenReturn(status(CreateAccountState.IN_PROGRESS, null));

        reconciler.reconcile(new Request(NAMESPACE, NAME));

        assertEquals("car-1", account.getStatus().getCreateAccountRequestId());
        assertEquals(1, store.getUpdates());
    }

    @Test
    public void newAccountEntersCreating() {
        Account account = store(account(null));

        Result result = reconciler.reconcile(new Request(NAMESPACE, NAME));

        assertTrue(result.isRequeue());
        assertEquals(AccountState.CREATING, account.getStatus().getState());
        Condition creating = condition(account, AccountConditionType.CREATING);
        assertEquals(OffsetDateTime.ofInstant(NOW, ZoneOffset.UTC), creating.getLastProbeTime());
        verifyNoInteractions(accountProvisioner, clientFactory);
    }

    @Test
    public void creationInProgressPersistsRequestId() throws ApiException {
        Account account = store(creatingAccount(Duration.ofMinutes(1)));
        stubClient();
        when(accountProvisioner.requestAccountCreation(client, NAME,
                String.format(properties.getAccountEmailTemplate(), NAME))).thenReturn("car-1");
        when(accountProvisioner.checkCreateAccountStatus(client, "car-1"))
                .thenReturn(status(CreateAccountState.IN_PROGRESS, null));

        Result result = reconciler.reconcile(new Request(NAMESPACE, NAME));

        assertTrue(result.isRequeue());
        assertEquals(properties.getRequeueInterval(), result.getRequeueAfter());
        assertEquals("car-1", account.getStatus().getCreateAccountRequestId());
        assertEquals(AccountState.CREATING, account.getStatus().getState());
        assertEquals(2, store.getStatusUpdates());
    }

    @Test
    public void failedStatusCheckKeepsRequestId() throws ApiException {
        Account account = store(creatingAccount(Duration.ofMinutes(1)));
        stubClient();
        when(accountProvisioner.requestAccountCreation(any(), any(), any())).thenReturn("car-9");
        when(accountProvisioner.checkCreateAccountStatus(client, "car-9"))
                .thenThrow(ServiceException.builder().message("describe failed").build())
                .thenReturn(status(CreateAccountState.IN_PROGRESS, null));

        Result failed = reconciler.reconcile(new Request(NAMESPACE, NAME));

        assertTrue(failed.isRequeue());
        assertEquals("car-9", account.getStatus().getCreateAccountRequestId());
        assertEquals(1, store.getStatusUpdates());

        Result retried = reconciler.reconcile(new Request(NAMESPACE, NAME));

        assertEquals(properties.getRequeueInterval(), retried.getRequeueAfter());
        assertEquals("car-9", account.getStatus().getCreateAccountRequestId());
        verify(accountProvisioner, times(1)).requestAccountCreation(any(), any(), any());
        verify(accountProvisioner, times(2)).checkCreateAccountStatus(client, "car-9");
    }

    @Test
    public void completedCreationMakesAccountReady() throws ApiException {
        Account account = store(creatingAccount(Duration.ofMinutes(1)));
        account.getStatus().setCreateAccountRequestId("car-1");
        stubClient();
        when(accountProvisioner.checkCreateAccountStatus(client, "car-1"))
                .thenReturn(status(CreateAccountState.SUCCEEDED, "123456789012"));

        Result result = reconciler.reconcile(new Request(NAMESPACE, NAME));

        assertFalse(result.isRequeue());
        assertEquals("123456789012", account.getSpec().getAwsAccountId());
        assertEquals(AccountState.READY, account.getStatus().getState());
        assertNull(account.getStatus().getCreateAccountRequestId());
        verify(accountProvisioner).tagAccount(client, "123456789012", "shard-a");
        assertEquals(1, store.getUpdates());
    }

    @Test
    public void stuckCreationFails() {
        Account account = store(creatingAccount(properties.getCreationTimeout().plusMinutes(1)));
        account.getStatus().setCreateAccountRequestId("car-1");

        Result result = reconciler.reconcile(new Request(NAMESPACE, NAME));

        assertFalse(result.isRequeue());
        assertEquals(AccountState.FAILED, account.getStatus().getState());
        assertEquals("CreationTimeout", condition(account, AccountConditionType.FAILED).getReason());
        verifyNoInteractions(clientFactory);
    }

    @Test
    public void accountLimitBacksOff() throws ApiException {
        Account account = store(creatingAccount(Duration.ofMinutes(1)));
        account.getStatus().setCreateAccountRequestId("car-1");
        stubClient();
        when(accountProvisioner.checkCreateAccountStatus(client, "car-1"))
                .thenThrow(new AccountCreationException(AccountCreationException.Reason.ACCOUNT_LIMIT_EXCEEDED,
                        "limit"));

        Result result = reconciler.reconcile(new Request(NAMESPACE, NAME));

        assertTrue(result.isRequeue());
        assertEquals(properties.getAccountLimitBackoff(), result.getRequeueAfter());
        assertNull(account.getStatus().getCreateAccountRequestId());
        assertEquals(AccountState.CREATING, account.getStatus().getState());
        condition(account, AccountConditionType.ACCOUNT_LIMIT_EXCEEDED);
    }

    @Test
    public void accountLimitRetriesCreationAfterBackoff() throws ApiException {
        Account account = store(creatingAccount(Duration.ofMinutes(1)));
        stubClient();
        when(accountProvisioner.requestAccountCreation(any(), any(), any()))
                .thenThrow(new AccountCreationException(AccountCreationException.Reason.ACCOUNT_LIMIT_EXCEEDED,
                        "limit"))
                .thenReturn("car-2");
        when(accountProvisioner.checkCreateAccountStatus(client, "car-2"))
                .thenReturn(status(CreateAccountState.IN_PROGRESS, null));

        Result backoff = reconciler.reconcile(new Request(NAMESPACE, NAME));
        assertEquals(properties.getAccountLimitBackoff(), backoff.getRequeueAfter());

        Instant later = NOW.plus(properties.getAccountLimitBackoff()).plusSeconds(5);
        AccountReconciler laterReconciler = new AccountReconciler(store, configLoader, clientFactory,
                accountProvisioner, new FinalizerManager(), properties, Clock.fixed(later, ZoneOffset.UTC));

        Result retried = laterReconciler.reconcile(new Request(NAMESPACE, NAME));

        assertTrue(retried.isRequeue());
        assertEquals(AccountState.CREATING, account.getStatus().getState());
        assertEquals("car-2", account.getStatus().getCreateAccountRequestId());
        assertEquals(OffsetDateTime.ofInstant(later, ZoneOffset.UTC),
                condition(account, AccountConditionType.CREATING).getLastProbeTime());
        verify(accountProvisioner, times(2)).requestAccountCreation(any(), any(), any());
    }

    @Test
    public void rejectedCreationFails() throws ApiException {
        Account account = store(creatingAccount(Duration.ofMinutes(1)));
        stubClient();
        when(accountProvisioner.requestAccountCreation(any(), any(), any()))
                .thenThrow(new AccountCreationException(AccountCreationException.Reason.FAILED_CREATE_ACCOUNT,
                        "duplicate"));

        Result result = reconciler.reconcile(new Request(NAMESPACE, NAME));

        assertFalse(result.isRequeue());
        assertEquals(AccountState.FAILED, account.getStatus().getState());
    }

    @Test
    public void throttledCreationRequeues() throws ApiException {
        Account account = store(creatingAccount(Duration.ofMinutes(1)));
        stubClient();
        when(accountProvisioner.requestAccountCreation(any(), any(), any()))
                .thenThrow(new AccountCreationException(AccountCreationException.Reason.TOO_MANY_REQUESTS,
                        "slow down"));

        Result result = reconciler.reconcile(new Request(NAMESPACE, NAME));

        assertTrue(result.isRequeue());
        assertEquals(AccountState.CREATING, account.getStatus().getState());
        assertEquals(0, store.getStatusUpdates());
    }

    @Test
    public void byocAccountWithoutIdFails() {
        Account account = account(null);
        account.getSpec().setByoc(true);
        store(account);

        reconciler.reconcile(new Request(NAMESPACE, NAME));

        assertEquals(AccountState.FAILED, account.getStatus().getState());
        assertEquals("MissingAccountID", condition(account, AccountConditionType.FAILED).getReason());
    }

    @Test
    public void byocAccountWithIdIsReady() {
        Account account = account(null);
        account.getSpec().setByoc(true);
        account.getSpec().setAwsAccountId("123456789012");
        store(account);

        reconciler.reconcile(new Request(NAMESPACE, NAME));

        assertEquals(AccountState.READY, account.getStatus().getState());
        verifyNoInteractions(clientFactory);
    }

    @Test
    public void readyAccountWithClaimLinkIsClaimed() {
        Account account = account(AccountState.READY);
        account.getSpec().setClaimLink("cluster-claim");
        store(account);

        reconciler.reconcile(new Request(NAMESPACE, NAME));

        assertTrue(account.getStatus().isClaimed());
        condition(account, AccountConditionType.CLAIMED);
    }

    @Test
    public void deletedByocAccountReleasesFinalizer() {
        Account account = account(AccountState.READY);
        account.getSpec().setByoc(true);
        account.getMetadata().setDeletionTimestamp(OffsetDateTime.ofInstant(NOW, ZoneOffset.UTC));
        account.getMetadata().setFinalizers(new ArrayList<>(List.of(FinalizerManager.FINALIZER)));
        store(account);

        Result result = reconciler.reconcile(new Request(NAMESPACE, NAME));

        assertFalse(result.isRequeue());
        assertTrue(account.getMetadata().getFinalizers().isEmpty());
        assertEquals(1, store.getUpdates());
    }

    @Test
    public void deletedPoolAccountReleasesFinalizer() {
        Account account = account(AccountState.READY);
        account.getMetadata().setDeletionTimestamp(OffsetDateTime.ofInstant(NOW, ZoneOffset.UTC));
        store(account);

        Result result = reconciler.reconcile(new Request(NAMESPACE, NAME));

        assertFalse(result.isRequeue());
        assertFalse(account.getMetadata().getFinalizers().contains(FinalizerManager.FINALIZER));
        assertEquals(1, store.getUpdates());
        verifyNoInteractions(accountProvisioner, clientFactory);
    }

    @Test
    public void failedAccountIsLeftAlone() {
        store(account(AccountState.FAILED));

        Result result = reconciler.reconcile(new Request(NAMESPACE, NAME));

        assertFalse(result.isRequeue());
        assertEquals(0, store.getStatusUpdates());
    }

    @Test
    public void configurationErrorBacksOff() throws ApiException {
        store(creatingAccount(Duration.ofMinutes(1)));
        when(configLoader.load()).thenThrow(new OperatorConfigurationException("ConfigMap not found"));

        Result result = reconciler.reconcile(new Request(NAMESPACE, NAME));

        assertTrue(result.isRequeue());
        assertEquals(properties.getConfigErrorBackoff(), result.getRequeueAfter());
    }

    private void stubClient() throws ApiException {
        when(configLoader.load()).thenReturn(CONFIG);
        when(clientFactory.fromOperatorSecret(CONFIG)).thenReturn(client);
    }

    private Account store(Account account) {
        store.with(account);
        return account;
    }

    private static Condition condition(Account account, String type) {
        return Conditions.find(account.getStatus().getConditions(), type)
                .orElseThrow(() -> new AssertionError("missing condition " + type));
    }

    private static DescribeCreateAccountStatusResponse status(CreateAccountState state, String accountId) {
        return DescribeCreateAccountStatusResponse.builder()
                .createAccountStatus(CreateAccountStatus.builder()
                        .id("car-1")
                        .state(state)
                        .accountId(accountId)
                        .build())
                .build();
    }

    private static Account creatingAccount(Duration creatingFor) {
        Account account = account(AccountState.CREATING);
        OffsetDateTime since = OffsetDateTime.ofInstant(NOW, ZoneOffset.UTC).minus(creatingFor);
        Conditions.set(account.getStatus().getConditions(), AccountConditionType.CREATING, true,
                "AccountCreating", "Attempting to create account", since);
        return account;
    }

    static Account account(AccountState state) {
        AccountStatus status = new AccountStatus();
        status.setState(state);

        Account account = new Account();
        account.setMetadata(new V1ObjectMeta().namespace(NAMESPACE).name(NAME)
                .finalizers(new ArrayList<>(List.of(FinalizerManager.FINALIZER))));
        account.setSpec(new AccountSpec());
        account.setStatus(status);
        return account;
    }
}
