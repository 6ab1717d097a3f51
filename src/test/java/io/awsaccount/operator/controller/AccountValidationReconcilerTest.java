package io.awsaccount.operator.controller;

import io.awsaccount.operator.client.AwsClient;
import io.awsaccount.operator.client.AwsClientFactory;
import io.awsaccount.operator.config.OperatorConfig;
import io.awsaccount.operator.config.OperatorConfigLoader;
import io.awsaccount.operator.config.OperatorProperties;
import io.awsaccount.operator.error.AccountValidationException;
import io.awsaccount.operator.model.Account;
import io.awsaccount.operator.model.AccountState;
import io.awsaccount.operator.service.AccountValidationService;
import io.awsaccount.operator.store.InMemoryResourceStore;
import io.kubernetes.client.extended.controller.reconciler.Request;
import io.kubernetes.client.extended.controller.reconciler.Result;
import io.kubernetes.client.openapi.ApiException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
public class AccountValidationReconcilerTest {
    private static final OperatorConfig CONFIG = OperatorConfig.builder()
            .rootOuId("ou-root")
            .shardName("shard-a")
            .build();

    @Mock
    private OperatorConfigLoader configLoader;
    @Mock
    private AwsClientFactory clientFactory;
    @Mock
    private AccountValidationService validationService;

    private final InMemoryResourceStore<Account> store = new InMemoryResourceStore<>();
    private final OperatorProperties properties = new OperatorProperties();
    private final AwsClient client = mock(AwsClient.class);
    private AccountValidationReconciler reconciler;
    private Account account;
    private Request request;

    @BeforeEach
    public void setUp() {
        reconciler = new AccountValidationReconciler(store, configLoader, clientFactory, validationService,
                properties);
        account = AccountReconcilerTest.account(AccountState.READY);
        store.with(account);
        request = new Request(account.getMetadata().getNamespace(), account.getMetadata().getName());
    }

    @Test
    public void validAccountIsPlaced() throws ApiException {
        stubClient();

        Result result = reconciler.reconcile(request);

        assertFalse(result.isRequeue());
        verify(validationService).validatePlacement(client, account, CONFIG);
    }

    @Test
    public void ineligibleAccountIsNotRetried() {
        doThrow(new AccountValidationException(AccountValidationException.Reason.INVALID_ACCOUNT, "BYOC"))
                .when(validationService).validatePreconditions(account);

        Result result = reconciler.reconcile(request);

        assertFalse(result.isRequeue());
        verifyNoInteractions(configLoader, clientFactory);
    }

    @Test
    public void accountWithoutIdIsNotRetried() {
        doThrow(new AccountValidationException(AccountValidationException.Reason.MISSING_AWS_ACCOUNT, "no id"))
                .when(validationService).validatePreconditions(account);

        assertFalse(reconciler.reconcile(request).isRequeue());
    }

    @Test
    public void failedMoveWaitsBeforeRetry() throws ApiException {
        stubClient();
        doThrow(new AccountValidationException(AccountValidationException.Reason.ACCOUNT_MOVE_FAILED, "denied"))
                .when(validationService).validatePlacement(client, account, CONFIG);

        Result result = reconciler.reconcile(request);

        assertTrue(result.isRequeue());
        assertEquals(properties.getMoveWaitTime(), result.getRequeueAfter());
    }

    @Test
    public void tagFailureIsRetried() throws ApiException {
        stubClient();
        doThrow(new AccountValidationException(AccountValidationException.Reason.MISSING_OWNER_TAG, "untagged"))
                .when(validationService).validatePlacement(client, account, CONFIG);

        Result result = reconciler.reconcile(request);

        assertTrue(result.isRequeue());
        assertEquals(null, result.getRequeueAfter());
    }

    private void stubClient() throws ApiException {
        when(configLoader.load()).thenReturn(CONFIG);
        when(clientFactory.fromOperatorSecret(CONFIG)).thenReturn(client);
    }
}
