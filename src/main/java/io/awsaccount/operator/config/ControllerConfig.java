package io.awsaccount.operator.config;

import io.awsaccount.operator.controller.AccountReconciler;
import io.awsaccount.operator.controller.AccountValidationReconciler;
import io.awsaccount.operator.controller.FederatedAccountAccessReconciler;
import io.awsaccount.operator.controller.FederatedRoleReconciler;
import io.awsaccount.operator.model.Account;
import io.awsaccount.operator.model.AccountList;
import io.awsaccount.operator.model.FederatedAccountAccess;
import io.awsaccount.operator.model.FederatedAccountAccessList;
import io.awsaccount.operator.model.FederatedRole;
import io.awsaccount.operator.model.FederatedRoleList;
import io.awsaccount.operator.store.KubernetesResourceStore;
import io.awsaccount.operator.store.ResourceStore;
import io.kubernetes.client.common.KubernetesObject;
import io.kubernetes.client.extended.controller.Controller;
import io.kubernetes.client.extended.controller.ControllerManager;
import io.kubernetes.client.extended.controller.builder.ControllerBuilder;
import io.kubernetes.client.extended.controller.reconciler.Reconciler;
import io.kubernetes.client.informer.SharedIndexInformer;
import io.kubernetes.client.informer.SharedInformerFactory;
import io.kubernetes.client.openapi.ApiClient;
import io.kubernetes.client.openapi.models.V1ConfigMap;
import io.kubernetes.client.openapi.models.V1ConfigMapList;
import io.kubernetes.client.openapi.models.V1Secret;
import io.kubernetes.client.openapi.models.V1SecretList;
import io.kubernetes.client.util.generic.GenericKubernetesApi;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration for the Kubernetes controllers.
 */
@Configuration
@EnableConfigurationProperties(OperatorProperties.class)
public class ControllerConfig {
    public static final String GROUP = "aws.managed.openshift.io";
    public static final String VERSION = "v1alpha1";

    @Bean
    public GenericKubernetesApi<Account, AccountList> accountApi(ApiClient apiClient) {
        return new GenericKubernetesApi<>(Account.class, AccountList.class, GROUP, VERSION, Account.PLURAL, apiClient);
    }

    @Bean
    public GenericKubernetesApi<FederatedRole, FederatedRoleList> federatedRoleApi(ApiClient apiClient) {
        return new GenericKubernetesApi<>(FederatedRole.class, FederatedRoleList.class,
                GROUP, VERSION, FederatedRole.PLURAL, apiClient);
    }

    @Bean
    public GenericKubernetesApi<FederatedAccountAccess, FederatedAccountAccessList> federatedAccountAccessApi(
            ApiClient apiClient) {
        return new GenericKubernetesApi<>(FederatedAccountAccess.class, FederatedAccountAccessList.class,
                GROUP, VERSION, FederatedAccountAccess.PLURAL, apiClient);
    }

    @Bean
    public ResourceStore<Account> accountStore(GenericKubernetesApi<Account, AccountList> accountApi) {
        return new KubernetesResourceStore<>(accountApi, Account::getStatus);
    }

    @Bean
    public ResourceStore<FederatedRole> federatedRoleStore(
            GenericKubernetesApi<FederatedRole, FederatedRoleList> federatedRoleApi) {
        return new KubernetesResourceStore<>(federatedRoleApi, FederatedRole::getStatus);
    }

    @Bean
    public ResourceStore<FederatedAccountAccess> federatedAccountAccessStore(
            GenericKubernetesApi<FederatedAccountAccess, FederatedAccountAccessList> federatedAccountAccessApi) {
        return new KubernetesResourceStore<>(federatedAccountAccessApi, FederatedAccountAccess::getStatus);
    }

    @Bean
    public ResourceStore<V1ConfigMap> configMapStore(ApiClient apiClient) {
        return new KubernetesResourceStore<>(new GenericKubernetesApi<>(V1ConfigMap.class, V1ConfigMapList.class,
                "", "v1", "configmaps", apiClient));
    }

    @Bean
    public ResourceStore<V1Secret> secretStore(ApiClient apiClient) {
        return new KubernetesResourceStore<>(new GenericKubernetesApi<>(V1Secret.class, V1SecretList.class,
                "", "v1", "secrets", apiClient));
    }

    @Bean
    public SharedIndexInformer<Account> accountInformer(
            SharedInformerFactory informerFactory,
            GenericKubernetesApi<Account, AccountList> accountApi,
            OperatorProperties properties) {
        return informerFactory.sharedIndexInformerFor(accountApi, Account.class,
                properties.getResyncPeriod().toMillis());
    }

    @Bean
    public SharedIndexInformer<FederatedRole> federatedRoleInformer(
            SharedInformerFactory informerFactory,
            GenericKubernetesApi<FederatedRole, FederatedRoleList> federatedRoleApi,
            OperatorProperties properties) {
        return informerFactory.sharedIndexInformerFor(federatedRoleApi, FederatedRole.class,
                properties.getResyncPeriod().toMillis());
    }

    @Bean
    public SharedIndexInformer<FederatedAccountAccess> federatedAccountAccessInformer(
            SharedInformerFactory informerFactory,
            GenericKubernetesApi<FederatedAccountAccess, FederatedAccountAccessList> federatedAccountAccessApi,
            OperatorProperties properties) {
        return informerFactory.sharedIndexInformerFor(federatedAccountAccessApi, FederatedAccountAccess.class,
                properties.getResyncPeriod().toMillis());
    }

    @Bean
    public Controller accountController(
            SharedInformerFactory informerFactory,
            AccountReconciler reconciler,
            SharedIndexInformer<Account> accountInformer,
            OperatorProperties properties) {
        return buildController(informerFactory, Account.class, accountInformer, reconciler,
                "AccountController", properties.workersFor("account"), properties);
    }

    @Bean
    public Controller accountValidationController(
            SharedInformerFactory informerFactory,
            AccountValidationReconciler reconciler,
            SharedIndexInformer<Account> accountInformer,
            OperatorProperties properties) {
        return buildController(informerFactory, Account.class, accountInformer, reconciler,
                "AccountValidationController", properties.workersFor("accountvalidation"), properties);
    }

    @Bean
    public Controller federatedRoleController(
            SharedInformerFactory informerFactory,
            FederatedRoleReconciler reconciler,
            SharedIndexInformer<FederatedRole> federatedRoleInformer,
            OperatorProperties properties) {
        return buildController(informerFactory, FederatedRole.class, federatedRoleInformer, reconciler,
                "AWSFederatedRoleController", properties.workersFor("awsfederatedrole"), properties);
    }

    @Bean
    public Controller federatedAccountAccessController(
            SharedInformerFactory informerFactory,
            FederatedAccountAccessReconciler reconciler,
            SharedIndexInformer<FederatedAccountAccess> federatedAccountAccessInformer,
            OperatorProperties properties) {
        return buildController(informerFactory, FederatedAccountAccess.class, federatedAccountAccessInformer,
                reconciler, "AWSFederatedAccountAccessController",
                properties.workersFor("awsfederatedaccountaccess"), properties);
    }

    @Bean
    public ControllerManager controllerManager(
            SharedInformerFactory informerFactory,
            @Qualifier("accountController") Controller accountController,
            @Qualifier("accountValidationController") Controller accountValidationController,
            @Qualifier("federatedRoleController") Controller federatedRoleController,
            @Qualifier("federatedAccountAccessController") Controller federatedAccountAccessController) {
        return ControllerBuilder.controllerManagerBuilder(informerFactory)
                .addController(accountController)
                .addController(accountValidationController)
                .addController(federatedRoleController)
                .addController(federatedAccountAccessController)
                .build();
    }

    private static <T extends KubernetesObject> Controller buildController(
            SharedInformerFactory informerFactory,
            Class<T> kind,
            SharedIndexInformer<T> informer,
            Reconciler reconciler,
            String name,
            int workers,
            OperatorProperties properties) {
        return ControllerBuilder.defaultBuilder(informerFactory)
                .watch(workQueue -> ControllerBuilder.controllerWatchBuilder(kind, workQueue)
                        .withResyncPeriod(properties.getResyncPeriod())
                        .build())
                .withWorkerCount(workers)
                .withReadyFunc(informer::hasSynced)
                .withReconciler(reconciler)
                .withName(name)
                .build();
    }
}
