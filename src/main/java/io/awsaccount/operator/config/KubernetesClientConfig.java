package io.awsaccount.operator.config;

import io.kubernetes.client.informer.SharedInformerFactory;
import io.kubernetes.client.openapi.ApiClient;
import io.kubernetes.client.util.ClientBuilder;
import io.kubernetes.client.util.KubeConfig;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.io.FileReader;
import java.io.IOException;
import java.time.Clock;

/**
 * Configuration for the Kubernetes client.
 */
@Slf4j
@Configuration
public class KubernetesClientConfig {

    @Bean
    public ApiClient kubernetesApiClient() throws IOException {
        // In-cluster service account first, kubeconfig for local runs
        try {
            ApiClient client = ClientBuilder.cluster().build();
            client.setReadTimeout(60000);
            return client;
        } catch (IOException | IllegalStateException e) {
            String kubeConfigPath = System.getProperty("user.home") + "/.kube/config";
            log.info("Not running in cluster, loading {}", kubeConfigPath);
            try (FileReader reader = new FileReader(kubeConfigPath)) {
                ApiClient client = ClientBuilder.kubeconfig(KubeConfig.loadKubeConfig(reader)).build();
                client.setReadTimeout(60000);
                return client;
            }
        }
    }

    @Bean
    public SharedInformerFactory sharedInformerFactory(ApiClient apiClient) {
        return new SharedInformerFactory(apiClient);
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
