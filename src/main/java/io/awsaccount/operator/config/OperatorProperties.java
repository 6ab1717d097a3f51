package io.awsaccount.operator.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.HashMap;
import java.util.Map;

/**
 * Static operator settings bound from {@code operator.*}.
 */
@Data
@ConfigurationProperties("operator")
public class OperatorProperties {
    private String namespace = "aws-account-operator";
    private String configMapName = "aws-account-operator-configmap";
    private String credentialsSecretName = "aws-account-operator-credentials";

    /**
     * Format string for new account e-mail addresses; receives the account name.
     */
    private String accountEmailTemplate = "aws-accounts+%s@example.com";

    private Duration creationTimeout = Duration.ofMinutes(10);
    private Duration accountLimitBackoff = Duration.ofMinutes(15);
    private Duration moveWaitTime = Duration.ofMinutes(5);
    private Duration requeueInterval = Duration.ofSeconds(30);
    private Duration configErrorBackoff = Duration.ofMinutes(5);
    private Duration resyncPeriod = Duration.ofMinutes(1);

    /**
     * Worker count per controller name.
     */
    private Map<String, Integer> workers = new HashMap<>();

    public int workersFor(String controller) {
        return workers.getOrDefault(controller, 1);
    }
}
