package io.awsaccount.operator.config;

import io.awsaccount.operator.error.OperatorConfigurationException;
import io.awsaccount.operator.store.ResourceStore;
import io.kubernetes.client.openapi.ApiException;
import io.kubernetes.client.openapi.models.V1ConfigMap;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * Reads the operator ConfigMap into an {@link OperatorConfig}.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class OperatorConfigLoader {
    static final String FEDRAMP_KEY = "fedramp";
    static final String ROOT_KEY = "root";
    static final String SHARD_NAME_KEY = "shard-name";
    static final String MOVE_ACCOUNT_KEY = "feature.validation_move_account";
    static final String TAG_ACCOUNT_KEY = "feature.validation_tag_account";

    private final ResourceStore<V1ConfigMap> configMapStore;
    private final OperatorProperties properties;

    public OperatorConfig load() throws ApiException {
        V1ConfigMap configMap = configMapStore.get(properties.getNamespace(), properties.getConfigMapName())
                .orElseThrow(() -> new OperatorConfigurationException(String.format(
                        "ConfigMap %s/%s not found", properties.getNamespace(), properties.getConfigMapName())));
        return parse(configMap.getData() == null ? Map.of() : configMap.getData());
    }

    static OperatorConfig parse(Map<String, String> data) {
        return OperatorConfig.builder()
                .fedramp(parseFedramp(data.get(FEDRAMP_KEY)))
                .moveAccountEnabled(parseFeatureFlag(MOVE_ACCOUNT_KEY, data.get(MOVE_ACCOUNT_KEY)))
                .tagAccountEnabled(parseFeatureFlag(TAG_ACCOUNT_KEY, data.get(TAG_ACCOUNT_KEY)))
                .rootOuId(data.getOrDefault(ROOT_KEY, ""))
                .shardName(data.getOrDefault(SHARD_NAME_KEY, ""))
                .build();
    }

    private static boolean parseFedramp(String value) {
        if (value == null) {
            return false;
        }
        String trimmed = value.trim();
        if ("true".equalsIgnoreCase(trimmed)) {
            return true;
        }
        if ("false".equalsIgnoreCase(trimmed)) {
            return false;
        }
        throw new OperatorConfigurationException("Invalid value for " + FEDRAMP_KEY + ": " + value);
    }

    private static boolean parseFeatureFlag(String key, String value) {
        if (value == null) {
            return false;
        }
        String trimmed = value.trim();
        if ("true".equalsIgnoreCase(trimmed)) {
            return true;
        }
        if (!"false".equalsIgnoreCase(trimmed)) {
            log.warn("Unable to parse {}={}, feature disabled", key, value);
        }
        return false;
    }
}
