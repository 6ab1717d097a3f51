package io.awsaccount.operator.model;

import io.kubernetes.client.common.KubernetesObject;

import java.util.HashMap;
import java.util.Map;

/**
 * Label keys persisted on managed resources, and helpers to read and write them.
 */
public final class Labels {
    public static final String UID = "uid";
    public static final String AWS_ACCOUNT_ID = "awsAccountID";

    private Labels() {
    }

    public static boolean has(KubernetesObject resource, String key) {
        Map<String, String> labels = resource.getMetadata().getLabels();
        return labels != null && labels.containsKey(key);
    }

    public static String get(KubernetesObject resource, String key) {
        Map<String, String> labels = resource.getMetadata().getLabels();
        return labels == null ? null : labels.get(key);
    }

    public static void put(KubernetesObject resource, String key, String value) {
        Map<String, String> labels = resource.getMetadata().getLabels();
        if (labels == null) {
            labels = new HashMap<>();
            resource.getMetadata().setLabels(labels);
        }
        labels.put(key, value);
    }
}
