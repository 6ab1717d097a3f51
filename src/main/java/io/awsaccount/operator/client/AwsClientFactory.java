package io.awsaccount.operator.client;

import io.awsaccount.operator.config.OperatorConfig;
import io.awsaccount.operator.config.OperatorProperties;
import io.awsaccount.operator.store.ResourceStore;
import io.kubernetes.client.openapi.ApiException;
import io.kubernetes.client.openapi.models.V1Secret;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import software.amazon.awssdk.auth.credentials.AwsBasicCredentials;
import software.amazon.awssdk.auth.credentials.AwsCredentialsProvider;
import software.amazon.awssdk.auth.credentials.AwsSessionCredentials;
import software.amazon.awssdk.auth.credentials.StaticCredentialsProvider;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.iam.IamClient;
import software.amazon.awssdk.services.organizations.OrganizationsClient;
import software.amazon.awssdk.services.sts.StsClient;
import software.amazon.awssdk.services.sts.model.AssumeRoleRequest;
import software.amazon.awssdk.services.sts.model.Credentials;

import java.nio.charset.StandardCharsets;
import java.util.Map;

/**
 * Factory for creating {@link AwsClient} instances.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class AwsClientFactory {
    static final String ACCESS_KEY_ID = "aws_access_key_id";
    static final String SECRET_ACCESS_KEY = "aws_secret_access_key";

    private final ResourceStore<V1Secret> secretStore;
    private final OperatorProperties properties;

    /**
     * Creates a client from a Secret holding a static access key pair.
     */
    public AwsClient fromSecret(String namespace, String name, OperatorConfig config) throws ApiException {
        V1Secret secret = secretStore.get(namespace, name)
                .orElseThrow(() -> new IllegalStateException(
                        String.format("Secret %s/%s not found", namespace, name)));
        Map<String, byte[]> data = secret.getData();
        String accessKeyId = value(data, ACCESS_KEY_ID, namespace, name);
        String secretAccessKey = value(data, SECRET_ACCESS_KEY, namespace, name);

        log.debug("Creating AWS client from secret {}/{}", namespace, name);
        return build(StaticCredentialsProvider.create(AwsBasicCredentials.create(accessKeyId, secretAccessKey)),
                config.defaultRegion());
    }

    /**
     * Creates a client with the operator's own credentials.
     */
    public AwsClient fromOperatorSecret(OperatorConfig config) throws ApiException {
        return fromSecret(properties.getNamespace(), properties.getCredentialsSecretName(), config);
    }

    public AwsClient fromSessionCredentials(Credentials credentials, OperatorConfig config) {
        return build(StaticCredentialsProvider.create(AwsSessionCredentials.create(
                        credentials.accessKeyId(), credentials.secretAccessKey(), credentials.sessionToken())),
                config.defaultRegion());
    }

    /**
     * Assumes {@code roleArn} with the source client and returns a client for the new session.
     */
    public AwsClient assumeRole(AwsClient source, String roleArn, String sessionName, OperatorConfig config) {
        Credentials credentials = source.getSts().assumeRole(AssumeRoleRequest.builder()
                        .roleArn(roleArn)
                        .roleSessionName(sessionName)
                        .build())
                .credentials();
        log.debug("Assumed role {} as session {}", roleArn, sessionName);
        return fromSessionCredentials(credentials, config);
    }

    protected AwsClient build(AwsCredentialsProvider credentialsProvider, Region region) {
        return new AwsClient(
                OrganizationsClient.builder()
                        .region(region)
                        .credentialsProvider(credentialsProvider)
                        .build(),
                IamClient.builder()
                        .region(region)
                        .credentialsProvider(credentialsProvider)
                        .build(),
                StsClient.builder()
                        .region(region)
                        .credentialsProvider(credentialsProvider)
                        .build());
    }

    private static String value(Map<String, byte[]> data, String key, String namespace, String name) {
        if (data == null || data.get(key) == null) {
            throw new IllegalStateException(String.format("Secret %s/%s is missing key %s", namespace, name, key));
        }
        return new String(data.get(key), StandardCharsets.UTF_8).trim();
    }
}
