package io.awsaccount.operator.client;

import lombok.Getter;
import software.amazon.awssdk.services.iam.IamClient;
import software.amazon.awssdk.services.organizations.OrganizationsClient;
import software.amazon.awssdk.services.sts.StsClient;

/**
 * Provider clients sharing one set of credentials.
 */
@Getter
public class AwsClient implements AutoCloseable {
    private final OrganizationsClient organizations;
    private final IamClient iam;
    private final StsClient sts;

    public AwsClient(OrganizationsClient organizations, IamClient iam, StsClient sts) {
        this.organizations = organizations;
        this.iam = iam;
        this.sts = sts;
    }

    @Override
    public void close() {
        organizations.close();
        iam.close();
        sts.close();
    }
}
