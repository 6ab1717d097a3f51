package io.awsaccount.operator.service;

import io.awsaccount.operator.client.AwsClient;
import io.awsaccount.operator.client.AwsErrors;
import io.awsaccount.operator.error.AccountCreationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import software.amazon.awssdk.services.organizations.model.ConstraintViolationException;
import software.amazon.awssdk.services.organizations.model.CreateAccountFailureReason;
import software.amazon.awssdk.services.organizations.model.CreateAccountRequest;
import software.amazon.awssdk.services.organizations.model.CreateAccountResponse;
import software.amazon.awssdk.services.organizations.model.CreateAccountState;
import software.amazon.awssdk.services.organizations.model.CreateAccountStatus;
import software.amazon.awssdk.services.organizations.model.DescribeCreateAccountStatusRequest;
import software.amazon.awssdk.services.organizations.model.DescribeCreateAccountStatusResponse;
import software.amazon.awssdk.services.organizations.model.OrganizationsException;
import software.amazon.awssdk.services.organizations.model.ServiceException;
import software.amazon.awssdk.services.organizations.model.Tag;
import software.amazon.awssdk.services.organizations.model.TagResourceRequest;
import software.amazon.awssdk.services.organizations.model.TooManyRequestsException;

/**
 * Drives account creation and owner tagging through the Organizations API.
 */
@Slf4j
@Component
public class AccountProvisioner {
    public static final String OWNER_TAG_KEY = "owner";

    /**
     * Issues a create request followed by exactly one status check.
     *
     * @return the status check response when the request succeeded or is still in progress
     * @throws AccountCreationException when the create call or the reported status is a failure
     */
    public DescribeCreateAccountStatusResponse createAccount(AwsClient client, String accountName, String email) {
        return checkCreateAccountStatus(client, requestAccountCreation(client, accountName, email));
    }

    /**
     * Issues the create request only, so the caller can record the request id before checking on it.
     *
     * @return the creation request id
     * @throws AccountCreationException when the create call is rejected
     */
    public String requestAccountCreation(AwsClient client, String accountName, String email) {
        CreateAccountResponse created;
        try {
            created = client.getOrganizations().createAccount(CreateAccountRequest.builder()
                    .accountName(accountName)
                    .email(email)
                    .build());
        } catch (ConstraintViolationException e) {
            log.error("Account limit reached creating account {}: {}", accountName, AwsErrors.describe(e));
            throw new AccountCreationException(AccountCreationException.Reason.ACCOUNT_LIMIT_EXCEEDED,
                    "Account limit exceeded", e);
        } catch (ServiceException e) {
            log.error("Internal provider failure creating account {}: {}", accountName, AwsErrors.describe(e));
            throw new AccountCreationException(AccountCreationException.Reason.INTERNAL_FAILURE,
                    "Internal provider failure", e);
        } catch (TooManyRequestsException e) {
            log.error("Throttled creating account {}: {}", accountName, AwsErrors.describe(e));
            throw new AccountCreationException(AccountCreationException.Reason.TOO_MANY_REQUESTS,
                    "Too many requests", e);
        } catch (OrganizationsException e) {
            log.error("Failed to create account {}: {}", accountName, AwsErrors.describe(e));
            throw new AccountCreationException(AccountCreationException.Reason.FAILED_CREATE_ACCOUNT,
                    "Failed to create account", e);
        }

        String requestId = created.createAccountStatus().id();
        log.info("Requested account {} with request id {}", accountName, requestId);
        return requestId;
    }

    /**
     * Performs a single status check for an in-flight creation request.
     * Errors from the status call itself propagate unchanged.
     */
    public DescribeCreateAccountStatusResponse checkCreateAccountStatus(AwsClient client, String requestId) {
        DescribeCreateAccountStatusResponse response = client.getOrganizations()
                .describeCreateAccountStatus(DescribeCreateAccountStatusRequest.builder()
                        .createAccountRequestId(requestId)
                        .build());

        CreateAccountStatus status = response.createAccountStatus();
        if (status != null && status.state() == CreateAccountState.FAILED) {
            if (status.failureReason() == CreateAccountFailureReason.ACCOUNT_LIMIT_EXCEEDED) {
                log.error("Account creation {} failed: account limit exceeded", requestId);
                throw new AccountCreationException(AccountCreationException.Reason.ACCOUNT_LIMIT_EXCEEDED,
                        "Account limit exceeded");
            }
            log.error("Account creation {} failed: {}", requestId, status.failureReasonAsString());
            throw new AccountCreationException(AccountCreationException.Reason.FAILED_CREATE_ACCOUNT,
                    "Account creation failed: " + status.failureReasonAsString());
        }
        return response;
    }

    /**
     * Sets the {@code owner} tag on an account, replacing any previous value.
     */
    public void tagAccount(AwsClient client, String accountId, String owner) {
        client.getOrganizations().tagResource(TagResourceRequest.builder()
                .resourceId(accountId)
                .tags(Tag.builder().key(OWNER_TAG_KEY).value(owner).build())
                .build());
        log.info("Tagged account {} with {}={}", accountId, OWNER_TAG_KEY, owner);
    }
}
