package io.awsaccount.operator.service;

import io.awsaccount.operator.client.AwsClient;
import io.awsaccount.operator.client.AwsErrors;
import io.awsaccount.operator.error.AccountValidationException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import software.amazon.awssdk.services.organizations.model.ListTagsForResourceRequest;
import software.amazon.awssdk.services.organizations.model.ListTagsForResourceResponse;
import software.amazon.awssdk.services.organizations.model.OrganizationsException;
import software.amazon.awssdk.services.organizations.model.Tag;
import software.amazon.awssdk.services.organizations.model.UntagResourceRequest;

import java.util.Optional;

/**
 * Verifies, and optionally repairs, the owner tag of a pool account.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class AccountTagValidator {
    private final AccountProvisioner accountProvisioner;

    public void validateOwnerTag(AwsClient client, String accountId, String expectedOwner, boolean tagEnabled) {
        Optional<String> owner = findOwnerTag(client, accountId);

        if (owner.isPresent() && owner.get().equals(expectedOwner)) {
            return;
        }

        if (owner.isPresent()) {
            if (!tagEnabled) {
                throw new AccountValidationException(AccountValidationException.Reason.INCORRECT_OWNER_TAG,
                        String.format("Account is not tagged with the correct owner, has %s; want %s",
                                owner.get(), expectedOwner));
            }
            try {
                client.getOrganizations().untagResource(UntagResourceRequest.builder()
                        .resourceId(accountId)
                        .tagKeys(AccountProvisioner.OWNER_TAG_KEY)
                        .build());
            } catch (OrganizationsException e) {
                log.error("Unable to remove owner tag from account {}: {}", accountId, AwsErrors.describe(e));
                throw new AccountValidationException(AccountValidationException.Reason.ACCOUNT_TAG_FAILED,
                        "Unable to remove incorrect owner tag", e);
            }
            tag(client, accountId, expectedOwner);
            return;
        }

        if (!tagEnabled) {
            throw new AccountValidationException(AccountValidationException.Reason.MISSING_OWNER_TAG,
                    "Account is not tagged with an owner");
        }
        tag(client, accountId, expectedOwner);
    }

    private void tag(AwsClient client, String accountId, String owner) {
        try {
            accountProvisioner.tagAccount(client, accountId, owner);
        } catch (OrganizationsException e) {
            log.error("Unable to tag account {}: {}", accountId, AwsErrors.describe(e));
            throw new AccountValidationException(AccountValidationException.Reason.ACCOUNT_TAG_FAILED,
                    "Unable to tag account", e);
        }
    }

    private Optional<String> findOwnerTag(AwsClient client, String accountId) {
        String nextToken = null;
        do {
            ListTagsForResourceResponse response = client.getOrganizations().listTagsForResource(
                    ListTagsForResourceRequest.builder()
                            .resourceId(accountId)
                            .nextToken(nextToken)
                            .build());
            for (Tag tag : response.tags()) {
                if (AccountProvisioner.OWNER_TAG_KEY.equals(tag.key())) {
                    return Optional.ofNullable(tag.value());
                }
            }
            nextToken = response.nextToken();
        } while (nextToken != null && !nextToken.isEmpty());
        return Optional.empty();
    }
}
