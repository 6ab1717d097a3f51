package io.awsaccount.operator.model;

import com.google.gson.annotations.SerializedName;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * Status for an Account custom resource.
 * A null state means the account has not been picked up yet.
 */
@Data
public class AccountStatus {
    private AccountState state;
    private boolean claimed;

    @SerializedName("supportCaseID")
    private String supportCaseId;

    private boolean rotateCredentials;
    private boolean rotateConsoleCredentials;

    @SerializedName("createAccountRequestID")
    private String createAccountRequestId;

    private List<Condition> conditions = new ArrayList<>();
}
