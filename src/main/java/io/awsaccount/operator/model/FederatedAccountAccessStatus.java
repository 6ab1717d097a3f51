package io.awsaccount.operator.model;

import com.google.gson.annotations.SerializedName;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * Status for an AWSFederatedAccountAccess. Ready and Failed are terminal; null means in progress.
 */
@Data
public class FederatedAccountAccessStatus {
    private FederatedAccountAccessState state;
    private List<Condition> conditions = new ArrayList<>();

    @SerializedName("consoleURL")
    private String consoleUrl;
}
