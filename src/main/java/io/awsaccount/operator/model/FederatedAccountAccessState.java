package io.awsaccount.operator.model;

import com.google.gson.annotations.SerializedName;

public enum FederatedAccountAccessState {
    @SerializedName("Ready")
    READY,
    @SerializedName("Failed")
    FAILED
}
