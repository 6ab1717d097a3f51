package io.awsaccount.operator.model;

import com.google.gson.annotations.SerializedName;

public enum FederatedRoleState {
    @SerializedName("Valid")
    VALID,
    @SerializedName("Invalid")
    INVALID
}
