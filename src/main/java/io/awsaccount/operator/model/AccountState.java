package io.awsaccount.operator.model;

import com.google.gson.annotations.SerializedName;

/**
 * Lifecycle states of an Account.
 */
public enum AccountState {
    @SerializedName("Creating")
    CREATING,
    @SerializedName("PendingVerification")
    PENDING_VERIFICATION,
    @SerializedName("Pending")
    PENDING,
    @SerializedName("Ready")
    READY,
    @SerializedName("Failed")
    FAILED
}
