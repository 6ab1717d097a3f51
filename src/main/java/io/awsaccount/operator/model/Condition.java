package io.awsaccount.operator.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.OffsetDateTime;

/**
 * A typed status entry recording the last observed outcome of a check.
 * Use {@link Conditions#set} to keep at most one entry per type.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Condition {
    private String type;
    private boolean status;
    private String reason;
    private String message;
    private OffsetDateTime lastProbeTime;
    private OffsetDateTime lastTransitionTime;
}
