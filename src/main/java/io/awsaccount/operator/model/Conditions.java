package io.awsaccount.operator.model;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Helpers for maintaining condition lists.
 */
public final class Conditions {

    private Conditions() {
    }

    /**
     * Records an observation of a condition type.
     * A repeat observation with the same status and reason only refreshes the probe time;
     * anything else rewrites the entry and moves its transition time.
     *
     * @return the entry now held for {@code type}
     */
    public static Condition set(List<Condition> conditions, String type, boolean status,
                                String reason, String message, OffsetDateTime now) {
        Optional<Condition> existing = find(conditions, type);
        if (existing.isEmpty()) {
            Condition condition = Condition.builder()
                    .type(type)
                    .status(status)
                    .reason(reason)
                    .message(message)
                    .lastProbeTime(now)
                    .lastTransitionTime(now)
                    .build();
            conditions.add(condition);
            return condition;
        }

        Condition condition = existing.get();
        condition.setLastProbeTime(now);
        if (condition.isStatus() != status || !Objects.equals(condition.getReason(), reason)) {
            condition.setStatus(status);
            condition.setReason(reason);
            condition.setMessage(message);
            condition.setLastTransitionTime(now);
        }
        return condition;
    }

    public static Optional<Condition> find(List<Condition> conditions, String type) {
        if (conditions == null) {
            return Optional.empty();
        }
        return conditions.stream()
                .filter(c -> type.equals(c.getType()))
                .findFirst();
    }
}
