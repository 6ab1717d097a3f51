package io.awsaccount.operator.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Map;

/**
 * A statement of a custom policy as declared on the template.
 * Condition is keyed by operator, then by condition key.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PolicyStatement {
    private String effect;
    private List<String> action;
    private List<String> resource;
    private Map<String, Map<String, Object>> condition;
    private StatementPrincipal principal;
}
