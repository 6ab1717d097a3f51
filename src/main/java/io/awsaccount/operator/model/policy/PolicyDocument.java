package io.awsaccount.operator.model.policy;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.awsaccount.operator.model.CustomPolicy;
import io.awsaccount.operator.model.PolicyStatement;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * IAM policy document in the provider's wire format.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public class PolicyDocument {
    public static final String VERSION = "2012-10-17";

    private static final ObjectMapper MAPPER = new ObjectMapper();

    @JsonProperty("Version")
    @Builder.Default
    private String version = VERSION;

    @JsonProperty("Statement")
    @Builder.Default
    private List<Statement> statement = new ArrayList<>();

    /**
     * Builds the document for a template's custom policy, keeping statement order.
     */
    public static PolicyDocument fromCustomPolicy(CustomPolicy policy) {
        List<Statement> statements = new ArrayList<>();
        if (policy.getStatements() != null) {
            for (PolicyStatement source : policy.getStatements()) {
                Statement.StatementBuilder builder = Statement.builder()
                        .effect(source.getEffect())
                        .action(source.getAction())
                        .resource(source.getResource())
                        .condition(source.getCondition());
                if (source.getPrincipal() != null) {
                    builder.principal(new Principal(source.getPrincipal().getAws()));
                }
                statements.add(builder.build());
            }
        }
        return PolicyDocument.builder().statement(statements).build();
    }

    /**
     * Trust policy letting exactly one principal assume the role.
     */
    public static PolicyDocument assumeRoleTrust(String principalArn) {
        Statement statement = Statement.builder()
                .effect("Allow")
                .action(List.of("sts:AssumeRole"))
                .principal(new Principal(List.of(principalArn)))
                .build();
        return PolicyDocument.builder().statement(List.of(statement)).build();
    }

    public String toJson() {
        try {
            return MAPPER.writeValueAsString(this);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Unable to serialize policy document", e);
        }
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    public static class Statement {
        @JsonProperty("Effect")
        private String effect;

        @JsonProperty("Action")
        private List<String> action;

        @JsonProperty("Resource")
        private List<String> resource;

        @JsonProperty("Condition")
        private Map<String, Map<String, Object>> condition;

        @JsonProperty("Principal")
        private Principal principal;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    public static class Principal {
        @JsonProperty("AWS")
        private List<String> aws;
    }
}
