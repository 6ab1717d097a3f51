package io.awsaccount.operator.model.policy;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.awsaccount.operator.model.CustomPolicy;
import io.awsaccount.operator.model.PolicyStatement;
import io.awsaccount.operator.model.StatementPrincipal;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class PolicyDocumentTest {
    private final ObjectMapper mapper = new ObjectMapper();

    @Test
    public void customPolicyUsesProviderFieldNamesAndKeepsOrder() throws Exception {
        CustomPolicy policy = CustomPolicy.builder()
                .name("read-buckets")
                .statements(List.of(
                        PolicyStatement.builder()
                                .effect("Allow")
                                .action(List.of("s3:GetObject", "s3:ListBucket"))
                                .resource(List.of("*"))
                                .build(),
                        PolicyStatement.builder()
                                .effect("Deny")
                                .action(List.of("s3:DeleteObject"))
                                .resource(List.of("arn:aws:s3:::audit/*"))
                                .condition(Map.of("Bool", Map.of("aws:SecureTransport", "false")))
                                .build()))
                .build();

        JsonNode json = mapper.readTree(PolicyDocument.fromCustomPolicy(policy).toJson());

        assertEquals("2012-10-17", json.get("Version").asText());
        JsonNode statements = json.get("Statement");
        assertEquals(2, statements.size());
        assertEquals("Allow", statements.get(0).get("Effect").asText());
        assertEquals("s3:ListBucket", statements.get(0).get("Action").get(1).asText());
        assertFalse(statements.get(0).has("Condition"));
        assertFalse(statements.get(0).has("Principal"));
        assertEquals("Deny", statements.get(1).get("Effect").asText());
        assertEquals("false", statements.get(1).get("Condition").get("Bool").get("aws:SecureTransport").asText());
    }

    @Test
    public void multiValuedConditionIsWrittenAsArray() throws Exception {
        CustomPolicy policy = CustomPolicy.builder()
                .name("vpc-only")
                .statements(List.of(PolicyStatement.builder()
                        .effect("Allow")
                        .action(List.of("s3:GetObject"))
                        .resource(List.of("*"))
                        .condition(Map.of("StringEquals", Map.of("aws:SourceVpc", List.of("vpc-a", "vpc-b"))))
                        .build()))
                .build();

        JsonNode vpcs = mapper.readTree(PolicyDocument.fromCustomPolicy(policy).toJson())
                .get("Statement").get(0).get("Condition").get("StringEquals").get("aws:SourceVpc");

        assertTrue(vpcs.isArray());
        assertEquals(2, vpcs.size());
        assertEquals("vpc-a", vpcs.get(0).asText());
        assertEquals("vpc-b", vpcs.get(1).asText());
    }

    @Test
    public void statementPrincipalIsCarriedOver() throws Exception {
        CustomPolicy policy = CustomPolicy.builder()
                .name("with-principal")
                .statements(List.of(PolicyStatement.builder()
                        .effect("Allow")
                        .action(List.of("sts:AssumeRole"))
                        .principal(new StatementPrincipal(List.of("arn:aws:iam::111111111111:root")))
                        .build()))
                .build();

        JsonNode statement = mapper.readTree(PolicyDocument.fromCustomPolicy(policy).toJson()).get("Statement").get(0);

        assertEquals("arn:aws:iam::111111111111:root", statement.get("Principal").get("AWS").get(0).asText());
        assertFalse(statement.has("Resource"));
    }

    @Test
    public void trustPolicyAllowsExactlyOnePrincipal() throws Exception {
        JsonNode json = mapper.readTree(PolicyDocument.assumeRoleTrust("arn:aws:iam::222222222222:user/alice").toJson());

        JsonNode statements = json.get("Statement");
        assertEquals(1, statements.size());
        JsonNode statement = statements.get(0);
        assertEquals("Allow", statement.get("Effect").asText());
        assertEquals("sts:AssumeRole", statement.get("Action").get(0).asText());
        JsonNode principals = statement.get("Principal").get("AWS");
        assertEquals(1, principals.size());
        assertEquals("arn:aws:iam::222222222222:user/alice", principals.get(0).asText());
        assertTrue(json.has("Version"));
    }
}
