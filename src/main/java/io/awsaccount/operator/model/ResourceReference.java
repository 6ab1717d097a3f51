package io.awsaccount.operator.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Name and namespace of another resource.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ResourceReference {
    private String name;
    private String namespace;
}
