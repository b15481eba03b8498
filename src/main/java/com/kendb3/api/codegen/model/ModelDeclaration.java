package com.kendb3.api.codegen.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * Template view of one exported model.
 */
@Value
@Builder
public class ModelDeclaration {
    String name;
    String apiName;
    String endpoint;

    /**
     * Lines of the class documentation comment; empty for none.
     */
    @Singular("docLine")
    List<String> docLines;

    @Singular
    List<FieldDeclaration> fields;

    /**
     * Field group names in declaration order.
     */
    @Singular
    List<String> groups;

    @Singular
    List<RelationWiring> relations;
}
