package com.kendb3.api.codegen.model;

import lombok.Value;

/**
 * A joined property whose target type is bound after every class is declared.
 */
@Value
public class RelationWiring {
    String model;
    String joinedField;
    String rawField;
    String target;
    boolean many;

    public String getJoinFunction() {
        return many ? "joinMany" : "joinOne";
    }
}
