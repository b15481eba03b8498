package com.kendb3.api.codegen.model;

import lombok.Value;

/**
 * One property of an exported class declaration.
 */
@Value
public class FieldDeclaration {
    String name;
    String type;
}
