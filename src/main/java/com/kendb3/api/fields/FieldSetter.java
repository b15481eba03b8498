package com.kendb3.api.fields;

/**
 * Assigns {@code value} to API field {@code name} of a model instance.
 */
@FunctionalInterface
public interface FieldSetter {

    void set(Object instance, String name, Object value);
}
