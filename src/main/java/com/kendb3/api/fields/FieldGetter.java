package com.kendb3.api.fields;

/**
 * Reads the value of API field {@code name} from a model instance.
 */
@FunctionalInterface
public interface FieldGetter {

    Object get(Object instance, String name);
}
