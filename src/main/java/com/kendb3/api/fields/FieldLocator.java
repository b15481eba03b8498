package com.kendb3.api.fields;

import java.lang.reflect.Field;

/**
 * Identifies the attribute a {@link FieldRequest} refers to. Resolved against
 * the model class when the engine is assembled.
 */
public interface FieldLocator {

    /**
     * Short human-readable form used in error messages.
     */
    String describe();

    static FieldLocator named(String name) {
        return new Named(name);
    }

    static FieldLocator marker(Registrar<?> registrar) {
        return new Marker(registrar);
    }

    static FieldLocator attribute(Object attribute) {
        return new AttributeObject(attribute);
    }

    static FieldLocator member(Field field) {
        return new Member(field);
    }

    /**
     * Literal API field name, used as-is.
     */
    record Named(String name) implements FieldLocator {
        public Named {
            if (name == null || name.isBlank()) {
                throw new IllegalArgumentException("Field name must not be blank");
            }
        }

        @Override
        public String describe() {
            return "'" + name + "'";
        }
    }

    /**
     * A registrar, matched by identity against the declared marker table.
     */
    record Marker(Registrar<?> registrar) implements FieldLocator {
        @Override
        public String describe() {
            return registrar.toString();
        }
    }

    /**
     * A descriptor object, matched by identity against the static fields of the model.
     */
    record AttributeObject(Object attribute) implements FieldLocator {
        @Override
        public String describe() {
            return String.valueOf(attribute);
        }
    }

    /**
     * A member of the model class carrying {@link ApiField}.
     */
    record Member(Field field) implements FieldLocator {
        @Override
        public String describe() {
            return field.getDeclaringClass().getSimpleName() + "." + field.getName();
        }
    }
}
