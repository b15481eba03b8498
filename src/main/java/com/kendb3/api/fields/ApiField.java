package com.kendb3.api.fields;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Marks an instance field of a model as an API field.
 *
 * <pre>{@code
 * @ApiField({"*", "basic"})
 * private String name;
 * }</pre>
 *
 * The field is registered when the model's {@link ApiEngine} is assembled,
 * before any manual registration.
 */
@Documented
@Retention(RetentionPolicy.RUNTIME)
@Target(ElementType.FIELD)
public @interface ApiField {

    /**
     * Field groups the field belongs to.
     */
    String[] value() default {ApiEngine.ALL_GROUP};
}
