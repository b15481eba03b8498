package com.kendb3.api.fields;

import com.kendb3.api.exception.ApiDataException;
import com.kendb3.store.ForeignKey;
import com.kendb3.store.RelatedManager;
import com.kendb3.store.TagManager;

import java.lang.reflect.Field;
import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.lang.reflect.Modifier;
import java.util.Optional;

/**
 * Accessor pairs used when a request does not bring its own.
 *
 * <p>Plain accessors are bound to one member. Relation and tag accessors are
 * driven by the field name they receive, so the same pair can be handed to
 * {@link ApiEngine#addField(String, FieldGetter, FieldSetter, String...)} for
 * any model.
 */
public final class FieldAccessors {

    private FieldAccessors() {
        // Utility class
    }

    /**
     * Plain get through the JavaBean getter, or the field itself when there is none.
     */
    public static FieldGetter plainGetter(Class<?> modelClass, Field field) {
        Optional<Method> getter = ModelMembers.beanGetter(modelClass, field);
        if (getter.isPresent()) {
            Method method = getter.get();
            return (instance, name) -> invoke(method, instance, name);
        }
        return (instance, name) -> ModelMembers.read(field, instance);
    }

    /**
     * Plain set through the JavaBean setter, or the field itself when it is not final.
     * Payload values are converted to the attribute type first.
     */
    public static FieldSetter plainSetter(Class<?> modelClass, Field field) {
        Optional<Method> setter = ModelMembers.beanSetter(modelClass, field);
        Class<?> type = field.getType();
        if (setter.isPresent()) {
            Method method = setter.get();
            return (instance, name, value) -> invoke(method, instance, name, ValueCoercion.coerce(value, type, name));
        }
        if (Modifier.isFinal(field.getModifiers())) {
            return readOnly();
        }
        return (instance, name, value) -> ModelMembers.write(field, instance, ValueCoercion.coerce(value, type, name));
    }

    /**
     * Setter for fields that cannot be assigned.
     */
    public static FieldSetter readOnly() {
        return (instance, name, value) -> {
            throw new ApiDataException("Field '" + name + "' is read-only");
        };
    }

    /**
     * Reads the raw key of a foreign key; {@code name} may be the holder name or {@code <holder>_id}.
     */
    public static FieldGetter foreignKeyGetter() {
        return (instance, name) -> {
            ForeignKey<?> key = holder(instance, name, ForeignKey.class);
            return key != null ? key.getId() : null;
        };
    }

    public static FieldSetter foreignKeySetter() {
        return (instance, name, value) -> requireHolder(instance, name, ForeignKey.class)
                .setId(ValueCoercion.toId(value, name));
    }

    /**
     * Reads a to-many relation as the list of referenced identifiers.
     */
    public static FieldGetter relatedGetter() {
        return (instance, name) -> {
            RelatedManager<?> manager = holder(instance, name, RelatedManager.class);
            return manager != null ? manager.ids() : null;
        };
    }

    /**
     * Replaces the membership of a to-many relation with the given identifiers.
     */
    public static FieldSetter relatedSetter() {
        return (instance, name, value) -> requireHolder(instance, name, RelatedManager.class)
                .set(ValueCoercion.toIds(value, name));
    }

    /**
     * Reads a tag collection as the list of tag names.
     */
    public static FieldGetter tagsGetter() {
        return (instance, name) -> {
            TagManager tags = holder(instance, name, TagManager.class);
            return tags != null ? tags.names() : null;
        };
    }

    /**
     * Replaces the tag set.
     */
    public static FieldSetter tagsSetter() {
        return (instance, name, value) -> {
            TagManager tags = requireHolder(instance, name, TagManager.class);
            try {
                tags.set(ValueCoercion.toNames(value, name));
            } catch (IllegalArgumentException e) {
                throw new ApiDataException("Invalid value for field '" + name + "': " + e.getMessage(), e);
            }
        };
    }

    private static <H> H holder(Object instance, String name, Class<H> holderType) {
        Field field = ModelMembers.findRelationField(instance.getClass(), name)
                .filter(f -> holderType.isAssignableFrom(f.getType()))
                .orElseThrow(() -> new IllegalStateException(instance.getClass().getSimpleName()
                        + " has no " + holderType.getSimpleName() + " for field '" + name + "'"));
        return holderType.cast(ModelMembers.read(field, instance));
    }

    private static <H> H requireHolder(Object instance, String name, Class<H> holderType) {
        H holder = holder(instance, name, holderType);
        if (holder == null) {
            throw new IllegalStateException(holderType.getSimpleName() + " behind field '" + name + "' of "
                    + instance.getClass().getSimpleName() + " is not initialized");
        }
        return holder;
    }

    private static Object invoke(Method method, Object instance, String name, Object... args) {
        try {
            return method.invoke(instance, args);
        } catch (IllegalAccessException e) {
            throw new IllegalStateException("Cannot access " + method, e);
        } catch (InvocationTargetException e) {
            Throwable cause = e.getCause();
            if (cause instanceof IllegalArgumentException) {
                throw new ApiDataException("Invalid value for field '" + name + "': " + cause.getMessage(), cause);
            }
            if (cause instanceof RuntimeException runtime) {
                throw runtime;
            }
            throw new IllegalStateException("Accessor of field '" + name + "' failed", cause);
        }
    }
}
