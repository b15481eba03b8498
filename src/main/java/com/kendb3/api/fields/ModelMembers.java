package com.kendb3.api.fields;

import com.kendb3.store.Model;
import com.kendb3.util.NamingUtil;

import java.lang.reflect.Field;
import java.lang.reflect.Method;
import java.lang.reflect.Modifier;
import java.lang.reflect.ParameterizedType;
import java.lang.reflect.Type;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Reflection helpers over model classes. Lookups by API name are cached per
 * class so accessors built from a field name stay cheap on the serving path.
 */
final class ModelMembers {

    private record MemberKey(Class<?> modelClass, String apiName) {}

    private static final Map<MemberKey, Optional<Field>> RELATION_CACHE = new ConcurrentHashMap<>();

    private ModelMembers() {
    }

    /**
     * Finds an instance field by Java name or API name, searching superclasses
     * up to {@link Model}.
     */
    static Optional<Field> findInstanceField(Class<?> modelClass, String name) {
        Class<?> cursor = modelClass;
        while (cursor != null && cursor != Model.class && cursor != Object.class) {
            for (Field field : cursor.getDeclaredFields()) {
                if (Modifier.isStatic(field.getModifiers()) || field.isSynthetic()) {
                    continue;
                }
                if (field.getName().equals(name) || NamingUtil.toFieldName(field.getName()).equals(name)) {
                    return Optional.of(field);
                }
            }
            cursor = cursor.getSuperclass();
        }
        return Optional.empty();
    }

    /**
     * Finds the relation holder behind an API name, accepting the raw key
     * spellings {@code <name>_id} and {@code <name>_ids}.
     */
    static Optional<Field> findRelationField(Class<?> modelClass, String apiName) {
        return RELATION_CACHE.computeIfAbsent(new MemberKey(modelClass, apiName), key -> {
            Optional<Field> direct = findInstanceField(modelClass, apiName)
                    .filter(f -> RelationKind.of(f.getType()) != RelationKind.NONE);
            if (direct.isPresent()) {
                return direct;
            }
            return stripRelationSuffix(apiName)
                    .flatMap(base -> findInstanceField(modelClass, base))
                    .filter(f -> RelationKind.of(f.getType()) != RelationKind.NONE);
        });
    }

    static Optional<String> stripRelationSuffix(String apiName) {
        if (apiName.endsWith("_ids") && apiName.length() > 4) {
            return Optional.of(apiName.substring(0, apiName.length() - 4));
        }
        if (apiName.endsWith("_id") && apiName.length() > 3) {
            return Optional.of(apiName.substring(0, apiName.length() - 3));
        }
        return Optional.empty();
    }

    static Object read(Field field, Object instance) {
        try {
            field.setAccessible(true);
            return field.get(instance);
        } catch (IllegalAccessException e) {
            throw new IllegalStateException("Cannot read " + field, e);
        }
    }

    static void write(Field field, Object instance, Object value) {
        try {
            field.setAccessible(true);
            field.set(instance, value);
        } catch (IllegalAccessException e) {
            throw new IllegalStateException("Cannot write " + field, e);
        }
    }

    /**
     * Returns the JavaBean getter of {@code field}, if declared.
     */
    static Optional<Method> beanGetter(Class<?> modelClass, Field field) {
        String suffix = NamingUtil.toPascalCase(NamingUtil.toFieldName(field.getName()));
        Optional<Method> getter = publicMethod(modelClass, "get" + suffix);
        if (getter.isEmpty() && (field.getType() == boolean.class || field.getType() == Boolean.class)) {
            getter = publicMethod(modelClass, "is" + suffix);
        }
        return getter.filter(m -> m.getReturnType() != void.class);
    }

    /**
     * Returns the JavaBean setter of {@code field}, if declared.
     */
    static Optional<Method> beanSetter(Class<?> modelClass, Field field) {
        String suffix = NamingUtil.toPascalCase(NamingUtil.toFieldName(field.getName()));
        return publicMethod(modelClass, "set" + suffix, field.getType());
    }

    /**
     * Returns the model type a relation holder field points at, read from its
     * type argument.
     */
    @SuppressWarnings("unchecked")
    static Class<? extends Model> relationTarget(Field field) {
        Type type = field.getGenericType();
        if (type instanceof ParameterizedType parameterized) {
            Type[] arguments = parameterized.getActualTypeArguments();
            if (arguments.length == 1 && arguments[0] instanceof Class<?> target
                    && Model.class.isAssignableFrom(target)) {
                return (Class<? extends Model>) target;
            }
        }
        return null;
    }

    private static Optional<Method> publicMethod(Class<?> type, String name, Class<?>... parameterTypes) {
        try {
            Method method = type.getMethod(name, parameterTypes);
            // public accessors of package-private model classes
            method.setAccessible(true);
            return Optional.of(method);
        } catch (NoSuchMethodException e) {
            return Optional.empty();
        }
    }
}
