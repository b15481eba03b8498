package com.kendb3.store;

import java.util.Map;
import java.util.Optional;

/**
 * Many-to-one (or one-to-one) relation holder. Stores the raw key of the
 * referenced object and, once known, the object itself.
 *
 * @param <T> referenced model type
 */
public final class ForeignKey<T extends Model> {

    private final Class<T> target;
    private final boolean oneToOne;
    private Long id;
    private T value;

    private ForeignKey(Class<T> target, boolean oneToOne) {
        this.target = target;
        this.oneToOne = oneToOne;
    }

    public static <T extends Model> ForeignKey<T> to(Class<T> target) {
        return new ForeignKey<>(target, false);
    }

    public static <T extends Model> ForeignKey<T> oneToOne(Class<T> target) {
        return new ForeignKey<>(target, true);
    }

    public Class<T> getTarget() {
        return target;
    }

    public boolean isOneToOne() {
        return oneToOne;
    }

    public Long getId() {
        return id;
    }

    /**
     * Sets the raw key. A cached object with a different key is dropped.
     */
    public void setId(Long id) {
        this.id = id;
        if (value != null && (id == null || !id.equals(value.getPk()))) {
            value = null;
        }
    }

    /**
     * Returns the referenced object if it was set directly or resolved before.
     */
    public T getValue() {
        return value;
    }

    public void set(T value) {
        this.value = value;
        this.id = value != null ? value.getPk() : null;
    }

    /**
     * Resolves the referenced object through {@code store}, caching the result.
     */
    public Optional<T> resolve(ObjectStore<T> store) {
        if (id == null) {
            return Optional.empty();
        }
        if (value == null) {
            value = store.get(Map.of("pk", id)).orElse(null);
        }
        return Optional.ofNullable(value);
    }

    @Override
    public String toString() {
        return "ForeignKey<" + target.getSimpleName() + ">(" + id + ")";
    }
}
