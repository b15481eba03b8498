package com.kendb3.api.fields;

import com.kendb3.api.exception.ApiDataException;
import com.kendb3.store.Model;

import java.util.function.BiConsumer;
import java.util.function.Function;

/**
 * Property descriptor registered as an API field, created by
 * {@link Registrar#property(Function)}.
 *
 * <pre>{@code
 * public static final ApiProperty<Profile, String> DISPLAY_NAME = API.mark("basic", "*")
 *         .property(Profile::getDisplayName)
 *         .setter(Profile::setDisplayName);
 * }</pre>
 *
 * Descriptors are immutable. {@link #getter(Function)} and {@link #setter(BiConsumer)}
 * return new descriptors and point the originating request at them, so the
 * descriptor finally stored in the static field is the one that gets resolved.
 */
public final class ApiProperty<M extends Model, V> {

    private final Registrar<M> registrar;
    private final Function<M, V> getterFn;
    private final BiConsumer<M, V> setterFn;
    private FieldRequest request;

    ApiProperty(Registrar<M> registrar, Function<M, V> getterFn, BiConsumer<M, V> setterFn,
                FieldRequest request) {
        this.registrar = registrar;
        this.getterFn = getterFn;
        this.setterFn = setterFn;
        this.request = request;
    }

    void bind(FieldRequest request) {
        this.request = request;
    }

    public ApiProperty<M, V> getter(Function<M, V> newGetter) {
        return update(new ApiProperty<>(registrar, newGetter, setterFn, request));
    }

    public ApiProperty<M, V> setter(BiConsumer<M, V> newSetter) {
        return update(new ApiProperty<>(registrar, getterFn, newSetter, request));
    }

    public V get(M instance) {
        return getterFn.apply(instance);
    }

    public void set(M instance, V value) {
        if (setterFn == null) {
            throw new ApiDataException("Property " + this + " has no setter");
        }
        setterFn.accept(instance, value);
    }

    public boolean isReadOnly() {
        return setterFn == null;
    }

    @SuppressWarnings("unchecked")
    FieldGetter toFieldGetter() {
        return (instance, name) -> getterFn.apply((M) instance);
    }

    @SuppressWarnings("unchecked")
    FieldSetter toFieldSetter() {
        return (instance, name, value) -> {
            if (setterFn == null) {
                throw new ApiDataException("Field '" + name + "' is read-only");
            }
            try {
                setterFn.accept((M) instance, (V) value);
            } catch (ClassCastException | IllegalArgumentException e) {
                throw new ApiDataException("Invalid value for field '" + name + "': " + e.getMessage(), e);
            }
        };
    }

    private ApiProperty<M, V> update(ApiProperty<M, V> next) {
        request.retarget(FieldLocator.attribute(next));
        return next;
    }

    @Override
    public String toString() {
        return registrar + ".property(" + (setterFn == null ? "read-only" : "read-write") + ")";
    }
}
