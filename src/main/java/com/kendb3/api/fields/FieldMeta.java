package com.kendb3.api.fields;

import com.kendb3.api.exception.ApiDataException;
import com.kendb3.api.exception.ApiException;
import com.kendb3.store.Model;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * Resolved API field: its name and the accessor pair used to read and write it.
 *
 * Immutable; shared by every instance of the model.
 */
@Value
@Builder(toBuilder = true)
public class FieldMeta {

    /**
     * API field name, the key used in payloads.
     */
    @NonNull
    String name;

    @NonNull
    FieldGetter getter;

    @NonNull
    FieldSetter setter;

    @NonNull
    @Builder.Default
    RelationKind relationKind = RelationKind.NONE;

    /**
     * Referenced model type for foreign keys and to-many relations, if known.
     */
    Class<? extends Model> relationTarget;

    /**
     * Reads this field from {@code instance}.
     *
     * @throws ApiDataException if the accessor fails
     */
    public Object get(Object instance) {
        try {
            return getter.get(instance, name);
        } catch (ApiException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new ApiDataException("Cannot read field '" + name + "' of " + describe(instance)
                    + ": " + e.getMessage(), e);
        }
    }

    /**
     * Writes {@code value} to this field of {@code instance}.
     *
     * @throws ApiDataException if the value is rejected or the accessor fails
     */
    public void set(Object instance, Object value) {
        try {
            setter.set(instance, name, value);
        } catch (ApiException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new ApiDataException("Cannot write field '" + name + "' of " + describe(instance)
                    + ": " + e.getMessage(), e);
        }
    }

    public boolean isRelation() {
        return relationKind.referencesModels();
    }

    private static String describe(Object instance) {
        return instance == null ? "null" : instance.getClass().getSimpleName();
    }
}
