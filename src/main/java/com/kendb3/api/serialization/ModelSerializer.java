package com.kendb3.api.serialization;

import com.kendb3.api.exception.ApiDataException;
import com.kendb3.api.fields.ApiEngine;
import com.kendb3.api.fields.FieldMeta;
import com.kendb3.store.Model;

import java.math.BigInteger;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Converts between model instances and plain key-value payloads, one field
 * group at a time.
 *
 * <p>Stateless; safe for concurrent use once the engine is assembled.
 */
public final class ModelSerializer {

    /**
     * Payload key of the primary identifier.
     */
    public static final String ID_KEY = "id";

    private ModelSerializer() {
    }

    /**
     * Serializes {@code instance} into a map holding every field of
     * {@code group}, in registration order, followed by {@code id}.
     *
     * @throws com.kendb3.api.exception.UnknownFieldGroupException if the group is not declared
     */
    public static <M extends Model> Map<String, Object> serialize(ApiEngine<M> engine, M instance, String group) {
        List<FieldMeta> fields = engine.getFields(group);
        Map<String, Object> result = new LinkedHashMap<>();
        for (FieldMeta field : fields) {
            result.put(field.getName(), field.get(instance));
        }
        result.put(ID_KEY, instance.getPk());
        return result;
    }

    /**
     * Creates an unsaved instance from {@code payload}, as if by
     * <pre>
     *   obj = new Model()
     *   if payload has 'id':      obj.pk = payload['id']
     *   if payload has 'field_1': obj.field_1 = payload['field_1']
     *   ...
     * </pre>
     * for the fields of {@code group}, in registration order. Missing fields and
     * keys that are not fields are ignored. The instance is not saved.
     *
     * @throws com.kendb3.api.exception.UnknownFieldGroupException if the group is not declared
     * @throws ApiDataException if a value cannot be applied
     */
    public static <M extends Model> M deserialize(ApiEngine<M> engine, Map<String, ?> payload, String group) {
        List<FieldMeta> fields = engine.getFields(group);

        M instance = engine.newInstance();
        if (payload.containsKey(ID_KEY)) {
            instance.setPk(toPk(payload.get(ID_KEY)));
        }
        for (FieldMeta field : fields) {
            if (payload.containsKey(field.getName())) {
                field.set(instance, payload.get(field.getName()));
            }
        }
        return instance;
    }

    private static Long toPk(Object value) {
        if (value == null) {
            return null;
        }
        if (value instanceof Long || value instanceof Integer || value instanceof Short || value instanceof Byte) {
            return ((Number) value).longValue();
        }
        if (value instanceof BigInteger big && big.bitLength() < 64) {
            return big.longValue();
        }
        throw new ApiDataException("'" + ID_KEY + "' must be an integer, got " + value);
    }
}
