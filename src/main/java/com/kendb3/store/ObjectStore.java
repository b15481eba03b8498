package com.kendb3.store;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Object store of one model type, as exposed by the storage layer.
 *
 * <p>Lookups are predicate maps keyed by attribute name. Every store understands
 * {@code pk} (equality) and {@code pk__in} (membership in a collection).
 * Results are ordered by primary identifier.
 */
public interface ObjectStore<M extends Model> {

    List<M> all();

    List<M> filter(Map<String, ?> lookups);

    /**
     * Returns the single instance matching {@code lookups}.
     *
     * @throws IllegalStateException if more than one instance matches
     */
    Optional<M> get(Map<String, ?> lookups);

    /**
     * Persists {@code instance}, assigning a primary identifier if it has none.
     */
    M save(M instance);
}
