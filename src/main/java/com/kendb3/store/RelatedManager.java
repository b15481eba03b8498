package com.kendb3.store;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * To-many relation manager. Membership is tracked by primary identifier of the
 * referenced objects, in insertion order.
 *
 * @param <T> referenced model type
 */
public final class RelatedManager<T extends Model> {

    private final Class<T> target;
    private final Set<Long> ids = new LinkedHashSet<>();

    private RelatedManager(Class<T> target) {
        this.target = target;
    }

    public static <T extends Model> RelatedManager<T> of(Class<T> target) {
        return new RelatedManager<>(target);
    }

    public Class<T> getTarget() {
        return target;
    }

    public List<Long> ids() {
        return List.copyOf(ids);
    }

    /**
     * Replaces the membership with {@code newIds}.
     */
    public void set(Collection<Long> newIds) {
        ids.clear();
        ids.addAll(newIds);
    }

    public void add(T instance) {
        if (instance.getPk() == null) {
            throw new IllegalArgumentException("Cannot relate unsaved " + instance);
        }
        ids.add(instance.getPk());
    }

    public boolean contains(Long id) {
        return ids.contains(id);
    }

    public int size() {
        return ids.size();
    }

    /**
     * Fetches the related objects from {@code store}.
     */
    public List<T> all(ObjectStore<T> store) {
        if (ids.isEmpty()) {
            return List.of();
        }
        return store.filter(Map.of("pk__in", new ArrayList<>(ids)));
    }
}
