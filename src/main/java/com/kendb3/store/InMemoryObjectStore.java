package com.kendb3.store;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentSkipListMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Function;
import java.util.function.Predicate;

/**
 * Object store kept in memory, ordered by primary identifier.
 *
 * <p>Besides {@code pk} and {@code pk__in}, lookups on other attributes are
 * available once registered with {@link #withAttribute(String, Function)}.
 */
public class InMemoryObjectStore<M extends Model> implements ObjectStore<M> {

    private final NavigableMap<Long, M> instances = new ConcurrentSkipListMap<>();
    private final Map<String, Function<M, ?>> attributes = new ConcurrentHashMap<>();
    private final AtomicLong sequence = new AtomicLong();

    public InMemoryObjectStore<M> withAttribute(String name, Function<M, ?> reader) {
        attributes.put(name, reader);
        return this;
    }

    @Override
    public List<M> all() {
        return new ArrayList<>(instances.values());
    }

    @Override
    public List<M> filter(Map<String, ?> lookups) {
        Predicate<M> predicate = m -> true;
        for (Map.Entry<String, ?> lookup : lookups.entrySet()) {
            predicate = predicate.and(toPredicate(lookup.getKey(), lookup.getValue()));
        }
        return instances.values().stream().filter(predicate).toList();
    }

    @Override
    public Optional<M> get(Map<String, ?> lookups) {
        List<M> matches = filter(lookups);
        if (matches.size() > 1) {
            throw new IllegalStateException("get() returned " + matches.size() + " objects for " + lookups);
        }
        return matches.stream().findFirst();
    }

    @Override
    public M save(M instance) {
        if (instance.getPk() == null) {
            instance.setPk(sequence.incrementAndGet());
        } else {
            sequence.accumulateAndGet(instance.getPk(), Math::max);
        }
        instances.put(instance.getPk(), instance);
        return instance;
    }

    public boolean delete(Long pk) {
        return instances.remove(pk) != null;
    }

    public int size() {
        return instances.size();
    }

    private Predicate<M> toPredicate(String key, Object expected) {
        if ("pk".equals(key)) {
            return m -> expected != null && expected.equals(m.getPk());
        }
        if ("pk__in".equals(key)) {
            if (!(expected instanceof Collection<?> candidates)) {
                throw new IllegalArgumentException("pk__in expects a collection, got " + expected);
            }
            return m -> candidates.contains(m.getPk());
        }
        Function<M, ?> reader = attributes.get(key);
        if (reader == null) {
            throw new IllegalArgumentException("Unsupported lookup: " + key);
        }
        return m -> Objects.equals(reader.apply(m), expected);
    }
}
