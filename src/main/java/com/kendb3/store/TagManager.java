package com.kendb3.store;

import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Collection of tag names attached to a model instance.
 */
public final class TagManager {

    private final Set<String> names = new LinkedHashSet<>();

    public List<String> names() {
        return List.copyOf(names);
    }

    /**
     * Replaces the tag set with {@code newNames}. Nothing changes if any name is invalid.
     */
    public void set(Collection<String> newNames) {
        Set<String> replacement = new LinkedHashSet<>();
        for (String name : newNames) {
            replacement.add(normalize(name));
        }
        names.clear();
        names.addAll(replacement);
    }

    public void add(String name) {
        names.add(normalize(name));
    }

    public boolean contains(String name) {
        return names.contains(name);
    }

    private static String normalize(String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Tag name must not be blank");
        }
        return name.trim();
    }
}
