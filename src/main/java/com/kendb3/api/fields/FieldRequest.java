package com.kendb3.api.fields;

import com.kendb3.api.exception.ApiConfigurationException;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Deferred field registration: a locator, the groups the field joins and an
 * optional accessor pair. Only the locator may change after creation.
 */
public final class FieldRequest {

    private FieldLocator locator;
    private final List<String> groups;
    private final FieldGetter getter;
    private final FieldSetter setter;

    FieldRequest(FieldLocator locator, Iterable<?> groups, FieldGetter getter, FieldSetter setter) {
        this.locator = Objects.requireNonNull(locator, "locator");
        this.groups = validateGroups(groups);
        this.getter = getter;
        this.setter = setter;
    }

    public FieldLocator getLocator() {
        return locator;
    }

    public List<String> getGroups() {
        return groups;
    }

    public FieldGetter getGetter() {
        return getter;
    }

    public FieldSetter getSetter() {
        return setter;
    }

    /**
     * Points this request at another attribute, e.g. a property descriptor that
     * replaced the one originally registered.
     */
    public void retarget(FieldLocator newLocator) {
        this.locator = Objects.requireNonNull(newLocator, "locator");
    }

    @Override
    public String toString() {
        return "FieldRequest(" + locator.describe() + ", " + groups + ")";
    }

    private static List<String> validateGroups(Iterable<?> groups) {
        if (groups == null) {
            throw new ApiConfigurationException("groups must be a non-string iterable, not null");
        }
        List<String> result = new ArrayList<>();
        List<Object> badGroups = new ArrayList<>();
        for (Object group : groups) {
            if (group instanceof String name) {
                result.add(name);
            } else {
                badGroups.add(group);
            }
        }
        if (!badGroups.isEmpty()) {
            throw new ApiConfigurationException("groups must be strings, not " + badGroups);
        }
        if (result.isEmpty()) {
            throw new ApiConfigurationException("groups must name at least one group");
        }
        return List.copyOf(result);
    }
}
