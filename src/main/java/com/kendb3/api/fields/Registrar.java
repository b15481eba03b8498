package com.kendb3.api.fields;

import com.kendb3.api.exception.ApiConfigurationException;
import com.kendb3.store.Model;

import java.util.List;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Marker created by {@link ApiEngine#mark(String...)}. Creating one files a
 * request located by the registrar itself, so it must end up marking exactly
 * one attribute.
 *
 * <p>Three ways to use it:
 * <ul>
 *   <li>{@link #on(String)}: declares that the named attribute carries this marker</li>
 *   <li>{@link #property(Function)}: builds a tracked property descriptor, to be
 *       stored in a static field of the model</li>
 *   <li>{@link #attach(Object)}: marks another descriptor object stored in a
 *       static field of the model</li>
 * </ul>
 */
public final class Registrar<M extends Model> {

    private final ApiEngine<M> engine;
    private final List<String> groups;

    Registrar(ApiEngine<M> engine, List<String> groups) {
        this.engine = engine;
        this.groups = List.copyOf(groups);
        engine.request(FieldLocator.marker(this), this.groups);
    }

    public List<String> getGroups() {
        return groups;
    }

    /**
     * Declares that {@code attributeName} (Java member or API name) carries this marker.
     */
    public Registrar<M> on(String attributeName) {
        engine.declareMarker(attributeName, this);
        return this;
    }

    /**
     * Marks {@code attribute}, which must be stored in exactly one static field
     * of the model class by the time the engine is assembled.
     */
    public <A> A attach(A attribute) {
        if (attribute instanceof ApiProperty) {
            throw new ApiConfigurationException("Use " + this + ".property(getter), not "
                    + this + ".attach(property)");
        }
        engine.request(FieldLocator.attribute(attribute), groups);
        return attribute;
    }

    /**
     * Returns a property descriptor that is registered as an API field. Every
     * {@code getter(...)} or {@code setter(...)} call on it returns a new
     * descriptor that replaces the previous one in the registration.
     */
    public <V> ApiProperty<M, V> property(Function<M, V> getter) {
        if (getter == null) {
            throw new ApiConfigurationException(this + ".property() requires a getter");
        }
        ApiProperty<M, V> first = new ApiProperty<>(this, getter, null, null);
        first.bind(engine.request(FieldLocator.attribute(first), groups));
        return first;
    }

    @Override
    public String toString() {
        return "mark(" + groups.stream().map(g -> "'" + g + "'").collect(Collectors.joining(", ")) + ")";
    }
}
