package com.kendb3.api.fields;

import com.kendb3.api.exception.ApiConfigurationException;
import com.kendb3.store.Model;
import com.kendb3.util.NamingUtil;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.reflect.Field;
import java.lang.reflect.Modifier;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Turns the pending requests of one model into {@link FieldMeta} lists.
 *
 * <p>Runs once per model. Each request is resolved to an attribute name,
 * given an accessor pair (explicit, or inferred from the attribute type) and
 * appended to every group it lists, in registration order.
 */
final class FieldAssembler<M extends Model> {

    private static final Logger log = LoggerFactory.getLogger(FieldAssembler.class);

    private final Class<M> modelClass;

    FieldAssembler(Class<M> modelClass) {
        this.modelClass = modelClass;
    }

    AssembledFields assemble(List<FieldRequest> registered, Map<String, Registrar<M>> markers) {
        List<FieldRequest> requests = new ArrayList<>(annotatedRequests());
        requests.addAll(registered);

        Map<String, List<FieldMeta>> fieldGroups = new LinkedHashMap<>();
        for (FieldRequest request : requests) {
            Optional<FieldMeta> resolved = resolve(request, markers);
            if (resolved.isEmpty()) {
                continue;
            }
            FieldMeta meta = resolved.get();
            log.debug("{}: {} -> {} {}", modelClass.getSimpleName(), request.getLocator().describe(),
                    meta.getName(), request.getGroups());
            for (String group : new LinkedHashSet<>(request.getGroups())) {
                fieldGroups.computeIfAbsent(group, g -> new ArrayList<>()).add(meta);
            }
        }

        fieldGroups.replaceAll((group, fields) -> List.copyOf(fields));
        List<String> allFields = fieldGroups.values().stream()
                .flatMap(List::stream)
                .map(FieldMeta::getName)
                .distinct()
                .toList();

        return new AssembledFields(
                Collections.unmodifiableMap(fieldGroups),
                allFields,
                NamingUtil.toApiName(modelClass.getSimpleName()));
    }

    // -------------------------------------------------------------------------
    // locator resolution
    // -------------------------------------------------------------------------

    private List<FieldRequest> annotatedRequests() {
        List<FieldRequest> requests = new ArrayList<>();
        for (Field field : modelClass.getDeclaredFields()) {
            ApiField annotation = field.getAnnotation(ApiField.class);
            if (annotation == null) {
                continue;
            }
            if (Modifier.isStatic(field.getModifiers())) {
                throw new ApiConfigurationException("@ApiField is not allowed on static field "
                        + modelClass.getName() + "." + field.getName());
            }
            requests.add(new FieldRequest(FieldLocator.member(field), Arrays.asList(annotation.value()), null, null));
        }
        return requests;
    }

    private Optional<FieldMeta> resolve(FieldRequest request, Map<String, Registrar<M>> markers) {
        FieldLocator locator = request.getLocator();

        if (locator instanceof FieldLocator.Named named) {
            return Optional.of(resolveName(named.name(), true, request));
        }
        if (locator instanceof FieldLocator.Marker marker) {
            return findMarkedAttribute(marker.registrar(), markers)
                    .map(attributeName -> resolveName(attributeName, false, request));
        }
        if (locator instanceof FieldLocator.AttributeObject attribute) {
            return Optional.of(resolveAttributeObject(attribute.attribute(), request));
        }
        if (locator instanceof FieldLocator.Member member) {
            Field field = requireDeclared(member.field());
            return Optional.of(fromMember(NamingUtil.toFieldName(field.getName()), field, false, request));
        }
        throw new ApiConfigurationException("Unsupported locator " + locator.describe() + " in " + modelClass.getName());
    }

    /**
     * Scans the declared marker table for entries holding exactly this registrar.
     * No entry means the registrar was never put on an attribute and is skipped.
     */
    private Optional<String> findMarkedAttribute(Registrar<?> registrar, Map<String, Registrar<M>> markers) {
        List<String> names = new ArrayList<>();
        for (Map.Entry<String, Registrar<M>> entry : markers.entrySet()) {
            if (entry.getValue() == registrar) {
                names.add(entry.getKey());
            }
        }
        if (names.size() > 1) {
            throw new ApiConfigurationException(registrar + " marker reused on fields " + names
                    + " in " + modelClass.getName());
        }
        if (names.isEmpty()) {
            log.debug("{}: {} marks no attribute, skipped", modelClass.getSimpleName(), registrar);
            return Optional.empty();
        }
        return Optional.of(names.get(0));
    }

    /**
     * Scans the static fields of the model for the one holding exactly {@code attribute}.
     */
    private FieldMeta resolveAttributeObject(Object attribute, FieldRequest request) {
        List<Field> matches = new ArrayList<>();
        for (Field field : modelClass.getDeclaredFields()) {
            if (Modifier.isStatic(field.getModifiers()) && ModelMembers.read(field, null) == attribute) {
                matches.add(field);
            }
        }
        if (matches.isEmpty()) {
            throw new ApiConfigurationException("Attribute object " + attribute + ", marked as API, not found in "
                    + modelClass.getName());
        }
        if (matches.size() > 1) {
            throw new ApiConfigurationException("Attribute object " + attribute
                    + ", marked as API, found in several fields in " + modelClass.getName() + ": "
                    + matches.stream().map(Field::getName).toList());
        }

        String name = NamingUtil.toFieldName(matches.get(0).getName());
        if (attribute instanceof ApiProperty<?, ?> property) {
            return FieldMeta.builder()
                    .name(name)
                    .getter(request.getGetter() != null ? request.getGetter() : property.toFieldGetter())
                    .setter(request.getSetter() != null ? request.getSetter() : property.toFieldSetter())
                    .build();
        }
        return resolveName(name, true, request);
    }

    /**
     * Resolves an attribute name: a member spelled this way, or a relation holder
     * whose raw key is spelled this way, or nothing but explicit accessors.
     * A literal name is kept as the field name; otherwise the member's API
     * spelling is used.
     */
    private FieldMeta resolveName(String name, boolean literal, FieldRequest request) {
        Optional<Field> member = ModelMembers.findInstanceField(modelClass, name);
        if (member.isPresent()) {
            Field field = member.get();
            String fieldName = literal ? name : NamingUtil.toFieldName(field.getName());
            return fromMember(fieldName, field, false, request);
        }

        Optional<Field> relation = ModelMembers.findRelationField(modelClass, name);
        if (relation.isPresent()) {
            return fromMember(name, relation.get(), true, request);
        }

        if (request.getGetter() == null) {
            throw new ApiConfigurationException("No attribute '" + name + "' found in " + modelClass.getName()
                    + " and no getter given");
        }
        return FieldMeta.builder()
                .name(name)
                .getter(request.getGetter())
                .setter(request.getSetter() != null ? request.getSetter() : FieldAccessors.readOnly())
                .build();
    }

    // -------------------------------------------------------------------------
    // accessor inference
    // -------------------------------------------------------------------------

    private FieldMeta fromMember(String name, Field field, boolean rawKeyName, FieldRequest request) {
        RelationKind kind = RelationKind.of(field.getType());
        String fieldName = name;
        FieldGetter getter;
        FieldSetter setter;

        switch (kind) {
            case FOREIGN_KEY -> {
                if (!rawKeyName) {
                    fieldName = name + "_id";
                }
                getter = FieldAccessors.foreignKeyGetter();
                setter = FieldAccessors.foreignKeySetter();
            }
            case TAGS -> {
                getter = FieldAccessors.tagsGetter();
                setter = FieldAccessors.tagsSetter();
            }
            case TO_MANY -> {
                getter = FieldAccessors.relatedGetter();
                setter = FieldAccessors.relatedSetter();
            }
            default -> {
                getter = FieldAccessors.plainGetter(modelClass, field);
                setter = FieldAccessors.plainSetter(modelClass, field);
            }
        }

        if (request.getGetter() != null) {
            getter = request.getGetter();
        }
        if (request.getSetter() != null) {
            setter = request.getSetter();
        }

        return FieldMeta.builder()
                .name(fieldName)
                .getter(getter)
                .setter(setter)
                .relationKind(kind)
                .relationTarget(kind.referencesModels() ? ModelMembers.relationTarget(field) : null)
                .build();
    }

    private Field requireDeclared(Field field) {
        List<Field> matches = Arrays.stream(modelClass.getDeclaredFields())
                .filter(field::equals)
                .toList();
        if (matches.isEmpty()) {
            throw new ApiConfigurationException("Attribute object " + field + ", marked as API, not found in "
                    + modelClass.getName());
        }
        return matches.get(0);
    }
}
