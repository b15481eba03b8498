package com.kendb3.api.fields;

import com.kendb3.api.exception.ApiConfigurationException;
import com.kendb3.api.exception.UnknownFieldGroupException;
import com.kendb3.api.serialization.ModelSerializer;
import com.kendb3.store.Model;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.reflect.Constructor;
import java.lang.reflect.InvocationTargetException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Orchestrator of API field registrations for one model class.
 *
 * <h2>Lifecycle</h2>
 * <ol>
 *   <li><b>Open</b>: while the model class initializes, fields are registered
 *       with {@link ApiField}, {@link #mark(String...)}, {@link #addField(String, String...)}
 *       and {@link #addRelated(String, String...)}.</li>
 *   <li><b>Assembly</b>: {@link #assemble()} runs once, normally from
 *       {@code ModelRegistry.register}, and resolves every request.</li>
 *   <li><b>Assembled</b>: read-only; the field groups may be read concurrently
 *       by any number of threads. Further registrations fail.</li>
 * </ol>
 *
 * <h2>Example</h2>
 * <pre>{@code
 * public class Car extends Model {
 *     public static final ApiEngine<Car> API = ApiEngine.of(Car.class);
 *
 *     @ApiField
 *     private String make;
 *
 *     @ApiField({"*", "looks"})
 *     private String designDesc;
 *
 *     public static final ApiProperty<Car, int[]> COLOR_RGB = API.mark("*", "looks")
 *             .property(Car::getColorRgb)
 *             .setter(Car::setColorRgb);
 * }
 * }</pre>
 */
public final class ApiEngine<M extends Model> {

    private static final Logger log = LoggerFactory.getLogger(ApiEngine.class);

    /**
     * The implicit default group.
     */
    public static final String ALL_GROUP = "*";

    private final Class<M> modelClass;
    private final String description;
    private final Map<String, Registrar<M>> markers = new LinkedHashMap<>();
    private List<FieldRequest> requests = new ArrayList<>();
    private volatile AssembledFields assembled;

    private ApiEngine(Class<M> modelClass, String description) {
        this.modelClass = modelClass;
        this.description = description;
    }

    public static <M extends Model> ApiEngine<M> of(Class<M> modelClass) {
        return new ApiEngine<>(modelClass, null);
    }

    /**
     * Creates an engine with a description, carried into exported declarations.
     */
    public static <M extends Model> ApiEngine<M> of(Class<M> modelClass, String description) {
        return new ApiEngine<>(modelClass, description);
    }

    // -------------------------------------------------------------------------
    // registration
    // -------------------------------------------------------------------------

    /**
     * Returns a registrar for {@code groups} (default {@code *}) and files a
     * request located by that registrar.
     */
    public Registrar<M> mark(String... groups) {
        return new Registrar<>(this, defaultGroups(groups));
    }

    public FieldRequest request(FieldLocator locator, Iterable<?> groups) {
        return request(locator, groups, null, null);
    }

    /**
     * Requests that the attribute identified by {@code locator} be registered in
     * {@code groups}. The returned request may be retargeted until assembly.
     *
     * @throws ApiConfigurationException if {@code locator} is null, the engine is
     *         already assembled, or {@code groups} holds anything but strings
     */
    public FieldRequest request(FieldLocator locator, Iterable<?> groups, FieldGetter getter, FieldSetter setter) {
        if (locator == null) {
            throw new ApiConfigurationException("Field locator of " + modelClass.getName() + " must not be null");
        }
        ensureOpen("request registration of " + locator.describe());
        FieldRequest request = new FieldRequest(locator, groups, getter, setter);
        requests.add(request);
        return request;
    }

    /**
     * Manually registers field {@code name} in {@code groups} (default {@code *}).
     * Prefer {@link ApiField} or {@link #mark(String...)}.
     */
    public FieldRequest addField(String name, String... groups) {
        return request(FieldLocator.named(name), defaultGroups(groups));
    }

    public FieldRequest addField(String name, FieldGetter getter, FieldSetter setter, String... groups) {
        return request(FieldLocator.named(name), defaultGroups(groups), getter, setter);
    }

    /**
     * Registers a to-many relation, serialized as the list of referenced identifiers.
     */
    public FieldRequest addRelated(String name, String... groups) {
        return addField(name, FieldAccessors.relatedGetter(), FieldAccessors.relatedSetter(), groups);
    }

    void declareMarker(String attributeName, Registrar<M> registrar) {
        ensureOpen("mark attribute '" + attributeName + "'");
        markers.put(attributeName, registrar);
    }

    // -------------------------------------------------------------------------
    // assembly
    // -------------------------------------------------------------------------

    /**
     * Resolves every pending request and freezes the field groups.
     *
     * @throws ApiConfigurationException on a resolution error or a second call
     */
    public synchronized ApiEngine<M> assemble() {
        ensureOpen("assemble again");
        List<FieldRequest> pending = requests;
        requests = null;

        AssembledFields result = new FieldAssembler<>(modelClass).assemble(pending, markers);
        assembled = result;
        log.info("Assembled API model {} ('{}'): groups {}, fields {}",
                modelClass.getSimpleName(), result.apiName(), result.fieldGroups().keySet(), result.allFields());
        return this;
    }

    public boolean isAssembled() {
        return assembled != null;
    }

    // -------------------------------------------------------------------------
    // resolved metadata
    // -------------------------------------------------------------------------

    public Class<M> getModelClass() {
        return modelClass;
    }

    public String getDescription() {
        return description;
    }

    public String getApiName() {
        return assembled().apiName();
    }

    public Map<String, List<FieldMeta>> getFieldGroups() {
        return assembled().fieldGroups();
    }

    /**
     * Group names in the order they were first used.
     */
    public List<String> getGroupNames() {
        return List.copyOf(assembled().fieldGroups().keySet());
    }

    public boolean hasGroup(String group) {
        return assembled().fieldGroups().containsKey(group);
    }

    /**
     * Names of the fields across all groups, in first-registration order.
     */
    public List<String> getAllFields() {
        return assembled().allFields();
    }

    /**
     * Returns the fields of {@code group} in registration order.
     *
     * @throws UnknownFieldGroupException if nothing was registered in {@code group}
     */
    public List<FieldMeta> getFields(String group) {
        List<FieldMeta> fields = assembled().fieldGroups().get(group);
        if (fields == null) {
            throw new UnknownFieldGroupException(group);
        }
        return fields;
    }

    // -------------------------------------------------------------------------
    // instances
    // -------------------------------------------------------------------------

    public Map<String, Object> serialize(M instance) {
        return ModelSerializer.serialize(this, instance, ALL_GROUP);
    }

    public Map<String, Object> serialize(M instance, String group) {
        return ModelSerializer.serialize(this, instance, group);
    }

    public M deserialize(Map<String, ?> payload) {
        return ModelSerializer.deserialize(this, payload, ALL_GROUP);
    }

    public M deserialize(Map<String, ?> payload, String group) {
        return ModelSerializer.deserialize(this, payload, group);
    }

    /**
     * Creates a new, unsaved instance through the no-argument constructor.
     */
    public M newInstance() {
        try {
            Constructor<M> constructor = modelClass.getDeclaredConstructor();
            constructor.setAccessible(true);
            return constructor.newInstance();
        } catch (NoSuchMethodException e) {
            throw new ApiConfigurationException(modelClass.getName() + " needs a no-argument constructor", e);
        } catch (InstantiationException | IllegalAccessException e) {
            throw new ApiConfigurationException("Cannot instantiate " + modelClass.getName(), e);
        } catch (InvocationTargetException e) {
            throw new IllegalStateException("Constructor of " + modelClass.getName() + " failed", e.getCause());
        }
    }

    @Override
    public String toString() {
        return "ApiEngine(" + modelClass.getSimpleName() + (isAssembled() ? ", assembled" : ", open") + ")";
    }

    private AssembledFields assembled() {
        AssembledFields result = assembled;
        if (result == null) {
            throw new ApiConfigurationException("API of " + modelClass.getName() + " is not assembled yet");
        }
        return result;
    }

    private void ensureOpen(String action) {
        if (requests == null) {
            throw new ApiConfigurationException("API of " + modelClass.getName()
                    + " is already assembled, cannot " + action);
        }
    }

    private static List<String> defaultGroups(String... groups) {
        if (groups == null || groups.length == 0) {
            return List.of(ALL_GROUP);
        }
        return Arrays.asList(groups);
    }
}
