package com.kendb3.api.server;

import com.kendb3.api.fields.ApiEngine;
import com.kendb3.store.Model;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;

/**
 * Builds data manager packets: serialized instances plus freshness information.
 *
 * <p>A packet is {@code {instances: [...], last_modified: <ISO-8601 or null>, dump: <bool>}};
 * {@code dump} is {@code true} when the packet holds every instance of the model.
 */
public class ModelQueryService {

    public static final String INJECTED_PACKETS = "injected_packets";

    private final ModelRegistry registry;
    private final LastModifiedTracker lastModifiedTracker;

    public ModelQueryService(ModelRegistry registry, LastModifiedTracker lastModifiedTracker) {
        this.registry = registry;
        this.lastModifiedTracker = lastModifiedTracker;
    }

    /**
     * Returns the packet of the instances with identifiers {@code ids}, or of all
     * instances when {@code ids} is {@code null}.
     *
     * @throws com.kendb3.api.exception.UnknownFieldGroupException if {@code group} is not declared
     * @throws com.kendb3.api.exception.ApiConfigurationException if the model is not registered
     */
    public <M extends Model> Map<String, Object> getModels(Collection<Long> ids, String group, ApiEngine<M> engine) {
        ModelRegistration<M> registration = registry.require(engine.getModelClass());
        List<M> instances = ids == null
                ? registration.store().all()
                : registration.store().filter(Map.of("pk__in", new LinkedHashSet<>(ids)));
        return packet(engine, instances, group, ids == null);
    }

    public Map<String, Object> inject(Map<String, Object> context, Iterable<? extends Model> instances) {
        return inject(context, instances, ApiEngine.ALL_GROUP, false);
    }

    /**
     * Appends a packet of {@code instances} to the {@code injected_packets} list of
     * {@code context}, creating the list when absent. {@code null} elements are
     * skipped. Can be called several times on the same context.
     *
     * @return {@code context}, or {@code null} if there was nothing to inject
     * @throws IllegalArgumentException if the instances are of different types
     */
    public Map<String, Object> inject(Map<String, Object> context, Iterable<? extends Model> instances,
                                      String group, boolean dump) {
        List<Model> present = new ArrayList<>();
        for (Model instance : instances) {
            if (instance != null) {
                present.add(instance);
            }
        }
        if (present.isEmpty()) {
            return null;
        }

        Class<? extends Model> modelClass = present.get(0).getClass();
        for (Model instance : present) {
            if (instance.getClass() != modelClass) {
                throw new IllegalArgumentException("Cannot inject instances of different types: "
                        + modelClass.getSimpleName() + " and " + instance.getClass().getSimpleName());
            }
        }

        Map<String, Object> injection = new LinkedHashMap<>();
        injection.put("model", modelClass.getSimpleName());
        injection.put("fields", group);
        injection.put("packet", packetOf(modelClass, present, group, dump));

        injectedPackets(context).add(injection);
        return context;
    }

    private <M extends Model> Map<String, Object> packetOf(Class<M> modelClass, List<Model> instances,
                                                           String group, boolean dump) {
        List<M> typed = new ArrayList<>();
        for (Model instance : instances) {
            typed.add(modelClass.cast(instance));
        }
        return packet(registry.require(modelClass).engine(), typed, group, dump);
    }

    private <M extends Model> Map<String, Object> packet(ApiEngine<M> engine, List<M> instances,
                                                         String group, boolean dump) {
        List<Map<String, Object>> serialized = new ArrayList<>();
        for (M instance : instances) {
            serialized.add(engine.serialize(instance, group));
        }

        Instant lastModified = lastModifiedTracker.lastModificationTimestamp();
        Map<String, Object> packet = new LinkedHashMap<>();
        packet.put("instances", serialized);
        packet.put("last_modified", lastModified == null ? null : lastModified.toString());
        packet.put("dump", dump);
        return packet;
    }

    @SuppressWarnings("unchecked")
    private static List<Object> injectedPackets(Map<String, Object> context) {
        Object existing = context.get(INJECTED_PACKETS);
        if (existing == null) {
            List<Object> created = new ArrayList<>();
            context.put(INJECTED_PACKETS, created);
            return created;
        }
        if (!(existing instanceof List<?>)) {
            throw new IllegalArgumentException("'" + INJECTED_PACKETS + "' of the context is not a list");
        }
        return (List<Object>) existing;
    }
}
