package com.kendb3.api.server;

import com.kendb3.api.exception.ApiConfigurationException;
import com.kendb3.api.fields.ApiEngine;
import com.kendb3.store.Model;
import com.kendb3.store.ObjectStore;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Process-wide table of API models, keyed by API name.
 *
 * <p>Registering a model assembles its engine. Lookups are thread-safe;
 * registrations are expected to happen during application startup.
 */
public class ModelRegistry {

    private static final Logger log = LoggerFactory.getLogger(ModelRegistry.class);

    private final Map<String, ModelRegistration<?>> byApiName = new ConcurrentHashMap<>();
    private final Map<Class<?>, ModelRegistration<?>> byModelClass = new ConcurrentHashMap<>();
    private final List<ModelRegistration<?>> registrations = new CopyOnWriteArrayList<>();

    /**
     * Assembles {@code engine} if needed and makes the model available under its API name.
     *
     * @throws ApiConfigurationException if the API name or model class is already registered
     */
    public synchronized <M extends Model> ModelRegistration<M> register(ApiEngine<M> engine, ObjectStore<M> store) {
        if (byModelClass.containsKey(engine.getModelClass())) {
            throw new ApiConfigurationException(
                    "Model " + engine.getModelClass().getName() + " is already registered");
        }
        if (!engine.isAssembled()) {
            engine.assemble();
        }

        ModelRegistration<M> registration = new ModelRegistration<>(engine, store);
        String apiName = registration.apiName();
        if (byApiName.containsKey(apiName)) {
            throw new ApiConfigurationException("API name '" + apiName + "' of "
                    + engine.getModelClass().getName() + " is already used by "
                    + byApiName.get(apiName).modelClass().getName());
        }

        byApiName.put(apiName, registration);
        byModelClass.put(engine.getModelClass(), registration);
        registrations.add(registration);
        log.debug("Registered model '{}'", apiName);
        return registration;
    }

    public Optional<ModelRegistration<?>> find(String apiName) {
        return Optional.ofNullable(byApiName.get(apiName));
    }

    @SuppressWarnings("unchecked")
    public <M extends Model> Optional<ModelRegistration<M>> find(Class<M> modelClass) {
        return Optional.ofNullable((ModelRegistration<M>) byModelClass.get(modelClass));
    }

    public <M extends Model> ModelRegistration<M> require(Class<M> modelClass) {
        return find(modelClass).orElseThrow(() -> new ApiConfigurationException(
                "Model " + modelClass.getName() + " is not registered"));
    }

    public boolean contains(Class<?> modelClass) {
        return byModelClass.containsKey(modelClass);
    }

    /**
     * All registrations in registration order.
     */
    public List<ModelRegistration<?>> registrations() {
        return List.copyOf(registrations);
    }

    /**
     * Registrations whose models carry a last modification timestamp.
     */
    public List<ModelRegistration<?>> lastModifiedRegistrations() {
        List<ModelRegistration<?>> tracked = new ArrayList<>();
        for (ModelRegistration<?> registration : registrations) {
            if (registration.tracksLastModified()) {
                tracked.add(registration);
            }
        }
        return tracked;
    }
}
