package com.kendb3.api.codegen;

import com.kendb3.api.exception.ApiConfigurationException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Registry of {@link Autogenerator}s.
 *
 * <p>Generators run sequentially in registration order, once. Running the
 * registry closes it: later registrations fail.
 */
public class Autogenerators {

    private static final Logger log = LoggerFactory.getLogger(Autogenerators.class);

    private List<Autogenerator> registry = new ArrayList<>();

    /**
     * @throws ApiConfigurationException if the registry has already run or was closed
     */
    public synchronized void register(Autogenerator generator) {
        if (registry == null) {
            throw new ApiConfigurationException("Autogenerator registration is no longer possible");
        }
        registry.add(generator);
    }

    /**
     * Closes the registry and runs every registered generator.
     *
     * @return number of generators run
     */
    public int run() {
        List<Autogenerator> generators;
        synchronized (this) {
            generators = registry == null ? List.of() : registry;
            registry = null;
        }
        for (Autogenerator generator : generators) {
            log.debug("Running autogenerator {}", generator);
            generator.generate();
        }
        return generators.size();
    }

    /**
     * Prevents future registrations without running anything.
     */
    public synchronized void cancelRegistrations() {
        registry = null;
    }

    public synchronized boolean isOpen() {
        return registry != null;
    }
}
