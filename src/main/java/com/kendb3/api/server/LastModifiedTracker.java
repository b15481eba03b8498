package com.kendb3.api.server;

import com.kendb3.store.LastModified;
import com.kendb3.store.Model;

import java.time.Instant;

/**
 * Computes the last modification timestamp across all tracked API models.
 *
 * <p>A model is tracked when its class implements {@link LastModified}.
 */
public class LastModifiedTracker {

    private final ModelRegistry registry;

    public LastModifiedTracker(ModelRegistry registry) {
        this.registry = registry;
    }

    /**
     * Returns the latest {@code lastModified} of any tracked instance, or
     * {@code null} if no model is tracked or every tracked store is empty.
     */
    public Instant lastModificationTimestamp() {
        Instant latest = null;
        for (ModelRegistration<?> registration : registry.lastModifiedRegistrations()) {
            for (Model instance : registration.store().all()) {
                Instant candidate = ((LastModified) instance).getLastModified();
                if (candidate != null && (latest == null || candidate.isAfter(latest))) {
                    latest = candidate;
                }
            }
        }
        return latest;
    }
}
