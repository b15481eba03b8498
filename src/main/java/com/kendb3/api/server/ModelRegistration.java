package com.kendb3.api.server;

import com.kendb3.api.fields.ApiEngine;
import com.kendb3.store.LastModified;
import com.kendb3.store.Model;
import com.kendb3.store.ObjectStore;

/**
 * An assembled API model together with the store serving its instances.
 */
public record ModelRegistration<M extends Model>(ApiEngine<M> engine, ObjectStore<M> store) {

    public Class<M> modelClass() {
        return engine.getModelClass();
    }

    public String apiName() {
        return engine.getApiName();
    }

    public boolean tracksLastModified() {
        return LastModified.class.isAssignableFrom(engine.getModelClass());
    }
}
