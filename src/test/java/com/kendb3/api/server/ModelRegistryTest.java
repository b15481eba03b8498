package com.kendb3.api.server;

import com.kendb3.KenDb3Models;
import com.kendb3.api.exception.ApiConfigurationException;
import com.kendb3.api.fields.ApiEngine;
import com.kendb3.store.InMemoryObjectStore;
import com.kendb3.store.Model;
import com.kendb3.submissions.model.MinecraftVersion;
import com.kendb3.submissions.model.SubmissionRevision;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for ModelRegistry.
 */
class ModelRegistryTest {

    static class Profile extends Model {
    }

    static class Standalone extends Model {
    }

    @Test
    void testRegisterAssemblesEngine() {
        ModelRegistry registry = new ModelRegistry();
        ApiEngine<Standalone> engine = ApiEngine.of(Standalone.class);

        ModelRegistration<Standalone> registration = registry.register(engine, new InMemoryObjectStore<>());

        assertThat(engine.isAssembled()).isTrue();
        assertThat(registration.apiName()).isEqualTo("standalone");
        assertThat(registry.find("standalone")).containsSame(registration);
        assertThat(registry.find(Standalone.class)).containsSame(registration);
    }

    @Test
    void testApplicationModelsRegisteredUnderApiNames() {
        ModelRegistry registry = KenDb3Models.createRegistry();

        assertThat(registry.registrations())
                .extracting(ModelRegistration::apiName)
                .containsExactly("minecraft_version", "submission", "submission_revision", "profile");
    }

    @Test
    void testDuplicateApiNameRejected() {
        ModelRegistry registry = KenDb3Models.createRegistry();

        assertThatThrownBy(() -> registry.register(ApiEngine.of(Profile.class), new InMemoryObjectStore<>()))
                .isInstanceOf(ApiConfigurationException.class)
                .hasMessageContaining("API name 'profile'");
    }

    @Test
    void testDuplicateModelRejected() {
        ModelRegistry registry = KenDb3Models.createRegistry();

        assertThatThrownBy(() -> registry.register(MinecraftVersion.API, new InMemoryObjectStore<>()))
                .isInstanceOf(ApiConfigurationException.class)
                .hasMessageContaining("already registered");
    }

    @Test
    void testLastModifiedRegistrations() {
        ModelRegistry registry = KenDb3Models.createRegistry();

        assertThat(registry.lastModifiedRegistrations())
                .<Class<?>>extracting(ModelRegistration::modelClass)
                .containsExactly(MinecraftVersion.class, SubmissionRevision.class);
    }

    @Test
    void testRequireUnknownModelFails() {
        assertThatThrownBy(() -> new ModelRegistry().require(Standalone.class))
                .isInstanceOf(ApiConfigurationException.class);
    }
}
