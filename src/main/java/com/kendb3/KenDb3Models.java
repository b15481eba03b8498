package com.kendb3;

import com.kendb3.api.server.ModelRegistry;
import com.kendb3.profiles.model.Profile;
import com.kendb3.profiles.model.User;
import com.kendb3.store.InMemoryObjectStore;
import com.kendb3.store.ObjectStore;
import com.kendb3.submissions.model.MinecraftVersion;
import com.kendb3.submissions.model.Submission;
import com.kendb3.submissions.model.SubmissionRevision;

/**
 * Assembles the API models of the application.
 */
public final class KenDb3Models {

    private KenDb3Models() {
        // Utility class
    }

    /**
     * Registers every API model, backed by in-memory stores.
     */
    public static ModelRegistry createRegistry() {
        return createRegistry(new InMemoryObjectStore<>());
    }

    /**
     * Registers every API model, backed by in-memory stores; profiles load their
     * users from {@code users}.
     */
    public static ModelRegistry createRegistry(ObjectStore<User> users) {
        Profile.useUserStore(users);
        ModelRegistry registry = new ModelRegistry();
        registry.register(MinecraftVersion.API, new InMemoryObjectStore<MinecraftVersion>()
                .withAttribute("display_name", MinecraftVersion::getDisplayName)
                .withAttribute("family", MinecraftVersion::getFamily));
        registry.register(Submission.API, new InMemoryObjectStore<>());
        registry.register(SubmissionRevision.API, new InMemoryObjectStore<SubmissionRevision>()
                .withAttribute("revision_of_id", r -> r.getRevisionOf().getId()));
        registry.register(Profile.API, new InMemoryObjectStore<Profile>()
                .withAttribute("user_id", p -> p.getUser().getId()));
        return registry;
    }
}
