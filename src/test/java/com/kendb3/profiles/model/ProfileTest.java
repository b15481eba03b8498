package com.kendb3.profiles.model;

import com.kendb3.KenDb3Models;
import com.kendb3.api.exception.ApiDataException;
import com.kendb3.store.InMemoryObjectStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.Map;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for Profile and its display name property.
 */
class ProfileTest {

    private Profile profile;
    private User user;
    private InMemoryObjectStore<User> users;

    @BeforeEach
    void setUp() {
        users = new InMemoryObjectStore<>();
        KenDb3Models.createRegistry(users);
        user = new User();
        user.setPk(5L);
        user.setUsername("steve");
        users.save(user);
        profile = new Profile();
        profile.setPk(2L);
        profile.getUser().set(user);
    }

    @Test
    void testDisplayNameFallsBackToUsername() {
        assertThat(profile.getDisplayName()).isEqualTo("steve");

        user.setFirstName("Steve Builder");
        assertThat(profile.getDisplayName()).isEqualTo("Steve Builder");
        assertThat(profile).hasToString("@steve (Steve Builder)");
    }

    @Test
    void testApiGroups() {
        assertThat(Profile.API.getGroupNames()).containsExactly("*", "basic");
        assertThat(Profile.API.serialize(profile)).containsExactly(
                entry("user_id", 5L), entry("display_name", "steve"), entry("id", 2L));
        assertThat(Profile.API.serialize(profile, "basic")).containsExactly(
                entry("display_name", "steve"), entry("id", 2L));
    }

    @Test
    void testDisplayNameThroughApi() {
        Profile.API.getFields("basic").get(0).set(profile, "Alex_99");

        assertThat(user.getFirstName()).isEqualTo("Alex_99");
    }

    @Test
    void testNullDisplayNameResets() {
        user.setFirstName("Someone");

        Profile.DISPLAY_NAME.set(profile, null);

        assertThat(profile.getDisplayName()).isEqualTo("steve");
    }

    @ParameterizedTest
    @ValueSource(strings = {"ab", "two  spaces", " leading", "trailing ", "emoji☺", "semi;colon"})
    void testInvalidDisplayNamesRejected(String value) {
        assertThatThrownBy(() -> profile.setDisplayName(value))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void testTooLongDisplayName() {
        assertThatThrownBy(() -> profile.setDisplayName("x".repeat(151)))
                .hasMessage("Display name is too long (151 > 150)");
        assertThatThrownBy(() -> profile.setDisplayName("x"))
                .hasMessage("Display name is too short (1 < 3)");
    }

    @Test
    void testInvalidDisplayNameInPayloadIsDataError() {
        assertThatThrownBy(() -> Profile.API.getFields("basic").get(0).set(profile, "#"))
                .isInstanceOf(ApiDataException.class)
                .hasMessageContaining("display_name");
    }

    @Test
    void testDeserializeKeepsUserKey() {
        Profile fresh = Profile.API.deserialize(Map.of("user_id", 5, "display_name", "Steve_B"), "*");

        assertThat(fresh.getUser().getId()).isEqualTo(5L);
        assertThat(fresh.getUser().isOneToOne()).isTrue();
        assertThat(fresh.getDisplayName()).isEqualTo("Steve_B");
    }

    @Test
    void testUserLoadedFromKey() {
        Profile stored = new Profile();
        stored.setPk(3L);
        stored.getUser().setId(5L);

        assertThat(stored.getDisplayName()).isEqualTo("steve");
        assertThat(stored.getUser().getValue()).isSameAs(user);
    }

    @Test
    void testSerializeRoundTrip() {
        user.setFirstName("alice");
        Map<String, Object> payload = Profile.API.serialize(profile, "*");

        Profile copy = Profile.API.deserialize(payload, "*");

        assertThat(Profile.API.serialize(copy, "*")).isEqualTo(payload);
    }

    @Test
    void testMissingUserIsDataError() {
        Profile orphan = new Profile();
        orphan.setPk(4L);
        orphan.getUser().setId(99L);

        assertThatThrownBy(() -> Profile.API.serialize(orphan))
                .isInstanceOf(ApiDataException.class)
                .hasMessageContaining("display_name")
                .hasMessageContaining("User 99");
    }
}
