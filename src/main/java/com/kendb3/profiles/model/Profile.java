package com.kendb3.profiles.model;

import com.kendb3.api.fields.ApiEngine;
import com.kendb3.api.fields.ApiField;
import com.kendb3.api.fields.ApiProperty;
import com.kendb3.store.ForeignKey;
import com.kendb3.store.Model;
import com.kendb3.store.ObjectStore;

import lombok.Getter;

import java.util.regex.Pattern;

/**
 * Profile model.
 *
 * All code should reference profiles instead of users unless in an
 * authentication context.
 */
@Getter
public class Profile extends Model {

    public static final ApiEngine<Profile> API = ApiEngine.of(Profile.class, """
            Profile model.

            All other code should reference Profiles instead of Users unless in
            authentication/authorization context.
            """);

    static final int DISPLAY_NAME_MAX_LENGTH = 150;
    static final int DISPLAY_NAME_MIN_LENGTH = 3;

    /**
     * Groups of allowed non-whitespace characters separated by exactly one space.
     * Length limits are checked separately.
     */
    private static final Pattern DISPLAY_NAME_PATTERN =
            Pattern.compile("(?:[A-Za-z0-9\\-.@+_()\\[\\]{}&=#~]+ ?)*[A-Za-z0-9\\-.@+_()\\[\\]{}&=#~]");

    /**
     * Corresponding user.
     */
    @ApiField
    private final ForeignKey<User> user = ForeignKey.oneToOne(User.class);

    /**
     * Where users are loaded from when a profile only knows the user key.
     */
    private static volatile ObjectStore<User> users;

    public static final ApiProperty<Profile, String> DISPLAY_NAME = API.mark("basic", "*")
            .property(Profile::getDisplayName)
            .setter(Profile::setDisplayName);

    /**
     * Preferred name: the user's first name, or the username when it is blank.
     */
    public String getDisplayName() {
        User account = requireUser();
        String firstName = account.getFirstName();
        return firstName == null || firstName.isEmpty() ? account.getUsername() : firstName;
    }

    /**
     * Sets the preferred name; {@code null} falls back to the username.
     *
     * @throws IllegalArgumentException if the name is too long, too short or contains illegal characters
     */
    public void setDisplayName(String value) {
        User account = requireUser();
        if (value == null) {
            account.setFirstName("");
            return;
        }
        if (value.length() > DISPLAY_NAME_MAX_LENGTH) {
            throw new IllegalArgumentException("Display name is too long ("
                    + value.length() + " > " + DISPLAY_NAME_MAX_LENGTH + ")");
        }
        if (value.length() < DISPLAY_NAME_MIN_LENGTH) {
            throw new IllegalArgumentException("Display name is too short ("
                    + value.length() + " < " + DISPLAY_NAME_MIN_LENGTH + ")");
        }
        if (!DISPLAY_NAME_PATTERN.matcher(value).matches()) {
            throw new IllegalArgumentException("Display name contains illegal characters");
        }
        account.setFirstName(value);
    }

    /**
     * Binds the user store of the application. Users are loaded lazily, on the
     * first display name access of a profile.
     */
    public static void useUserStore(ObjectStore<User> store) {
        users = store;
    }

    private User requireUser() {
        if (user.getValue() != null) {
            return user.getValue();
        }
        Long userId = user.getId();
        if (userId == null) {
            throw new IllegalStateException("Profile " + getPk() + " has no user");
        }
        ObjectStore<User> store = users;
        if (store == null) {
            throw new IllegalStateException("No user store bound, cannot load user " + userId
                    + " of profile " + getPk());
        }
        return user.resolve(store).orElseThrow(() -> new IllegalStateException("User " + userId
                + " of profile " + getPk() + " does not exist"));
    }

    @Override
    public String toString() {
        User account = user.getValue();
        return account == null ? super.toString() : "@" + account.getUsername() + " (" + getDisplayName() + ")";
    }
}
