package com.github.dimitryivaniuta.eventreg.server.user;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.github.dimitryivaniuta.eventreg.common.error.ValidationException;
import java.util.Locale;

/**
 * Wire shape of a user. {@code password} is only read: on create it is required, on update a
 * missing password keeps the current one. Responses never carry it.
 *
 * @param status account status name; defaults to {@code ACTIVE} on create and is kept on update
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record UserDto(String id, String email, String password, String status) {

    static final int MIN_PASSWORD_LENGTH = 8;

    public static UserDto from(final User user) {
        return new UserDto(user.getId(), user.getEmail(), null, user.getStatus().name());
    }

    public boolean isNew() {
        return id == null || id.isEmpty();
    }

    /**
     * Checks this item and returns it with a normalized email.
     *
     * @throws ValidationException with a path relative to this item
     */
    public UserDto validated() {
        if (email == null || email.isBlank()) {
            throw ValidationException.empty("email");
        }
        if (!email.contains("@")) {
            throw ValidationException.invalidValue("email");
        }
        if (password == null) {
            if (isNew()) {
                throw ValidationException.empty("password");
            }
        } else if (password.length() < MIN_PASSWORD_LENGTH) {
            throw ValidationException.invalidValue("password");
        }
        if (status != null && !isStatus(status)) {
            throw ValidationException.invalidEnum("status");
        }
        return new UserDto(id, email.trim().toLowerCase(Locale.ROOT), password, status);
    }

    /** Status to store; {@code null} on update means unchanged. */
    UserStatus statusOrDefault() {
        if (status == null) {
            return isNew() ? UserStatus.ACTIVE : null;
        }
        return UserStatus.valueOf(status);
    }

    private static boolean isStatus(final String value) {
        for (UserStatus s : UserStatus.values()) {
            if (s.name().equals(value)) return true;
        }
        return false;
    }
}
