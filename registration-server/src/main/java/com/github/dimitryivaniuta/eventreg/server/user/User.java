package com.github.dimitryivaniuta.eventreg.server.user;

import lombok.Builder;
import lombok.Value;

/** A principal that can log in. */
@Value
@Builder(toBuilder = true)
public class User {

    String id;

    String email;

    /** BCrypt hash; never leaves the server. */
    String passwordHash;

    UserStatus status;
}
