package com.github.dimitryivaniuta.eventreg.server.token;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Optional;
import lombok.Getter;

/** Intended use of a token, carried in the {@code aud} claim. */
@Getter
public enum Audience {
    ACCESS("Access"),
    REFRESH("Refresh");

    /** Value written to and expected in the {@code aud} claim. */
    @JsonValue
    private final String claimValue;

    Audience(final String claimValue) {
        this.claimValue = claimValue;
    }

    public static Optional<Audience> fromClaim(final String value) {
        for (Audience a : values()) {
            if (a.claimValue.equals(value)) {
                return Optional.of(a);
            }
        }
        return Optional.empty();
    }
}
