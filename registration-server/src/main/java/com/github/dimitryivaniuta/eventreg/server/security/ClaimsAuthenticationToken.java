package com.github.dimitryivaniuta.eventreg.server.security;

import com.github.dimitryivaniuta.eventreg.server.token.Claims;
import java.util.List;
import org.springframework.security.authentication.AbstractAuthenticationToken;

/**
 * Before authentication: the raw token as credentials. After: the validated {@link Claims} as
 * principal, with the raw token dropped.
 */
public final class ClaimsAuthenticationToken extends AbstractAuthenticationToken {

    private final String token;
    private final Claims claims;

    private ClaimsAuthenticationToken(final String token, final Claims claims) {
        super(List.of());
        this.token = token;
        this.claims = claims;
        setAuthenticated(claims != null);
    }

    public static ClaimsAuthenticationToken unauthenticated(final String token) {
        return new ClaimsAuthenticationToken(token, null);
    }

    public static ClaimsAuthenticationToken authenticated(final Claims claims) {
        return new ClaimsAuthenticationToken(null, claims);
    }

    @Override
    public Object getCredentials() {
        return token;
    }

    @Override
    public Object getPrincipal() {
        return claims;
    }

    @Override
    public String getName() {
        return claims == null ? "" : claims.subject();
    }

    public Claims getClaims() {
        return claims;
    }
}
