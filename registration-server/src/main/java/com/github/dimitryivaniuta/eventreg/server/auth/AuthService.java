package com.github.dimitryivaniuta.eventreg.server.auth;

import com.github.dimitryivaniuta.eventreg.common.error.UnauthenticatedException;
import com.github.dimitryivaniuta.eventreg.common.query.Query;
import com.github.dimitryivaniuta.eventreg.server.token.Audience;
import com.github.dimitryivaniuta.eventreg.server.token.IssuedToken;
import com.github.dimitryivaniuta.eventreg.server.token.TokenService;
import com.github.dimitryivaniuta.eventreg.server.user.User;
import com.github.dimitryivaniuta.eventreg.server.user.UserField;
import com.github.dimitryivaniuta.eventreg.server.user.UserStatus;
import com.github.dimitryivaniuta.eventreg.server.user.UserStore;
import java.util.Locale;
import java.util.Optional;
import java.util.UUID;
import lombok.extern.slf4j.Slf4j;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

/**
 * Verifies email/password credentials and issues access tokens.
 *
 * <p>An unknown email, an inactive account and a wrong password fail identically, and all three
 * pay for one password hash comparison.</p>
 */
@Slf4j
@Service
public class AuthService {

    static final String INVALID_CREDENTIALS = "invalid email or password";

    private final PasswordEncoder passwordEncoder;

    private final TokenService tokenService;

    private final UserStore userStore;

    /** Hash of a random secret, compared against when no account matches. */
    private final String unmatchedHash;

    public AuthService(final PasswordEncoder passwordEncoder, final TokenService tokenService,
                       final UserStore userStore) {
        this.passwordEncoder = passwordEncoder;
        this.tokenService = tokenService;
        this.userStore = userStore;
        this.unmatchedHash = passwordEncoder.encode(UUID.randomUUID().toString());
    }

    public Mono<IssuedToken> login(final String email, final String password) {
        final String principal = email.trim().toLowerCase(Locale.ROOT);
        final Query<UserField> active = Query.and(
                Query.equalTo(UserField.EMAIL, principal),
                Query.equalTo(UserField.STATUS, UserStatus.ACTIVE.name()));

        return userStore.findOne(active)
                .map(Optional::of)
                .defaultIfEmpty(Optional.empty())
                .flatMap(user -> verify(user, password))
                .flatMap(user -> tokenService.issue(user.getId(), Audience.ACCESS))
                .doOnSuccess(token -> log.info("User authenticated sub={}", token.claims().subject()))
                .doOnError(UnauthenticatedException.class, e -> log.info("Login rejected"));
    }

    private Mono<User> verify(final Optional<User> user, final String password) {
        final String hash = user.map(User::getPasswordHash).orElse(unmatchedHash);
        // BCrypt is CPU-bound
        return Mono.fromCallable(() -> passwordEncoder.matches(password, hash))
                .subscribeOn(Schedulers.boundedElastic())
                .flatMap(matches -> matches && user.isPresent()
                        ? Mono.just(user.get())
                        : Mono.<User>error(new UnauthenticatedException(INVALID_CREDENTIALS)));
    }
}
