package com.github.dimitryivaniuta.eventreg.server.auth;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.github.dimitryivaniuta.eventreg.common.error.UnauthenticatedException;
import com.github.dimitryivaniuta.eventreg.server.token.TokenService;
import com.github.dimitryivaniuta.eventreg.server.user.User;
import com.github.dimitryivaniuta.eventreg.server.user.UserStatus;
import com.github.dimitryivaniuta.eventreg.server.user.UserStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.security.crypto.password.PasswordEncoder;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

class AuthServiceTest {

    private static final String UNMATCHED_HASH = "$2a$12$unmatched";

    private PasswordEncoder passwordEncoder;
    private TokenService tokenService;
    private UserStore userStore;
    private AuthService service;

    @BeforeEach
    void setUp() {
        passwordEncoder = mock(PasswordEncoder.class);
        tokenService = mock(TokenService.class);
        userStore = mock(UserStore.class);
        when(passwordEncoder.encode(anyString())).thenReturn(UNMATCHED_HASH);
        when(passwordEncoder.matches(anyString(), anyString())).thenReturn(false);

        service = new AuthService(passwordEncoder, tokenService, userStore);
    }

    @Test
    void unknownEmailStillComparesAPasswordHash() {
        when(userStore.findOne(any())).thenReturn(Mono.empty());

        StepVerifier.create(service.login("nobody@example.com", "secret"))
                .expectErrorSatisfies(e -> assertThat(e)
                        .isInstanceOf(UnauthenticatedException.class)
                        .hasMessage(AuthService.INVALID_CREDENTIALS))
                .verify();
        verify(passwordEncoder).matches("secret", UNMATCHED_HASH);
        verify(tokenService, never()).issue(any(), any());
    }

    @Test
    void unknownEmailIsRejectedEvenIfThePlaceholderHashMatched() {
        when(userStore.findOne(any())).thenReturn(Mono.empty());
        when(passwordEncoder.matches("secret", UNMATCHED_HASH)).thenReturn(true);

        StepVerifier.create(service.login("nobody@example.com", "secret"))
                .expectError(UnauthenticatedException.class)
                .verify();
        verify(tokenService, never()).issue(any(), any());
    }

    @Test
    void wrongPasswordComparesTheStoredHash() {
        User alice = User.builder().id("u-1").email("alice@example.com").passwordHash("$2a$12$alice")
                .status(UserStatus.ACTIVE).build();
        when(userStore.findOne(any())).thenReturn(Mono.just(alice));

        StepVerifier.create(service.login("alice@example.com", "wrong"))
                .expectErrorMessage(AuthService.INVALID_CREDENTIALS)
                .verify();
        verify(passwordEncoder).matches("wrong", "$2a$12$alice");
    }
}
