package com.github.dimitryivaniuta.eventreg.server.user;

import com.github.dimitryivaniuta.eventreg.server.config.BootstrapProperties;
import com.github.dimitryivaniuta.eventreg.server.permission.Permission;
import com.github.dimitryivaniuta.eventreg.server.permission.PermissionStore;
import com.github.dimitryivaniuta.eventreg.server.permission.Role;
import java.time.Duration;
import java.util.Locale;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Component;
import org.springframework.transaction.reactive.TransactionalOperator;
import reactor.core.publisher.Mono;

/**
 * Creates an ACTIVE user holding SERVER ADMIN when {@code registration.bootstrap.admin-email}
 * is set and no user exists yet. Does nothing once any user is stored.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class AdminBootstrapRunner implements ApplicationRunner {

    private static final Duration TIMEOUT = Duration.ofSeconds(30);

    private final BootstrapProperties properties;

    private final PasswordEncoder passwordEncoder;

    private final PermissionStore permissionStore;

    private final UserStore userStore;

    private final TransactionalOperator tx;

    @Override
    public void run(final ApplicationArguments args) {
        final String email = properties.getAdminEmail();
        if (email == null || email.isBlank()) {
            return;
        }
        final String password = properties.getAdminPassword();
        if (password == null || password.length() < UserDto.MIN_PASSWORD_LENGTH) {
            throw new IllegalStateException("registration.bootstrap.admin-password must have at least "
                    + UserDto.MIN_PASSWORD_LENGTH + " characters");
        }
        if (Boolean.TRUE.equals(userStore.any().block(TIMEOUT))) {
            log.info("Users present; admin bootstrap skipped");
            return;
        }
        createAdmin(email.trim().toLowerCase(Locale.ROOT), password).block(TIMEOUT);
    }

    Mono<User> createAdmin(final String email, final String password) {
        final User admin = User.builder()
                .id(UUID.randomUUID().toString())
                .email(email)
                .passwordHash(passwordEncoder.encode(password))
                .status(UserStatus.ACTIVE)
                .build();
        final Permission grant = new Permission(null, admin.getId(), Role.serverAdmin())
                .withId(UUID.randomUUID().toString());
        return tx.transactional(userStore.insert(admin)
                        .flatMap(user -> permissionStore.insert(grant).thenReturn(user)))
                .doOnSuccess(user -> log.info("Bootstrapped server admin id={}", user.getId()));
    }
}
