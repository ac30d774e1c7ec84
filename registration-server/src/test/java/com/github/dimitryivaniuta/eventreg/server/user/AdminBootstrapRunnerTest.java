package com.github.dimitryivaniuta.eventreg.server.user;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.github.dimitryivaniuta.eventreg.server.config.BootstrapProperties;
import com.github.dimitryivaniuta.eventreg.server.permission.Permission;
import com.github.dimitryivaniuta.eventreg.server.permission.PermissionStore;
import com.github.dimitryivaniuta.eventreg.server.permission.RoleType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.boot.DefaultApplicationArguments;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.transaction.reactive.TransactionalOperator;
import reactor.core.publisher.Mono;

class AdminBootstrapRunnerTest {

    private BootstrapProperties properties;
    private PermissionStore permissionStore;
    private UserStore userStore;
    private AdminBootstrapRunner runner;

    @BeforeEach
    @SuppressWarnings("unchecked")
    void setUp() {
        properties = new BootstrapProperties();
        permissionStore = mock(PermissionStore.class);
        userStore = mock(UserStore.class);
        PasswordEncoder passwordEncoder = mock(PasswordEncoder.class);
        TransactionalOperator tx = mock(TransactionalOperator.class);

        when(passwordEncoder.encode("first-admin-pass")).thenReturn("$2a$hash");
        when(userStore.insert(any())).thenAnswer(inv -> Mono.just(inv.getArgument(0)));
        when(permissionStore.insert(any())).thenAnswer(inv -> Mono.just(inv.getArgument(0)));
        when(tx.transactional(any(Mono.class))).thenAnswer(inv -> inv.getArgument(0));

        runner = new AdminBootstrapRunner(properties, passwordEncoder, permissionStore, userStore, tx);
    }

    @Test
    void createsServerAdminWhenNoUserExists() {
        properties.setAdminEmail(" Root@Example.com ");
        properties.setAdminPassword("first-admin-pass");
        when(userStore.any()).thenReturn(Mono.just(false));

        runner.run(new DefaultApplicationArguments());

        ArgumentCaptor<User> user = ArgumentCaptor.forClass(User.class);
        ArgumentCaptor<Permission> grant = ArgumentCaptor.forClass(Permission.class);
        verify(userStore).insert(user.capture());
        verify(permissionStore).insert(grant.capture());
        assertThat(user.getValue().getEmail()).isEqualTo("root@example.com");
        assertThat(user.getValue().getPasswordHash()).isEqualTo("$2a$hash");
        assertThat(user.getValue().getStatus()).isEqualTo(UserStatus.ACTIVE);
        assertThat(grant.getValue().userId()).isEqualTo(user.getValue().getId());
        assertThat(grant.getValue().role().type()).isEqualTo(RoleType.SERVER_ADMIN);
        assertThat(grant.getValue().isNew()).isFalse();
    }

    @Test
    void leavesExistingUsersAlone() {
        properties.setAdminEmail("root@example.com");
        properties.setAdminPassword("first-admin-pass");
        when(userStore.any()).thenReturn(Mono.just(true));

        runner.run(new DefaultApplicationArguments());

        verify(userStore, never()).insert(any());
        verifyNoInteractions(permissionStore);
    }

    @Test
    void doesNothingWithoutAdminEmail() {
        runner.run(new DefaultApplicationArguments());

        verifyNoInteractions(userStore, permissionStore);
    }

    @Test
    void rejectsShortAdminPassword() {
        properties.setAdminEmail("root@example.com");
        properties.setAdminPassword("short");

        assertThatThrownBy(() -> runner.run(new DefaultApplicationArguments()))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("admin-password");
        verifyNoInteractions(userStore);
    }
}
