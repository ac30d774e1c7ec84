package com.github.dimitryivaniuta.eventreg.server.event;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyCollection;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.github.dimitryivaniuta.eventreg.common.error.NotFoundException;
import com.github.dimitryivaniuta.eventreg.common.r2dbc.ExistenceCheck;
import com.github.dimitryivaniuta.eventreg.server.permission.Capability;
import com.github.dimitryivaniuta.eventreg.server.permission.PermissionService;
import com.github.dimitryivaniuta.eventreg.server.token.Audience;
import com.github.dimitryivaniuta.eventreg.server.token.Claims;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.transaction.reactive.TransactionalOperator;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

/** Events removed between the existence check and the owner lookup. */
class EventServiceTest {

    private static final Claims CLAIMS = new Claims("https://auth.example.com", "u-1", Audience.ACCESS,
            Instant.parse("2026-01-01T00:00:00Z"), Instant.parse("2026-01-02T00:00:00Z"));

    private EventStore eventStore;
    private PermissionService permissionService;
    private EventService service;

    @BeforeEach
    @SuppressWarnings("unchecked")
    void setUp() {
        eventStore = mock(EventStore.class);
        permissionService = mock(PermissionService.class);
        ExistenceCheck existenceCheck = mock(ExistenceCheck.class);
        TransactionalOperator tx = mock(TransactionalOperator.class);

        when(existenceCheck.requireExisting(any(), anyCollection())).thenReturn(Mono.empty());
        when(eventStore.organizationIds(anyCollection())).thenReturn(Mono.just(Map.of()));
        when(eventStore.delete(anyCollection())).thenReturn(Mono.just(1L));
        when(tx.transactional(any(Mono.class))).thenAnswer(inv -> inv.getArgument(0));
        when(tx.transactional(any(Flux.class))).thenAnswer(inv -> inv.getArgument(0));
        when(permissionService.require(any(), any())).thenReturn(Mono.empty());

        service = new EventService(eventStore, existenceCheck, permissionService, tx);
    }

    @Test
    void deleteReportsEventWithoutOwner() {
        StepVerifier.create(service.delete(CLAIMS, List.of("ev-gone")))
                .expectErrorSatisfies(e -> assertThat(e)
                        .isInstanceOf(NotFoundException.class)
                        .extracting(ex -> ((NotFoundException) ex).getId())
                        .isEqualTo("ev-gone"))
                .verify();
        verify(permissionService, never()).require(any(), any(Capability.class));
    }

    @Test
    void updateReportsEventWithoutOwner() {
        StepVerifier.create(service.upsert(CLAIMS, List.of(new Event("ev-gone", "org-1", "Renamed"))))
                .expectError(NotFoundException.class)
                .verify();
        verify(eventStore, never()).update(any());
    }
}
