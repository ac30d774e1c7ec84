package com.github.dimitryivaniuta.eventreg.server.event;

import com.github.dimitryivaniuta.eventreg.common.error.NotFoundException;
import com.github.dimitryivaniuta.eventreg.common.error.ValidationException;
import com.github.dimitryivaniuta.eventreg.common.query.Query;
import com.github.dimitryivaniuta.eventreg.common.query.QueryParser;
import com.github.dimitryivaniuta.eventreg.common.query.QueryRequest;
import com.github.dimitryivaniuta.eventreg.common.r2dbc.ExistenceCheck;
import com.github.dimitryivaniuta.eventreg.server.permission.Access;
import com.github.dimitryivaniuta.eventreg.server.permission.Capability;
import com.github.dimitryivaniuta.eventreg.server.permission.PermissionService;
import com.github.dimitryivaniuta.eventreg.server.permission.ResourceType;
import com.github.dimitryivaniuta.eventreg.server.persistence.Tables;
import com.github.dimitryivaniuta.eventreg.server.token.Claims;
import com.github.dimitryivaniuta.eventreg.server.web.Batches;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.reactive.TransactionalOperator;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Event use cases.
 *
 * <p>Creating an event needs ADMIN on its organization. Updating needs EDIT on the event, plus
 * ADMIN on the target organization when the event moves. Deleting needs ADMIN on the event.</p>
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class EventService {

    private static final QueryParser<EventField> PARSER = new QueryParser<>(EventField.CATALOG);

    private final EventStore eventStore;

    private final ExistenceCheck existenceCheck;

    private final PermissionService permissionService;

    private final TransactionalOperator tx;

    /**
     * @return stored events in request order, new ones with their generated ids
     */
    public Flux<Event> upsert(final Claims claims, final List<Event> request) {
        return Mono.fromCallable(() -> validate(request))
                .flatMapMany(items -> {
                    final List<String> updated = items.stream().filter(e -> !e.isNew()).map(Event::id).toList();
                    final List<String> organizations = items.stream().map(Event::organizationId).toList();
                    return existenceCheck.requireExisting(Tables.ORGANIZATIONS, organizations)
                            .then(existenceCheck.requireExisting(Tables.EVENTS, updated))
                            .then(updated.isEmpty() ? Mono.just(Map.<String, String>of())
                                    : eventStore.organizationIds(updated))
                            .flatMap(owners -> Mono.fromCallable(() -> capabilities(items, owners)))
                            .flatMap(needed -> authorize(claims, needed))
                            .thenMany(tx.transactional(Flux.fromIterable(items)
                                    .concatMap(e -> e.isNew()
                                            ? eventStore.insert(e.withId(UUID.randomUUID().toString()))
                                            : eventStore.update(e))));
                })
                .doOnComplete(() -> log.info("Upserted {} event(s) by sub={}", request.size(), claims.subject()));
    }

    /** Events matching {@code request} that the caller may read. */
    public Flux<Event> query(final Claims claims, final QueryRequest request) {
        return Mono.fromCallable(() -> Optional.ofNullable(PARSER.parse(request)))
                .flatMapMany(parsed -> eventStore.findGranted(Query.restrict(parsed.orElse(null),
                        permissionService.readScope(claims, ResourceType.EVENT, EventField.GRANTS))));
    }

    /**
     * Deletes events along with the permissions bound to them.
     *
     * @return number of deleted events
     */
    public Mono<Long> delete(final Claims claims, final List<String> ids) {
        return Mono.fromCallable(() -> List.copyOf(Batches.require(ids, "ids")))
                .flatMap(checked -> existenceCheck.requireExisting(Tables.EVENTS, checked)
                        .then(eventStore.organizationIds(checked))
                        .flatMapMany(owners -> Flux.fromIterable(checked)
                                .distinct()
                                .concatMap(id -> Mono.fromCallable(() -> ownerOf(owners, id))
                                        .flatMap(organization -> permissionService.require(claims,
                                                Capability.event(Access.ADMIN, organization, id)))))
                        .then(tx.transactional(eventStore.delete(checked))))
                .doOnSuccess(n -> log.info("Deleted {} event(s) by sub={}", n, claims.subject()));
    }

    private Mono<Void> authorize(final Claims claims, final List<Capability> needed) {
        return Flux.fromIterable(needed)
                .distinct()
                .concatMap(capability -> permissionService.require(claims, capability))
                .then();
    }

    private static List<Capability> capabilities(final List<Event> items, final Map<String, String> owners) {
        final List<Capability> needed = new ArrayList<>();
        for (Event e : items) {
            if (e.isNew()) {
                needed.add(Capability.organization(Access.ADMIN, e.organizationId()));
                continue;
            }
            final String currentOrganization = ownerOf(owners, e.id());
            needed.add(Capability.event(Access.EDIT, currentOrganization, e.id()));
            if (!currentOrganization.equals(e.organizationId())) {
                needed.add(Capability.organization(Access.ADMIN, e.organizationId()));
            }
        }
        return needed;
    }

    /** Owner looked up after the existence check; a concurrent delete leaves it missing. */
    private static String ownerOf(final Map<String, String> owners, final String eventId) {
        final String organization = owners.get(eventId);
        if (organization == null) {
            throw new NotFoundException(eventId);
        }
        return organization;
    }

    private static List<Event> validate(final List<Event> request) {
        final List<Event> items = Batches.require(request, "events");
        for (int i = 0; i < items.size(); i++) {
            final Event e = items.get(i);
            if (e.organizationId() == null || e.organizationId().isBlank()) {
                throw ValidationException.empty("events[" + i + "].organizationId");
            }
            if (e.name() == null || e.name().isBlank()) {
                throw ValidationException.empty("events[" + i + "].name");
            }
        }
        return items;
    }
}
