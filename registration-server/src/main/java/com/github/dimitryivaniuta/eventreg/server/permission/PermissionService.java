package com.github.dimitryivaniuta.eventreg.server.permission;

import com.github.dimitryivaniuta.eventreg.common.error.ForbiddenException;
import com.github.dimitryivaniuta.eventreg.common.error.NotFoundException;
import com.github.dimitryivaniuta.eventreg.common.error.ValidationException;
import com.github.dimitryivaniuta.eventreg.common.query.Field;
import com.github.dimitryivaniuta.eventreg.common.query.Query;
import com.github.dimitryivaniuta.eventreg.common.query.QueryParser;
import com.github.dimitryivaniuta.eventreg.common.query.QueryRequest;
import com.github.dimitryivaniuta.eventreg.common.r2dbc.ExistenceCheck;
import com.github.dimitryivaniuta.eventreg.server.event.EventStore;
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
 * Authorization checks and permission management.
 *
 * <p>Checks are queries over the permissions table built by {@link PermissionRules}; a check
 * passes when at least one permission row satisfies the predicate.</p>
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PermissionService {

    private static final QueryParser<PermissionField> PARSER = new QueryParser<>(PermissionField.CATALOG);

    private final EventStore eventStore;

    private final ExistenceCheck existenceCheck;

    private final PermissionStore permissionStore;

    private final TransactionalOperator tx;

    /**
     * Completes when the caller holds {@code capability}.
     *
     * @return empty on success, {@link ForbiddenException} otherwise
     */
    public Mono<Void> require(final Claims claims, final Capability capability) {
        return permissionStore.exists(PermissionRules.authorize(claims.subject(), capability, PermissionField.GRANTS))
                .flatMap(granted -> {
                    if (granted) {
                        return Mono.<Void>empty();
                    }
                    log.debug("Denied sub={} capability={}", claims.subject(), capability);
                    return Mono.error(new ForbiddenException());
                });
    }

    public Mono<Boolean> isServerAdmin(final Claims claims) {
        return permissionStore.exists(PermissionRules.authorize(claims.subject(),
                Capability.server(Access.ADMIN), PermissionField.GRANTS));
    }

    /**
     * Row-scoped READ predicate for an entity query that joins permissions.
     */
    public <F extends Field> Query<F> readScope(final Claims claims, final ResourceType type,
                                                final GrantColumns<F> columns) {
        return PermissionRules.authorize(claims.subject(), Capability.rowScoped(type, Access.READ), columns);
    }

    /**
     * Creates or updates permissions. Items without an id are created; the caller needs ADMIN on
     * the resource of every granted role and, for updates, of the role being replaced.
     *
     * @return stored permissions in request order
     */
    public Flux<Permission> upsert(final Claims claims, final List<PermissionDto> request) {
        return Mono.fromCallable(() -> toPermissions(request))
                .flatMapMany(items -> checkReferences(items)
                        .then(existingOf(items))
                        .flatMapMany(existing -> {
                            final List<Role> touched = new ArrayList<>();
                            items.forEach(p -> touched.add(p.role()));
                            existing.values().forEach(p -> touched.add(p.role()));
                            return requireAdminOn(claims, touched)
                                    .thenMany(write(items));
                        }))
                .doOnComplete(() -> log.info("Upserted {} permission(s) by sub={}", request.size(), claims.subject()));
    }

    /**
     * Permissions matching {@code request}. Server admins see every permission; other callers
     * see only their own.
     */
    public Flux<Permission> query(final Claims claims, final QueryRequest request) {
        return Mono.fromCallable(() -> Optional.ofNullable(PARSER.parse(request)))
                .flatMapMany(parsed -> isServerAdmin(claims).flatMapMany(admin -> {
                    final Query<PermissionField> query = parsed.orElse(null);
                    return admin
                            ? permissionStore.find(query)
                            : permissionStore.find(Query.restrict(query,
                                    Query.equalTo(PermissionField.USER_ID, claims.subject())));
                }));
    }

    /**
     * Deletes permissions; the caller needs ADMIN on the resource of each.
     *
     * @return number of deleted rows
     */
    public Mono<Long> delete(final Claims claims, final List<String> ids) {
        return Mono.fromCallable(() -> List.copyOf(Batches.require(ids, "ids")))
                .flatMap(checked -> existenceCheck.requireExisting(Tables.PERMISSIONS, checked)
                        .thenMany(permissionStore.findByIds(checked))
                        .map(Permission::role)
                        .collectList()
                        .flatMap(roles -> requireAdminOn(claims, roles))
                        .then(tx.transactional(permissionStore.delete(checked))))
                .doOnSuccess(n -> log.info("Deleted {} permission(s) by sub={}", n, claims.subject()));
    }

    /** ADMIN on the resource a role is bound to. */
    Mono<Capability> adminCapabilityFor(final Role role) {
        return switch (role.type().getResourceType()) {
            case SERVER -> Mono.just(Capability.server(Access.ADMIN));
            case ORGANIZATION -> Mono.just(Capability.organization(Access.ADMIN, role.organizationId()));
            case EVENT -> eventStore.organizationIds(List.of(role.eventId()))
                    .flatMap(owners -> {
                        final String org = owners.get(role.eventId());
                        return org == null
                                ? Mono.error(new NotFoundException(role.eventId()))
                                : Mono.just(Capability.event(Access.ADMIN, org, role.eventId()));
                    });
        };
    }

    private Mono<Void> requireAdminOn(final Claims claims, final List<Role> roles) {
        return Flux.fromIterable(roles)
                .distinct()
                .concatMap(this::adminCapabilityFor)
                .distinct()
                .concatMap(capability -> require(claims, capability))
                .then();
    }

    private static List<Permission> toPermissions(final List<PermissionDto> request) {
        final List<PermissionDto> items = Batches.require(request, "permissions");
        final List<Permission> out = new ArrayList<>(items.size());
        for (int i = 0; i < items.size(); i++) {
            try {
                out.add(items.get(i).toPermission());
            } catch (ValidationException e) {
                throw e.withContext("permissions[" + i + "]");
            }
        }
        return out;
    }

    private Mono<Void> checkReferences(final List<Permission> items) {
        final List<String> users = new ArrayList<>();
        final List<String> organizations = new ArrayList<>();
        final List<String> events = new ArrayList<>();
        final List<String> updated = new ArrayList<>();
        for (Permission p : items) {
            users.add(p.userId());
            if (p.role().organizationId() != null) organizations.add(p.role().organizationId());
            if (p.role().eventId() != null) events.add(p.role().eventId());
            if (!p.isNew()) updated.add(p.id());
        }
        return existenceCheck.requireExisting(Tables.PERMISSIONS, updated)
                .then(existenceCheck.requireExisting(Tables.USERS, users))
                .then(existenceCheck.requireExisting(Tables.ORGANIZATIONS, organizations))
                .then(existenceCheck.requireExisting(Tables.EVENTS, events));
    }

    private Mono<Map<String, Permission>> existingOf(final List<Permission> items) {
        final List<String> ids = items.stream().filter(p -> !p.isNew()).map(Permission::id).toList();
        if (ids.isEmpty()) {
            return Mono.just(Map.of());
        }
        return permissionStore.findByIds(ids).collectMap(Permission::id);
    }

    private Flux<Permission> write(final List<Permission> items) {
        final Flux<Permission> writes = Flux.fromIterable(items)
                .concatMap(p -> p.isNew()
                        ? permissionStore.insert(p.withId(UUID.randomUUID().toString()))
                        : permissionStore.update(p));
        return tx.transactional(writes);
    }
}
