package com.github.dimitryivaniuta.eventreg.server.organization;

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
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.reactive.TransactionalOperator;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Organization use cases. Creating and deleting organizations needs SERVER ADMIN; renaming
 * needs EDIT on the organization; queries only return organizations the caller may read.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class OrganizationService {

    private static final QueryParser<OrganizationField> PARSER = new QueryParser<>(OrganizationField.CATALOG);

    private final ExistenceCheck existenceCheck;

    private final OrganizationStore organizationStore;

    private final PermissionService permissionService;

    private final TransactionalOperator tx;

    /**
     * @return stored organizations in request order, new ones with their generated ids
     */
    public Flux<Organization> upsert(final Claims claims, final List<Organization> request) {
        return Mono.fromCallable(() -> validate(request))
                .flatMapMany(items -> {
                    final List<String> updated = items.stream()
                            .filter(o -> !o.isNew()).map(Organization::id).toList();
                    return existenceCheck.requireExisting(Tables.ORGANIZATIONS, updated)
                            .then(authorize(claims, items))
                            .thenMany(tx.transactional(Flux.fromIterable(items)
                                    .concatMap(o -> o.isNew()
                                            ? organizationStore.insert(o.withId(UUID.randomUUID().toString()))
                                            : organizationStore.update(o))));
                })
                .doOnComplete(() -> log.info("Upserted {} organization(s) by sub={}", request.size(), claims.subject()));
    }

    /** Organizations matching {@code request} that the caller may read. */
    public Flux<Organization> query(final Claims claims, final QueryRequest request) {
        return Mono.fromCallable(() -> Optional.ofNullable(PARSER.parse(request)))
                .flatMapMany(parsed -> organizationStore.findGranted(Query.restrict(parsed.orElse(null),
                        permissionService.readScope(claims, ResourceType.ORGANIZATION, OrganizationField.GRANTS))));
    }

    /**
     * Deletes organizations along with their events and permissions.
     *
     * @return number of deleted organizations
     */
    public Mono<Long> delete(final Claims claims, final List<String> ids) {
        return Mono.fromCallable(() -> List.copyOf(Batches.require(ids, "ids")))
                .flatMap(checked -> existenceCheck.requireExisting(Tables.ORGANIZATIONS, checked)
                        .then(permissionService.require(claims, Capability.server(Access.ADMIN)))
                        .then(tx.transactional(organizationStore.delete(checked))))
                .doOnSuccess(n -> log.info("Deleted {} organization(s) by sub={}", n, claims.subject()));
    }

    private Mono<Void> authorize(final Claims claims, final List<Organization> items) {
        return Flux.fromIterable(items)
                .map(o -> o.isNew()
                        ? Capability.server(Access.ADMIN)
                        : Capability.organization(Access.EDIT, o.id()))
                .distinct()
                .concatMap(capability -> permissionService.require(claims, capability))
                .then();
    }

    private static List<Organization> validate(final List<Organization> request) {
        final List<Organization> items = Batches.require(request, "organizations");
        for (int i = 0; i < items.size(); i++) {
            final Organization o = items.get(i);
            if (o.name() == null || o.name().isBlank()) {
                throw ValidationException.empty("organizations[" + i + "].name");
            }
        }
        return items;
    }
}
