package com.github.dimitryivaniuta.eventreg.server.user;

import com.github.dimitryivaniuta.eventreg.common.error.ValidationException;
import com.github.dimitryivaniuta.eventreg.common.query.Query;
import com.github.dimitryivaniuta.eventreg.common.query.QueryParser;
import com.github.dimitryivaniuta.eventreg.common.query.QueryRequest;
import com.github.dimitryivaniuta.eventreg.common.r2dbc.ExistenceCheck;
import com.github.dimitryivaniuta.eventreg.server.permission.Access;
import com.github.dimitryivaniuta.eventreg.server.permission.Capability;
import com.github.dimitryivaniuta.eventreg.server.permission.PermissionService;
import com.github.dimitryivaniuta.eventreg.server.persistence.Tables;
import com.github.dimitryivaniuta.eventreg.server.token.Claims;
import com.github.dimitryivaniuta.eventreg.server.web.Batches;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;
import org.springframework.transaction.reactive.TransactionalOperator;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

/**
 * User accounts. Creating, updating and deleting users needs SERVER ADMIN; a server admin may
 * query every user, anyone else only sees themselves.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class UserService {

    private static final QueryParser<UserField> PARSER = new QueryParser<>(UserField.CATALOG);

    private final ExistenceCheck existenceCheck;

    private final PasswordEncoder passwordEncoder;

    private final PermissionService permissionService;

    private final UserStore userStore;

    private final TransactionalOperator tx;

    /**
     * Creates or updates users. Passwords are stored as BCrypt hashes.
     *
     * @return stored users in request order, new ones with their generated ids
     */
    public Flux<UserDto> upsert(final Claims claims, final List<UserDto> request) {
        return Mono.fromCallable(() -> validate(request))
                .flatMapMany(items -> {
                    final List<String> updated = items.stream()
                            .filter(u -> !u.isNew()).map(UserDto::id).toList();
                    return existenceCheck.requireExisting(Tables.USERS, updated)
                            .then(permissionService.require(claims, Capability.server(Access.ADMIN)))
                            .then(requireFreeEmails(items))
                            .thenMany(Flux.fromIterable(items).concatMap(this::toUser))
                            .collectList()
                            .flatMapMany(users -> tx.transactional(Flux.fromIterable(users)
                                    .concatMap(u -> u.getId() == null
                                            ? userStore.insert(u.toBuilder().id(UUID.randomUUID().toString()).build())
                                            : userStore.update(u))
                                    .concatMap(u -> userStore.findOne(Query.equalTo(UserField.ID, u.getId())))));
                })
                .map(UserDto::from)
                .doOnComplete(() -> log.info("Upserted {} user(s) by sub={}", request.size(), claims.subject()));
    }

    /** Users matching {@code request} that the caller may see. */
    public Flux<UserDto> query(final Claims claims, final QueryRequest request) {
        return Mono.fromCallable(() -> Optional.ofNullable(PARSER.parse(request)))
                .flatMapMany(parsed -> permissionService.isServerAdmin(claims).flatMapMany(admin -> {
                    final Query<UserField> query = parsed.orElse(null);
                    return admin
                            ? userStore.find(query)
                            : userStore.find(Query.restrict(query, Query.equalTo(UserField.ID, claims.subject())));
                }))
                .map(UserDto::from);
    }

    /**
     * Deletes users along with their permissions.
     *
     * @return number of deleted users
     */
    public Mono<Long> delete(final Claims claims, final List<String> ids) {
        return Mono.fromCallable(() -> List.copyOf(Batches.require(ids, "ids")))
                .flatMap(checked -> existenceCheck.requireExisting(Tables.USERS, checked)
                        .then(permissionService.require(claims, Capability.server(Access.ADMIN)))
                        .then(tx.transactional(userStore.delete(checked))))
                .doOnSuccess(n -> log.info("Deleted {} user(s) by sub={}", n, claims.subject()));
    }

    private Mono<User> toUser(final UserDto dto) {
        final Mono<Optional<String>> hash = dto.password() == null
                ? Mono.just(Optional.empty())
                // BCrypt is CPU-bound
                : Mono.fromCallable(() -> Optional.of(passwordEncoder.encode(dto.password())))
                        .subscribeOn(Schedulers.boundedElastic());
        return hash.map(h -> User.builder()
                .id(dto.isNew() ? null : dto.id())
                .email(dto.email())
                .passwordHash(h.orElse(null))
                .status(dto.statusOrDefault())
                .build());
    }

    /** Rejects emails already held by a user other than the item's own. */
    private Mono<Void> requireFreeEmails(final List<UserDto> items) {
        final Map<String, Integer> positions = new HashMap<>();
        for (int i = 0; i < items.size(); i++) {
            positions.put(items.get(i).email(), i);
        }
        return userStore.find(Query.in(UserField.EMAIL, new ArrayList<>(positions.keySet())))
                .concatMap(existing -> {
                    final int i = positions.get(existing.getEmail());
                    return existing.getId().equals(items.get(i).id())
                            ? Mono.<Void>empty()
                            : Mono.<Void>error(ValidationException.invalidValue("users[" + i + "].email"));
                })
                .then();
    }

    private static List<UserDto> validate(final List<UserDto> request) {
        final List<UserDto> items = Batches.require(request, "users");
        final List<UserDto> out = new ArrayList<>(items.size());
        final Map<String, Integer> seen = new HashMap<>();
        for (int i = 0; i < items.size(); i++) {
            final UserDto item;
            try {
                item = items.get(i).validated();
            } catch (ValidationException e) {
                throw e.withContext("users[" + i + "]");
            }
            if (seen.putIfAbsent(item.email(), i) != null) {
                throw ValidationException.invalidValue("users[" + i + "].email");
            }
            out.add(item);
        }
        return out;
    }
}
