package com.github.dimitryivaniuta.eventreg.common.r2dbc;

import static org.assertj.core.api.Assertions.assertThat;

import com.github.dimitryivaniuta.eventreg.common.error.NotFoundException;
import com.github.dimitryivaniuta.eventreg.common.error.StoreException;
import com.github.dimitryivaniuta.eventreg.common.query.ItemField;
import com.github.dimitryivaniuta.eventreg.common.query.Query;
import io.r2dbc.h2.H2ConnectionFactory;
import java.util.List;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.r2dbc.core.DatabaseClient;
import reactor.test.StepVerifier;

class R2dbcQueryExecutorTest {

    private static final String SELECT_NAMES = "SELECT i.name FROM items i";

    private DatabaseClient db;
    private R2dbcQueryExecutor executor;

    @BeforeEach
    void setUp() {
        db = DatabaseClient.create(H2ConnectionFactory.inMemory("items-" + UUID.randomUUID()));
        executor = new R2dbcQueryExecutor(db);

        db.sql("CREATE TABLE items (id VARCHAR(36) PRIMARY KEY, name VARCHAR(64) NOT NULL, "
                        + "owner VARCHAR(64) NOT NULL, quantity BIGINT NOT NULL, secret VARCHAR(64))")
                .then()
                .then(db.sql("INSERT INTO items (id, name, owner, quantity) VALUES "
                        + "('a', 'apple', 'ann', 1), ('c', 'cherry', 'bob', 2), ('d', 'date', 'ann', 3)").then())
                .block();
    }

    @Test
    void placeholdersBecomeNamedMarkersInOrder() {
        assertThat(R2dbcQueryExecutor.toNamedParameters("(a = ? AND b IN (?, ?))"))
                .isEqualTo("(a = :p0 AND b IN (:p1, :p2))");
    }

    @Test
    void selectsRowsMatchingCompoundFilter() {
        Query<ItemField> q = Query.and(
                Query.equalTo(ItemField.OWNER, "ann"),
                Query.notEqualTo(ItemField.NAME, "apple"));

        StepVerifier.create(executor.select(SELECT_NAMES, q, (row, meta) -> row.get("name", String.class)))
                .expectNext("date")
                .verifyComplete();
    }

    @Test
    void authorizationRestrictionNeverWidensResult() {
        Query<ItemField> caller = Query.or(
                Query.equalTo(ItemField.NAME, "apple"),
                Query.equalTo(ItemField.NAME, "cherry"));
        Query<ItemField> restriction = Query.equalTo(ItemField.OWNER, "bob");

        StepVerifier.create(executor.select(SELECT_NAMES, Query.restrict(caller, restriction), " ORDER BY i.name",
                        (row, meta) -> row.get("name", String.class)))
                .expectNext("cherry")
                .verifyComplete();
    }

    @Test
    void nullFilterSelectsEverything() {
        StepVerifier.create(executor.select(SELECT_NAMES, null, (row, meta) -> row.get("name", String.class)).count())
                .expectNext(3L)
                .verifyComplete();
    }

    @Test
    void executeDeletesMatchingRows() {
        StepVerifier.create(executor.execute("DELETE FROM items i", Query.in(ItemField.ID, List.of("a", "d"))))
                .expectNext(2L)
                .verifyComplete();
        StepVerifier.create(executor.exists(SELECT_NAMES, Query.equalTo(ItemField.OWNER, "ann")))
                .expectNext(false)
                .verifyComplete();
    }

    @Test
    void driverFailuresSurfaceAsStoreException() {
        StepVerifier.create(executor.select("SELECT i.name FROM missing_table i", null,
                        (row, meta) -> row.get(0, String.class)))
                .expectError(StoreException.class)
                .verify();
    }

    @Test
    void existenceCheckReportsFirstMissingId() {
        ExistenceCheck check = new ExistenceCheck(executor);

        StepVerifier.create(check.requireExisting(ItemTable.ITEMS, List.of("a", "b", "c")))
                .expectErrorSatisfies(e -> assertThat(e)
                        .isInstanceOf(NotFoundException.class)
                        .extracting("id").isEqualTo("b"))
                .verify();
    }

    @Test
    void existenceCheckPassesWhenAllIdsExist() {
        ExistenceCheck check = new ExistenceCheck(executor);

        StepVerifier.create(check.requireExisting(ItemTable.ITEMS, List.of("a", "c", "a")))
                .verifyComplete();
        StepVerifier.create(check.requireExisting(ItemTable.ITEMS, List.of()))
                .verifyComplete();
    }
}
