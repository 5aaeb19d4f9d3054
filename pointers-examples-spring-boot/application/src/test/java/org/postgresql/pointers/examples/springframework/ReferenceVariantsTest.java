package org.postgresql.pointers.examples.springframework;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.postgresql.pointers.Ulid;
import org.postgresql.pointers.examples.springframework.config.PersistenceTestConfiguration;
import org.postgresql.pointers.examples.springframework.containers.AugmentedPostgreSQLContainer;
import org.postgresql.pointers.examples.springframework.dao.ExampleDao;
import org.postgresql.pointers.examples.springframework.migration.ExampleMigration;
import org.postgresql.pointers.migration.PointerMigration;
import org.postgresql.pointers.store.PointerStore;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.testcontainers.service.connection.ServiceConnection;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.test.context.ActiveProfiles;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.util.Locale;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Deleting a row removes its pointer, and each kind of reference to that
 * pointer reacts in its own way.
 */
@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.NONE,
        classes = {
                PersistenceTestConfiguration.class,
                ExampleMigration.class,
                ExampleDao.class
        }
)
@ActiveProfiles("test")
@Testcontainers(disabledWithoutDocker = true)
public class ReferenceVariantsTest {

    @Container
    @ServiceConnection
    protected static PostgreSQLContainer<?> postgres =
            new AugmentedPostgreSQLContainer<>(AugmentedPostgreSQLContainer.DEFAULT_IMAGE_NAME);

    private final ExampleMigration exampleMigration;
    private final ExampleDao dao;
    private final PointerStore pointerStore;
    private final PointerMigration migration;
    private final JdbcTemplate jdbcTemplate;

    @Autowired
    public ReferenceVariantsTest(ExampleMigration exampleMigration, ExampleDao dao, PointerStore pointerStore,
                                 PointerMigration migration, JdbcTemplate jdbcTemplate) {
        this.exampleMigration = exampleMigration;
        this.dao = dao;
        this.pointerStore = pointerStore;
        this.migration = migration;
        this.jdbcTemplate = jdbcTemplate;
    }

    private long count(String sql, Object... args) {
        final Long n = jdbcTemplate.queryForObject(sql, Long.class, args);
        return (n == null) ? 0L : n;
    }

    @BeforeEach
    public void migrate() {
        exampleMigration.up();
    }

    @Test
    public void deleteRemovesPointer() {
        final Ulid widget = dao.createWidget("short-lived");
        assertThat(pointerStore.find(widget)).isPresent();

        assertThat(dao.deleteWidget(widget)).isTrue();
        assertThat(pointerStore.find(widget)).isEmpty();
    }

    @Test
    public void strongReferenceCascades() {
        final Ulid widget = dao.createWidget("owner");
        final Ulid link = dao.createLink(widget, null, null);

        dao.deleteWidget(widget);

        assertThat(dao.linkExists(link)).isFalse();
        assertThat(pointerStore.find(link)).isEmpty();
    }

    @Test
    public void weakReferenceIsCleared() {
        final Ulid widget = dao.createWidget("subject");
        final Ulid link = dao.createLink(null, widget, null);
        assertThat(dao.linkSubject(link)).contains(widget);

        dao.deleteWidget(widget);

        assertThat(dao.linkExists(link)).isTrue();
        assertThat(dao.linkSubject(link)).isEmpty();
    }

    @Test
    public void unbreakableReferenceRefusesDelete() {
        final Ulid widget = dao.createWidget("pinned");
        final Ulid link = dao.createLink(null, null, widget);

        assertThatThrownBy(() -> dao.deleteWidget(widget))
                .isInstanceOf(DataIntegrityViolationException.class);

        assertThat(dao.widgetExists(widget)).isTrue();
        assertThat(pointerStore.find(widget)).isPresent();
        assertThat(dao.linkExists(link)).isTrue();
    }

    @Test
    public void referencesMayTargetAnyTable() {
        final Ulid gadget = dao.createGadget("polymorphic");
        final Ulid link = dao.createLink(gadget, null, null);

        assertThat(dao.linkExists(link)).isTrue();
    }

    @Test
    public void referenceToNothingIsRefused() {
        assertThatThrownBy(() -> dao.createLink(Ulid.generate(), null, null))
                .isInstanceOf(DataIntegrityViolationException.class);
    }

    @Test
    public void mixinRowFollowsItsOwner() {
        final Ulid widget = dao.createWidget("annotated");
        dao.addNote(widget, "hello");
        assertThat(dao.note(widget)).contains("hello");

        dao.deleteWidget(widget);

        assertThat(dao.note(widget)).isEmpty();
    }

    @Test
    public void mixinNeedsAPointer() {
        assertThatThrownBy(() -> dao.addNote(Ulid.generate(), "orphan"))
                .isInstanceOf(DataIntegrityViolationException.class);
    }

    @Test
    public void bulkDeleteOverStrongSelfReference() {
        final String table = "comments_" + Ulid.generate().toString().toLowerCase(Locale.ROOT);
        final Ulid tableId = Ulid.generate();
        migration.createPointableTable(table, tableId, t -> t.add("parent", migration.strongPointer()));
        try {
            final Ulid root = Ulid.generate();
            final Ulid reply = Ulid.generate();
            final Ulid nested = Ulid.generate();
            jdbcTemplate.update("insert into " + table + " (id, parent) values (?, null)", root.dump());
            jdbcTemplate.update("insert into " + table + " (id, parent) values (?, ?)", reply.dump(), root.dump());
            jdbcTemplate.update("insert into " + table + " (id, parent) values (?, ?)", nested.dump(), reply.dump());
            assertThat(pointerStore.count(tableId)).isEqualTo(3L);

            jdbcTemplate.update("delete from " + table);

            assertThat(count("select count(*) from " + table)).isZero();
            assertThat(pointerStore.count(tableId)).isZero();
        } finally {
            migration.dropPointableTable(table, tableId);
        }
    }

    @Test
    public void deletingParentCascadesThroughSelfReference() {
        final String table = "threads_" + Ulid.generate().toString().toLowerCase(Locale.ROOT);
        final Ulid tableId = Ulid.generate();
        migration.createPointableTable(table, tableId, t -> t.add("parent", migration.strongPointer()));
        try {
            final Ulid root = Ulid.generate();
            final Ulid reply = Ulid.generate();
            final Ulid other = Ulid.generate();
            jdbcTemplate.update("insert into " + table + " (id, parent) values (?, null), (?, null)",
                    root.dump(), other.dump());
            jdbcTemplate.update("insert into " + table + " (id, parent) values (?, ?)", reply.dump(), root.dump());

            jdbcTemplate.update("delete from " + table + " where id = ?", root.dump());

            assertThat(count("select count(*) from " + table)).isEqualTo(1L);
            assertThat(pointerStore.find(reply)).isEmpty();
            assertThat(pointerStore.find(other)).isPresent();
        } finally {
            migration.dropPointableTable(table, tableId);
        }
    }
}
