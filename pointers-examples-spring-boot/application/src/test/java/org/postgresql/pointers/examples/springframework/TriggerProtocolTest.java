package org.postgresql.pointers.examples.springframework;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.postgresql.pointers.Ulid;
import org.postgresql.pointers.config.PointerSettings;
import org.postgresql.pointers.examples.springframework.config.PersistenceTestConfiguration;
import org.postgresql.pointers.examples.springframework.containers.AugmentedPostgreSQLContainer;
import org.postgresql.pointers.examples.springframework.dao.ExampleDao;
import org.postgresql.pointers.examples.springframework.migration.ExampleMigration;
import org.postgresql.pointers.examples.springframework.schema.ExampleSchema.Gadget;
import org.postgresql.pointers.examples.springframework.schema.ExampleSchema.Widget;
import org.postgresql.pointers.jdbc.JdbcRepository;
import org.postgresql.pointers.jdbc.UnregisteredTableInsertException;
import org.postgresql.pointers.migration.Direction;
import org.postgresql.pointers.migration.PointerMigration;
import org.postgresql.pointers.registry.TableRegistry;
import org.postgresql.pointers.store.PointerStore;
import org.postgresql.pointers.trigger.PointerTriggers;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.testcontainers.service.connection.ServiceConnection;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.test.context.ActiveProfiles;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.util.Locale;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * The trigger refuses rows of unregistered tables, tolerates pointers that
 * already exist, and installing it (or the whole abstraction) again changes
 * nothing.
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
public class TriggerProtocolTest {

    @Container
    @ServiceConnection
    protected static PostgreSQLContainer<?> postgres =
            new AugmentedPostgreSQLContainer<>(AugmentedPostgreSQLContainer.DEFAULT_IMAGE_NAME);

    private final ExampleMigration exampleMigration;
    private final ExampleDao dao;
    private final PointerMigration migration;
    private final PointerTriggers triggers;
    private final TableRegistry registry;
    private final PointerStore pointerStore;
    private final JdbcTemplate jdbcTemplate;

    @Autowired
    public TriggerProtocolTest(ExampleMigration exampleMigration, ExampleDao dao, PointerMigration migration,
                               PointerTriggers triggers, TableRegistry registry, PointerStore pointerStore,
                               JdbcTemplate jdbcTemplate) {
        this.exampleMigration = exampleMigration;
        this.dao = dao;
        this.migration = migration;
        this.triggers = triggers;
        this.registry = registry;
        this.pointerStore = pointerStore;
        this.jdbcTemplate = jdbcTemplate;
    }

    @BeforeEach
    public void migrate() {
        exampleMigration.up();
    }

    private static String uniqueName(String prefix) {
        return prefix + Ulid.generate().toString().toLowerCase(Locale.ROOT);
    }

    private long count(String sql, Object... args) {
        final Long n = jdbcTemplate.queryForObject(sql, Long.class, args);
        return (n == null) ? 0L : n;
    }

    private boolean relationExists(String name) {
        return count("select count(*) from pg_catalog.pg_class where oid = to_regclass(?)", "\"" + name + "\"") > 0;
    }

    @Test
    public void unregisteredTableFailsClosed() {
        final String table = uniqueName("unregistered_");
        jdbcTemplate.execute("create table " + table + " (id uuid primary key)");
        triggers.createTrigger(table);

        final Ulid id = Ulid.generate();
        assertThatThrownBy(() -> jdbcTemplate.update("insert into " + table + " (id) values (?)", id.dump()))
                .isInstanceOf(UnregisteredTableInsertException.class)
                .satisfies(e -> assertThat(((UnregisteredTableInsertException) e).getTable()).isEqualTo(table));

        assertThat(pointerStore.find(id)).isEmpty();
        assertThat(count("select count(*) from " + table)).isZero();
    }

    @Test
    public void triggerInstallIsIdempotent() {
        triggers.createTrigger(Widget.TABLE);
        triggers.createTrigger(Widget.TABLE);

        assertThat(triggers.hasTrigger(Widget.TABLE)).isTrue();
        assertThat(count("select count(*) from pg_catalog.pg_trigger where tgrelid = 'widgets'::regclass and not tgisinternal"))
                .isEqualTo(2L);

        final Ulid id = dao.createWidget("after reinstall");
        assertThat(pointerStore.find(id)).isPresent();
    }

    @Test
    public void existingPointerIsKept() {
        final Ulid id = Ulid.generate();
        final Ulid widgets = Ulid.parse(Widget.ID);
        final Ulid gadgets = Ulid.parse(Gadget.ID);

        assertThat(pointerStore.create(id, widgets)).isTrue();
        assertThat(pointerStore.create(id, gadgets)).isFalse();

        jdbcTemplate.update("insert into widgets (id, name) values (?, ?)", id.dump(), "pre-pointed");

        assertThat(count("select count(*) from pointers_pointer where id = ?", id.dump())).isEqualTo(1L);
        assertThat(pointerStore.find(id).orElseThrow().getTableId()).isEqualTo(widgets);
    }

    @Test
    public void repointMovesOwnership() {
        final Ulid id = dao.createWidget("moving");
        final Ulid gadgets = Ulid.parse(Gadget.ID);

        assertThat(pointerStore.repoint(id, gadgets)).isTrue();
        assertThat(pointerStore.find(id).orElseThrow().getTableId()).isEqualTo(gadgets);
        assertThat(pointerStore.repoint(Ulid.generate(), gadgets)).isFalse();
    }

    @Test
    public void initIsIdempotent() {
        exampleMigration.up();

        assertThat(count("select count(*) from pointers_table where \"table\" = 'pointers_table'")).isEqualTo(1L);
        assertThat(count("select count(*) from pg_catalog.pg_trigger where tgrelid = 'pointers_table'::regclass and not tgisinternal"))
                .isEqualTo(2L);
        assertThat(triggers.hasTrigger("pointers_table")).isTrue();
    }

    @Test
    public void downRemovesEverything() {
        exampleMigration.down();

        assertThat(relationExists("pointers_table")).isFalse();
        assertThat(relationExists("pointers_pointer")).isFalse();
        assertThat(relationExists("widgets")).isFalse();
        assertThat(relationExists("notes")).isFalse();
        assertThat(count("select count(*) from pg_catalog.pg_proc where proname in ('insert_pointer', 'pointers_ulid_timestamp')"))
                .isZero();
    }

    @Test
    public void droppedPointableTableLeavesNothing() {
        final String table = uniqueName("scratch_");
        final Ulid id = Ulid.generate();
        migration.createPointableTable(table, id, t -> t.add("n", "integer"));

        jdbcTemplate.update("insert into " + table + " (id, n) values (?, 1), (?, 2)",
                Ulid.generate().dump(), Ulid.generate().dump());
        assertThat(pointerStore.count(id)).isEqualTo(2L);

        migration.dropPointableTable(table, id);

        assertThat(registry.find(table)).isEmpty();
        assertThat(pointerStore.count(id)).isZero();
        assertThat(relationExists(table)).isFalse();
    }

    @Test
    public void invalidTableIdChangesNothing() {
        final String table = uniqueName("invalid_");

        assertThatThrownBy(() -> migration.createPointableTable(table, "not a ulid", t -> t.add("n", "integer")))
                .isInstanceOf(IllegalArgumentException.class);

        assertThat(registry.find(table)).isEmpty();
        assertThat(relationExists(table)).isFalse();
    }

    @Test
    public void alternativeNames() {
        final PointerSettings settings = PointerSettings.builder()
                .triggerFunction("alt_insert_pointer")
                .triggerPrefix("alt_")
                .tableTable("alt_tables")
                .pointerTable("alt_pointers")
                .build();
        final PointerMigration alt = new PointerMigration(new JdbcRepository(jdbcTemplate), settings);
        final Ulid thingsId = Ulid.generate();

        alt.initPointers(Direction.UP);
        try {
            alt.createPointableTable("alt_things", thingsId, t -> t.add("name", "text"));
            jdbcTemplate.update("insert into alt_things (id, name) values (?, ?)", Ulid.generate().dump(), "thing");

            assertThat(count("select count(*) from alt_pointers where table_id = ?", thingsId.dump())).isEqualTo(1L);
            assertThat(alt.triggers().hasTrigger("alt_things")).isTrue();
        } finally {
            alt.dropPointableTable("alt_things", thingsId);
            alt.initPointers(Direction.DOWN);
        }
        assertThat(relationExists("alt_pointers")).isFalse();
    }
}
