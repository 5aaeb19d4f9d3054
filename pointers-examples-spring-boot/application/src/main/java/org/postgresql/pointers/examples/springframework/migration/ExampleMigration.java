package org.postgresql.pointers.examples.springframework.migration;

import org.postgresql.pointers.migration.Direction;
import org.postgresql.pointers.migration.PointerMigration;
import org.postgresql.pointers.migration.TableOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.transaction.support.TransactionTemplate;

import static org.postgresql.pointers.examples.springframework.schema.ExampleSchema.Gadget;
import static org.postgresql.pointers.examples.springframework.schema.ExampleSchema.Link;
import static org.postgresql.pointers.examples.springframework.schema.ExampleSchema.Note;
import static org.postgresql.pointers.examples.springframework.schema.ExampleSchema.Widget;

/**
 * The example application's schema, installed and removed in one
 * transaction each way.
 * <p>
 * Installing twice is harmless, so the application can run it on every
 * start.
 */
@Component
public class ExampleMigration {
    private static final Logger LOG = LoggerFactory.getLogger(ExampleMigration.class);

    private final PointerMigration migration;
    private final TransactionTemplate transactionTemplate;

    public ExampleMigration(PointerMigration migration, TransactionTemplate transactionTemplate) {
        this.migration = migration;
        this.transactionTemplate = transactionTemplate;
    }

    public void up() {
        LOG.info("migrating example schema up");
        transactionTemplate.executeWithoutResult(status -> {
            migration.initPointers(Direction.UP);
            migration.initUlidExtra(Direction.UP);

            migration.createPointableTable(Widget.class, TableOptions.none().withComment("named widgets"),
                    t -> t.add("name", "text").notNull());

            migration.createPointableTable(Gadget.class, TableOptions.none(), t -> {
                t.add("name", "text").notNull();
                t.add("created", "timestamptz").notNull().defaultsTo("now()");
            });

            migration.createMixinTable(Note.class, TableOptions.none(),
                    t -> t.add("body", "text").notNull());

            migration.createPointableTable(Link.class, TableOptions.none(), t -> {
                t.add("owner", migration.strongPointer());
                t.add("subject", migration.weakPointer());
                t.add("pinned", migration.unbreakablePointer());
            });
        });
    }

    public void down() {
        LOG.info("migrating example schema down");
        transactionTemplate.executeWithoutResult(status -> {
            migration.dropPointableTable(Link.class);
            migration.dropMixinTable(Note.class);
            migration.dropPointableTable(Gadget.class);
            migration.dropPointableTable(Widget.class);

            migration.initUlidExtra(Direction.DOWN);
            migration.initPointers(Direction.DOWN);
        });
    }
}
