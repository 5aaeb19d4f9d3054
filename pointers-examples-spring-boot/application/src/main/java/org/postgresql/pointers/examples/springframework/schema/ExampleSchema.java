package org.postgresql.pointers.examples.springframework.schema;

import org.postgresql.pointers.annotation.Mixin;
import org.postgresql.pointers.annotation.Pointable;

/**
 * The tables of the example application.
 * <p>
 * Each class stands for one table; the migration, the registry and the
 * reference generators all find the table name (and, for pointable tables,
 * the registry id) through the annotation.
 */
public final class ExampleSchema {

    private ExampleSchema() {
    }

    /**
     * A pointable table of named widgets.
     */
    @Pointable(table = Widget.TABLE, id = Widget.ID)
    public static final class Widget {
        public static final String TABLE = "widgets";
        public static final String ID = "01J0000000WDGTS0000000000A";

        private Widget() {
        }
    }

    /**
     * A second pointable table, so that pointers have more than one owner.
     */
    @Pointable(table = Gadget.TABLE, id = Gadget.ID)
    public static final class Gadget {
        public static final String TABLE = "gadgets";
        public static final String ID = "01J0000000GDGTS0000000000B";

        private Gadget() {
        }
    }

    /**
     * Notes attached to any pointable row; a note goes when its row goes.
     */
    @Mixin(table = Note.TABLE)
    public static final class Note {
        public static final String TABLE = "notes";

        private Note() {
        }
    }

    /**
     * Links from one row to another, one column per reference variant:
     * deleting the row an {@code owner} points to deletes the link, deleting
     * the row a {@code subject} points to clears the column, and a row a
     * {@code pinned} column points to cannot be deleted.
     */
    @Pointable(table = Link.TABLE, id = Link.ID)
    public static final class Link {
        public static final String TABLE = "links";
        public static final String ID = "01J0000000NKS000000000000C";

        private Link() {
        }
    }
}
