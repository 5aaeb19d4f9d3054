package org.postgresql.pointers.examples.springframework.dao;

import org.postgresql.pointers.Ulid;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Plain inserts and deletes against the example tables. Nothing here touches
 * the pointer tables; the triggers keep them in step.
 */
@Repository
public class ExampleDao {
    private final JdbcTemplate jdbcTemplate;

    public ExampleDao(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    public Ulid createWidget(String name) {
        final Ulid id = Ulid.generate();
        jdbcTemplate.update("insert into widgets (id, name) values (?, ?)", id.dump(), name);
        return id;
    }

    public Ulid createGadget(String name) {
        final Ulid id = Ulid.generate();
        jdbcTemplate.update("insert into gadgets (id, name) values (?, ?)", id.dump(), name);
        return id;
    }

    public boolean deleteWidget(Ulid id) {
        return jdbcTemplate.update("delete from widgets where id = ?", id.dump()) > 0;
    }

    public boolean widgetExists(Ulid id) {
        return !jdbcTemplate.queryForList("select id from widgets where id = ?", UUID.class, id.dump()).isEmpty();
    }

    /**
     * Attach a note to any pointable row.
     */
    public void addNote(Ulid target, String body) {
        jdbcTemplate.update("insert into notes (id, body) values (?, ?)", target.dump(), body);
    }

    public Optional<String> note(Ulid target) {
        final List<String> bodies = jdbcTemplate.queryForList("select body from notes where id = ?", String.class, target.dump());
        return bodies.stream().findFirst();
    }

    /**
     * Create a link; any of the targets may be null.
     */
    public Ulid createLink(Ulid owner, Ulid subject, Ulid pinned) {
        final Ulid id = Ulid.generate();
        jdbcTemplate.update("insert into links (id, owner, subject, pinned) values (?, ?, ?, ?)",
                id.dump(), dump(owner), dump(subject), dump(pinned));
        return id;
    }

    public boolean linkExists(Ulid id) {
        return !jdbcTemplate.queryForList("select id from links where id = ?", UUID.class, id.dump()).isEmpty();
    }

    public Optional<Ulid> linkSubject(Ulid id) {
        final List<UUID> subjects = jdbcTemplate.queryForList("select subject from links where id = ?", UUID.class, id.dump());
        if (subjects.isEmpty() || (subjects.get(0) == null)) {
            return Optional.empty();
        }
        return Optional.of(Ulid.load(subjects.get(0)));
    }

    private static UUID dump(Ulid id) {
        return (id == null) ? null : id.dump();
    }
}
