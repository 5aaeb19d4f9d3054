package org.postgresql.pointers.examples.springframework;

import org.postgresql.pointers.config.PointerSettings;
import org.postgresql.pointers.examples.springframework.migration.ExampleMigration;
import org.postgresql.pointers.examples.springframework.security.LogDatabaseMetaData;
import org.postgresql.pointers.registry.TableRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;

/**
 * Example application: describes the database, installs the example schema
 * and lists the registered tables.
 * <p>
 * Run with {@code --pointers.examples.direction=down} to remove the schema
 * instead.
 */
@SpringBootApplication
public class ExampleApplication implements ApplicationRunner {
    private static final Logger LOG = LoggerFactory.getLogger(ExampleApplication.class);

    private final DataSource dataSource;
    private final PointerSettings settings;
    private final ExampleMigration migration;
    private final TableRegistry registry;

    @Value("${pointers.examples.direction:up}")
    private String direction;

    public ExampleApplication(DataSource dataSource, PointerSettings settings,
                              ExampleMigration migration, TableRegistry registry) {
        this.dataSource = dataSource;
        this.settings = settings;
        this.migration = migration;
        this.registry = registry;
    }

    public static void main(String[] args) {
        SpringApplication.run(ExampleApplication.class, args);
    }

    @Override
    public void run(ApplicationArguments args) throws SQLException {
        try (Connection conn = dataSource.getConnection()) {
            LOG.info("\n{}", LogDatabaseMetaData.format(conn.getMetaData(), LogDatabaseMetaData.pointers(settings)));
        }

        if ("down".equalsIgnoreCase(direction)) {
            migration.down();
            return;
        }

        migration.up();
        registry.list().forEach(table -> LOG.info("registered: {}", table));
    }
}
