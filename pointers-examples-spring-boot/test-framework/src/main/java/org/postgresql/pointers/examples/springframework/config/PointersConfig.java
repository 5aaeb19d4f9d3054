package org.postgresql.pointers.examples.springframework.config;

import org.postgresql.pointers.config.PointerSettings;
import org.postgresql.pointers.jdbc.JdbcRepository;
import org.postgresql.pointers.jdbc.SqlRepository;
import org.postgresql.pointers.migration.PointerMigration;
import org.postgresql.pointers.registry.TableRegistry;
import org.postgresql.pointers.store.PointerStore;
import org.postgresql.pointers.trigger.PointerTriggers;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.jdbc.core.JdbcOperations;

/**
 * Wires the pointers core onto the application's {@link JdbcOperations}.
 * <p>
 * The installation names are read once, here, and handed to every
 * component; any left unset take the defaults in {@link PointerSettings}.
 */
@Configuration
public class PointersConfig {
    private static final Logger LOG = LoggerFactory.getLogger(PointersConfig.class);

    @Value("${pointers.trigger-function:}")
    private String triggerFunction;

    @Value("${pointers.trigger-prefix:}")
    private String triggerPrefix;

    @Value("${pointers.table-table:}")
    private String tableTable;

    @Value("${pointers.pointer-table:}")
    private String pointerTable;

    @Bean
    public PointerSettings pointerSettings() {
        // @formatter:off
        final PointerSettings settings = PointerSettings.builder()
            .triggerFunction(triggerFunction)
            .triggerPrefix(triggerPrefix)
            .tableTable(tableTable)
            .pointerTable(pointerTable)
            .build();
        // @formatter:on
        LOG.info("{}", settings);
        return settings;
    }

    @Bean
    public SqlRepository sqlRepository(JdbcOperations jdbcOperations) {
        return new JdbcRepository(jdbcOperations);
    }

    @Bean
    public TableRegistry tableRegistry(SqlRepository sqlRepository, PointerSettings settings) {
        return new TableRegistry(sqlRepository, settings);
    }

    @Bean
    public PointerStore pointerStore(SqlRepository sqlRepository, PointerSettings settings) {
        return new PointerStore(sqlRepository, settings);
    }

    @Bean
    public PointerTriggers pointerTriggers(SqlRepository sqlRepository, PointerSettings settings) {
        return new PointerTriggers(sqlRepository, settings);
    }

    @Bean
    public PointerMigration pointerMigration(SqlRepository sqlRepository, PointerSettings settings,
                                             TableRegistry tableRegistry, PointerTriggers pointerTriggers) {
        return new PointerMigration(sqlRepository, settings, tableRegistry, pointerTriggers);
    }
}
