package org.postgresql.pointers.examples.springframework.config;

import org.postgresql.pointers.jdbc.PointerSQLExceptionTranslator;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.DataSourceTransactionManager;
import org.springframework.transaction.annotation.EnableTransactionManagement;
import org.springframework.transaction.support.TransactionTemplate;

import javax.sql.DataSource;

/**
 * This class configures the persistence implementation.
 * <p>
 * There is a single {@link JdbcTemplate}, shared by the pointers core and the
 * application, so that the pointer trigger's refusal of an insert reaches
 * both as an {@code UnregisteredTableInsertException}.
 */
@Configuration
@EnableTransactionManagement
public class PersistenceConfig {

    @Autowired
    private DataSource dataSource;

    @Bean
    public PointerSQLExceptionTranslator pointerExceptionTranslator() {
        return new PointerSQLExceptionTranslator();
    }

    @Bean
    public JdbcTemplate jdbcTemplate() {
        final JdbcTemplate jdbcTemplate = new JdbcTemplate(dataSource);
        jdbcTemplate.setExceptionTranslator(pointerExceptionTranslator());
        return jdbcTemplate;
    }

    // ---------------------------------------------------------------------
    // code beyond this point is boilerplate
    // ---------------------------------------------------------------------

    @Bean
    public DataSourceTransactionManager transactionManager() {
        return new DataSourceTransactionManager(dataSource);
    }

    @Bean
    public TransactionTemplate transactionTemplate() {
        return new TransactionTemplate(transactionManager());
    }
}
