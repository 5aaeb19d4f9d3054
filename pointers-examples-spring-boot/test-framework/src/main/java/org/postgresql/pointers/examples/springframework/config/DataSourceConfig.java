package org.postgresql.pointers.examples.springframework.config;

import com.zaxxer.hikari.HikariDataSource;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.jdbc.DataSourceProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Profile;

import javax.sql.DataSource;

import static org.apache.commons.lang3.StringUtils.isNotBlank;

/**
 * Explicit HikariCP data source for a developer's own database (dev profile).
 * <p>
 * Other profiles use the data source Spring Boot configures, or the one
 * a Testcontainers service connection provides.
 */
@Configuration
@Profile("dev")
public class DataSourceConfig {
    @Value("${spring.datasource.url}")
    private String url;

    @Value("${spring.datasource.username}")
    private String username;

    @Value("${spring.datasource.password}")
    private String password;

    @Value("${spring.datasource.driverClassName:}")
    private String driverClassName;

    @Value("${spring.datasource.hikari.connection-test-query:}")
    private String connectionTestQuery;

    @Value("${spring.datasource.hikari.maximum-pool-size:4}")
    private int maximumPoolSize;

    @Bean
    public DataSource dataSource() {
        // @formatter:off
        final HikariDataSource ds = dataSourceProperties()
            .initializeDataSourceBuilder()
            .type(HikariDataSource.class)
            .build();
        // @formatter:on
        ds.setPoolName("pointers");
        ds.setMaximumPoolSize(maximumPoolSize);
        if (isNotBlank(connectionTestQuery)) {
            ds.setConnectionTestQuery(connectionTestQuery);
        }
        return ds;
    }

    /*
     * Not a bean: Spring Boot already binds its own DataSourceProperties.
     */
    DataSourceProperties dataSourceProperties() {
        final DataSourceProperties props = new DataSourceProperties();
        props.setUrl(url);
        props.setUsername(username);
        props.setPassword(password);
        if (isNotBlank(driverClassName)) {
            props.setDriverClassName(driverClassName);
        }
        return props;
    }
}
