package org.postgresql.pointers.examples.springframework.config;

import org.springframework.boot.autoconfigure.EnableAutoConfiguration;
import org.springframework.context.annotation.ComponentScan;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Profile;

/**
 * Test configuration (test profile)
 * <p>
 * Note: this class works with service connections and dynamic properties
 * alike, so there is no difference between using a temporary TestContainer
 * or a permanent test server.
 */
@EnableAutoConfiguration
@Configuration
@ComponentScan({
        "org.postgresql.pointers.examples.springframework.config",
        "org.postgresql.pointers.examples.springframework.security"
})
@Profile("test")
public class PersistenceTestConfiguration {
}
