package com.launchpad.core.persistence;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import javax.sql.DataSource;
import java.time.Clock;

/**
 * Spring {@link Configuration} that provides the {@link LaunchRepository} bean.
 * <p>
 * With {@code launchpad.persistence.store=jdbc} (the {@code postgres} profile) a
 * {@link JdbcLaunchRepository} is created and its tables ensured. Otherwise an in-memory
 * repository is used, suitable for development and testing but not durable across restarts.
 */
@Configuration
public class PersistenceConfig {

    private static final Logger log = LoggerFactory.getLogger(PersistenceConfig.class);

    @Bean
    @ConditionalOnProperty(prefix = "launchpad.persistence", name = "store", havingValue = "jdbc")
    public LaunchRepository jdbcLaunchRepository(DataSource dataSource, Clock clock) throws Exception {
        log.info("Configuring JDBC launch repository (PostgreSQL)");
        var repository = new JdbcLaunchRepository(dataSource, clock);
        repository.createTables();
        return repository;
    }

    @Bean
    @ConditionalOnProperty(prefix = "launchpad.persistence", name = "store", havingValue = "memory",
            matchIfMissing = true)
    public LaunchRepository memoryLaunchRepository(Clock clock) {
        log.info("Using in-memory launch repository (launches will not persist across restarts)");
        return new InMemoryLaunchRepository(clock);
    }
}
