package com.concierge.core.persistence;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import javax.sql.DataSource;
import java.sql.SQLException;

/**
 * Provides the {@link CheckpointStore} bean.
 * <p>
 * When a {@link DataSource} is available (the {@code jdbc} profile), a
 * {@link JdbcCheckpointStore} persists checkpoints to the database. Otherwise
 * an {@link InMemoryCheckpointStore} is used, which does not survive restarts.
 * <p>
 * The DataSource is looked up when the store is created rather than through a
 * bean condition, since the auto-configured DataSource is registered after
 * user configuration classes are processed.
 */
@Configuration
public class CheckpointerConfig {

    private static final Logger log = LoggerFactory.getLogger(CheckpointerConfig.class);

    @Bean
    public CheckpointStore checkpointStore(ObjectProvider<DataSource> dataSource) throws SQLException {
        DataSource available = dataSource.getIfAvailable();
        if (available == null) {
            log.info("No DataSource available; using in-memory checkpoint store (checkpoints will not persist across restarts)");
            return new InMemoryCheckpointStore();
        }
        log.info("Configuring JDBC checkpoint store");
        var store = new JdbcCheckpointStore(available);
        store.createTables();
        return store;
    }
}
