package com.hypecycle.core.cache;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import javax.sql.DataSource;
import java.sql.SQLException;

/**
 * Spring {@link Configuration} that provides the {@link CacheStore} bean.
 * <p>
 * When a {@link DataSource} is available a {@link JdbcCacheStore} is created and its
 * table ensured. Otherwise an in-memory store is used, which does not survive restarts.
 */
@Configuration
public class CacheStoreConfig {

    private static final Logger log = LoggerFactory.getLogger(CacheStoreConfig.class);

    @Bean
    public CacheStore cacheStore(ObjectProvider<DataSource> dataSource) throws SQLException {
        DataSource available = dataSource.getIfAvailable();
        if (available == null) {
            log.info("No DataSource available; using in-memory cache store (results will not persist across restarts)");
            return new InMemoryCacheStore();
        }
        log.info("Configuring JDBC cache store");
        var store = new JdbcCacheStore(available);
        store.createTables();
        return store;
    }
}
