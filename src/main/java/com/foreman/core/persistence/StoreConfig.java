package com.foreman.core.persistence;

import com.foreman.config.ForemanProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.sqlite.SQLiteConfig;
import org.sqlite.SQLiteDataSource;

import javax.sql.DataSource;
import java.nio.file.Path;

/**
 * Spring {@link Configuration} that provides the {@link ProjectStore} bean.
 * <p>
 * The store is an SQLite file inside the configured project directory, opened in WAL
 * mode so dashboard readers are not blocked by the coordinator's writes.
 */
@Configuration
public class StoreConfig {

    private static final Logger log = LoggerFactory.getLogger(StoreConfig.class);

    private static final int BUSY_TIMEOUT_MS = 5_000;

    @Bean
    public DataSource projectStoreDataSource(ForemanProperties properties) {
        return sqliteDataSource(properties.getStorePath());
    }

    /**
     * JDBC-backed project store. Creates the required tables on startup.
     */
    @Bean
    public ProjectStore projectStore(DataSource projectStoreDataSource) {
        var store = new JdbcProjectStore(projectStoreDataSource);
        store.createTables();
        return store;
    }

    public static DataSource sqliteDataSource(Path storePath) {
        log.info("Configuring project store at {}", storePath);
        var config = new SQLiteConfig();
        config.setJournalMode(SQLiteConfig.JournalMode.WAL);
        config.setBusyTimeout(BUSY_TIMEOUT_MS);
        config.enforceForeignKeys(true);
        var dataSource = new SQLiteDataSource(config);
        dataSource.setUrl("jdbc:sqlite:" + storePath);
        return dataSource;
    }
}
