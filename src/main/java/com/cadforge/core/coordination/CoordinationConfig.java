package com.cadforge.core.coordination;

import com.cadforge.core.config.CadforgeProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import javax.sql.DataSource;
import java.time.Clock;

/**
 * Spring {@link Configuration} for the lease store and the shared clock.
 * <p>
 * With {@code cadforge.locks.store=auto} (the default) a {@link JdbcLeaseLockStore}
 * is used whenever a {@link DataSource} is available, so leases are shared by
 * every process using the same database. Otherwise leases live in an
 * {@link InMemoryLeaseLockStore} and only coordinate agents of this process.
 */
@Configuration
public class CoordinationConfig {

    private static final Logger log = LoggerFactory.getLogger(CoordinationConfig.class);

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public LeaseLockStore leaseLockStore(ObjectProvider<DataSource> dataSource,
                                         CadforgeProperties properties) throws Exception {
        String mode = properties.getLocks().getStore();
        DataSource ds = dataSource.getIfAvailable();
        if ("memory".equalsIgnoreCase(mode) || ds == null) {
            if ("jdbc".equalsIgnoreCase(mode)) {
                throw new IllegalStateException("cadforge.locks.store=jdbc requires a configured DataSource");
            }
            log.info("Using in-memory lease store (leases are process-local)");
            return new InMemoryLeaseLockStore();
        }
        log.info("Configuring JDBC lease store");
        var store = new JdbcLeaseLockStore(ds);
        store.createTables();
        return store;
    }
}
