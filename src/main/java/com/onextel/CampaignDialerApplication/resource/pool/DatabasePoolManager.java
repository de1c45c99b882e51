package com.onextel.CampaignDialerApplication.resource.pool;

import com.onextel.CampaignDialerApplication.repository.GlobalSettingsRepository;
import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import com.zaxxer.hikari.HikariPoolMXBean;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.SingleConnectionDataSource;
import org.springframework.stereotype.Component;

import javax.sql.DataSource;

/**
 * Owns the application's HikariCP pool.
 * <p>
 * Pool bounds come from {@code global_settings}, read over a short-lived bootstrap
 * connection before the pool exists; any failure there falls back to
 * {@link PoolSettings#DEFAULTS}. {@link #shutdown()} is idempotent and safe before
 * {@link #initialize()}.
 */
@Component
@Slf4j
public class DatabasePoolManager implements HealthIndicator {
    private static final String HEALTH_QUERY = "SELECT 1";

    private final String jdbcUrl;
    private final String username;
    private final String password;
    private final MeterRegistry meterRegistry;

    private HikariDataSource dataSource;
    private PoolSettings settings;
    private boolean shutdown;

    public DatabasePoolManager(@Value("${spring.datasource.url}") String jdbcUrl,
                               @Value("${spring.datasource.username:}") String username,
                               @Value("${spring.datasource.password:}") String password,
                               MeterRegistry meterRegistry) {
        this.jdbcUrl = jdbcUrl;
        this.username = username;
        this.password = password;
        this.meterRegistry = meterRegistry;
    }

    public synchronized DataSource initialize() {
        if (dataSource != null) {
            return dataSource;
        }
        if (shutdown) {
            throw new IllegalStateException("Database pool already shut down");
        }

        settings = loadSettings();
        HikariConfig config = new HikariConfig();
        config.setPoolName("campaign-dialer-db");
        config.setJdbcUrl(jdbcUrl);
        config.setUsername(username);
        config.setPassword(password);
        config.setMinimumIdle(settings.getMinConnections());
        config.setMaximumPoolSize(settings.getMaxConnections());
        config.setIdleTimeout(settings.getIdleTimeoutMs());
        config.setConnectionTimeout(5_000);
        config.setConnectionTestQuery(HEALTH_QUERY);

        dataSource = new HikariDataSource(config);
        registerGauges(dataSource);
        log.info("Database pool initialized: min={}, max={}, idleTimeout={}ms (from settings: {})",
                settings.getMinConnections(), settings.getMaxConnections(),
                settings.getIdleTimeoutMs(), settings.isLoadedFromSettings());
        return dataSource;
    }

    public synchronized PoolSettings getSettings() {
        return settings;
    }

    /**
     * Round-trips a trivial query and reports pool occupancy.
     */
    public PoolHealth healthCheck() {
        HikariDataSource current;
        synchronized (this) {
            current = dataSource;
        }
        if (current == null || current.isClosed()) {
            return PoolHealth.unavailable("pool not initialized");
        }
        try {
            new JdbcTemplate(current).queryForObject(HEALTH_QUERY, Integer.class);
            HikariPoolMXBean pool = current.getHikariPoolMXBean();
            return new PoolHealth(true,
                    pool.getTotalConnections(),
                    pool.getIdleConnections(),
                    pool.getActiveConnections(),
                    pool.getThreadsAwaitingConnection(),
                    null);
        } catch (Exception e) {
            log.error("Database health check failed: {}", e.getMessage());
            return PoolHealth.unavailable(e.getMessage());
        }
    }

    @Override
    public Health health() {
        PoolHealth poolHealth = healthCheck();
        Health.Builder builder = poolHealth.isHealthy() ? Health.up() : Health.down();
        builder.withDetail("total", poolHealth.getTotal())
                .withDetail("idle", poolHealth.getIdle())
                .withDetail("waiting", poolHealth.getWaiting());
        if (poolHealth.getError() != null) {
            builder.withDetail("error", poolHealth.getError());
        }
        return builder.build();
    }

    public synchronized void shutdown() {
        if (shutdown) {
            return;
        }
        shutdown = true;
        if (dataSource == null) {
            log.info("Database pool shutdown requested before initialization");
            return;
        }
        log.info("Closing database pool");
        dataSource.close();
        log.info("Database pool closed");
    }

    private PoolSettings loadSettings() {
        SingleConnectionDataSource bootstrap = null;
        try {
            bootstrap = new SingleConnectionDataSource(jdbcUrl, username, password, true);
            GlobalSettingsRepository repository = new GlobalSettingsRepository(new JdbcTemplate(bootstrap));
            PoolSettings defaults = PoolSettings.DEFAULTS;
            int min = repository.findInt(PoolSettings.MIN_CONNECTIONS_KEY).orElse(defaults.getMinConnections());
            int max = repository.findInt(PoolSettings.MAX_CONNECTIONS_KEY).orElse(defaults.getMaxConnections());
            long idle = repository.findInt(PoolSettings.IDLE_TIMEOUT_KEY)
                    .map(Integer::longValue)
                    .orElse(defaults.getIdleTimeoutMs());
            if (min < 0 || max < 1 || min > max) {
                log.warn("Ignoring inconsistent pool settings min={} max={}, using defaults", min, max);
                return defaults;
            }
            return new PoolSettings(min, max, idle, true);
        } catch (Exception e) {
            log.warn("Could not load pool settings, using defaults: {}", e.getMessage());
            return PoolSettings.DEFAULTS;
        } finally {
            if (bootstrap != null) {
                bootstrap.destroy();
            }
        }
    }

    private void registerGauges(HikariDataSource ds) {
        meterRegistry.gauge("db.pool.total", ds, d -> d.isClosed() ? 0 : d.getHikariPoolMXBean().getTotalConnections());
        meterRegistry.gauge("db.pool.idle", ds, d -> d.isClosed() ? 0 : d.getHikariPoolMXBean().getIdleConnections());
        meterRegistry.gauge("db.pool.active", ds, d -> d.isClosed() ? 0 : d.getHikariPoolMXBean().getActiveConnections());
        meterRegistry.gauge("db.pool.waiting", ds, d -> d.isClosed() ? 0 : d.getHikariPoolMXBean().getThreadsAwaitingConnection());
    }
}
