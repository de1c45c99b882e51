package com.onextel.CampaignDialerApplication.config;

import com.onextel.CampaignDialerApplication.resource.pool.DatabasePoolManager;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import javax.sql.DataSource;

@Configuration
public class DatabaseConfig {

    // Closed by GracefulShutdownHandler through DatabasePoolManager.shutdown()
    @Bean(destroyMethod = "")
    public DataSource dataSource(DatabasePoolManager poolManager) {
        return poolManager.initialize();
    }
}
