package com.oblivionstack.accessservice;

import com.oblivionstack.accessservice.config.AccessServiceProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.flyway.FlywayAutoConfiguration;
import org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Access service: answers authorization questions against the tenancy model, provisions
 * businesses and memberships, and keeps the cached membership view fresh.
 *
 * <p>Requests arrive already authenticated. The gateway forwards verified claims in
 * {@code X-Verified-Claims}; this service never validates tokens itself.
 *
 * <p>The tenancy data source and its migrations are owned by
 * {@link com.oblivionstack.database.migration.TenancyDatabaseConfig}, so Boot's own data source and
 * Flyway auto-configuration are off.
 */
@SpringBootApplication(exclude = {DataSourceAutoConfiguration.class, FlywayAutoConfiguration.class})
@EnableScheduling
@EnableConfigurationProperties(AccessServiceProperties.class)
public class AccessServiceApplication {

    private static final Logger log = LoggerFactory.getLogger(AccessServiceApplication.class);

    public static void main(String[] args) {
        SpringApplication.run(AccessServiceApplication.class, args);
        log.info("OblivionStack access service started");
    }
}
