package com.oblivionstack.database.migration;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Connection and migration settings for the tenancy database.
 *
 * <pre>{@code
 * oblivion:
 *   database:
 *     enabled: true
 *     url: jdbc:postgresql://localhost:5432/oblivion
 *     username: oblivion
 *     password: oblivion_dev_password
 *     locations: classpath:db/migration/tenancy
 *     maximum-pool-size: 10
 * }</pre>
 *
 * @param enabled         whether the JDBC stores are used at all
 * @param url             JDBC URL
 * @param username        database user
 * @param password        database password
 * @param locations       Flyway migration locations
 * @param migrateOnStartup run pending migrations when the context starts
 * @param maximumPoolSize Hikari pool size
 */
@Validated
@ConfigurationProperties(prefix = "oblivion.database")
public record TenancyDatabaseProperties(
        boolean enabled,
        @NotBlank String url,
        @NotBlank String username,
        String password,
        String locations,
        Boolean migrateOnStartup,
        @Min(1) Integer maximumPoolSize
) {

    public static final String DEFAULT_LOCATIONS = "classpath:db/migration/tenancy";

    public TenancyDatabaseProperties {
        if (locations == null || locations.isBlank()) {
            locations = DEFAULT_LOCATIONS;
        }
        if (migrateOnStartup == null) {
            migrateOnStartup = Boolean.TRUE;
        }
        if (maximumPoolSize == null) {
            maximumPoolSize = 10;
        }
    }
}
