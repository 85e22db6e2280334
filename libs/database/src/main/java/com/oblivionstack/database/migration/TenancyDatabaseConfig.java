package com.oblivionstack.database.migration;

import com.oblivionstack.database.jdbc.JdbcAuditSink;
import com.oblivionstack.database.jdbc.JdbcBusinessRepository;
import com.oblivionstack.database.jdbc.JdbcMembershipRepository;
import com.zaxxer.hikari.HikariDataSource;
import java.time.Clock;
import javax.sql.DataSource;
import org.flywaydb.core.Flyway;
import org.flywaydb.core.api.output.MigrateResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.jdbc.DataSourceBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.DependsOn;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.DataSourceTransactionManager;
import org.springframework.transaction.annotation.EnableTransactionManagement;

/**
 * Data source, Flyway, transaction manager and JDBC stores for the tenancy database.
 * <p>
 * The stores run their statements through one {@link JdbcTemplate}, so {@code @Transactional}
 * service methods commit or roll back their writes together.
 * <p>
 * Active when {@code oblivion.database.enabled=true}. Services importing this configuration should
 * set {@code spring.flyway.enabled=false} so Boot's own Flyway auto-configuration stays out of
 * the way.
 *
 * @see TenancyDatabaseProperties
 */
@Configuration
@EnableTransactionManagement
@EnableConfigurationProperties(TenancyDatabaseProperties.class)
@ConditionalOnProperty(prefix = "oblivion.database", name = "enabled", havingValue = "true")
public class TenancyDatabaseConfig {

    private static final Logger log = LoggerFactory.getLogger(TenancyDatabaseConfig.class);

    public static final String FLYWAY_BEAN = "tenancyFlyway";

    @Bean
    public DataSource tenancyDataSource(TenancyDatabaseProperties properties) {
        HikariDataSource dataSource = DataSourceBuilder.create()
                .type(HikariDataSource.class)
                .url(properties.url())
                .username(properties.username())
                .password(properties.password())
                .build();
        dataSource.setMaximumPoolSize(properties.maximumPoolSize());
        dataSource.setPoolName("tenancy");
        return dataSource;
    }

    /** The tenancy Flyway instance, migrated before it is returned unless {@code migrate-on-startup} is false. */
    @Bean(name = FLYWAY_BEAN)
    public Flyway tenancyFlyway(DataSource tenancyDataSource, TenancyDatabaseProperties properties) {
        Flyway flyway = createFlyway(tenancyDataSource, properties.locations());
        if (properties.migrateOnStartup()) {
            MigrateResult result = flyway.migrate();
            log.info("Tenancy schema migrated to version {} ({} migrations applied)",
                    result.targetSchemaVersion, result.migrationsExecuted);
        }
        return flyway;
    }

    @Bean
    @DependsOn(FLYWAY_BEAN)
    public JdbcTemplate tenancyJdbcTemplate(DataSource tenancyDataSource) {
        return new JdbcTemplate(tenancyDataSource);
    }

    @Bean
    public DataSourceTransactionManager tenancyTransactionManager(DataSource tenancyDataSource) {
        return new DataSourceTransactionManager(tenancyDataSource);
    }

    @Bean
    public JdbcMembershipRepository jdbcMembershipRepository(JdbcTemplate tenancyJdbcTemplate) {
        return new JdbcMembershipRepository(tenancyJdbcTemplate, Clock.systemUTC());
    }

    @Bean
    public JdbcBusinessRepository jdbcBusinessRepository(JdbcTemplate tenancyJdbcTemplate) {
        return new JdbcBusinessRepository(tenancyJdbcTemplate);
    }

    @Bean
    public JdbcAuditSink jdbcAuditSink(JdbcTemplate tenancyJdbcTemplate) {
        return new JdbcAuditSink(tenancyJdbcTemplate);
    }

    /**
     * Creates a Flyway instance over {@code dataSource}. Clean is always disabled.
     */
    public static Flyway createFlyway(DataSource dataSource, String locations) {
        return Flyway.configure()
                .dataSource(dataSource)
                .locations(locations)
                .baselineOnMigrate(true)
                .cleanDisabled(true)
                .load();
    }
}
