package com.oblivionstack.database.migration;

import static org.assertj.core.api.Assertions.assertThat;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

/**
 * Checks that the migration scripts are packaged where Flyway looks for them.
 */
@DisplayName("Migration SQL resources")
class MigrationResourceTest {

    private static final String BASE = "db/migration/tenancy/";

    @Nested
    @DisplayName("V1 tenancy schema")
    class TenancySchema {

        @Test
        @DisplayName("creates businesses and business_users")
        void createsTables() throws IOException {
            String sql = read(BASE + "V1__tenancy_schema.sql");

            assertThat(sql).containsIgnoringCase("CREATE TABLE businesses");
            assertThat(sql).containsIgnoringCase("CREATE TABLE business_users");
        }

        @Test
        @DisplayName("enforces one membership per business and user")
        void uniqueMembership() throws IOException {
            assertThat(read(BASE + "V1__tenancy_schema.sql")).contains("UNIQUE (business_id, user_id)");
        }

        @Test
        @DisplayName("constrains roles and statuses to the known values")
        void checkConstraints() throws IOException {
            String sql = read(BASE + "V1__tenancy_schema.sql");

            assertThat(sql).contains("role IN ('owner', 'admin', 'manager', 'staff', 'client')");
            assertThat(sql).contains("status IN ('active', 'inactive', 'pending')");
        }
    }

    @Test
    @DisplayName("V2 creates the audit log")
    void auditSchema() throws IOException {
        assertThat(read(BASE + "V2__audit_schema.sql")).containsIgnoringCase("CREATE TABLE audit_logs");
    }

    private String read(String path) throws IOException {
        try (InputStream is = getClass().getClassLoader().getResourceAsStream(path)) {
            assertThat(is).as(path + " must be on the classpath").isNotNull();
            return new String(is.readAllBytes(), StandardCharsets.UTF_8);
        }
    }
}
