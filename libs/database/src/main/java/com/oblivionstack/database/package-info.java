/**
 * Persistence for the tenancy model.
 *
 * <ul>
 *   <li>{@link com.oblivionstack.database.migration} wires the data source and runs the Flyway
 *       migrations under {@code classpath:db/migration/tenancy}
 *   <li>{@link com.oblivionstack.database.jdbc} implements the membership, business and audit
 *       stores on Spring's {@code JdbcTemplate}
 * </ul>
 */
package com.oblivionstack.database;
