/**
 * {@code JdbcTemplate} implementations of the membership, business and audit stores. Timestamps
 * are exchanged as {@link java.time.OffsetDateTime} in UTC.
 */
package com.oblivionstack.database.jdbc;
