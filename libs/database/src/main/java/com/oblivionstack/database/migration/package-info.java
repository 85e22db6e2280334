/**
 * Data source and Flyway configuration for the tenancy database.
 */
package com.oblivionstack.database.migration;
