package com.oblivionstack.security.policy;

import java.util.regex.Pattern;

/**
 * A table (or any other row collection) guarded by the policy registry.
 *
 * @param schema lower-case schema name, e.g. {@code public}
 * @param table  lower-case table name, e.g. {@code appointments}
 */
public record ProtectedResource(String schema, String table) {

    public static final String DEFAULT_SCHEMA = "public";

    private static final Pattern IDENTIFIER = Pattern.compile("^[a-z_][a-z0-9_]*$");

    public ProtectedResource {
        if (schema == null || !IDENTIFIER.matcher(schema).matches()) {
            throw new IllegalArgumentException("Invalid schema name: " + schema);
        }
        if (table == null || !IDENTIFIER.matcher(table).matches()) {
            throw new IllegalArgumentException("Invalid table name: " + table);
        }
    }

    public static ProtectedResource of(String schema, String table) {
        return new ProtectedResource(schema, table);
    }

    /** A table in the {@value #DEFAULT_SCHEMA} schema. */
    public static ProtectedResource table(String table) {
        return new ProtectedResource(DEFAULT_SCHEMA, table);
    }

    /**
     * Parses {@code schema.table} or a bare {@code table} (default schema).
     *
     * @throws IllegalArgumentException if either part is not a valid identifier
     */
    public static ProtectedResource parse(String qualifiedName) {
        if (qualifiedName == null) {
            throw new IllegalArgumentException("qualifiedName must not be null");
        }
        int dot = qualifiedName.indexOf('.');
        if (dot < 0) {
            return table(qualifiedName.strip());
        }
        return new ProtectedResource(qualifiedName.substring(0, dot).strip(), qualifiedName.substring(dot + 1).strip());
    }

    public String qualifiedName() {
        return schema + "." + table;
    }

    @Override
    public String toString() {
        return qualifiedName();
    }
}
