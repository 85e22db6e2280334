package com.oblivionstack.audit;

import java.util.ArrayList;
import java.util.List;

/**
 * Checks an {@link AuditRecord} for required fields and for data that matches its action.
 * Returns every problem at once.
 */
public final class AuditRecordValidator {

    private AuditRecordValidator() {
        // utility class
    }

    public static ValidationResult validate(AuditRecord record) {
        List<String> errors = new ArrayList<>();

        if (record.id() == null) {
            errors.add("id must not be null");
        }
        if (isBlank(record.tableName())) {
            errors.add("tableName must not be null or blank");
        }
        if (record.action() == null) {
            errors.add("action must not be null");
        } else {
            switch (record.action()) {
                case INSERT -> {
                    requireRecordId(record, errors);
                    if (record.newData() == null) {
                        errors.add("INSERT requires newData");
                    }
                }
                case UPDATE -> {
                    requireRecordId(record, errors);
                    if (record.oldData() == null || record.newData() == null) {
                        errors.add("UPDATE requires oldData and newData");
                    }
                }
                case DELETE -> {
                    requireRecordId(record, errors);
                    if (record.oldData() == null) {
                        errors.add("DELETE requires oldData");
                    }
                }
                case TRUNCATE -> {
                    if (record.oldData() != null || record.newData() != null) {
                        errors.add("TRUNCATE must not carry row data");
                    }
                }
            }
        }
        if (record.createdAt() == null) {
            errors.add("createdAt must not be null");
        }

        return errors.isEmpty() ? ValidationResult.ok() : ValidationResult.fail(errors);
    }

    private static void requireRecordId(AuditRecord record, List<String> errors) {
        if (isBlank(record.recordId())) {
            errors.add("recordId must not be null or blank for " + record.action());
        }
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }
}
