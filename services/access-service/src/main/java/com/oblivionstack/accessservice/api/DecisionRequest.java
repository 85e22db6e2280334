package com.oblivionstack.accessservice.api;

import jakarta.validation.constraints.NotBlank;

/**
 * @param resource qualified table name, e.g. {@code public.appointments}; a bare name means public
 * @param operation {@code select}, {@code insert}, {@code update} or {@code delete}
 * @param row       the row as stored, or the new row for inserts
 * @param proposed  update only: the row after the change, checked as well when present
 */
public record DecisionRequest(
        @NotBlank String resource,
        @NotBlank String operation,
        RowPayload row,
        RowPayload proposed) {
}
