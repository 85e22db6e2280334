package com.oblivionstack.accessservice.api;

import jakarta.validation.constraints.NotBlank;

/**
 * @param businessId business to evaluate the caller's role in; when absent, the caller's current
 *                   business, which is unspecified for callers with several
 * @param targetRole role being acted upon
 * @param permission {@code read}, {@code write}, {@code delete} or {@code owner_only}
 */
public record HierarchyRequest(String businessId, @NotBlank String targetRole, @NotBlank String permission) {
}
