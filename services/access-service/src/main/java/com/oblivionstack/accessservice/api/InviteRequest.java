package com.oblivionstack.accessservice.api;

import jakarta.validation.constraints.NotBlank;

public record InviteRequest(@NotBlank String userId, @NotBlank String role) {
}
