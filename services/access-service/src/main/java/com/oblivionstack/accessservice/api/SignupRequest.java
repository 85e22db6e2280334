package com.oblivionstack.accessservice.api;

import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;

public record SignupRequest(
        @NotBlank String name,
        @NotBlank String slug,
        @NotBlank String industry,
        @NotBlank @Email String email) {
}
