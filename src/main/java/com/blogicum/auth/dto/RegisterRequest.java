package com.blogicum.auth.dto;

import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record RegisterRequest(
        @NotBlank @Size(max = 150) String username,
        @NotBlank @Size(min = 8, max = 128) String password,
        @Email @Size(max = 254) String email
) {
}
