package com.adlanda.phoneadvisor.model;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

/**
 * Request body for the ask endpoint.
 */
public record AskRequest(
        @NotBlank(message = "Question is required")
        @Size(min = 3, message = "Question must be at least 3 characters")
        String question
) {}
