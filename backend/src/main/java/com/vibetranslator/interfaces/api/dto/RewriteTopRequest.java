package com.vibetranslator.interfaces.api.dto;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record RewriteTopRequest(
        @NotBlank(message = "Message is required")
        @Size(max = 5000, message = "Message must not exceed 5000 characters")
        String message,

        @Size(max = 50, message = "Platform must not exceed 50 characters")
        String platform,

        @NotBlank(message = "Target tone is required")
        @Size(max = 50, message = "Target tone must not exceed 50 characters")
        String targetTone,

        @Min(value = 1, message = "numCandidates must be at least 1")
        @Max(value = 10, message = "numCandidates must be at most 10")
        Integer numCandidates,

        @Size(max = 100, message = "User id must not exceed 100 characters")
        String userId
) {}
