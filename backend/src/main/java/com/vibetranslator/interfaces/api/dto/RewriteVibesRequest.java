package com.vibetranslator.interfaces.api.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record RewriteVibesRequest(
        @NotBlank(message = "Message is required")
        @Size(max = 5000, message = "Message must not exceed 5000 characters")
        String message,

        @Size(max = 50, message = "Platform must not exceed 50 characters")
        String platform,

        @Size(max = 100, message = "User id must not exceed 100 characters")
        String userId
) {}
