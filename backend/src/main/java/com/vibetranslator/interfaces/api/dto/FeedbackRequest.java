package com.vibetranslator.interfaces.api.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record FeedbackRequest(
        @NotBlank(message = "User id is required")
        @Size(max = 100, message = "User id must not exceed 100 characters")
        String userId,

        @NotBlank(message = "Message is required")
        @Size(max = 5000, message = "Message must not exceed 5000 characters")
        String message,

        @NotBlank(message = "Accepted text is required")
        @Size(max = 5000, message = "Accepted text must not exceed 5000 characters")
        String acceptedText,

        @Size(max = 50, message = "Platform must not exceed 50 characters")
        String platform,

        @NotBlank(message = "Target tone is required")
        @Size(max = 50, message = "Target tone must not exceed 50 characters")
        String targetTone
) {}
