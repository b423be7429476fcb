package com.vibetranslator.interfaces.api.dto;

public record ErrorResponse(String code, String message) {}
