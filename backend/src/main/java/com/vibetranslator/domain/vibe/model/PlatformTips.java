package com.vibetranslator.domain.vibe.model;

public record PlatformTips(String platform, String tips) {}
