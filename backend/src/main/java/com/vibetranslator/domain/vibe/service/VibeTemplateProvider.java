package com.vibetranslator.domain.vibe.service;

import com.vibetranslator.domain.vibe.model.VibeSpec;

import java.util.List;

public interface VibeTemplateProvider {

    /**
     * The five vibe specs in canonical order. Constant for the life of the process.
     */
    List<VibeSpec> getVibes();
}
