package com.vibetranslator.infrastructure.ai.ranking;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.vibetranslator.domain.vibe.exception.MalformedResponseException;
import com.vibetranslator.domain.vibe.exception.ProviderUnavailableException;
import com.vibetranslator.domain.vibe.exception.RankingContractViolationException;
import com.vibetranslator.domain.vibe.model.VibeCandidate;
import com.vibetranslator.infrastructure.ai.ProviderCallExecutor;
import com.vibetranslator.infrastructure.ai.StructuralParser;
import com.vibetranslator.testsupport.ScriptedGenerationService;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class LlmCandidateScorerTest {

    private static final List<VibeCandidate> CANDIDATES = List.of(
            new VibeCandidate("Professional", "Dear team, the report is ready.", "", List.of()),
            new VibeCandidate("Friendly", "Hey all, report's done!", "", List.of()),
            new VibeCandidate("Concise", "Report ready.", "", List.of()));

    private ExecutorService executor;
    private ProviderCallExecutor callExecutor;
    private StructuralParser parser;

    @BeforeEach
    void setUp() {
        executor = Executors.newCachedThreadPool();
        callExecutor = new ProviderCallExecutor(executor, Duration.ofSeconds(2));
        parser = new StructuralParser(new ObjectMapper());
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    private List<Double> scoreWith(String response) {
        var service = ScriptedGenerationService.returning("primary", response);
        return new LlmCandidateScorer(service, callExecutor, parser)
                .score(CANDIDATES, "The report is ready", "Concise", "slack");
    }

    @Test
    @DisplayName("Scores are matched to candidates by id even when returned out of order")
    void scoresKeyedById() {
        List<Double> scores = scoreWith("""
                [{"id": "c3", "score": 9}, {"id": "c1", "score": 6.5}, {"id": "c2", "score": 7}]""");

        assertThat(scores).containsExactly(6.5, 7.0, 9.0);
    }

    @Test
    @DisplayName("Out-of-range scores are clamped to 0..10")
    void scoresClamped() {
        List<Double> scores = scoreWith("""
                [{"id": "c1", "score": 14}, {"id": "c2", "score": -3}, {"id": "c3", "score": 5}]""");

        assertThat(scores).containsExactly(10.0, 0.0, 5.0);
    }

    @Test
    @DisplayName("Prompt lists every candidate id with its text")
    void promptCarriesIds() {
        String prompt = LlmCandidateScorer.buildUserPrompt(CANDIDATES, "The report is ready", "Concise", null);

        assertThat(prompt)
                .contains("Target tone: Concise")
                .contains("Platform: generic")
                .contains("- id c1: Dear team, the report is ready.")
                .contains("- id c3: Report ready.");
    }

    @Test
    @DisplayName("A score list of the wrong length is a ranking contract violation")
    void wrongLength() {
        assertThatThrownBy(() -> scoreWith("""
                [{"id": "c1", "score": 6}, {"id": "c2", "score": 7}]"""))
                .isInstanceOf(RankingContractViolationException.class);
    }

    @Test
    @DisplayName("A duplicated id is rejected")
    void duplicateId() {
        assertThatThrownBy(() -> scoreWith("""
                [{"id": "c1", "score": 6}, {"id": "c1", "score": 7}, {"id": "c3", "score": 8}]"""))
                .isInstanceOf(RankingContractViolationException.class)
                .hasMessageContaining("duplicate");
    }

    @Test
    @DisplayName("An unknown id leaves a candidate unscored")
    void unknownId() {
        assertThatThrownBy(() -> scoreWith("""
                [{"id": "c1", "score": 6}, {"id": "c2", "score": 7}, {"id": "c9", "score": 8}]"""))
                .isInstanceOf(RankingContractViolationException.class)
                .hasMessageContaining("c3");
    }

    @Test
    @DisplayName("A bare number array is rejected")
    void bareNumbers() {
        assertThatThrownBy(() -> scoreWith("[6, 7, 8]"))
                .isInstanceOf(RankingContractViolationException.class);
    }

    @Test
    @DisplayName("Non-JSON output is malformed")
    void nonJson() {
        assertThatThrownBy(() -> scoreWith("I would rank the second one highest."))
                .isInstanceOf(MalformedResponseException.class);
    }

    @Test
    @DisplayName("Provider failure propagates as unavailable")
    void providerFailure() {
        var scorer = new LlmCandidateScorer(ScriptedGenerationService.failing("primary"), callExecutor, parser);

        assertThatThrownBy(() -> scorer.score(CANDIDATES, "msg", "Concise", null))
                .isInstanceOf(ProviderUnavailableException.class);
    }
}
