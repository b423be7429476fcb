package com.vibetranslator.infrastructure.ai.pipeline;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.vibetranslator.domain.vibe.exception.ContractViolationException;
import com.vibetranslator.domain.vibe.model.VibeCandidate;
import com.vibetranslator.testsupport.VibeJsonFixtures;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CandidateContractTest {

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final CandidateContract contract = new CandidateContract();

    private JsonNode json(String text) throws Exception {
        return objectMapper.readTree(text);
    }

    @Nested
    @DisplayName("Accepted output")
    class Accepted {

        @Test
        void canonicalOrderIsKept() throws Exception {
            List<VibeCandidate> candidates = contract.validate(json(VibeJsonFixtures.canonicalArray()));

            assertThat(candidates).extracting(VibeCandidate::vibe)
                    .containsExactlyElementsOf(VibeJsonFixtures.CANONICAL);
            assertThat(candidates.get(0).rewrittenText()).isEqualTo("Professional rewrite");
            assertThat(candidates.get(0).useCases()).containsExactly("first", "second");
            assertThat(candidates).allMatch(c -> c.score() == null);
        }

        @Test
        @DisplayName("Records are re-keyed by vibe label, not by position")
        void reorderedOutputIsCanonicalized() throws Exception {
            String shuffled = VibeJsonFixtures.arrayOf(
                    List.of("Empathetic", "Concise", "Professional", "Friendly", "Persuasive"));

            List<VibeCandidate> candidates = contract.validate(json(shuffled));

            assertThat(candidates).extracting(VibeCandidate::vibe)
                    .containsExactlyElementsOf(VibeJsonFixtures.CANONICAL);
            assertThat(candidates.get(4).rewrittenText()).isEqualTo("Empathetic rewrite");
        }

        @Test
        @DisplayName("More than four use cases are cut to the first four")
        void useCasesCapped() throws Exception {
            String payload = VibeJsonFixtures.canonicalArray().replaceFirst(
                    "\\[\"first\", \"second\"]", "[\"a\", \"b\", \"c\", \"d\", \"e\", \"f\"]");

            List<VibeCandidate> candidates = contract.validate(json(payload));

            assertThat(candidates.get(0).useCases()).containsExactly("a", "b", "c", "d");
        }
    }

    @Nested
    @DisplayName("Contract violations")
    class Violations {

        @Test
        void notAnArray() {
            assertThatThrownBy(() -> contract.validate(json("{\"vibes\": []}")))
                    .isInstanceOf(ContractViolationException.class)
                    .hasMessageContaining("array");
        }

        @Test
        void wrongCount() {
            String four = VibeJsonFixtures.arrayOf(List.of("Professional", "Friendly", "Persuasive", "Concise"));

            assertThatThrownBy(() -> contract.validate(json(four)))
                    .isInstanceOf(ContractViolationException.class)
                    .hasMessageContaining("exactly 5");
        }

        @Test
        void duplicateLabel() {
            String dup = VibeJsonFixtures.arrayOf(
                    List.of("Professional", "Professional", "Persuasive", "Concise", "Empathetic"));

            assertThatThrownBy(() -> contract.validate(json(dup)))
                    .isInstanceOf(ContractViolationException.class)
                    .hasMessageContaining("duplicate");
        }

        @Test
        void unrecognizedLabel() {
            String odd = VibeJsonFixtures.arrayOf(
                    List.of("Professional", "Sarcastic", "Persuasive", "Concise", "Empathetic"));

            assertThatThrownBy(() -> contract.validate(json(odd)))
                    .isInstanceOf(ContractViolationException.class)
                    .hasMessageContaining("Sarcastic");
        }

        @Test
        @DisplayName("Label matching is exact")
        void lowercaseLabelRejected() {
            String lower = VibeJsonFixtures.arrayOf(
                    List.of("professional", "Friendly", "Persuasive", "Concise", "Empathetic"));

            assertThatThrownBy(() -> contract.validate(json(lower)))
                    .isInstanceOf(ContractViolationException.class);
        }

        @Test
        void missingField() {
            String payload = VibeJsonFixtures.canonicalArray()
                    .replaceFirst(", \"explanation\": \"Professional explanation\"", "");

            assertThatThrownBy(() -> contract.validate(json(payload)))
                    .isInstanceOf(ContractViolationException.class)
                    .hasMessageContaining("explanation");
        }

        @Test
        @DisplayName("Non-text values are rejected rather than coerced")
        void numericTextRejected() {
            String payload = VibeJsonFixtures.canonicalArray()
                    .replaceFirst("\"Professional rewrite\"", "42");

            assertThatThrownBy(() -> contract.validate(json(payload)))
                    .isInstanceOf(ContractViolationException.class)
                    .hasMessageContaining("rewritten_text");
        }

        @Test
        void nonTextUseCase() {
            String payload = VibeJsonFixtures.canonicalArray()
                    .replaceFirst("\\[\"first\", \"second\"]", "[\"first\", 2]");

            assertThatThrownBy(() -> contract.validate(json(payload)))
                    .isInstanceOf(ContractViolationException.class)
                    .hasMessageContaining("use_cases");
        }
    }
}
