package com.vibetranslator.interfaces.api.vibe;

import com.vibetranslator.application.vibe.RewriteTopResult;
import com.vibetranslator.application.vibe.RewriteVibesResult;
import com.vibetranslator.application.vibe.VibeAppService;
import com.vibetranslator.interfaces.api.dto.FeedbackRequest;
import com.vibetranslator.interfaces.api.dto.RewriteTopRequest;
import com.vibetranslator.interfaces.api.dto.RewriteTopResponse;
import com.vibetranslator.interfaces.api.dto.RewriteVibesRequest;
import com.vibetranslator.interfaces.api.dto.RewriteVibesResponse;
import com.vibetranslator.interfaces.api.dto.VibeItem;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

@RestController
@RequestMapping("/api/v1/vibes")
@RequiredArgsConstructor
public class VibeController {

    private final VibeAppService vibeAppService;

    @PostMapping("/rewrite")
    public ResponseEntity<RewriteVibesResponse> rewrite(@Valid @RequestBody RewriteVibesRequest request) {
        RewriteVibesResult result = vibeAppService.rewriteVibes(
                request.message(), request.platform(), request.userId());

        return ResponseEntity.ok(new RewriteVibesResponse(
                result.originalMessage(),
                result.toneAnalysis(),
                VibeItem.fromAll(result.generation().candidates()),
                result.platformTips(),
                result.generation().servedBy(),
                result.generation().validationIssues()));
    }

    @PostMapping("/top")
    public ResponseEntity<RewriteTopResponse> top(@Valid @RequestBody RewriteTopRequest request) {
        RewriteTopResult result = vibeAppService.rewriteTop(
                request.message(),
                request.platform(),
                request.targetTone(),
                request.numCandidates(),
                request.userId());

        return ResponseEntity.ok(new RewriteTopResponse(
                result.originalMessage(),
                result.targetTone(),
                result.platformTips(),
                VibeItem.fromAll(result.topRewrites()),
                result.servedBy()));
    }

    @PostMapping("/guidelines/seed")
    public ResponseEntity<Map<String, Integer>> seedGuidelines() {
        return ResponseEntity.ok(Map.of("inserted", vibeAppService.seedGuidelines()));
    }

    @PostMapping("/feedback")
    public ResponseEntity<Map<String, String>> feedback(@Valid @RequestBody FeedbackRequest request) {
        String id = vibeAppService.acceptFeedback(
                request.userId(),
                request.message(),
                request.acceptedText(),
                request.platform(),
                request.targetTone());
        return ResponseEntity.ok(Map.of("stored", id));
    }
}
