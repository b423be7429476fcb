package com.vibetranslator.infrastructure.ai;

import com.vibetranslator.domain.vibe.model.Vibe;
import com.vibetranslator.domain.vibe.model.VibeSpec;
import com.vibetranslator.domain.vibe.service.VibeTemplateProvider;
import org.springframework.stereotype.Component;

import java.util.List;

@Component
public class StaticVibeTemplateProvider implements VibeTemplateProvider {

    private static final List<VibeSpec> VIBES = List.of(
            new VibeSpec(Vibe.PROFESSIONAL, """
                    Rewrite in a polished, businesslike register. Lead with the point, keep sentences \
                    complete and grammatical, avoid slang and emojis, and close with a courteous line. \
                    Suitable for colleagues, clients and anyone you have not met before."""),
            new VibeSpec(Vibe.FRIENDLY, """
                    Rewrite warmly and casually, as if talking to a friend or a teammate you like. \
                    Contractions are fine, a light exclamation or a single emoji is fine, but keep the \
                    original request or information intact."""),
            new VibeSpec(Vibe.PERSUASIVE, """
                    Rewrite to win agreement. State the benefit to the reader early, back it with one \
                    concrete reason, and finish with a clear, low-friction call to action. Confident, \
                    never pushy or manipulative."""),
            new VibeSpec(Vibe.CONCISE, """
                    Rewrite as briefly as possible without losing meaning. Remove filler, hedging and \
                    repetition; prefer one or two short sentences. Keep names, dates, numbers and the \
                    actual ask."""),
            new VibeSpec(Vibe.EMPATHETIC, """
                    Rewrite with care for how the reader feels. Acknowledge their situation or effort, \
                    use gentle, supportive wording, and avoid blame. Keep the underlying message honest \
                    and clear.""")
    );

    @Override
    public List<VibeSpec> getVibes() {
        return VIBES;
    }
}
