package com.vibetranslator.infrastructure.grounding;

import java.util.List;

/**
 * Built-in platform and tone guidelines loaded by {@link InMemoryGroundingStore#seedGuidelines()}.
 * A null platform means the guideline applies everywhere.
 */
final class GuidelineSeeds {

    private GuidelineSeeds() {
    }

    record Guideline(String id, String title, String text, String platform) {}

    static final List<Guideline> ALL = List.of(
            new Guideline("guide:linkedin:structure", "LinkedIn post structure",
                    "Open with a one-line hook, keep paragraphs to two or three lines, end with a clear ask "
                            + "or question. Avoid slang; three to five relevant hashtags at the end.",
                    "linkedin"),
            new Guideline("guide:twitter:brevity", "Twitter/X brevity",
                    "Stay under 280 characters, lead with the action or news, use at most two or three "
                            + "hashtags, and split longer thoughts into a thread.",
                    "twitter"),
            new Guideline("guide:whatsapp:chat", "WhatsApp chat style",
                    "Short conversational lines, line breaks between ideas, an emoji or two to convey tone. "
                            + "One message per topic.",
                    "whatsapp"),
            new Guideline("guide:email:format", "Email formatting",
                    "Greeting, one key ask in the first paragraph, supporting detail after, and a short "
                            + "signature. Subject lines should state the ask.",
                    "email"),
            new Guideline("guide:sms:minimal", "SMS minimalism",
                    "One clear ask in a single short line, no links unless necessary, no hashtags.",
                    "sms"),
            new Guideline("guide:tone:professional", "Professional tone",
                    "Polite and precise wording, complete sentences, no slang. Close with regards or a "
                            + "note of appreciation.",
                    null),
            new Guideline("guide:tone:friendly", "Friendly tone",
                    "Warm greeting, contractions, light enthusiasm. Thanks and glad-to-help phrasing work well.",
                    null),
            new Guideline("guide:tone:persuasive", "Persuasive tone",
                    "State the benefit and impact for the reader, give one concrete reason, recommend a "
                            + "specific next step.",
                    null),
            new Guideline("guide:tone:concise", "Concise tone",
                    "Cut filler and hedging, keep one or two short sentences, preserve names, dates and numbers.",
                    null),
            new Guideline("guide:tone:empathetic", "Empathetic tone",
                    "Acknowledge feelings, show you understand, offer support, avoid blame.",
                    null)
    );
}
