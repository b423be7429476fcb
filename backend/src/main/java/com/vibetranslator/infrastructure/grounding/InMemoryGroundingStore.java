package com.vibetranslator.infrastructure.grounding;

import com.vibetranslator.domain.vibe.model.GroundingDocument;
import com.vibetranslator.domain.vibe.service.GroundingStore;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HexFormat;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Process-local guidance store: seeded platform/tone guidelines plus accepted user examples.
 * <p>
 * Relevance = share of query terms found in the document, plus a boost when the document
 * targets the requested platform. Documents for other platforms and other users' examples
 * are never returned. Ties break by document id for deterministic output.
 * </p>
 */
@Slf4j
@Component
public class InMemoryGroundingStore implements GroundingStore {

    static final double PLATFORM_BOOST = 0.5;

    private static final Pattern TERM_PATTERN = Pattern.compile("\\w{3,}", Pattern.UNICODE_CHARACTER_CLASS);

    private static final Set<String> STOPWORDS = Set.of(
            "the", "and", "for", "you", "your", "with", "that", "this", "are", "was",
            "guidance", "generic", "have", "from", "will", "can", "not"
    );

    public record StoredDocument(
            String id,
            String title,
            String text,
            String platform,
            String userId,
            Set<String> terms
    ) {}

    private final Map<String, StoredDocument> documents = new LinkedHashMap<>();
    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();

    private final boolean seedOnStartup;
    private final int maxExamplesPerUser;

    public InMemoryGroundingStore(@Value("${vibe.grounding.seed-on-startup:true}") boolean seedOnStartup,
                                  @Value("${vibe.grounding.max-examples-per-user:50}") int maxExamplesPerUser) {
        if (maxExamplesPerUser < 1) {
            throw new IllegalArgumentException("vibe.grounding.max-examples-per-user must be >= 1");
        }
        this.seedOnStartup = seedOnStartup;
        this.maxExamplesPerUser = maxExamplesPerUser;
    }

    @PostConstruct
    void seedIfConfigured() {
        if (seedOnStartup) {
            seedGuidelines();
        }
    }

    /**
     * Inserts the built-in guidelines that are not present yet.
     *
     * @return number of newly inserted documents
     */
    public int seedGuidelines() {
        int inserted = 0;
        lock.writeLock().lock();
        try {
            for (GuidelineSeeds.Guideline g : GuidelineSeeds.ALL) {
                if (!documents.containsKey(g.id())) {
                    documents.put(g.id(), toStored(g.id(), g.title(), g.text(), g.platform(), null));
                    inserted++;
                }
            }
        } finally {
            lock.writeLock().unlock();
        }
        log.info("[Grounding] Seeded {} guideline documents (total: {})", inserted, size());
        return inserted;
    }

    /**
     * Stores an accepted rewrite as a style example for this user. Same input → same id (upsert).
     * Past {@code maxExamplesPerUser} the user's least recently stored example is evicted.
     *
     * @return the document id
     */
    public String upsertUserExample(String userId, String message, String platform,
                                    String targetTone, String acceptedText) {
        if (userId == null || userId.isBlank()) {
            throw new IllegalArgumentException("userId is required");
        }
        String normalizedPlatform = normalizePlatform(platform);
        String id = "user:" + userId + ":" + shortHash(normalizedPlatform + "|" + targetTone + "|" + message);
        String title = "Accepted " + targetTone + " example (" + normalizedPlatform + ")";
        String text = "Tone: " + targetTone + ". Original: " + message + " Accepted rewrite: " + acceptedText;

        lock.writeLock().lock();
        try {
            // Re-insert so an upsert counts as the most recent example
            documents.remove(id);
            documents.put(id, toStored(id, title, text,
                    "generic".equals(normalizedPlatform) ? null : normalizedPlatform, userId));
            evictOldestExamples(userId);
        } finally {
            lock.writeLock().unlock();
        }
        log.info("[Grounding] Stored user example {}", id);
        return id;
    }

    @Override
    public List<GroundingDocument> retrieve(String query, String platform, String userId, int topK) {
        Set<String> queryTerms = terms(query);
        String normalizedPlatform = platform == null || platform.isBlank() ? null : normalizePlatform(platform);

        record Scored(StoredDocument doc, double relevance) {}

        List<Scored> scored = new ArrayList<>();
        lock.readLock().lock();
        try {
            for (StoredDocument doc : documents.values()) {
                if (doc.userId() != null && !doc.userId().equals(userId)) {
                    continue;
                }
                if (doc.platform() != null && !doc.platform().equals(normalizedPlatform)) {
                    continue;
                }
                double relevance = relevance(queryTerms, doc, normalizedPlatform);
                if (relevance > 0) {
                    scored.add(new Scored(doc, relevance));
                }
            }
        } finally {
            lock.readLock().unlock();
        }

        return scored.stream()
                .sorted(Comparator.comparingDouble(Scored::relevance).reversed()
                        .thenComparing(s -> s.doc().id()))
                .limit(Math.max(0, topK))
                .map(s -> new GroundingDocument(s.doc().title(), s.doc().text(), s.relevance()))
                .toList();
    }

    public int countUserExamples(String userId) {
        lock.readLock().lock();
        try {
            return (int) documents.values().stream()
                    .filter(doc -> userId.equals(doc.userId()))
                    .count();
        } finally {
            lock.readLock().unlock();
        }
    }

    public int size() {
        lock.readLock().lock();
        try {
            return documents.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    // Caller holds the write lock; map order is insertion order, oldest first
    private void evictOldestExamples(String userId) {
        List<String> owned = documents.values().stream()
                .filter(doc -> userId.equals(doc.userId()))
                .map(StoredDocument::id)
                .toList();
        int excess = owned.size() - maxExamplesPerUser;
        for (int i = 0; i < excess; i++) {
            documents.remove(owned.get(i));
            log.info("[Grounding] Evicted user example {} (limit {})", owned.get(i), maxExamplesPerUser);
        }
    }

    private static double relevance(Set<String> queryTerms, StoredDocument doc, String platform) {
        double overlap = 0;
        if (!queryTerms.isEmpty()) {
            long hits = queryTerms.stream().filter(doc.terms()::contains).count();
            overlap = (double) hits / queryTerms.size();
        }
        double boost = platform != null && platform.equals(doc.platform()) ? PLATFORM_BOOST : 0;
        return overlap + boost;
    }

    private static StoredDocument toStored(String id, String title, String text, String platform, String userId) {
        return new StoredDocument(id, title, text, platform, userId, terms(title + " " + text));
    }

    static Set<String> terms(String text) {
        Set<String> result = new LinkedHashSet<>();
        if (text == null) {
            return result;
        }
        Matcher m = TERM_PATTERN.matcher(text.toLowerCase(Locale.ROOT));
        while (m.find()) {
            String term = m.group();
            if (!STOPWORDS.contains(term)) {
                result.add(term);
            }
        }
        return result;
    }

    private static String normalizePlatform(String platform) {
        return platform == null || platform.isBlank() ? "generic" : platform.strip().toLowerCase(Locale.ROOT);
    }

    private static String shortHash(String value) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] hash = digest.digest(value.getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(hash).substring(0, 16);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
