package com.vibetranslator.testsupport;

import com.vibetranslator.domain.vibe.exception.ProviderUnavailableException;
import com.vibetranslator.domain.vibe.service.GenerationService;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Generation service whose behaviour is fixed by the test.
 */
public class ScriptedGenerationService implements GenerationService {

    @FunctionalInterface
    public interface Responder {
        String respond(String systemPrompt, String userPrompt) throws Exception;
    }

    private final String name;
    private final Responder responder;
    private final AtomicInteger calls = new AtomicInteger();
    private final List<String> userPrompts = new ArrayList<>();

    public ScriptedGenerationService(String name, Responder responder) {
        this.name = name;
        this.responder = responder;
    }

    public static ScriptedGenerationService returning(String name, String response) {
        return new ScriptedGenerationService(name, (s, u) -> response);
    }

    public static ScriptedGenerationService failing(String name) {
        return new ScriptedGenerationService(name, (s, u) -> {
            throw new ProviderUnavailableException(name + " is down");
        });
    }

    public static ScriptedGenerationService throwingUnexpected(String name) {
        return new ScriptedGenerationService(name, (s, u) -> {
            throw new IllegalStateException("socket closed");
        });
    }

    public static ScriptedGenerationService sleeping(String name, long millis, String response) {
        return new ScriptedGenerationService(name, (s, u) -> {
            Thread.sleep(millis);
            return response;
        });
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public String complete(String systemPrompt, String userPrompt, double temperature) {
        calls.incrementAndGet();
        synchronized (userPrompts) {
            userPrompts.add(userPrompt);
        }
        try {
            return responder.respond(systemPrompt, userPrompt);
        } catch (RuntimeException e) {
            throw e;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ProviderUnavailableException(name + " interrupted", e);
        } catch (Exception e) {
            throw new ProviderUnavailableException(name + " failed", e);
        }
    }

    public int calls() {
        return calls.get();
    }

    public String lastUserPrompt() {
        synchronized (userPrompts) {
            return userPrompts.isEmpty() ? null : userPrompts.get(userPrompts.size() - 1);
        }
    }
}
