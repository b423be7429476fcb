package com.vibetranslator.infrastructure.ai.preprocessing;

import org.springframework.stereotype.Component;

import java.util.regex.Pattern;

/**
 * Masks e-mail addresses and phone numbers before the message leaves the request boundary.
 */
@Component
public class PiiMasker {

    static final String EMAIL_PLACEHOLDER = "[email]";
    static final String PHONE_PLACEHOLDER = "[phone]";

    private static final Pattern EMAIL_PATTERN = Pattern.compile(
            "[A-Za-z0-9._%+-]+@[A-Za-z0-9.-]+\\.[A-Za-z]{2,}"
    );

    // Optional +, then at least 9 digits/separators, starting and ending on a digit
    private static final Pattern PHONE_PATTERN = Pattern.compile(
            "\\+?\\d[\\d\\s\\-()]{7,}\\d"
    );

    public String mask(String text) {
        if (text == null || text.isEmpty()) {
            return text;
        }
        String result = EMAIL_PATTERN.matcher(text).replaceAll(EMAIL_PLACEHOLDER);
        result = PHONE_PATTERN.matcher(result).replaceAll(PHONE_PLACEHOLDER);
        return result;
    }
}
