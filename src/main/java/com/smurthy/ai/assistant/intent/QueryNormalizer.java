package com.smurthy.ai.assistant.intent;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Lower-cases a query and rewrites known Hindi / Hinglish tokens to their English equivalent.
 *
 * Replacement is plain substring substitution. No key occurs inside another key or inside any
 * replacement, so the result does not depend on the order the table is applied in.
 */
public final class QueryNormalizer {

    private static final Map<String, String> MIXED_LANGUAGE_TOKENS = new LinkedHashMap<>();

    static {
        MIXED_LANGUAGE_TOKENS.put("खोलो", "open");
        MIXED_LANGUAGE_TOKENS.put("बंद करो", "close");
        MIXED_LANGUAGE_TOKENS.put("बनाओ", "create");
        MIXED_LANGUAGE_TOKENS.put("लिखो", "write");
        MIXED_LANGUAGE_TOKENS.put("भेजो", "send");
        MIXED_LANGUAGE_TOKENS.put("ढूंढो", "search");
        MIXED_LANGUAGE_TOKENS.put("चलाओ", "play");
        MIXED_LANGUAGE_TOKENS.put("रुको", "stop");
        MIXED_LANGUAGE_TOKENS.put("सिस्टम", "system");
        MIXED_LANGUAGE_TOKENS.put("फ़ाइल", "file");
        MIXED_LANGUAGE_TOKENS.put("फोल्डर", "folder");
        MIXED_LANGUAGE_TOKENS.put("कोड", "code");
        MIXED_LANGUAGE_TOKENS.put("प्रोग्राम", "program");
        MIXED_LANGUAGE_TOKENS.put("मौसम", "weather");
        MIXED_LANGUAGE_TOKENS.put("समय", "time");
        // romanized Hinglish
        MIXED_LANGUAGE_TOKENS.put("kholo", "open");
        MIXED_LANGUAGE_TOKENS.put("banao", "create");
        MIXED_LANGUAGE_TOKENS.put("likho", "write");
        MIXED_LANGUAGE_TOKENS.put("bhejo", "send");
        MIXED_LANGUAGE_TOKENS.put("dhundho", "search");
        MIXED_LANGUAGE_TOKENS.put("chalao", "play");
    }

    private QueryNormalizer() {
    }

    static Set<String> mixedLanguageTokens() {
        return Collections.unmodifiableSet(MIXED_LANGUAGE_TOKENS.keySet());
    }

    public static String normalize(String query) {
        if (query == null) {
            return "";
        }
        String normalized = query.toLowerCase(Locale.ROOT);
        for (Map.Entry<String, String> token : MIXED_LANGUAGE_TOKENS.entrySet()) {
            normalized = normalized.replace(token.getKey(), token.getValue());
        }
        return normalized;
    }
}
