package com.smurthy.ai.assistant.intent;

import com.smurthy.ai.assistant.tools.ToolCategory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Deterministic keyword/regex intent classifier.
 * <p>
 * For each category, every pattern is counted against the normalized query and contributes
 * {@code min(occurrences * 0.3, 1.0)}; the category keeps its strongest pattern. Naming the category
 * (or its canonical keyword) literally adds a flat 0.2, clamped to 1.0.
 */
public class LexicalIntentClassifier implements IntentClassifier {

    private static final Logger log = LoggerFactory.getLogger(LexicalIntentClassifier.class);

    static final double OCCURRENCE_WEIGHT = 0.3;
    static final double LITERAL_BONUS = 0.2;

    private static final int FLAGS = Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE;

    private static final Map<ToolCategory, List<Pattern>> INTENT_PATTERNS = new EnumMap<>(ToolCategory.class);
    private static final Map<ToolCategory, List<Pattern>> LITERAL_PATTERNS = new EnumMap<>(ToolCategory.class);

    static {
        patterns(ToolCategory.SYSTEM_INFO,
                "system.*info|hardware|specs|performance|cpu|memory|ram|disk",
                "computer.*details|pc.*info|machine.*specs",
                "how much.*ram|storage.*space|processor.*speed|process(es)?|network|ip address");
        patterns(ToolCategory.FILE_MANAGEMENT,
                "file|folder|directory|create.*file|open.*file|delete.*file",
                "folder create|file open|delete करो",
                "make.*folder|new.*directory|copy.*file|open.*app|close.*app|launch");
        patterns(ToolCategory.CODE_DEVELOPMENT,
                "code|program|script|function|class|app|website|api",
                "python|javascript|html|css|react|flask|fastapi|node|java",
                "vs ?code|वीएस code|code write|program create|sandbox",
                "bug|debug|error|fix.*code|analyze.*code");
        patterns(ToolCategory.WEB_SEARCH,
                "search|google|find.*information|look.*up|research",
                "खोजो|information|जानकारी|search करो",
                "what.*is|how.*to|tell.*me.*about",
                "weather|temperature|rain|climate|बारिश|तापमान",
                "forecast|humidity|wind|clouds|sunny|cloudy");
        patterns(ToolCategory.AUTOMATION,
                "automate|control|keyboard|mouse|click|type|press",
                "volume|cursor|scroll|hotkey|shortcut",
                "automation|macro|script.*run");
        patterns(ToolCategory.WRITING,
                "write|type|text|document|note|letter|email",
                "टाइप करो|text.*input|compose",
                "draft|content|article|blog|story");
        patterns(ToolCategory.MULTIMEDIA,
                "play.*music|video|audio|image|photo|picture",
                "media|song|movie|gallery|camera|screenshot",
                "record|capture|stream");
        patterns(ToolCategory.LEARNING,
                "learn|study|tutorial|course|lesson|teach|explain",
                "education|knowledge|skill|training|practice",
                "सिखाओ|समझाओ|tutorial|guide");
        patterns(ToolCategory.ENTERTAINMENT,
                "game|fun|joke|story|quiz|puzzle|music|movie",
                "entertainment|leisure|hobby|recreation",
                "मजा|खेल|कहानी|गाना");
        patterns(ToolCategory.PRODUCTIVITY,
                "schedule|calendar|reminder|todo|task|meeting|appointment",
                "organize|plan|manage|productivity|efficiency",
                "काम|कार्य|meeting|reminder");
        patterns(ToolCategory.COMMUNICATION,
                "email|message|send|call|chat|contact|whatsapp|telegram",
                "communicate|reply|respond|forward|share",
                "संदेश|मैसेज|call करो");
        patterns(ToolCategory.UTILITIES,
                "time|date|clock|today|now",
                "calculate|calculator|compute|convert|password",
                "clean.*up|cleanup|optimi[sz]e|stop|halt|cancel|abort");

        for (ToolCategory category : ToolCategory.values()) {
            LITERAL_PATTERNS.put(category, category.literalForms().stream()
                    .map(form -> Pattern.compile("\\b" + Pattern.quote(form) + "\\b", FLAGS))
                    .toList());
        }
    }

    static List<Pattern> intentPatterns(ToolCategory category) {
        return INTENT_PATTERNS.getOrDefault(category, List.of());
    }

    private static void patterns(ToolCategory category, String... regexes) {
        INTENT_PATTERNS.put(category, Arrays.stream(regexes)
                .map(regex -> Pattern.compile(regex, FLAGS))
                .toList());
    }

    @Override
    public IntentScores classify(String query) {
        String normalized = QueryNormalizer.normalize(query);
        if (normalized.isBlank()) {
            return IntentScores.empty();
        }

        Map<ToolCategory, Double> scores = new EnumMap<>(ToolCategory.class);
        for (ToolCategory category : ToolCategory.values()) {
            double score = 0.0;
            for (Pattern pattern : intentPatterns(category)) {
                int occurrences = countOccurrences(pattern, normalized);
                score = Math.max(score, Math.min(occurrences * OCCURRENCE_WEIGHT, 1.0));
            }
            if (namesCategory(category, normalized)) {
                score = Math.min(score + LITERAL_BONUS, 1.0);
            }
            if (score > 0.0) {
                scores.put(category, score);
            }
        }

        IntentScores result = new IntentScores(scores);
        log.debug("intent.classify q='{}' scores={}", normalized, result.asRankedMap());
        return result;
    }

    private static boolean namesCategory(ToolCategory category, String normalized) {
        for (Pattern literal : LITERAL_PATTERNS.get(category)) {
            if (literal.matcher(normalized).find()) {
                return true;
            }
        }
        return false;
    }

    private static int countOccurrences(Pattern pattern, String text) {
        Matcher matcher = pattern.matcher(text);
        int count = 0;
        while (matcher.find()) {
            count++;
        }
        return count;
    }
}
