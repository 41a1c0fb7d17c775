package im.arun.provisiongraph.semantic;

import im.arun.provisiongraph.catalog.LanguageKeywords;
import im.arun.provisiongraph.classify.TextNormalizer;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Role detector backed by a keyword vocabulary: language → role → keywords.
 * Matching is case-insensitive, word-boundary anchored and tolerates a trailing
 * possessive or word continuation ("provider's", "providers").
 */
public class KeywordRoleDetector implements RoleDetector {

    private static final String SUFFIX = "(?:'s|\\w+)?";

    private final String name;
    private final Map<String, Map<String, List<Pattern>>> patternsByLanguage;

    public KeywordRoleDetector(String name, Map<String, Map<String, List<String>>> vocabulary) {
        this.name = name;
        Map<String, Map<String, List<Pattern>>> compiled = new LinkedHashMap<>();
        vocabulary.forEach((language, roles) -> {
            Map<String, List<Pattern>> rolePatterns = new LinkedHashMap<>();
            roles.forEach((role, keywords) -> {
                List<Pattern> patterns = new ArrayList<>();
                for (String keyword : keywords) {
                    patterns.add(Pattern.compile(
                        "\\b" + TextNormalizer.foldForMatching(keyword) + SUFFIX + "\\b",
                        Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE | Pattern.UNICODE_CHARACTER_CLASS));
                }
                rolePatterns.put(role, Collections.unmodifiableList(patterns));
            });
            compiled.put(LanguageKeywords.normalizeLanguage(language), Collections.unmodifiableMap(rolePatterns));
        });
        this.patternsByLanguage = Collections.unmodifiableMap(compiled);
    }

    @Override
    public List<String> detectRoles(String text, String language) {
        if (text == null || text.isBlank()) {
            return List.of();
        }
        Map<String, List<Pattern>> roles = patternsByLanguage.get(LanguageKeywords.normalizeLanguage(language));
        if (roles == null) {
            roles = patternsByLanguage.getOrDefault(LanguageKeywords.DEFAULT_LANGUAGE, Map.of());
        }

        String folded = TextNormalizer.foldForMatching(text);
        List<String> detected = new ArrayList<>();
        for (Map.Entry<String, List<Pattern>> role : roles.entrySet()) {
            for (Pattern pattern : role.getValue()) {
                if (pattern.matcher(folded).find()) {
                    detected.add(role.getKey());
                    break;
                }
            }
        }
        return detected;
    }

    public String getName() {
        return name;
    }

    @Override
    public String toString() {
        return "KeywordRoleDetector[" + name + "]";
    }
}
