package im.arun.provisiongraph.semantic;

import im.arun.provisiongraph.catalog.LanguageKeywords;
import im.arun.provisiongraph.classify.TextNormalizer;
import im.arun.provisiongraph.model.RequirementType;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Lexical classifier for the normative force of provision text (EN, DE, FR).
 *
 * <p>Families are checked in a fixed order: prohibition, obligation, permission,
 * definition. Prohibition patterns contain obligation and permission cues
 * ("shall not", "may not"), so they must win first.
 */
public class RequirementClassifier {

    private static final List<RequirementType> PRECEDENCE = List.of(
        RequirementType.PROHIBITION,
        RequirementType.OBLIGATION,
        RequirementType.PERMISSION,
        RequirementType.DEFINITION
    );

    private static final Map<String, Map<RequirementType, List<Pattern>>> PATTERNS = new LinkedHashMap<>();

    static {
        Map<RequirementType, List<String>> en = new EnumMap<>(RequirementType.class);
        en.put(RequirementType.OBLIGATION, List.of(
            "\\bshall\\b(?=\\s|:|,|\\.|$)",
            "\\bmust\\b(?=\\s|:|,|\\.|$)",
            "\\bis required to\\b",
            "\\bis obliged to\\b",
            "\\bhas to\\b",
            "\\bshall ensure\\b"));
        en.put(RequirementType.PROHIBITION, List.of(
            "\\bshall not\\b",
            "\\bmay not\\b",
            "\\bmust not\\b",
            "\\bis prohibited\\b",
            "\\bshall refrain from\\b"));
        en.put(RequirementType.PERMISSION, List.of(
            "\\bmay\\b(?=\\s|:|,|\\.|$)",
            "\\bis permitted\\b",
            "\\bis allowed to\\b"));
        en.put(RequirementType.DEFINITION, List.of(
            "'[^']+'\\s+means\\b",
            "‘[^’]+’\\s+means\\b",
            "\"[^\"]+\"\\s+means\\b",
            "“[^”]+”\\s+means\\b",
            "\\brefers to\\b",
            "\\bdenotes\\b"));

        Map<RequirementType, List<String>> de = new EnumMap<>(RequirementType.class);
        de.put(RequirementType.OBLIGATION, List.of(
            "\\bmuss\\b",
            "\\bverpflichtet\\b",
            "\\bhat sicherzustellen\\b",
            "\\bist verpflichtet\\b"));
        de.put(RequirementType.PROHIBITION, List.of(
            "\\bdarf nicht\\b",
            "\\bist untersagt\\b",
            "\\bverboten\\b"));
        de.put(RequirementType.PERMISSION, List.of(
            "\\bdarf\\b",
            "\\bist erlaubt\\b"));
        de.put(RequirementType.DEFINITION, List.of(
            "'[^']+'\\s+bezeichnet\\b",
            "„[^“]+“\\s+bezeichnet\\b",
            "\"[^\"]+\"\\s+bezeichnet\\b",
            "\\bbezeichnet\\b",
            "\\bsteht für\\b"));

        Map<RequirementType, List<String>> fr = new EnumMap<>(RequirementType.class);
        fr.put(RequirementType.OBLIGATION, List.of(
            "\\bdoit\\b",
            "\\best tenu de\\b",
            "\\best obligé de\\b"));
        fr.put(RequirementType.PROHIBITION, List.of(
            "\\bne doit pas\\b",
            "\\best interdit\\b"));
        fr.put(RequirementType.PERMISSION, List.of(
            "\\bpeut\\b",
            "\\best autorisé à\\b"));
        fr.put(RequirementType.DEFINITION, List.of(
            "'[^']+'\\s+signifie\\b",
            "«[^»]+»\\s+signifie\\b",
            "\"[^\"]+\"\\s+signifie\\b",
            "\\bsignifie\\b",
            "\\bdésigne\\b"));

        PATTERNS.put("EN", compile(en));
        PATTERNS.put("DE", compile(de));
        PATTERNS.put("FR", compile(fr));
    }

    private static Map<RequirementType, List<Pattern>> compile(Map<RequirementType, List<String>> sources) {
        Map<RequirementType, List<Pattern>> compiled = new EnumMap<>(RequirementType.class);
        sources.forEach((type, regexes) -> {
            List<Pattern> patterns = new ArrayList<>();
            for (String regex : regexes) {
                patterns.add(Pattern.compile(TextNormalizer.foldForMatching(regex),
                    Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE));
            }
            compiled.put(type, Collections.unmodifiableList(patterns));
        });
        return Collections.unmodifiableMap(compiled);
    }

    /**
     * True when any pattern of any family matches.
     */
    public boolean isRequirement(String text, String language) {
        String folded = TextNormalizer.foldForMatching(text);
        for (List<Pattern> family : patternsFor(language).values()) {
            for (Pattern pattern : family) {
                if (pattern.matcher(folded).find()) {
                    return true;
                }
            }
        }
        return false;
    }

    /**
     * First family (in precedence order) with a matching pattern, else {@link RequirementType#OTHER}.
     */
    public RequirementType classify(String text, String language) {
        String folded = TextNormalizer.foldForMatching(text);
        Map<RequirementType, List<Pattern>> patterns = patternsFor(language);
        for (RequirementType type : PRECEDENCE) {
            for (Pattern pattern : patterns.getOrDefault(type, List.of())) {
                if (pattern.matcher(folded).find()) {
                    return type;
                }
            }
        }
        return RequirementType.OTHER;
    }

    private Map<RequirementType, List<Pattern>> patternsFor(String language) {
        return PATTERNS.getOrDefault(LanguageKeywords.normalizeLanguage(language),
            PATTERNS.get(LanguageKeywords.DEFAULT_LANGUAGE));
    }
}
