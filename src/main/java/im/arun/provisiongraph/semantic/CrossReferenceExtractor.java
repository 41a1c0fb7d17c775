package im.arun.provisiongraph.semantic;

import im.arun.provisiongraph.catalog.LanguageKeywords;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Finds references to Articles and Annexes and normalizes them to symbolic
 * targets such as "Article_5" or "Annex_IV". Targets are not resolved.
 */
public class CrossReferenceExtractor {

    /**
     * @return distinct targets, articles first, each group in text order
     */
    public List<String> extract(String text, String language) {
        if (text == null || text.isBlank()) {
            return List.of();
        }
        LanguageKeywords keywords = LanguageKeywords.forLanguage(language);
        Set<String> references = new LinkedHashSet<>();

        Matcher articles = Pattern.compile(
            "(?i:" + Pattern.quote(keywords.getArticle()) + ")\\s+(\\d+)").matcher(text);
        while (articles.find()) {
            references.add("Article_" + articles.group(1));
        }

        Matcher annexes = Pattern.compile(
            "(?i:" + Pattern.quote(keywords.getAnnex()) + ")\\s+([IVXLCDM]+)\\b").matcher(text);
        while (annexes.find()) {
            references.add("Annex_" + annexes.group(1));
        }

        return new ArrayList<>(references);
    }
}
