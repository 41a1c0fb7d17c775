package im.arun.provisiongraph.classify;

import im.arun.provisiongraph.catalog.LanguageKeywords;
import im.arun.provisiongraph.model.Level;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Extracts level, marker and title from heading blocks. Malformed headings never
 * fail: the marker falls back to the first bare numeral in the text, then to the
 * keyword itself.
 */
public class HeadingInterpreter {

    private static final String SEPARATOR = "\\s*[:\\-.–—]?\\s*";
    private static final Pattern ANY_ROMAN = Pattern.compile("\\b([IVXLCDM]+)\\b", Pattern.CASE_INSENSITIVE);
    private static final Pattern ANY_ROMAN_OR_NUMBER = Pattern.compile("\\b([IVXLCDM]+|\\d+)\\b", Pattern.CASE_INSENSITIVE);
    private static final Pattern ANY_NUMBER = Pattern.compile("\\b(\\d+)\\b");

    private final Map<String, MarkerPatterns> markerPatterns = new ConcurrentHashMap<>();

    /**
     * Interpret a heading block. Returns null for non-heading blocks.
     */
    public Heading interpret(ClassifiedBlock block, String language) {
        if (block == null || !block.getType().isHeading()) {
            return null;
        }
        LanguageKeywords keywords = LanguageKeywords.forLanguage(language);
        MarkerPatterns patterns = markerPatterns.computeIfAbsent(
            LanguageKeywords.normalizeLanguage(language), lang -> new MarkerPatterns(LanguageKeywords.forLanguage(lang)));
        String text = block.getText();

        switch (block.getType()) {
            case TITLE:
                return new Heading(Level.TITLE, marker(text, patterns.title, ANY_ROMAN, "TITLE"), text, "");
            case CHAPTER_TITLE:
                return new Heading(Level.CHAPTER, marker(text, patterns.chapter, ANY_ROMAN, "CHAPTER"), text, "");
            case SECTION_TITLE:
                return new Heading(Level.SECTION,
                    marker(text, patterns.section, ANY_ROMAN_OR_NUMBER, "SECTION"), text, "");
            case ANNEX_TITLE:
                return new Heading(Level.ANNEX,
                    marker(text, patterns.annex, ANY_ROMAN, keywords.getAnnex()), text, "");
            case ARTICLE_TITLE:
                return article(text, keywords.getArticle(), patterns.article);
            default:
                return null;
        }
    }

    private Heading article(String text, String keyword, Pattern shape) {
        Matcher shaped = shape.matcher(text);
        if (shaped.matches()) {
            String marker = shaped.group(1);
            String shortTitle = shaped.group(2).strip();
            return new Heading(Level.ARTICLE, marker, keyword + " " + marker, shortTitle);
        }

        // Lenient fallback: keep the whole heading as title
        Matcher number = ANY_NUMBER.matcher(text);
        String marker = number.find() ? number.group(1) : "ARTICLE";
        return new Heading(Level.ARTICLE, marker, text, "");
    }

    private String marker(String text, Pattern keyed, Pattern fallback, String defaultMarker) {
        Matcher matcher = keyed.matcher(text);
        if (matcher.find()) {
            return matcher.group(1);
        }
        Matcher any = fallback.matcher(text);
        return any.find() ? any.group(1) : defaultMarker;
    }

    private static final class MarkerPatterns {
        private final Pattern title;
        private final Pattern chapter;
        private final Pattern section;
        private final Pattern annex;
        private final Pattern article;

        private MarkerPatterns(LanguageKeywords keywords) {
            this.title = keyed(keywords.getTitle(), "[IVXLCDM]+");
            this.chapter = keyed(keywords.getChapter(), "[IVXLCDM]+");
            this.section = keyed(keywords.getSection(), "[IVXLCDM]+|\\d+");
            this.annex = keyed(keywords.getAnnex(), "[IVXLCDM]+");
            this.article = Pattern.compile(
                "^" + Pattern.quote(keywords.getArticle()) + SEPARATOR + "(\\d+|[IVXLCDM]+)\\b\\s*(.*)$",
                Pattern.CASE_INSENSITIVE | Pattern.DOTALL);
        }

        private static Pattern keyed(String keyword, String numeral) {
            return Pattern.compile(Pattern.quote(keyword) + SEPARATOR + "(" + numeral + ")\\b", Pattern.CASE_INSENSITIVE);
        }
    }
}
