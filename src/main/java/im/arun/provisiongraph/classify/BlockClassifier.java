package im.arun.provisiongraph.classify;

import im.arun.provisiongraph.catalog.LanguageKeywords;
import im.arun.provisiongraph.model.Level;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Maps a raw text fragment to a structural guess: a heading kind from the
 * per-language keyword table, or a numbering-derived level.
 * Numerals are matched lexically only.
 */
public class BlockClassifier {

    private static final List<NumberingPattern> NUMBERING_PATTERNS = List.of(
        new NumberingPattern("^(\\d+\\.\\d+\\.\\d+)\\s+(.+)", Level.SUBSECTION),
        new NumberingPattern("^(\\d+\\.\\d+)\\s+(.+)", Level.SUBSECTION),
        new NumberingPattern("^(\\d+)\\.\\s+(.+)", Level.SECTION),
        new NumberingPattern("^\\((\\d+)\\)\\s*(.+)", Level.PARAGRAPH),
        new NumberingPattern("^\\(([a-z])\\)\\s*(.+)", Level.POINT),
        new NumberingPattern("^\\(([ivxlcdm]+)\\)\\s*(.+)", Level.SUBPOINT)
    );

    private final Map<String, HeadingPatterns> headingPatterns = new ConcurrentHashMap<>();

    /**
     * Classify a fragment. Returns null when the normalized text is empty.
     *
     * @param text raw fragment text
     * @param markupHint element name the fragment came from (e.g. "p", "table"), may be null
     * @param language language code used for keyword lookup
     */
    public ClassifiedBlock classify(String text, String markupHint, String language) {
        String normalized = TextNormalizer.normalize(text);
        if (normalized.isEmpty()) {
            return null;
        }

        HeadingPatterns patterns = headingPatterns.computeIfAbsent(
            LanguageKeywords.normalizeLanguage(language), lang -> new HeadingPatterns(LanguageKeywords.forLanguage(lang)));

        if (patterns.annex.matcher(normalized).lookingAt()) {
            return new ClassifiedBlock(BlockType.ANNEX_TITLE, normalized);
        }
        if (patterns.title.matcher(normalized).lookingAt()) {
            return new ClassifiedBlock(BlockType.TITLE, normalized);
        }
        if (patterns.chapter.matcher(normalized).lookingAt()) {
            return new ClassifiedBlock(BlockType.CHAPTER_TITLE, normalized);
        }
        if (patterns.section.matcher(normalized).lookingAt()) {
            return new ClassifiedBlock(BlockType.SECTION_TITLE, normalized);
        }
        if (patterns.article.matcher(normalized).lookingAt()) {
            return new ClassifiedBlock(BlockType.ARTICLE_TITLE, normalized);
        }
        if ("table".equalsIgnoreCase(markupHint)) {
            return new ClassifiedBlock(BlockType.TABLE, normalized);
        }
        return new ClassifiedBlock(BlockType.PARAGRAPH, normalized);
    }

    /**
     * Detect a numbering prefix. Patterns are tried in priority order and the first match wins.
     */
    public NumberingMatch detectNumbering(String text) {
        for (NumberingPattern numbering : NUMBERING_PATTERNS) {
            Matcher matcher = numbering.pattern.matcher(text);
            if (matcher.matches()) {
                return new NumberingMatch(numbering.level, matcher.group(1), matcher.group(2));
            }
        }
        return new NumberingMatch(null, null, text);
    }

    private static final class NumberingPattern {
        private final Pattern pattern;
        private final Level level;

        private NumberingPattern(String regex, Level level) {
            this.pattern = Pattern.compile(regex, Pattern.CASE_INSENSITIVE | Pattern.DOTALL);
            this.level = level;
        }
    }

    private static final class HeadingPatterns {
        private final Pattern annex;
        private final Pattern title;
        private final Pattern chapter;
        private final Pattern section;
        private final Pattern article;

        private HeadingPatterns(LanguageKeywords keywords) {
            this.annex = heading(keywords.getAnnex(), "[IVXLCDM]+");
            this.title = heading(keywords.getTitle(), "[IVXLCDM]+");
            this.chapter = heading(keywords.getChapter(), "[IVXLCDM]+");
            this.section = heading(keywords.getSection(), "(?:[IVXLCDM]+|\\d+)");
            this.article = heading(keywords.getArticle(), "(?:\\d+|[IVXLCDM]+)");
        }

        private static Pattern heading(String keyword, String numeral) {
            return Pattern.compile(Pattern.quote(keyword) + "\\s+" + numeral + "\\b", Pattern.CASE_INSENSITIVE);
        }
    }
}
