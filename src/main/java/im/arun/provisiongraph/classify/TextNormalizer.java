package im.arun.provisiongraph.classify;

import java.text.Normalizer;
import java.util.regex.Pattern;

/**
 * Text normalization shared by the classifiers.
 */
public final class TextNormalizer {

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final Pattern COMBINING_MARKS = Pattern.compile("\\p{M}+");

    private TextNormalizer() {}

    /**
     * NFKC normalization, whitespace (including non-breaking spaces) collapsed, trimmed.
     */
    public static String normalize(String text) {
        if (text == null || text.isEmpty()) {
            return "";
        }
        String normalized = Normalizer.normalize(text, Normalizer.Form.NFKC);
        normalized = normalized.replace('\u00A0', ' ');
        return WHITESPACE.matcher(normalized).replaceAll(" ").strip();
    }

    /**
     * Accent-folded form used for lexical matching. German umlauts are
     * transliterated first so that "Händler" and "haendler" fold to the same text.
     * Apply to both the text and the pattern source.
     */
    public static String foldForMatching(String text) {
        if (text == null || text.isEmpty()) {
            return "";
        }
        String folded = text
            .replace("ä", "ae").replace("Ä", "Ae")
            .replace("ö", "oe").replace("Ö", "Oe")
            .replace("ü", "ue").replace("Ü", "Ue")
            .replace("ß", "ss")
            .replace('’', '\'');
        folded = Normalizer.normalize(folded, Normalizer.Form.NFKD);
        return COMBINING_MARKS.matcher(folded).replaceAll("");
    }
}
