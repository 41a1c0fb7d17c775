package im.arun.provisiongraph.catalog;

import java.util.Locale;
import java.util.Map;

/**
 * Structural heading keywords per language. Unknown languages fall back to English.
 */
public final class LanguageKeywords {

    public static final String DEFAULT_LANGUAGE = "EN";

    private static final Map<String, LanguageKeywords> BY_LANGUAGE = Map.of(
        "EN", new LanguageKeywords("TITLE", "CHAPTER", "SECTION", "Article", "ANNEX"),
        "DE", new LanguageKeywords("TITEL", "KAPITEL", "ABSCHNITT", "Artikel", "ANHANG"),
        "FR", new LanguageKeywords("TITRE", "CHAPITRE", "SECTION", "Article", "ANNEXE")
    );

    private final String title;
    private final String chapter;
    private final String section;
    private final String article;
    private final String annex;

    private LanguageKeywords(String title, String chapter, String section, String article, String annex) {
        this.title = title;
        this.chapter = chapter;
        this.section = section;
        this.article = article;
        this.annex = annex;
    }

    public static LanguageKeywords forLanguage(String language) {
        return BY_LANGUAGE.getOrDefault(normalizeLanguage(language), BY_LANGUAGE.get(DEFAULT_LANGUAGE));
    }

    public static String normalizeLanguage(String language) {
        if (language == null || language.isBlank()) {
            return DEFAULT_LANGUAGE;
        }
        return language.trim().toUpperCase(Locale.ROOT);
    }

    public String getTitle() {
        return title;
    }

    public String getChapter() {
        return chapter;
    }

    public String getSection() {
        return section;
    }

    public String getArticle() {
        return article;
    }

    public String getAnnex() {
        return annex;
    }
}
