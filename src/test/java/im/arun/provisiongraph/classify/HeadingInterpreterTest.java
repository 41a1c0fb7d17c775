package im.arun.provisiongraph.classify;

import im.arun.provisiongraph.model.Level;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("HeadingInterpreter Tests")
class HeadingInterpreterTest {

    private final HeadingInterpreter interpreter = new HeadingInterpreter();

    private Heading interpret(BlockType type, String text, String language) {
        return interpreter.interpret(new ClassifiedBlock(type, text), language);
    }

    @Test
    @DisplayName("Should split article number and short title")
    void shouldSplitArticleNumberAndShortTitle() {
        Heading heading = interpret(BlockType.ARTICLE_TITLE, "Article 5 Prohibited AI practices", "EN");

        assertThat(heading.getLevel()).isEqualTo(Level.ARTICLE);
        assertThat(heading.getMarker()).isEqualTo("5");
        assertThat(heading.getTitle()).isEqualTo("Article 5");
        assertThat(heading.getIntroText()).isEqualTo("Prohibited AI practices");
    }

    @Test
    @DisplayName("Should accept a separator after the article keyword")
    void shouldAcceptSeparatorAfterKeyword() {
        Heading heading = interpret(BlockType.ARTICLE_TITLE, "Artikel: 12", "DE");

        assertThat(heading.getMarker()).isEqualTo("12");
        assertThat(heading.getTitle()).isEqualTo("Artikel 12");
        assertThat(heading.getIntroText()).isEmpty();
    }

    @Test
    @DisplayName("Should keep the whole text when the article heading is malformed")
    void shouldFallBackForMalformedArticleHeading() {
        Heading withNumber = interpret(BlockType.ARTICLE_TITLE, "Article (see point 3)", "EN");
        Heading withoutNumber = interpret(BlockType.ARTICLE_TITLE, "Article to be renumbered", "EN");

        assertThat(withNumber.getMarker()).isEqualTo("3");
        assertThat(withNumber.getTitle()).isEqualTo("Article (see point 3)");
        assertThat(withoutNumber.getMarker()).isEqualTo("ARTICLE");
        assertThat(withoutNumber.getTitle()).isEqualTo("Article to be renumbered");
    }

    @Test
    @DisplayName("Should keep roman article numerals as markers")
    void shouldKeepRomanArticleMarkers() {
        Heading heading = interpret(BlockType.ARTICLE_TITLE, "Article XII Transitional provisions", "EN");

        assertThat(heading.getMarker()).isEqualTo("XII");
        assertThat(heading.getTitle()).isEqualTo("Article XII");
        assertThat(heading.getIntroText()).isEqualTo("Transitional provisions");
        assertThat(interpret(BlockType.ARTICLE_TITLE, "Article IV", "EN").getMarker()).isEqualTo("IV");
    }

    @Test
    @DisplayName("Should give the same answer when patterns are reused across languages")
    void shouldReuseCachedPatterns() {
        assertThat(interpret(BlockType.ARTICLE_TITLE, "Artikel 7", "DE").getMarker()).isEqualTo("7");
        assertThat(interpret(BlockType.ARTICLE_TITLE, "Article 8", "FR").getMarker()).isEqualTo("8");
        assertThat(interpret(BlockType.ARTICLE_TITLE, "Artikel 9", "de").getMarker()).isEqualTo("9");
        assertThat(interpret(BlockType.CHAPTER_TITLE, "KAPITEL II", "DE").getMarker()).isEqualTo("II");
    }

    @Test
    @DisplayName("Should extract roman markers for titles, chapters and annexes")
    void shouldExtractRomanMarkers() {
        assertThat(interpret(BlockType.TITLE, "TITLE II", "EN").getMarker()).isEqualTo("II");
        assertThat(interpret(BlockType.CHAPTER_TITLE, "CHAPTER III", "EN"))
            .extracting(Heading::getLevel, Heading::getMarker, Heading::getTitle)
            .containsExactly(Level.CHAPTER, "III", "CHAPTER III");
        assertThat(interpret(BlockType.ANNEX_TITLE, "ANHANG IV", "DE"))
            .extracting(Heading::getLevel, Heading::getMarker)
            .containsExactly(Level.ANNEX, "IV");
    }

    @Test
    @DisplayName("Should accept arabic or roman section markers")
    void shouldAcceptSectionMarkers() {
        assertThat(interpret(BlockType.SECTION_TITLE, "SECTION 2", "EN").getMarker()).isEqualTo("2");
        assertThat(interpret(BlockType.SECTION_TITLE, "Section IV", "EN").getMarker()).isEqualTo("IV");
    }

    @Test
    @DisplayName("Should ignore non-heading blocks")
    void shouldIgnoreNonHeadingBlocks() {
        assertThat(interpret(BlockType.PARAGRAPH, "1. Text", "EN")).isNull();
        assertThat(interpret(BlockType.TABLE, "(a) Text", "EN")).isNull();
        assertThat(interpreter.interpret(null, "EN")).isNull();
    }
}
