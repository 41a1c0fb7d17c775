package im.arun.provisiongraph.classify;

import im.arun.provisiongraph.model.Level;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("BlockClassifier Tests")
class BlockClassifierTest {

    private BlockClassifier classifier;

    @BeforeEach
    void setUp() {
        classifier = new BlockClassifier();
    }

    @Test
    @DisplayName("Should return null for blank text")
    void shouldReturnNullForBlankText() {
        assertThat(classifier.classify("     ", "p", "EN")).isNull();
        assertThat(classifier.classify(null, "p", "EN")).isNull();
    }

    @Test
    @DisplayName("Should recognise English headings from the keyword table")
    void shouldRecogniseEnglishHeadings() {
        assertThat(classifier.classify("ANNEX IV", "p", "EN").getType()).isEqualTo(BlockType.ANNEX_TITLE);
        assertThat(classifier.classify("TITLE II", "p", "EN").getType()).isEqualTo(BlockType.TITLE);
        assertThat(classifier.classify("CHAPTER III", "p", "EN").getType()).isEqualTo(BlockType.CHAPTER_TITLE);
        assertThat(classifier.classify("SECTION 2", "p", "EN").getType()).isEqualTo(BlockType.SECTION_TITLE);
        assertThat(classifier.classify("Article 5", "p", "EN").getType()).isEqualTo(BlockType.ARTICLE_TITLE);
    }

    @Test
    @DisplayName("Should use the keywords of the document language")
    void shouldUseDocumentLanguageKeywords() {
        assertThat(classifier.classify("Artikel 12", "p", "DE").getType()).isEqualTo(BlockType.ARTICLE_TITLE);
        assertThat(classifier.classify("KAPITEL I", "p", "DE").getType()).isEqualTo(BlockType.CHAPTER_TITLE);
        assertThat(classifier.classify("ANNEXE III", "p", "FR").getType()).isEqualTo(BlockType.ANNEX_TITLE);
        assertThat(classifier.classify("Artikel 12", "p", "EN").getType()).isEqualTo(BlockType.PARAGRAPH);
    }

    @Test
    @DisplayName("Should fall back to English keywords for unknown languages")
    void shouldFallBackToEnglishKeywords() {
        assertThat(classifier.classify("Article 3", "p", "IT").getType()).isEqualTo(BlockType.ARTICLE_TITLE);
    }

    @Test
    @DisplayName("Should classify tables by markup hint and everything else as paragraph")
    void shouldClassifyTablesAndParagraphs() {
        assertThat(classifier.classify("(a) the system", "table", "EN").getType()).isEqualTo(BlockType.TABLE);
        assertThat(classifier.classify("Providers shall keep records.", "p", "EN").getType())
            .isEqualTo(BlockType.PARAGRAPH);
    }

    @Test
    @DisplayName("Should normalize whitespace in classified text")
    void shouldNormalizeWhitespace() {
        ClassifiedBlock block = classifier.classify("  Article  5 \n", "p", "EN");

        assertThat(block.getText()).isEqualTo("Article 5");
        assertThat(block.getType()).isEqualTo(BlockType.ARTICLE_TITLE);
    }

    @Test
    @DisplayName("Should detect numbering prefixes in priority order")
    void shouldDetectNumberingPrefixes() {
        assertThat(classifier.detectNumbering("1.2.3 Detailed scope"))
            .extracting(NumberingMatch::getLevel, NumberingMatch::getMarker, NumberingMatch::getBody)
            .containsExactly(Level.SUBSECTION, "1.2.3", "Detailed scope");
        assertThat(classifier.detectNumbering("1.2 Scope"))
            .extracting(NumberingMatch::getLevel, NumberingMatch::getMarker)
            .containsExactly(Level.SUBSECTION, "1.2");
        assertThat(classifier.detectNumbering("3. The provider shall act."))
            .extracting(NumberingMatch::getLevel, NumberingMatch::getMarker, NumberingMatch::getBody)
            .containsExactly(Level.SECTION, "3", "The provider shall act.");
        assertThat(classifier.detectNumbering("(4) Recital text"))
            .extracting(NumberingMatch::getLevel, NumberingMatch::getMarker)
            .containsExactly(Level.PARAGRAPH, "4");
        assertThat(classifier.detectNumbering("(b) point text"))
            .extracting(NumberingMatch::getLevel, NumberingMatch::getMarker)
            .containsExactly(Level.POINT, "b");
        assertThat(classifier.detectNumbering("(ii) sub-point text"))
            .extracting(NumberingMatch::getLevel, NumberingMatch::getMarker)
            .containsExactly(Level.SUBPOINT, "ii");
    }

    @Test
    @DisplayName("Should read a single-letter roman numeral as a point")
    void shouldPreferPointForSingleLetter() {
        assertThat(classifier.detectNumbering("(i) first").getLevel()).isEqualTo(Level.POINT);
    }

    @Test
    @DisplayName("Should report no level for unnumbered text")
    void shouldReportNoLevelForUnnumberedText() {
        NumberingMatch match = classifier.detectNumbering("Subject matter");

        assertThat(match.isNumbered()).isFalse();
        assertThat(match.getMarker()).isNull();
        assertThat(match.getBody()).isEqualTo("Subject matter");
    }
}
