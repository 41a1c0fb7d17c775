package im.arun.provisiongraph.html;

import im.arun.provisiongraph.exception.ProvisionGraphException;
import im.arun.provisiongraph.model.RawBlock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("HtmlBlockReader Tests")
class HtmlBlockReaderTest {

    private HtmlBlockReader reader;
    private String html;

    @BeforeEach
    void setUp() throws IOException {
        reader = new HtmlBlockReader();
        try (InputStream in = getClass().getResourceAsStream("/fixtures/ai-act-excerpt.html")) {
            html = new String(in.readAllBytes(), StandardCharsets.UTF_8);
        }
    }

    @Test
    @DisplayName("Should emit paragraphs and outer tables in document order")
    void shouldEmitBlocksInDocumentOrder() {
        List<RawBlock> blocks = reader.read(html, "32024R1689", "EN");

        assertThat(blocks).extracting(RawBlock::getText).containsExactly(
            "REGULATION (EU) 2024/1689 OF THE EUROPEAN PARLIAMENT AND OF THE COUNCIL",
            "(1) The purpose of this Regulation is to improve the functioning of the internal market.",
            "(2) This Regulation should apply to providers placing AI systems on the market.",
            "CHAPTER I",
            "GENERAL PROVISIONS",
            "Article 1",
            "Subject matter",
            "1. The purpose of this Regulation is to lay down harmonised rules.",
            "Article 2",
            "1. Providers shall ensure compliance with Article 1 and Annex III.",
            "(a) the deployer may not use prohibited practices; nested note",
            "ANNEX III",
            "High-risk AI systems referred to in Article 6(2)");
        assertThat(blocks).extracting(RawBlock::getLanguage).containsOnly("EN");
    }

    @Test
    @DisplayName("Should tag blocks with their element name")
    void shouldTagBlocksWithElementName() {
        List<RawBlock> blocks = reader.read(html, "32024R1689", "EN");

        assertThat(blocks.get(0).getMarkupHint()).isEqualTo("p");
        assertThat(blocks.get(1).getMarkupHint()).isEqualTo("table");
        assertThat(blocks.get(1).isTable()).isTrue();
    }

    @Test
    @DisplayName("Should record source offsets of each element")
    void shouldRecordSourceOffsets() {
        List<RawBlock> blocks = reader.read(html, "32024R1689", "EN");

        RawBlock table = blocks.get(1);
        assertThat(table.getSourceStart()).isGreaterThan(0);
        assertThat(html.startsWith("<table", table.getSourceStart())).isTrue();
        assertThat(html.substring(table.getSourceStart(), table.getSourceEnd())).endsWith("</table>");

        RawBlock heading = blocks.get(3);
        assertThat(html.substring(heading.getSourceStart(), heading.getSourceEnd()))
            .isEqualTo("<p class=\"oj-ti-section-1\">CHAPTER I</p>");
    }

    @Test
    @DisplayName("Should read headings as blocks")
    void shouldReadHeadings() {
        List<RawBlock> blocks = reader.read("<html><body><h2>Article 7</h2><p>Text</p></body></html>", "X", "EN");

        assertThat(blocks).extracting(RawBlock::getMarkupHint).containsExactly("h2", "p");
    }

    @Test
    @DisplayName("Should fail on documents without content")
    void shouldFailOnEmptyDocuments() {
        assertThatThrownBy(() -> reader.read("", "32024R1689", "EN"))
            .isInstanceOf(ProvisionGraphException.class)
            .hasMessageContaining("32024R1689");
        assertThatThrownBy(() -> reader.read("<html><head><title>t</title></head><body></body></html>", "X", "EN"))
            .isInstanceOf(ProvisionGraphException.class);
        assertThatThrownBy(() -> reader.read("<html><body><div><span>no blocks</span></div></body></html>", "X", "EN"))
            .isInstanceOf(ProvisionGraphException.class)
            .hasMessageContaining("No text blocks");
    }
}
