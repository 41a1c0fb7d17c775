package im.arun.provisiongraph.html;

import im.arun.provisiongraph.exception.ProvisionGraphException;
import im.arun.provisiongraph.model.RawBlock;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.nodes.Range;
import org.jsoup.parser.Parser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Reads an EUR-Lex style HTML document into text blocks in document order.
 *
 * <p>Only paragraphs, tables and h1-h4 headings become blocks. Anything inside a
 * table is part of the outermost table's block.
 */
public class HtmlBlockReader {
    private static final Logger logger = LoggerFactory.getLogger(HtmlBlockReader.class);

    private static final String BLOCK_SELECTOR = "p, table, h1, h2, h3, h4";

    /**
     * Extract blocks from raw HTML.
     *
     * @throws ProvisionGraphException when the document has no body or no text blocks
     */
    public List<RawBlock> read(String html, String celexId, String language) {
        if (html == null || html.isBlank()) {
            throw new ProvisionGraphException(celexId, "Empty HTML document for " + celexId);
        }

        Document document = Jsoup.parse(html, "", Parser.htmlParser().setTrackPosition(true));
        Element body = document.body();
        if (body == null || body.childrenSize() == 0) {
            throw new ProvisionGraphException(celexId, "HTML document for " + celexId + " has no body content");
        }

        List<RawBlock> blocks = new ArrayList<>();
        for (Element element : body.select(BLOCK_SELECTOR)) {
            if (insideTable(element)) {
                continue;
            }
            String text = element.text();
            if (text.isBlank()) {
                continue;
            }
            blocks.add(new RawBlock(element.tagName(), text, language,
                startOf(element.sourceRange()), endOf(element)));
        }

        if (blocks.isEmpty()) {
            throw new ProvisionGraphException(celexId, "No text blocks found in HTML document for " + celexId);
        }
        logger.debug("Read {} blocks from HTML for {} ({})", blocks.size(), celexId, language);
        return blocks;
    }

    private static boolean insideTable(Element element) {
        for (Element parent = element.parent(); parent != null; parent = parent.parent()) {
            if ("table".equals(parent.normalName())) {
                return true;
            }
        }
        return false;
    }

    private static int startOf(Range range) {
        return range.isTracked() ? range.startPos() : -1;
    }

    // Implicitly closed elements (</p> omitted) have no end tag range
    private static int endOf(Element element) {
        Range end = element.endSourceRange();
        if (end.isTracked()) {
            return end.endPos();
        }
        Range start = element.sourceRange();
        return start.isTracked() ? start.endPos() : -1;
    }
}
