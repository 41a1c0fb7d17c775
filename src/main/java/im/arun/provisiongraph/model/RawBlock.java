package im.arun.provisiongraph.model;

import lombok.AllArgsConstructor;
import lombok.Value;

/**
 * One extracted text fragment in document order, with the markup element it
 * came from and its character offsets in the source (-1 when unknown).
 */
@Value
@AllArgsConstructor
public class RawBlock {
    String markupHint;
    String text;
    String language;
    int sourceStart;
    int sourceEnd;

    public RawBlock(String markupHint, String text, String language) {
        this(markupHint, text, language, -1, -1);
    }

    public boolean isTable() {
        return "table".equalsIgnoreCase(markupHint);
    }
}
