package im.arun.provisiongraph.classify;

import im.arun.provisiongraph.model.Level;
import lombok.AllArgsConstructor;
import lombok.Value;

/**
 * Result of numbering detection. {@code level} and {@code marker} are null when
 * the text carries no recognised numbering; {@code body} is then the whole text.
 */
@Value
@AllArgsConstructor
public class NumberingMatch {
    Level level;
    String marker;
    String body;

    public boolean isNumbered() {
        return level != null;
    }
}
