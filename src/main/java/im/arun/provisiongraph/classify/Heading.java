package im.arun.provisiongraph.classify;

import im.arun.provisiongraph.model.Level;
import lombok.AllArgsConstructor;
import lombok.Value;

/**
 * A structural heading resolved to its level, marker and display title.
 * {@code introText} carries an article's short title, if any.
 */
@Value
@AllArgsConstructor
public class Heading {
    Level level;
    String marker;
    String title;
    String introText;
}
