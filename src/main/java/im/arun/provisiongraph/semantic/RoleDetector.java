package im.arun.provisiongraph.semantic;

import java.util.List;

/**
 * Detects actor-role tags in provision text. One detector is chosen per document
 * from the regulation family and handed to the stack machine.
 */
public interface RoleDetector {

    RoleDetector NONE = (text, language) -> List.of();

    /**
     * @return role tags in vocabulary declaration order, never null
     */
    List<String> detectRoles(String text, String language);
}
