package im.arun.provisiongraph.tree;

import im.arun.provisiongraph.model.Level;
import im.arun.provisiongraph.model.Provenance;
import im.arun.provisiongraph.semantic.SemanticAnnotation;
import lombok.AccessLevel;
import lombok.Getter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * A provision that is still on the ancestor stack. Only its intro text and its
 * children list may grow; everything else is fixed at creation.
 */
@Getter
class OpenProvision {
    private final int order;
    private final String id;
    private final String parentId;
    private final Level level;
    private final String marker;
    private final String title;
    private final String text;
    private final List<String> path;
    private final Map<String, String> context;
    private final SemanticAnnotation semantics;
    private final List<String> references;
    private final Provenance provenance;

    @Getter(AccessLevel.NONE)
    private final StringBuilder introText;
    @Getter(AccessLevel.NONE)
    private final List<String> children = new ArrayList<>();

    OpenProvision(int order, String id, String parentId, Level level, String marker, String title, String text,
                  String introText, List<String> path, Map<String, String> context, SemanticAnnotation semantics,
                  List<String> references, Provenance provenance) {
        this.order = order;
        this.id = id;
        this.parentId = parentId;
        this.level = level;
        this.marker = marker;
        this.title = title;
        this.text = text;
        this.introText = new StringBuilder(introText != null ? introText : "");
        this.path = List.copyOf(path);
        this.context = context;
        this.semantics = semantics;
        this.references = List.copyOf(references);
        this.provenance = provenance;
    }

    boolean isFlat() {
        return level.isFlat();
    }

    int rank() {
        return level.getRank();
    }

    /**
     * Append unlabeled text that follows this node before its next numbered child.
     */
    void absorb(String fragment) {
        if (fragment == null || fragment.isBlank()) {
            return;
        }
        if (introText.length() > 0) {
            introText.append(' ');
        }
        introText.append(fragment.strip());
    }

    void addChild(String childId) {
        children.add(childId);
    }

    String introText() {
        return introText.toString().strip();
    }

    List<String> children() {
        return Collections.unmodifiableList(children);
    }
}
