package im.arun.provisiongraph.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Typed edge between two provisions. REFERENCES targets are symbolic
 * ("Article_5", "Annex_IV") and may not exist in the same document.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class Relation {

    @JsonProperty("source")
    private String source;

    @JsonProperty("type")
    private RelationType type;

    @JsonProperty("target")
    private String target;

    public static Relation hasChild(String parentId, String childId) {
        return new Relation(parentId, RelationType.HAS_CHILD, childId);
    }

    public static Relation references(String sourceId, String target) {
        return new Relation(sourceId, RelationType.REFERENCES, target);
    }
}
