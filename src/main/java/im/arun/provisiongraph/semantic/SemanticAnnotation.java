package im.arun.provisiongraph.semantic;

import im.arun.provisiongraph.model.Obligation;
import im.arun.provisiongraph.model.RequirementType;
import lombok.AllArgsConstructor;
import lombok.Value;

import java.util.List;

/**
 * Semantic fields computed once when a provision is created.
 */
@Value
@AllArgsConstructor
public class SemanticAnnotation {

    public static final SemanticAnnotation NONE =
        new SemanticAnnotation(false, RequirementType.OTHER, List.of(), false, null, null, List.of());

    boolean requirement;
    RequirementType requirementType;
    List<String> roles;
    boolean obligation;
    String obligationType;
    String semanticRole;
    List<Obligation> obligations;
}
