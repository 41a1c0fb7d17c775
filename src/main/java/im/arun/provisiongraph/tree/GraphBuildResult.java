package im.arun.provisiongraph.tree;

import im.arun.provisiongraph.model.Provision;
import im.arun.provisiongraph.model.Relation;
import lombok.AllArgsConstructor;
import lombok.Value;

import java.util.List;

/**
 * Provisions in creation order and relations in emission order for one document.
 */
@Value
@AllArgsConstructor
public class GraphBuildResult {
    List<Provision> provisions;
    List<Relation> relations;
}
