package im.arun.provisiongraph.verification;

import im.arun.provisiongraph.model.Level;
import im.arun.provisiongraph.model.Provision;
import im.arun.provisiongraph.model.ProvisionGraph;
import im.arun.provisiongraph.model.Relation;
import im.arun.provisiongraph.model.RelationType;
import im.arun.provisiongraph.util.ProvisionTreeUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * Checks the structural guarantees of an emitted provision graph.
 */
public class GraphValidator {
    private static final Logger logger = LoggerFactory.getLogger(GraphValidator.class);

    /**
     * Validation result containing the provision count and every violation found.
     */
    public static class ValidationResult {
        public final int provisionCount;
        public final List<String> violations;

        public ValidationResult(int provisionCount, List<String> violations) {
            this.provisionCount = provisionCount;
            this.violations = violations;
        }

        public boolean isValid() {
            return violations.isEmpty();
        }
    }

    public ValidationResult validate(ProvisionGraph graph) {
        return validate(graph.getProvisions(), graph.getRelations());
    }

    public ValidationResult validate(List<Provision> provisions, List<Relation> relations) {
        List<String> violations = new ArrayList<>();

        Set<String> seen = new HashSet<>();
        for (Provision provision : provisions) {
            if (!seen.add(provision.getId())) {
                violations.add("Duplicate id: " + provision.getId());
            }
        }

        Map<String, Provision> index = ProvisionTreeUtils.indexById(provisions);
        Map<String, Integer> hasChildEdges = new HashMap<>();
        for (Relation relation : relations) {
            if (relation.getType() == RelationType.HAS_CHILD) {
                hasChildEdges.merge(relation.getSource() + "->" + relation.getTarget(), 1, Integer::sum);
            }
        }

        for (Provision provision : provisions) {
            checkParent(provision, index, hasChildEdges, violations);
            checkDepth(provision, violations);
        }

        Map<String, List<String>> childrenByEdge = ProvisionTreeUtils.childrenFromRelations(relations);
        for (Provision provision : provisions) {
            List<String> expected = childrenByEdge.getOrDefault(provision.getId(), List.of());
            List<String> actual = provision.getChildren() != null ? provision.getChildren() : List.of();
            if (!expected.equals(actual)) {
                violations.add("Children of " + provision.getId() + " " + actual
                    + " disagree with HAS_CHILD edges " + expected);
            }
        }

        if (violations.isEmpty()) {
            logger.debug("Graph with {} provisions passed validation", provisions.size());
        } else {
            logger.debug("Graph with {} provisions has {} violations", provisions.size(), violations.size());
        }
        return new ValidationResult(provisions.size(), Collections.unmodifiableList(violations));
    }

    private void checkParent(Provision provision, Map<String, Provision> index,
                             Map<String, Integer> hasChildEdges, List<String> violations) {
        String parentId = provision.getParentId();
        if (parentId == null) {
            return;
        }

        Provision parent = index.get(parentId);
        if (parent == null) {
            violations.add("Parent " + parentId + " of " + provision.getId() + " is not emitted");
            return;
        }

        int edges = hasChildEdges.getOrDefault(parentId + "->" + provision.getId(), 0);
        if (edges != 1) {
            violations.add("Expected one HAS_CHILD edge " + parentId + " -> " + provision.getId()
                + ", found " + edges);
        }

        if (provision.getLevel() == Level.RECITAL || parent.getLevel() == Level.RECITAL) {
            return;
        }
        if (parent.getLevel().getRank() >= provision.getLevel().getRank()) {
            violations.add("Rank of " + provision.getId() + " (" + provision.getLevel().getLabel()
                + ") does not exceed parent rank (" + parent.getLevel().getLabel() + ")");
        }
    }

    private void checkDepth(Provision provision, List<String> violations) {
        int pathSize = provision.getPath() != null ? provision.getPath().size() : 0;
        if (provision.getDepth() != pathSize) {
            violations.add("Depth " + provision.getDepth() + " of " + provision.getId()
                + " does not match path length " + pathSize);
        }
    }
}
