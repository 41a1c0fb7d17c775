package im.arun.provisiongraph.util;

import im.arun.provisiongraph.model.Provision;
import im.arun.provisiongraph.model.Relation;
import im.arun.provisiongraph.model.RelationType;

import java.util.*;

/**
 * Lookup helpers over an emitted provision list and its relations.
 */
public class ProvisionTreeUtils {

    /**
     * Index provisions by id, keeping document order. Later duplicates do not replace earlier ones.
     */
    public static Map<String, Provision> indexById(List<Provision> provisions) {
        Map<String, Provision> index = new LinkedHashMap<>();
        for (Provision provision : provisions) {
            index.putIfAbsent(provision.getId(), provision);
        }
        return index;
    }

    /**
     * Child ids per parent id, in HAS_CHILD emission order.
     */
    public static Map<String, List<String>> childrenFromRelations(List<Relation> relations) {
        Map<String, List<String>> children = new LinkedHashMap<>();
        for (Relation relation : relations) {
            if (relation.getType() == RelationType.HAS_CHILD) {
                children.computeIfAbsent(relation.getSource(), k -> new ArrayList<>()).add(relation.getTarget());
            }
        }
        return children;
    }

    /**
     * Count provisions per level label, in first-seen order.
     */
    public static Map<String, Integer> countByLevel(List<Provision> provisions) {
        Map<String, Integer> counts = new LinkedHashMap<>();
        for (Provision provision : provisions) {
            counts.merge(provision.getLevel().getLabel(), 1, Integer::sum);
        }
        return counts;
    }
}
