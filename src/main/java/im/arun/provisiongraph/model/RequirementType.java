package im.arun.provisiongraph.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Normative force of a provision's text.
 */
public enum RequirementType {
    PROHIBITION("prohibition"),
    OBLIGATION("obligation"),
    PERMISSION("permission"),
    DEFINITION("definition"),
    OTHER("other");

    private final String label;

    RequirementType(String label) {
        this.label = label;
    }

    @JsonValue
    public String getLabel() {
        return label;
    }

    /**
     * Whether downstream obligation extraction treats this type as binding.
     * Definitions look like requirements but are never obligations.
     */
    public boolean isObligation() {
        return this == OBLIGATION || this == PROHIBITION || this == PERMISSION;
    }
}
