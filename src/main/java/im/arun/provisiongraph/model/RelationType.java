package im.arun.provisiongraph.model;

public enum RelationType {
    HAS_CHILD,
    REFERENCES
}
