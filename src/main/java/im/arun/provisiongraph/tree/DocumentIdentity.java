package im.arun.provisiongraph.tree;

import lombok.AllArgsConstructor;
import lombok.Value;

/**
 * Identity and provenance of the single document one stack machine processes.
 * {@code rawHash} is computed once from the whole source document.
 */
@Value
@AllArgsConstructor
public class DocumentIdentity {
    String celexId;
    String regulationId;
    String sourceName;
    String language;
    String sourcePath;
    String rawHash;
}
