package im.arun.provisiongraph.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * The complete output document for one regulation in one language.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class ProvisionGraph {

    @JsonProperty("graph_version")
    private String graphVersion;

    @JsonProperty("celex_id")
    private String celexId;

    @JsonProperty("regulation_id")
    private String regulationId;

    @JsonProperty("source_name")
    private String sourceName;

    @JsonProperty("lang")
    private String lang;

    @JsonProperty("generated_at")
    private String generatedAt;

    @JsonProperty("provisions")
    private List<Provision> provisions;

    @JsonProperty("relations")
    private List<Relation> relations;
}
