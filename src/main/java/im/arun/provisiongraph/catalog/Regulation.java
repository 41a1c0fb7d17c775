package im.arun.provisiongraph.catalog;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Identity and scope of one legal act, keyed by its CELEX id.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class Regulation {

    @JsonProperty("celex_id")
    private String celexId;

    @JsonProperty("name")
    private String name;

    @JsonProperty("source_name")
    private String sourceName;

    @JsonProperty("type")
    private RegulationFamily family;

    @JsonProperty("jurisdiction")
    private String jurisdiction;

    /**
     * Regulation id written into every provision: the human name, or the CELEX id when unnamed.
     */
    public String regulationId() {
        return name != null && !name.isBlank() ? name : celexId;
    }
}
