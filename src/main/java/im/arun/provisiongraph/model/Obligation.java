package im.arun.provisiongraph.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Value;

import java.util.List;

/**
 * Light-weight obligation view of a requirement provision: who must do what.
 */
@Value
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.ALWAYS)
public class Obligation {

    @JsonProperty("actors")
    List<String> actors;

    @JsonProperty("action")
    String action;

    @JsonProperty("modality")
    RequirementType modality;

    @JsonProperty("timing")
    String timing;
}
