package im.arun.provisiongraph.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Value;

@Value
@AllArgsConstructor
public class Provenance {

    @JsonProperty("parser")
    String parser;

    @JsonProperty("parser_version")
    String parserVersion;

    @JsonProperty("source_path")
    String sourcePath;

    @JsonProperty("raw_hash")
    String rawHash;

    @JsonProperty("source_start")
    int sourceStart;

    @JsonProperty("source_end")
    int sourceEnd;
}
