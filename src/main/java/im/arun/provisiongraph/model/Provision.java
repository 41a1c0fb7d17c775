package im.arun.provisiongraph.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Map;

/**
 * A sealed node of the provision graph. Built once by the stack machine when the
 * node leaves the ancestor stack; never mutated afterwards.
 */
@Value
@Builder
public class Provision {

    @JsonProperty("id")
    String id;

    @JsonProperty("parent_id")
    String parentId;

    @JsonProperty("level")
    Level level;

    @JsonProperty("kind")
    Level kind;

    @JsonProperty("marker")
    String marker;

    @JsonProperty("lang")
    String lang;

    @JsonProperty("celex")
    String celex;

    @JsonProperty("regulation_id")
    String regulationId;

    @JsonProperty("source")
    String source;

    @JsonProperty("title")
    String title;

    @JsonProperty("text")
    String text;

    @JsonProperty("intro_text")
    String introText;

    @JsonProperty("path")
    List<String> path;

    @JsonProperty("path_string")
    String pathString;

    @JsonProperty("depth")
    int depth;

    @JsonProperty("canonical_id")
    String canonicalId;

    @JsonProperty("canonical_tags")
    List<String> canonicalTags;

    @JsonProperty("is_requirement")
    boolean requirement;

    @JsonProperty("requirement_type")
    RequirementType requirementType;

    @JsonProperty("roles")
    List<String> roles;

    @JsonProperty("is_obligation")
    boolean obligation;

    @JsonProperty("obligation_type")
    String obligationType;

    @JsonProperty("semantic_role")
    String semanticRole;

    @JsonProperty("obligations")
    List<Obligation> obligations;

    @JsonProperty("snippet")
    String snippet;

    @JsonProperty("snippet_char_offsets")
    Map<String, Integer> snippetCharOffsets;

    @JsonProperty("embedding_id")
    String embeddingId;

    @JsonProperty("metadata")
    Map<String, String> metadata;

    @JsonProperty("references")
    List<String> references;

    @JsonProperty("children")
    List<String> children;

    @JsonProperty("provenance")
    Provenance provenance;
}
