package im.arun.provisiongraph.tree;

import im.arun.provisiongraph.model.Provision;
import im.arun.provisiongraph.semantic.SemanticAnnotation;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Builds the immutable provision record from an open stack node. Pure: callers
 * register the result wherever it needs to go.
 */
public class ProvisionAssembler {

    private final int snippetLength;

    public ProvisionAssembler(int snippetLength) {
        this.snippetLength = snippetLength;
    }

    Provision assemble(OpenProvision node, DocumentIdentity document) {
        SemanticAnnotation semantics = node.getSemantics();
        String text = node.getText() != null ? node.getText() : "";
        int snippetEnd = Math.min(text.length(), snippetLength);
        String snippet = text.substring(0, snippetEnd) + (text.length() > snippetLength ? "..." : "");

        Map<String, Integer> snippetOffsets = new LinkedHashMap<>();
        snippetOffsets.put("start", 0);
        snippetOffsets.put("end", snippetEnd);

        Map<String, String> metadata = new LinkedHashMap<>();
        metadata.put("celex_id", document.getCelexId());
        metadata.put("source", document.getSourceName());
        metadata.put("lang", document.getLanguage());
        metadata.putAll(node.getContext());

        return Provision.builder()
            .id(node.getId())
            .parentId(node.getParentId())
            .level(node.getLevel())
            .kind(node.getLevel())
            .marker(node.getMarker())
            .lang(document.getLanguage())
            .celex(document.getCelexId())
            .regulationId(document.getRegulationId())
            .source(document.getSourceName())
            .title(node.getTitle())
            .text(text)
            .introText(node.introText())
            .path(node.getPath())
            .pathString(String.join("/", node.getPath()))
            .depth(node.getPath().size())
            .canonicalId(node.getId())
            .canonicalTags(canonicalTags(node, document))
            .requirement(semantics.isRequirement())
            .requirementType(semantics.getRequirementType())
            .roles(semantics.getRoles())
            .obligation(semantics.isObligation())
            .obligationType(semantics.getObligationType())
            .semanticRole(semantics.getSemanticRole())
            .obligations(semantics.getObligations())
            .snippet(snippet)
            .snippetCharOffsets(Collections.unmodifiableMap(snippetOffsets))
            .embeddingId(node.getId() + "_emb_0")
            .metadata(Collections.unmodifiableMap(metadata))
            .references(node.getReferences())
            .children(List.copyOf(node.children()))
            .provenance(node.getProvenance())
            .build();
    }

    private List<String> canonicalTags(OpenProvision node, DocumentIdentity document) {
        SemanticAnnotation semantics = node.getSemantics();
        List<String> tags = new ArrayList<>();
        tags.add("celex:" + document.getCelexId());
        tags.add("lang:" + document.getLanguage());
        tags.add("level:" + node.getLevel().getLabel());
        tags.add("requirement:" + (semantics.isRequirement() ? "yes" : "no"));
        tags.add("requirement_type:" + semantics.getRequirementType().getLabel());
        return List.copyOf(tags);
    }
}
