package im.arun.provisiongraph.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import im.arun.provisiongraph.catalog.LanguageKeywords;
import im.arun.provisiongraph.catalog.Regulation;
import im.arun.provisiongraph.catalog.RegulationCatalog;
import im.arun.provisiongraph.config.GraphConfig;
import im.arun.provisiongraph.exception.ProvisionGraphException;
import im.arun.provisiongraph.html.HtmlBlockReader;
import im.arun.provisiongraph.model.ProvisionGraph;
import im.arun.provisiongraph.model.RawBlock;
import im.arun.provisiongraph.semantic.RoleVocabularies;
import im.arun.provisiongraph.semantic.SemanticClassifier;
import im.arun.provisiongraph.tree.DocumentIdentity;
import im.arun.provisiongraph.tree.GraphBuildResult;
import im.arun.provisiongraph.tree.HierarchyStackMachine;
import im.arun.provisiongraph.tree.ParserProfile;
import im.arun.provisiongraph.util.ContentHash;
import im.arun.provisiongraph.util.ExecutorProvider;
import im.arun.provisiongraph.util.ProvisionTreeUtils;
import im.arun.provisiongraph.verification.GraphValidator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.stream.Collectors;

/**
 * Main service orchestrator: catalog lookup, HTML reading, hierarchy building,
 * validation and output.
 */
public class ProvisionGraphService {
    private static final Logger logger = LoggerFactory.getLogger(ProvisionGraphService.class);

    private final GraphConfig config;
    private final RegulationCatalog catalog;
    private final HtmlBlockReader htmlBlockReader;
    private final GraphValidator graphValidator;
    private final ObjectMapper objectMapper;

    public ProvisionGraphService(GraphConfig config) {
        this.config = config;
        this.catalog = new RegulationCatalog(config.getRegulations());
        this.htmlBlockReader = new HtmlBlockReader();
        this.graphValidator = new GraphValidator();
        this.objectMapper = new ObjectMapper();
        this.objectMapper.enable(SerializationFeature.INDENT_OUTPUT);
    }

    public RegulationCatalog getCatalog() {
        return catalog;
    }

    /**
     * Parse one HTML document of a catalogued regulation.
     *
     * @throws im.arun.provisiongraph.exception.UnknownRegulationException before the file is read
     *         when the CELEX id is not catalogued
     */
    public ProvisionGraph parseHtml(Path htmlPath, String celexId, String language) throws IOException {
        Regulation regulation = catalog.require(celexId);
        String lang = resolveLanguage(language);

        logger.info("Parsing {} ({}) from {}", celexId, lang, htmlPath);
        String html = Files.readString(htmlPath, StandardCharsets.UTF_8);
        List<RawBlock> blocks = htmlBlockReader.read(html, celexId, lang);
        logger.info("Extracted {} blocks from {}", blocks.size(), htmlPath);

        DocumentIdentity identity = new DocumentIdentity(celexId, regulation.regulationId(),
            regulation.getSourceName(), lang, htmlPath.toString(), ContentHash.sha256(html));
        return build(regulation, identity, blocks);
    }

    /**
     * Build a graph from blocks that were already extracted. The provenance hash
     * covers the block texts joined by newlines.
     */
    public ProvisionGraph buildGraph(String celexId, String language, List<RawBlock> blocks) {
        Regulation regulation = catalog.require(celexId);
        String lang = resolveLanguage(language);
        if (blocks == null || blocks.isEmpty()) {
            throw new ProvisionGraphException(celexId, "No blocks supplied for " + celexId);
        }

        String joined = blocks.stream().map(RawBlock::getText).collect(Collectors.joining("\n"));
        DocumentIdentity identity = new DocumentIdentity(celexId, regulation.regulationId(),
            regulation.getSourceName(), lang, null, ContentHash.sha256(joined));
        return build(regulation, identity, blocks);
    }

    /**
     * Parse several language versions of one regulation concurrently, one stack machine per document.
     * Results keep the order of the input map.
     */
    public Map<String, ProvisionGraph> parseLanguages(String celexId, Map<String, Path> htmlByLanguage) throws IOException {
        catalog.require(celexId);

        Map<String, CompletableFuture<ProvisionGraph>> futures = new LinkedHashMap<>();
        htmlByLanguage.forEach((language, path) -> futures.put(language, CompletableFuture.supplyAsync(() -> {
            try {
                return parseHtml(path, celexId, language);
            } catch (IOException e) {
                throw new UncheckedIOException(e);
            }
        }, ExecutorProvider.getExecutor())));

        Map<String, ProvisionGraph> graphs = new LinkedHashMap<>();
        for (Map.Entry<String, CompletableFuture<ProvisionGraph>> entry : futures.entrySet()) {
            try {
                graphs.put(entry.getKey(), entry.getValue().join());
            } catch (CompletionException e) {
                Throwable cause = e.getCause();
                if (cause instanceof UncheckedIOException) {
                    throw ((UncheckedIOException) cause).getCause();
                }
                if (cause instanceof RuntimeException) {
                    throw (RuntimeException) cause;
                }
                throw new ProvisionGraphException(celexId, "Parsing " + entry.getKey() + " failed", cause);
            }
        }
        return graphs;
    }

    /**
     * Write the graph as pretty-printed JSON into {@code outDir}, creating it when missing.
     */
    public Path write(ProvisionGraph graph, Path outDir) throws IOException {
        Files.createDirectories(outDir);
        Path outFile = outDir.resolve(config.getOutputFileName());
        objectMapper.writeValue(outFile.toFile(), graph);
        logger.info("Wrote {} provisions and {} relations to {}",
            graph.getProvisions().size(), graph.getRelations().size(), outFile);
        return outFile;
    }

    public String toJson(ProvisionGraph graph) throws IOException {
        return objectMapper.writeValueAsString(graph);
    }

    private ProvisionGraph build(Regulation regulation, DocumentIdentity identity, List<RawBlock> blocks) {
        ParserProfile profile = ParserProfile.forFamily(regulation.getFamily()).toBuilder()
            .parserVersion(config.getParserVersion())
            .snippetLength(config.getSnippetLength())
            .build();
        SemanticClassifier semanticClassifier = new SemanticClassifier(RoleVocabularies.forFamily(regulation.getFamily()));

        GraphBuildResult result = new HierarchyStackMachine(profile, identity, semanticClassifier).build(blocks);
        logger.info("Built {} provisions for {} ({}): {}", result.getProvisions().size(),
            identity.getCelexId(), identity.getLanguage(), ProvisionTreeUtils.countByLevel(result.getProvisions()));

        ProvisionGraph graph = new ProvisionGraph(
            config.getGraphVersion(),
            identity.getCelexId(),
            identity.getRegulationId(),
            identity.getSourceName(),
            identity.getLanguage(),
            Instant.now().truncatedTo(ChronoUnit.SECONDS).toString(),
            result.getProvisions(),
            result.getRelations());

        if (config.isValidateOutput()) {
            GraphValidator.ValidationResult validation = graphValidator.validate(graph);
            if (!validation.isValid()) {
                logger.warn("Graph for {} ({}) has {} structural violations", identity.getCelexId(),
                    identity.getLanguage(), validation.violations.size());
                validation.violations.forEach(violation -> logger.warn("  {}", violation));
            }
        }
        return graph;
    }

    private String resolveLanguage(String language) {
        if (language == null || language.isBlank()) {
            return LanguageKeywords.normalizeLanguage(config.getDefaultLanguage());
        }
        return LanguageKeywords.normalizeLanguage(language);
    }
}
