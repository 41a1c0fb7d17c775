package im.arun.provisiongraph.cli;

import im.arun.provisiongraph.catalog.LanguageKeywords;
import im.arun.provisiongraph.catalog.Regulation;
import im.arun.provisiongraph.config.ConfigLoader;
import im.arun.provisiongraph.config.GraphConfig;
import im.arun.provisiongraph.exception.ProvisionGraphException;
import im.arun.provisiongraph.model.ProvisionGraph;
import im.arun.provisiongraph.service.ProvisionGraphService;
import im.arun.provisiongraph.util.ExecutorProvider;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;

/**
 * Command-line interface for building provision graphs using Picocli.
 */
@Command(
    name = "provision-graph",
    description = "Build a hierarchical provision graph with semantic tags from EU regulation HTML",
    mixinStandardHelpOptions = true,
    version = "Provision Graph 1.0"
)
public class ProvisionGraphCLI implements Callable<Integer> {

    @Option(names = {"--html"}, description = "Path to a regulation HTML file (repeat for several languages)")
    private List<String> htmlPaths = new ArrayList<>();

    @Option(names = {"--celex"}, description = "CELEX id of the regulation, e.g. 32024R1689")
    private String celex;

    @Option(names = {"--lang"}, description = "Language of each --html file, in the same order (EN, DE, FR)")
    private List<String> languages = new ArrayList<>();

    @Option(names = {"--output"}, description = "Output directory; parsed.json is written under <output>/<celex>/<lang>")
    private String outputDir;

    @Option(names = {"--config"}, description = "Path to a provision-graph.yaml overriding the bundled defaults")
    private String configPath;

    @Option(names = {"--validate"}, negatable = true, defaultValue = "true",
        description = "Check structural invariants of the emitted graph (default: true)")
    private boolean validate;

    @Option(names = {"--list-regulations"}, description = "Print the regulation catalog and exit")
    private boolean listRegulations;

    @Override
    public Integer call() throws Exception {
        Map<String, Object> overrides = new HashMap<>();
        overrides.put("validate_output", validate);
        GraphConfig config = new ConfigLoader(configPath).load(overrides);
        ProvisionGraphService service = new ProvisionGraphService(config);

        if (listRegulations) {
            for (Regulation regulation : service.getCatalog().all()) {
                System.out.printf("%-12s %-20s %-28s %s%n", regulation.getCelexId(), regulation.getName(),
                    regulation.getFamily().getCode(), regulation.getJurisdiction());
            }
            return 0;
        }

        if (celex == null || celex.isBlank()) {
            System.err.println("Error: --celex is required");
            return 1;
        }
        if (htmlPaths.isEmpty()) {
            System.err.println("Error: at least one --html file is required");
            return 1;
        }
        if (!languages.isEmpty() && languages.size() != htmlPaths.size()) {
            System.err.println("Error: give one --lang per --html file (" + htmlPaths.size() + " files, "
                + languages.size() + " languages)");
            return 1;
        }

        Map<String, Path> htmlByLanguage = new LinkedHashMap<>();
        for (int i = 0; i < htmlPaths.size(); i++) {
            Path htmlPath = Paths.get(htmlPaths.get(i));
            if (!Files.exists(htmlPath)) {
                System.err.println("Error: HTML file not found: " + htmlPath);
                return 1;
            }
            String language = languages.isEmpty() ? config.getDefaultLanguage() : languages.get(i);
            if (htmlByLanguage.put(LanguageKeywords.normalizeLanguage(language), htmlPath) != null) {
                System.err.println("Error: language " + language + " given more than once");
                return 1;
            }
        }

        Map<String, ProvisionGraph> graphs;
        try {
            graphs = service.parseLanguages(celex, htmlByLanguage);
        } catch (ProvisionGraphException e) {
            System.err.println("Error processing " + e.getCelexId() + ": " + e.getMessage());
            return 1;
        }

        for (Map.Entry<String, ProvisionGraph> entry : graphs.entrySet()) {
            ProvisionGraph graph = entry.getValue();
            if (outputDir != null) {
                Path written = service.write(graph, Paths.get(outputDir).resolve(celex).resolve(graph.getLang()));
                System.out.println("Output written to: " + written);
            } else {
                System.out.println(service.toJson(graph));
            }
        }
        return 0;
    }

    public static void main(String[] args) {
        try {
            int exitCode = new CommandLine(new ProvisionGraphCLI()).execute(args);
            System.exit(exitCode);
        } finally {
            ExecutorProvider.shutdown();
        }
    }
}
