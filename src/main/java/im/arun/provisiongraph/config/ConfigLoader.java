package im.arun.provisiongraph.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import im.arun.provisiongraph.catalog.Regulation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Map;

public class ConfigLoader {
    private static final Logger logger = LoggerFactory.getLogger(ConfigLoader.class);
    static final String CONFIG_RESOURCE = "provision-graph.yaml";

    private final ObjectMapper yamlMapper = new ObjectMapper(new YAMLFactory())
        .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    private final GraphConfig defaultConfig;

    public ConfigLoader() {
        this(null);
    }

    public ConfigLoader(String configPath) {
        this.defaultConfig = loadDefaultConfig(configPath);
    }

    private GraphConfig loadDefaultConfig(String configPath) {
        GraphConfig config = new GraphConfig();
        boolean found = false;

        // Classpath defaults first, then the file on top of them
        try (InputStream resourceStream = getClass().getClassLoader().getResourceAsStream(CONFIG_RESOURCE)) {
            if (resourceStream != null) {
                config = yamlMapper.readerForUpdating(config).readValue(resourceStream);
                found = true;
            }
        } catch (IOException e) {
            logger.warn("Failed to load {} from classpath, using defaults: {}", CONFIG_RESOURCE, e.getMessage());
        }

        if (configPath != null) {
            Path path = Paths.get(configPath);
            if (Files.exists(path)) {
                try {
                    config = yamlMapper.readerForUpdating(config).readValue(path.toFile());
                    found = true;
                } catch (IOException e) {
                    logger.warn("Failed to load configuration from {}: {}", path, e.getMessage());
                }
            } else {
                logger.warn("Configuration file {} does not exist", path);
            }
        }

        if (!found) {
            logger.warn("No {} found, using default configuration", CONFIG_RESOURCE);
        }
        return config;
    }

    public GraphConfig load() {
        return load(null);
    }

    public GraphConfig load(Map<String, Object> userOptions) {
        GraphConfig config = copyConfig(defaultConfig);

        if (userOptions == null || userOptions.isEmpty()) {
            return config;
        }

        // Merge user options into config
        userOptions.forEach((key, value) -> {
            try {
                switch (key) {
                    case "graph_version":
                    case "graphVersion":
                        if (value instanceof String) config.setGraphVersion((String) value);
                        break;
                    case "parser_version":
                    case "parserVersion":
                        if (value instanceof String) config.setParserVersion((String) value);
                        break;
                    case "default_language":
                    case "defaultLanguage":
                        if (value instanceof String) config.setDefaultLanguage((String) value);
                        break;
                    case "snippet_length":
                    case "snippetLength":
                        if (value instanceof Integer) config.setSnippetLength((Integer) value);
                        break;
                    case "output_file_name":
                    case "outputFileName":
                        if (value instanceof String) config.setOutputFileName((String) value);
                        break;
                    case "validate_output":
                    case "validateOutput":
                        config.setValidateOutput(parseBoolean(value));
                        break;
                    default:
                        logger.warn("Unknown configuration key: {}", key);
                }
            } catch (Exception e) {
                logger.error("Error setting config key {}: {}", key, e.getMessage());
            }
        });

        return config;
    }

    private boolean parseBoolean(Object value) {
        if (value instanceof Boolean) {
            return (Boolean) value;
        }
        if (value instanceof String) {
            return "yes".equalsIgnoreCase((String) value) || "true".equalsIgnoreCase((String) value);
        }
        return false;
    }

    private GraphConfig copyConfig(GraphConfig source) {
        GraphConfig copy = new GraphConfig();
        copy.setGraphVersion(source.getGraphVersion());
        copy.setParserVersion(source.getParserVersion());
        copy.setDefaultLanguage(source.getDefaultLanguage());
        copy.setSnippetLength(source.getSnippetLength());
        copy.setOutputFileName(source.getOutputFileName());
        copy.setValidateOutput(source.isValidateOutput());
        copy.setRegulations(new ArrayList<>());
        if (source.getRegulations() != null) {
            for (Regulation regulation : source.getRegulations()) {
                copy.getRegulations().add(new Regulation(regulation.getCelexId(), regulation.getName(),
                    regulation.getSourceName(), regulation.getFamily(), regulation.getJurisdiction()));
            }
        }
        return copy;
    }
}
