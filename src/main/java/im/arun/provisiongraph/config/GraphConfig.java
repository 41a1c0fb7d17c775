package im.arun.provisiongraph.config;

import im.arun.provisiongraph.catalog.Regulation;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;

@Data
public class GraphConfig {
    private String graphVersion = "0.1";
    private String parserVersion = "0.2";
    private String defaultLanguage = "EN";
    private int snippetLength = 240;
    private String outputFileName = "parsed.json";
    private boolean validateOutput = true;
    private List<Regulation> regulations = new ArrayList<>();
}
