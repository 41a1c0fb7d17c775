package im.arun.provisiongraph.catalog;

import im.arun.provisiongraph.exception.UnknownRegulationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Central metadata store for the supported legal acts.
 */
public class RegulationCatalog {
    private static final Logger logger = LoggerFactory.getLogger(RegulationCatalog.class);

    public static final String MDR_CELEX = "32017R0745";
    public static final String EU_AI_ACT_CELEX = "32024R1689";

    private final Map<String, Regulation> regulations = new LinkedHashMap<>();

    public RegulationCatalog() {
        this(List.of());
    }

    /**
     * Built-in entries plus any extra ones; extras replace built-ins with the same CELEX id.
     */
    public RegulationCatalog(Collection<Regulation> extraRegulations) {
        register(new Regulation(MDR_CELEX, "MDR 2017/745", "MDR_2017_745",
            RegulationFamily.MEDICAL_DEVICE_REGULATION, "EU"));
        register(new Regulation(EU_AI_ACT_CELEX, "EU AI Act", "EU_AI_ACT_2024",
            RegulationFamily.AI_REGULATION, "EU"));

        if (extraRegulations != null) {
            for (Regulation regulation : extraRegulations) {
                if (regulation.getCelexId() == null || regulation.getCelexId().isBlank()) {
                    logger.warn("Skipping catalog entry without CELEX id: {}", regulation);
                    continue;
                }
                register(regulation);
            }
        }
    }

    private void register(Regulation regulation) {
        if (regulation.getFamily() == null) {
            regulation.setFamily(RegulationFamily.OTHER);
        }
        if (regulation.getSourceName() == null) {
            regulation.setSourceName(regulation.getCelexId());
        }
        regulations.put(regulation.getCelexId(), regulation);
    }

    public Optional<Regulation> find(String celexId) {
        return Optional.ofNullable(celexId).map(regulations::get);
    }

    /**
     * Look up a regulation, failing fast when the CELEX id is not catalogued.
     */
    public Regulation require(String celexId) {
        return find(celexId).orElseThrow(() -> new UnknownRegulationException(celexId));
    }

    public List<Regulation> all() {
        return Collections.unmodifiableList(new ArrayList<>(regulations.values()));
    }
}
