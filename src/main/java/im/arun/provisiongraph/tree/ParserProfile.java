package im.arun.provisiongraph.tree;

import im.arun.provisiongraph.catalog.RegulationFamily;
import im.arun.provisiongraph.model.Level;
import lombok.Builder;
import lombok.Value;

import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Per-family knobs of the hierarchy builder.
 */
@Value
@Builder(toBuilder = true)
public class ParserProfile {

    String parserName;

    @Builder.Default
    String parserVersion = "0.2";

    /** Remaps raw numbering levels to canonical levels before rank comparison. */
    @Builder.Default
    Map<Level, Level> levelNormalization = Map.of(
        Level.SECTION, Level.PARAGRAPH,
        Level.SUBSECTION, Level.PARAGRAPH,
        Level.POINT, Level.LETTER
    );

    @Builder.Default
    List<Level> contextLevels = List.of(Level.TITLE, Level.CHAPTER, Level.SECTION, Level.ARTICLE);

    /** Container levels that skip requirement and role classification. */
    @Builder.Default
    Set<Level> nonRequirementLevels = EnumSet.of(
        Level.TITLE, Level.CHAPTER, Level.SECTION, Level.ARTICLE, Level.ANNEX, Level.RECITAL);

    /** Headings never carry outbound references themselves. */
    @Builder.Default
    Set<Level> referenceExcludedLevels = EnumSet.of(
        Level.TITLE, Level.CHAPTER, Level.SECTION, Level.ARTICLE, Level.ANNEX);

    @Builder.Default
    Set<Level> pathSkipLevels = EnumSet.of(Level.TITLE);

    @Builder.Default
    int snippetLength = 240;

    public Level normalize(Level level) {
        if (level == null) {
            return null;
        }
        return levelNormalization.getOrDefault(level, level);
    }

    public static ParserProfile forFamily(RegulationFamily family) {
        if (family == RegulationFamily.MEDICAL_DEVICE_REGULATION) {
            return ParserProfile.builder()
                .parserName("mdr_parser")
                .contextLevels(List.of(Level.TITLE, Level.CHAPTER, Level.SECTION, Level.ARTICLE, Level.ANNEX))
                .build();
        }
        if (family == RegulationFamily.AI_REGULATION) {
            return ParserProfile.builder()
                .parserName("eu_ai_parser")
                .build();
        }
        return ParserProfile.builder()
            .parserName("eurlex_parser")
            .build();
    }
}
