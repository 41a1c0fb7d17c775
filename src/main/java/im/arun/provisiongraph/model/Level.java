package im.arun.provisiongraph.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Structural levels of a regulation together with their stack rank.
 * A lower rank sits higher in the hierarchy; levels sharing a rank are siblings.
 * Recitals are flat: they never hold children and always yield to the next block.
 */
public enum Level {
    TITLE("title", 0, false),
    RECITAL("recital", 1, true),
    CHAPTER("chapter", 2, false),
    SECTION("section", 3, false),
    ARTICLE("article", 4, false),
    PARAGRAPH("paragraph", 5, false),
    LETTER("letter", 6, false),
    SUBPOINT("subpoint", 7, false),
    ANNEX("annex", 0, false),

    // Raw numbering levels, only ranked once a profile maps them to a canonical level
    SUBSECTION("subsection", Level.UNRANKED, false),
    POINT("point", Level.UNRANKED, false);

    public static final int UNRANKED = 99;

    private final String label;
    private final int rank;
    private final boolean flat;

    Level(String label, int rank, boolean flat) {
        this.label = label;
        this.rank = rank;
        this.flat = flat;
    }

    @JsonValue
    public String getLabel() {
        return label;
    }

    public int getRank() {
        return rank;
    }

    public boolean isFlat() {
        return flat;
    }

    /**
     * Path segment for this level: upper-cased label, followed by the marker when present.
     */
    public String pathSegment(String marker) {
        if (marker == null) {
            return label.toUpperCase(Locale.ROOT);
        }
        return label.toUpperCase(Locale.ROOT) + "_" + marker.replace(' ', '_').toUpperCase(Locale.ROOT);
    }
}
