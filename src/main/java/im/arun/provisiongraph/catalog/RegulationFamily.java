package im.arun.provisiongraph.catalog;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Regulation families. The family, never the document content, selects the
 * actor-role vocabulary.
 */
public enum RegulationFamily {
    AI_REGULATION("ai_regulation"),
    MEDICAL_DEVICE_REGULATION("medical_device_regulation"),
    OTHER("other");

    private final String code;

    RegulationFamily(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    @JsonCreator
    public static RegulationFamily fromCode(String code) {
        if (code != null) {
            for (RegulationFamily family : values()) {
                if (family.code.equalsIgnoreCase(code.trim())) {
                    return family;
                }
            }
        }
        return OTHER;
    }
}
