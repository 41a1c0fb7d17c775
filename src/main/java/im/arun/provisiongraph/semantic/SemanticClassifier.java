package im.arun.provisiongraph.semantic;

import im.arun.provisiongraph.model.Obligation;
import im.arun.provisiongraph.model.RequirementType;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Decorates provision text with requirement, obligation and actor-role metadata.
 * The role detector is fixed at construction for the whole document.
 */
public class SemanticClassifier {

    private static final int ACTION_LENGTH = 240;

    // Conservative English cues, consulted only when no requirement pattern matched
    private static final List<Pattern> LEGACY_OBLIGATION_CUES = List.of(
        cue("\\bshall\\b"),
        cue("\\bmust\\b"),
        cue("\\bare required to\\b"),
        cue("\\bis required to\\b"),
        cue("\\bresponsible for\\b"),
        cue("\\bensure\\b"),
        cue("\\bprohibited\\b"),
        cue("\\bnot permitted\\b")
    );

    private static final Map<String, Pattern> OBLIGATION_TOPICS = new LinkedHashMap<>();

    static {
        OBLIGATION_TOPICS.put("vigilance", cue("vigilance"));
        OBLIGATION_TOPICS.put("post_market_surveillance", cue("post-market surveillance"));
        OBLIGATION_TOPICS.put("classification_rule", cue("classification"));
        OBLIGATION_TOPICS.put("risk_management", cue("risk management"));
        OBLIGATION_TOPICS.put("conformity_assessment", cue("conformity assessment"));
        OBLIGATION_TOPICS.put("clinical_investigation", cue("clinical investigation"));
    }

    private final RequirementClassifier requirementClassifier;
    private final RoleDetector roleDetector;

    public SemanticClassifier(RoleDetector roleDetector) {
        this(new RequirementClassifier(), roleDetector);
    }

    public SemanticClassifier(RequirementClassifier requirementClassifier, RoleDetector roleDetector) {
        this.requirementClassifier = requirementClassifier;
        this.roleDetector = roleDetector != null ? roleDetector : RoleDetector.NONE;
    }

    public SemanticAnnotation annotate(String text, String language) {
        String analyzable = text != null ? text : "";

        boolean requirement = requirementClassifier.isRequirement(analyzable, language);
        RequirementType requirementType = requirementClassifier.classify(analyzable, language);
        List<String> roles = List.copyOf(roleDetector.detectRoles(analyzable, language));

        boolean obligation;
        if (requirementType != RequirementType.OTHER) {
            obligation = requirementType.isObligation();
        } else {
            obligation = LEGACY_OBLIGATION_CUES.stream().anyMatch(p -> p.matcher(analyzable).find());
        }

        String obligationType = obligation ? obligationType(analyzable, requirementType) : null;
        String semanticRole = roles.isEmpty() ? null : roles.get(0);

        List<Obligation> obligations = requirement
            ? List.of(new Obligation(roles, shortAction(analyzable), requirementType, null))
            : List.of();

        return new SemanticAnnotation(requirement, requirementType, roles, obligation,
            obligationType, semanticRole, obligations);
    }

    public RoleDetector getRoleDetector() {
        return roleDetector;
    }

    private String obligationType(String text, RequirementType requirementType) {
        for (Map.Entry<String, Pattern> topic : OBLIGATION_TOPICS.entrySet()) {
            if (topic.getValue().matcher(text).find()) {
                return topic.getKey();
            }
        }
        if (requirementType != RequirementType.OTHER) {
            return requirementType.getLabel();
        }
        return "general_obligation";
    }

    private String shortAction(String text) {
        String action = text.strip();
        int sentenceEnd = action.indexOf('.');
        String firstSentence = sentenceEnd >= 0 ? action.substring(0, sentenceEnd) : action;
        return firstSentence.length() > ACTION_LENGTH ? firstSentence.substring(0, ACTION_LENGTH) : firstSentence;
    }

    private static Pattern cue(String regex) {
        return Pattern.compile(regex, Pattern.CASE_INSENSITIVE);
    }
}
