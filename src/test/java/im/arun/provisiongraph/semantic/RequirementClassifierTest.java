package im.arun.provisiongraph.semantic;

import im.arun.provisiongraph.model.RequirementType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("RequirementClassifier Tests")
class RequirementClassifierTest {

    private final RequirementClassifier classifier = new RequirementClassifier();

    @Test
    @DisplayName("Should prefer prohibition over an embedded obligation cue")
    void shouldPreferProhibitionOverObligation() {
        String text = "The provider shall not process data";

        assertThat(classifier.classify(text, "EN")).isEqualTo(RequirementType.PROHIBITION);
        assertThat(classifier.isRequirement(text, "EN")).isTrue();
    }

    @Test
    @DisplayName("Should prefer prohibition over an embedded permission cue")
    void shouldPreferProhibitionOverPermission() {
        assertThat(classifier.classify("The deployer may not use the system for prohibited purposes.", "EN"))
            .isEqualTo(RequirementType.PROHIBITION);
    }

    @Test
    @DisplayName("Should classify obligations and permissions")
    void shouldClassifyObligationsAndPermissions() {
        assertThat(classifier.classify("The provider shall ensure compliance.", "EN"))
            .isEqualTo(RequirementType.OBLIGATION);
        assertThat(classifier.classify("Member States may lay down rules on penalties.", "EN"))
            .isEqualTo(RequirementType.PERMISSION);
    }

    @Test
    @DisplayName("Should classify quoted definitions with straight and curly quotes")
    void shouldClassifyDefinitions() {
        assertThat(classifier.classify("'AI system' means a machine-based system...", "EN"))
            .isEqualTo(RequirementType.DEFINITION);
        assertThat(classifier.classify("‘provider’ means a natural or legal person", "EN"))
            .isEqualTo(RequirementType.DEFINITION);
        assertThat(classifier.classify("„Anbieter“ bezeichnet eine natürliche Person", "DE"))
            .isEqualTo(RequirementType.DEFINITION);
    }

    @Test
    @DisplayName("Should classify German and French modal verbs")
    void shouldClassifyGermanAndFrench() {
        assertThat(classifier.classify("Der Anbieter muss die Konformität sicherstellen.", "DE"))
            .isEqualTo(RequirementType.OBLIGATION);
        assertThat(classifier.classify("Der Betreiber darf nicht das System verwenden.", "DE"))
            .isEqualTo(RequirementType.PROHIBITION);
        assertThat(classifier.classify("Le fournisseur ne doit pas traiter les données.", "FR"))
            .isEqualTo(RequirementType.PROHIBITION);
        assertThat(classifier.classify("Il est interdit de mettre sur le marché.", "FR"))
            .isEqualTo(RequirementType.PROHIBITION);
        assertThat(classifier.classify("Le fournisseur est autorisé à coopérer.", "FR"))
            .isEqualTo(RequirementType.PERMISSION);
    }

    @Test
    @DisplayName("Should return other when nothing matches")
    void shouldReturnOtherWhenNothingMatches() {
        String text = "This Regulation lays down harmonised rules.";

        assertThat(classifier.classify(text, "EN")).isEqualTo(RequirementType.OTHER);
        assertThat(classifier.isRequirement(text, "EN")).isFalse();
    }

    @Test
    @DisplayName("Should not treat words containing a modal verb as a match")
    void shouldRespectWordBoundaries() {
        assertThat(classifier.classify("The mayor of the town", "EN")).isEqualTo(RequirementType.OTHER);
    }

    @Test
    @DisplayName("Should use English patterns for unsupported languages")
    void shouldFallBackToEnglish() {
        assertThat(classifier.classify("The provider shall act.", "IT")).isEqualTo(RequirementType.OBLIGATION);
    }
}
