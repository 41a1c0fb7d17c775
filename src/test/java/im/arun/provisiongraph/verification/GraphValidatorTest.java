package im.arun.provisiongraph.verification;

import im.arun.provisiongraph.model.Level;
import im.arun.provisiongraph.model.Provision;
import im.arun.provisiongraph.model.Relation;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("GraphValidator Tests")
class GraphValidatorTest {

    private final GraphValidator validator = new GraphValidator();

    private static Provision provision(String id, String parentId, Level level, List<String> path, List<String> children) {
        return Provision.builder()
            .id(id)
            .parentId(parentId)
            .level(level)
            .path(path)
            .depth(path.size())
            .children(children)
            .build();
    }

    @Test
    @DisplayName("Should accept a well-formed tree")
    void shouldAcceptWellFormedTree() {
        List<Provision> provisions = List.of(
            provision("a", null, Level.ARTICLE, List.of("ARTICLE_1"), List.of("a_p")),
            provision("a_p", "a", Level.PARAGRAPH, List.of("ARTICLE_1", "PARAGRAPH_1"), List.of()));

        GraphValidator.ValidationResult result = validator.validate(provisions, List.of(Relation.hasChild("a", "a_p")));

        assertThat(result.isValid()).isTrue();
        assertThat(result.provisionCount).isEqualTo(2);
    }

    @Test
    @DisplayName("Should report duplicate ids and missing parents")
    void shouldReportDuplicatesAndMissingParents() {
        List<Provision> provisions = List.of(
            provision("a", null, Level.ARTICLE, List.of("ARTICLE_1"), List.of()),
            provision("a", null, Level.ARTICLE, List.of("ARTICLE_1"), List.of()),
            provision("orphan", "ghost", Level.PARAGRAPH, List.of("PARAGRAPH_1"), List.of()));

        List<String> violations = validator.validate(provisions, List.of()).violations;

        assertThat(violations).anyMatch(v -> v.startsWith("Duplicate id: a"));
        assertThat(violations).anyMatch(v -> v.contains("Parent ghost of orphan"));
    }

    @Test
    @DisplayName("Should report missing or repeated HAS_CHILD edges")
    void shouldReportEdgeCountMismatch() {
        List<Provision> provisions = List.of(
            provision("a", null, Level.ARTICLE, List.of("ARTICLE_1"), List.of("a_p", "a_p")),
            provision("a_p", "a", Level.PARAGRAPH, List.of("ARTICLE_1", "PARAGRAPH_1"), List.of()));

        List<String> violations = validator.validate(provisions,
            List.of(Relation.hasChild("a", "a_p"), Relation.hasChild("a", "a_p"))).violations;

        assertThat(violations).anyMatch(v -> v.contains("found 2"));
    }

    @Test
    @DisplayName("Should report depth and path disagreement")
    void shouldReportDepthMismatch() {
        Provision broken = Provision.builder()
            .id("a").level(Level.ARTICLE).path(List.of("ARTICLE_1")).depth(3).children(List.of()).build();

        assertThat(validator.validate(List.of(broken), List.of()).violations)
            .containsExactly("Depth 3 of a does not match path length 1");
    }

    @Test
    @DisplayName("Should report rank inversions but ignore recitals")
    void shouldReportRankInversions() {
        List<Provision> inverted = List.of(
            provision("p", null, Level.PARAGRAPH, List.of("PARAGRAPH_1"), List.of("p_a")),
            provision("p_a", "p", Level.ARTICLE, List.of("PARAGRAPH_1", "ARTICLE_1"), List.of()));
        List<Provision> withRecital = List.of(
            provision("t", null, Level.TITLE, List.of("TITLE_I"), List.of("t_r")),
            provision("t_r", "t", Level.RECITAL, List.of("RECITAL_1"), List.of()));

        assertThat(validator.validate(inverted, List.of(Relation.hasChild("p", "p_a"))).violations)
            .singleElement().asString().contains("does not exceed parent rank");
        assertThat(validator.validate(withRecital, List.of(Relation.hasChild("t", "t_r"))).isValid()).isTrue();
    }

    @Test
    @DisplayName("Should report children lists that disagree with edges")
    void shouldReportChildrenMismatch() {
        List<Provision> provisions = List.of(
            provision("a", null, Level.ARTICLE, List.of("ARTICLE_1"), List.of()),
            provision("a_p", "a", Level.PARAGRAPH, List.of("ARTICLE_1", "PARAGRAPH_1"), List.of()));

        assertThat(validator.validate(provisions, List.of(Relation.hasChild("a", "a_p"))).violations)
            .singleElement().asString().startsWith("Children of a []");
    }
}
