package im.arun.provisiongraph.tree;

import im.arun.provisiongraph.classify.BlockClassifier;
import im.arun.provisiongraph.classify.ClassifiedBlock;
import im.arun.provisiongraph.classify.Heading;
import im.arun.provisiongraph.classify.HeadingInterpreter;
import im.arun.provisiongraph.classify.NumberingMatch;
import im.arun.provisiongraph.model.Level;
import im.arun.provisiongraph.model.Provenance;
import im.arun.provisiongraph.model.Provision;
import im.arun.provisiongraph.model.RawBlock;
import im.arun.provisiongraph.model.Relation;
import im.arun.provisiongraph.semantic.CrossReferenceExtractor;
import im.arun.provisiongraph.semantic.SemanticAnnotation;
import im.arun.provisiongraph.semantic.SemanticClassifier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Turns a linear sequence of text blocks into the provision tree.
 *
 * <p>Keeps a stack of open ancestors. Each new node pops every open entry whose
 * rank is greater than or equal to its own, plus any flat (recital) entry, and
 * becomes a child of whatever remains on top. Unlabeled text is absorbed into
 * the open top node. A node is sealed into an immutable {@link Provision} when
 * it leaves the stack.
 *
 * <p>One instance processes exactly one document, in order, on one thread.
 */
public class HierarchyStackMachine {
    private static final Logger logger = LoggerFactory.getLogger(HierarchyStackMachine.class);

    private static final Pattern RECITAL_CUE =
        Pattern.compile("^(Whereas|Considérant|Erwägungsgrund)", Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE);
    private static final Pattern FIRST_NUMBER = Pattern.compile("\\b(\\d+)\\b");
    private static final String UNNUMBERED = "UNNUMBERED";

    private final ParserProfile profile;
    private final DocumentIdentity document;
    private final BlockClassifier blockClassifier;
    private final HeadingInterpreter headingInterpreter;
    private final SemanticClassifier semanticClassifier;
    private final CrossReferenceExtractor referenceExtractor;
    private final ProvisionAssembler assembler;

    private final List<OpenProvision> stack = new ArrayList<>();
    // Indexed by creation order; a slot is filled when its node leaves the stack
    private final List<Provision> sealed = new ArrayList<>();
    private final List<Relation> relations = new ArrayList<>();
    private final Map<String, Integer> idOccurrences = new HashMap<>();

    private int recitalCounter = 0;
    private boolean inPreamble = true;
    private boolean finished = false;

    public HierarchyStackMachine(ParserProfile profile, DocumentIdentity document, SemanticClassifier semanticClassifier) {
        this(profile, document, new BlockClassifier(), new HeadingInterpreter(), semanticClassifier,
            new CrossReferenceExtractor());
    }

    public HierarchyStackMachine(ParserProfile profile,
                                 DocumentIdentity document,
                                 BlockClassifier blockClassifier,
                                 HeadingInterpreter headingInterpreter,
                                 SemanticClassifier semanticClassifier,
                                 CrossReferenceExtractor referenceExtractor) {
        this.profile = profile;
        this.document = document;
        this.blockClassifier = blockClassifier;
        this.headingInterpreter = headingInterpreter;
        this.semanticClassifier = semanticClassifier;
        this.referenceExtractor = referenceExtractor;
        this.assembler = new ProvisionAssembler(profile.getSnippetLength());
    }

    /**
     * Process every block in order and return the finished graph.
     */
    public GraphBuildResult build(List<RawBlock> blocks) {
        for (RawBlock block : blocks) {
            accept(block);
        }
        return finish();
    }

    /**
     * Consume the next block in document order.
     */
    public void accept(RawBlock block) {
        if (finished) {
            throw new IllegalStateException("Stack machine already finished for " + document.getCelexId());
        }

        ClassifiedBlock classified = blockClassifier.classify(block.getText(), block.getMarkupHint(), document.getLanguage());
        if (classified == null) {
            return;
        }

        String text = classified.getText();
        String body = text;
        Level level = null;
        String marker = null;
        String title = null;
        String introText = "";

        Heading heading = headingInterpreter.interpret(classified, document.getLanguage());
        if (heading != null) {
            level = heading.getLevel();
            marker = heading.getMarker();
            title = heading.getTitle();
            introText = heading.getIntroText();
            inPreamble = false;
        }

        if (level == null) {
            NumberingMatch numbering = blockClassifier.detectNumbering(text);
            if (numbering.getBody() != null && !numbering.getBody().isEmpty()) {
                body = numbering.getBody();
            }
            level = profile.normalize(numbering.getLevel());
            marker = numbering.getMarker();
        }

        if (level == Level.PARAGRAPH && inPreamble && atPreambleDepth()) {
            level = Level.RECITAL;
            marker = nextRecitalMarker(marker);
            title = text;
        }

        if (level == null && RECITAL_CUE.matcher(text).lookingAt()) {
            level = Level.RECITAL;
            Matcher number = FIRST_NUMBER.matcher(text);
            marker = nextRecitalMarker(number.find() ? number.group(1) : null);
            title = text;
        }

        if (level == null) {
            absorb(text);
            return;
        }

        open(level, marker, title, body, introText, block);
    }

    /**
     * Seal every node still open and return the graph. The machine cannot be reused.
     */
    public GraphBuildResult finish() {
        if (!finished) {
            while (!stack.isEmpty()) {
                seal(stack.remove(stack.size() - 1));
            }
            finished = true;
        }
        return new GraphBuildResult(Collections.unmodifiableList(new ArrayList<>(sealed)),
            Collections.unmodifiableList(new ArrayList<>(relations)));
    }

    private void open(Level level, String marker, String title, String body, String introText, RawBlock block) {
        int currentRank = level.getRank();
        while (!stack.isEmpty()) {
            OpenProvision top = stack.get(stack.size() - 1);
            if (top.isFlat() || top.rank() >= currentRank) {
                seal(stack.remove(stack.size() - 1));
            } else {
                break;
            }
        }

        OpenProvision parent = stack.isEmpty() ? null : stack.get(stack.size() - 1);
        String parentId = parent != null ? parent.getId() : null;
        String id = uniqueId(parentId, level, marker);

        SemanticAnnotation semantics = profile.getNonRequirementLevels().contains(level)
            ? SemanticAnnotation.NONE
            : semanticClassifier.annotate(body, document.getLanguage());
        List<String> references = profile.getReferenceExcludedLevels().contains(level)
            ? List.of()
            : referenceExtractor.extract(body, document.getLanguage());

        Provenance provenance = new Provenance(profile.getParserName(), profile.getParserVersion(),
            document.getSourcePath(), document.getRawHash(), block.getSourceStart(), block.getSourceEnd());

        int order = sealed.size();
        sealed.add(null);
        OpenProvision node = new OpenProvision(order, id, parentId, level, marker, title, body, introText,
            buildPath(level, marker), buildContext(id, level, marker, title), semantics, references, provenance);

        if (parent != null) {
            parent.addChild(id);
            relations.add(Relation.hasChild(parentId, id));
        }
        for (String reference : references) {
            relations.add(Relation.references(id, reference));
        }

        stack.add(node);
    }

    private void absorb(String text) {
        if (stack.isEmpty()) {
            logger.debug("Dropping unlabeled text with no open provision: {}", abbreviate(text));
            return;
        }
        OpenProvision top = stack.get(stack.size() - 1);
        top.absorb(text);
        logger.debug("Absorbed text into {}", top.getId());
    }

    private void seal(OpenProvision node) {
        sealed.set(node.getOrder(), assembler.assemble(node, document));
    }

    // Recitals sit at the preamble level: no non-flat ancestor may be open
    private boolean atPreambleDepth() {
        return stack.stream().allMatch(OpenProvision::isFlat);
    }

    private String nextRecitalMarker(String marker) {
        if (marker != null && !marker.isEmpty() && marker.chars().allMatch(Character::isDigit)) {
            try {
                recitalCounter = Math.max(recitalCounter, Integer.parseInt(marker));
                return marker;
            } catch (NumberFormatException e) {
                logger.debug("Recital marker {} out of range, using counter", marker);
            }
        }
        recitalCounter++;
        return marker != null ? marker : "PREAMBLE_" + recitalCounter;
    }

    private String uniqueId(String parentId, Level level, String marker) {
        String token = (marker != null ? marker : UNNUMBERED).replace(' ', '_');
        String base = parentId != null
            ? parentId + "_" + level.getLabel() + "_" + token
            : document.getCelexId() + "_" + document.getLanguage() + "_" + level.getLabel() + "_" + token;

        int occurrence = idOccurrences.merge(base, 1, Integer::sum);
        if (occurrence == 1) {
            return base;
        }
        logger.debug("Id {} already used, appending occurrence {}", base, occurrence);
        return base + "__" + occurrence;
    }

    private List<String> buildPath(Level level, String marker) {
        List<String> segments = new ArrayList<>();
        for (OpenProvision ancestor : stack) {
            if (profile.getPathSkipLevels().contains(ancestor.getLevel())) {
                continue;
            }
            segments.add(ancestor.getLevel().pathSegment(ancestor.getMarker()));
        }
        segments.add(level.pathSegment(marker));
        return segments;
    }

    // Nearest ancestor (or self) title or marker for each context level
    private Map<String, String> buildContext(String id, Level level, String marker, String title) {
        Map<String, String> context = new LinkedHashMap<>();
        for (Level contextLevel : profile.getContextLevels()) {
            context.put(contextLevel.getLabel(), null);
        }
        context.put("root_id", stack.isEmpty() ? id : stack.get(0).getId());

        for (OpenProvision ancestor : stack) {
            putContext(context, ancestor.getLevel(), ancestor.getTitle(), ancestor.getMarker());
        }
        putContext(context, level, title, marker);
        return context;
    }

    private void putContext(Map<String, String> context, Level level, String title, String marker) {
        if (profile.getContextLevels().contains(level)) {
            context.put(level.getLabel(), title != null ? title : marker);
        }
    }

    private static String abbreviate(String text) {
        return text.length() > 80 ? text.substring(0, 80) + "..." : text;
    }
}
