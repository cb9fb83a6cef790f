package se.kth.hayroll.seed;

import java.nio.file.Path;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;
import se.kth.hayroll.exception.ExtractionException;
import se.kth.hayroll.syntax.RustAst;
import se.kth.hayroll.syntax.SyntaxKind;
import se.kth.hayroll.syntax.SyntaxNode;
import se.kth.hayroll.syntax.SyntaxTree;
import se.kth.hayroll.tag.AstKind;
import se.kth.hayroll.tag.HayrollTag;
import se.kth.hayroll.util.LazyLogger;
import se.kth.hayroll.util.Pair;

/**
 * Finds seed tags in parsed files and folds them into seeds.
 *
 * <p>Statement tags are paired with a stack per {@code (locBegin, seedType)}: an end tag closes
 * the most recently opened span with the same key. Both tags of a span must be statements of the
 * same statement list.
 */
public class SeedExtractor {
    private static final LazyLogger LOGGER = new LazyLogger(SeedExtractor.class);

    /**
     * Extract the seeds of all files.
     *
     * @param trees Parsed files keyed by their workspace path, iterated in map order.
     */
    public static ExtractionResult extract(Map<Path, SyntaxTree> trees) {
        List<HayrollSeed> seeds = new ArrayList<>();
        List<HayrollTag> unmatched = new ArrayList<>();
        for (Map.Entry<Path, SyntaxTree> entry : trees.entrySet()) {
            fold(findTags(entry.getKey(), entry.getValue()), seeds, unmatched);
        }
        LOGGER.debug(() -> "Extracted " + seeds.size() + " seeds");
        return new ExtractionResult(seeds, unmatched);
    }

    /** @return The tags of a file in document order. */
    public static List<HayrollTag> findTags(Path file, SyntaxTree tree) {
        return tree.getRoot()
                .descendants()
                .filter(n -> n.is(SyntaxKind.LITERAL))
                .map(n -> HayrollTag.fromLiteral(n, file))
                .filter(Optional::isPresent)
                .map(Optional::get)
                .collect(Collectors.toList());
    }

    /** Fold the tags of one file into seeds. Slots of unclosed spans are filled in place. */
    static void fold(List<HayrollTag> tags, List<HayrollSeed> seeds, List<HayrollTag> unmatched) {
        Map<Pair<String, String>, Deque<Integer>> open = new HashMap<>();
        int firstIndex = seeds.size();
        for (HayrollTag tag : tags) {
            AstKind kind = tag.astKind();
            if (kind == AstKind.EXPR) {
                requireBegin(tag);
                seeds.add(new HayrollSeed.Expr(tag));
            } else if (kind.isDeclarationLike()) {
                requireBegin(tag);
                seeds.add(new HayrollSeed.Decls(tag));
            } else if (kind.isStatementLike() && tag.begin()) {
                open.computeIfAbsent(key(tag), k -> new ArrayDeque<>()).push(seeds.size());
                seeds.add(new HayrollSeed.Stmts(tag, tag));
            } else if (!tag.begin()) {
                Deque<Integer> stack = open.get(key(tag));
                if (stack == null || stack.isEmpty()) {
                    throw new ExtractionException("Unmatched end tag " + tag);
                }
                int index = stack.pop();
                HayrollTag begin = seeds.get(index).hayrollTag();
                requireSameStatementList(begin, tag);
                seeds.set(index, new HayrollSeed.Stmts(begin, tag));
            } else {
                throw new ExtractionException(
                        "Unknown tag shape astKind=" + kind + " begin=" + tag.begin() + ": " + tag);
            }
        }
        for (HayrollSeed seed : seeds.subList(firstIndex, seeds.size())) {
            if (seed instanceof HayrollSeed.Stmts && !((HayrollSeed.Stmts) seed).isMatched()) {
                unmatched.add(seed.hayrollTag());
            }
        }
    }

    private static Pair<String, String> key(HayrollTag tag) {
        return Pair.of(tag.locBegin(), tag.seedType().name());
    }

    private static void requireBegin(HayrollTag tag) {
        if (!tag.begin()) {
            throw new ExtractionException(
                    tag.astKind() + " tag must be a begin tag: " + tag);
        }
    }

    private static void requireSameStatementList(HayrollTag begin, HayrollTag end) {
        SyntaxNode beginList = statementList(begin);
        SyntaxNode endList = statementList(end);
        if (beginList == null || beginList != endList) {
            throw new ExtractionException(
                    "Begin tag " + begin + " and end tag " + end
                            + " are not statements of the same statement list");
        }
    }

    private static SyntaxNode statementList(HayrollTag tag) {
        return RustAst.enclosingStatement(tag.getLiteral()).map(SyntaxNode::getParent).orElse(null);
    }
}
