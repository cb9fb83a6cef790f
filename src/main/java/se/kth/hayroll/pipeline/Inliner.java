package se.kth.hayroll.pipeline;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;
import se.kth.hayroll.syntax.RustAst;
import se.kth.hayroll.syntax.SyntaxEditor;
import se.kth.hayroll.syntax.SyntaxKind;
import se.kth.hayroll.syntax.SyntaxNode;
import se.kth.hayroll.syntax.SyntaxTree;
import se.kth.hayroll.syntax.Token;
import se.kth.hayroll.syntax.TokenKind;
import se.kth.hayroll.util.LazyLogger;

/**
 * Expands invocations of the {@code macro_rules!} templates defined in a workspace back into
 * their bodies. Only single-arm templates whose matcher is a plain comma-separated list of
 * {@code $name:fragment} bindings are expanded; the definitions themselves are kept.
 */
public class Inliner {
    private static final LazyLogger LOGGER = new LazyLogger(Inliner.class);

    private final Diagnostics diagnostics;

    public Inliner(Diagnostics diagnostics) {
        this.diagnostics = diagnostics;
    }

    /** @return The number of expanded invocations. */
    public int inline(Workspace workspace) {
        int expanded = 0;
        boolean converged = false;
        for (int round = 0; round < InvocationPass.MAX_ROUNDS; round++) {
            Map<String, Template> templates = templates(workspace, round == 0);
            EditPlan plan = new EditPlan(workspace);
            int planned = 0;
            for (Map.Entry<Path, SyntaxTree> entry : workspace.getTrees().entrySet()) {
                List<SyntaxNode> calls =
                        entry.getValue().getRoot().descendants()
                                .filter(n -> n.is(SyntaxKind.MACRO_CALL))
                                .collect(Collectors.toList());
                for (SyntaxNode call : calls) {
                    Template template = templates.get(macroName(call));
                    if (template != null && planExpansion(entry.getKey(), call, template, plan)) {
                        planned++;
                    }
                }
            }
            if (planned == 0) {
                converged = true;
                break;
            }
            plan.apply();
            expanded += planned;
        }
        if (!converged) {
            diagnostics.report(
                    Diagnostic.Kind.UNRESOLVED_NESTING,
                    workspace.getRoot().toString(),
                    "macro expansion did not terminate after " + InvocationPass.MAX_ROUNDS
                            + " rounds");
        }
        int total = expanded;
        LOGGER.info(() -> "Inlined " + total + " macro invocations");
        return total;
    }

    private Map<String, Template> templates(Workspace workspace, boolean report) {
        Map<String, Template> templates = new LinkedHashMap<>();
        Set<String> ambiguous = new HashSet<>();
        for (SyntaxTree tree : workspace.getTrees().values()) {
            List<SyntaxNode> definitions =
                    tree.getRoot().descendants()
                            .filter(n -> n.is(SyntaxKind.MACRO_RULES))
                            .collect(Collectors.toList());
            for (SyntaxNode definition : definitions) {
                String name = RustAst.name(definition).orElse("");
                Optional<Template> template = Template.parse(definition);
                if (!template.isPresent()) {
                    if (report) {
                        diagnostics.report(
                                Diagnostic.Kind.UNSUPPORTED_SHAPE,
                                name,
                                "only single-arm macros with plain bindings are inlined");
                    }
                    ambiguous.add(name);
                } else if (templates.put(name, template.get()) != null) {
                    if (report) {
                        diagnostics.report(
                                Diagnostic.Kind.UNSUPPORTED_SHAPE,
                                name,
                                "macro is defined more than once");
                    }
                    ambiguous.add(name);
                }
            }
        }
        templates.keySet().removeAll(ambiguous);
        return templates;
    }

    private boolean planExpansion(Path file, SyntaxNode call, Template template, EditPlan plan) {
        List<String> args = splitArguments(call);
        if (args.size() != template.params.size()) {
            diagnostics.report(
                    Diagnostic.Kind.SKIPPED_EDIT,
                    file + ":" + call.getStart(),
                    template.name + "! expects " + template.params.size() + " arguments but got "
                            + args.size());
            return false;
        }
        String body = template.expand(args);
        SyntaxNode parent = call.getParent();
        if (parent.is(SyntaxKind.EXPR_STMT) && RustAst.stmtExpr(parent) == call) {
            boolean terminated = body.endsWith(";") || body.endsWith("}");
            boolean hadSemicolon = parent.lastToken().isPunct(';');
            plan.replace(file, parent, hadSemicolon && !terminated ? body + ";" : body);
        } else if (parent.is(SyntaxKind.SOURCE_FILE) || parent.is(SyntaxKind.ITEM_LIST)) {
            plan.replace(file, call, body);
        } else if (template.isStatements()) {
            plan.replace(file, call, "{ " + body + " }");
        } else if (template.isDelimited()) {
            plan.replace(file, call, body);
        } else {
            plan.replace(file, call, "(" + body + ")");
        }
        return true;
    }

    /** @return The last path segment of a macro call, e.g. {@code m} for {@code crate::m!()}. */
    static String macroName(SyntaxNode call) {
        return call.firstChild(SyntaxKind.PATH).map(p -> p.lastToken().getText()).orElse("");
    }

    /** Split the token tree of a macro call on its top-level commas. */
    static List<String> splitArguments(SyntaxNode call) {
        SyntaxNode tt =
                call.firstChild(SyntaxKind.TOKEN_TREE)
                        .orElseThrow(() -> new IllegalStateException("macro call without tokens"));
        List<Token> tokens = tt.tokens();
        String text = call.getTree().getText();
        List<String> args = new ArrayList<>();
        int depth = 0;
        int first = -1;
        int last = -1;
        for (int i = 1; i < tokens.size() - 1; i++) {
            Token t = tokens.get(i);
            if (depth == 0 && t.isPunct(',')) {
                args.add(first < 0 ? "" : text.substring(first, last));
                first = -1;
                continue;
            }
            depth += delimiterDepth(t);
            if (first < 0) {
                first = t.getStart();
            }
            last = t.getEnd();
        }
        if (first >= 0) {
            args.add(text.substring(first, last));
        }
        return args;
    }

    private static int delimiterDepth(Token t) {
        if (t.isPunct('(') || t.isPunct('[') || t.isPunct('{')) {
            return 1;
        }
        if (t.isPunct(')') || t.isPunct(']') || t.isPunct('}')) {
            return -1;
        }
        return 0;
    }

    private static int matching(List<Token> tokens, int open) {
        int depth = 0;
        for (int i = open; i < tokens.size(); i++) {
            depth += delimiterDepth(tokens.get(i));
            if (depth == 0) {
                return i;
            }
        }
        return -1;
    }

    /** A single-arm template: its bindings and the token range of its body. */
    static class Template {
        final String name;
        final List<String> params;
        final List<String> fragments;
        final SyntaxTree tree;
        final List<Token> body;

        private Template(
                String name,
                List<String> params,
                List<String> fragments,
                SyntaxTree tree,
                List<Token> body) {
            this.name = name;
            this.params = params;
            this.fragments = fragments;
            this.tree = tree;
            this.body = body;
        }

        /** @return The template of a {@code macro_rules!} definition, if its form is supported. */
        static Optional<Template> parse(SyntaxNode definition) {
            Optional<SyntaxNode> tt = definition.firstChild(SyntaxKind.TOKEN_TREE);
            Optional<String> name = RustAst.name(definition);
            if (!tt.isPresent() || !name.isPresent()) {
                return Optional.empty();
            }
            List<Token> tokens = tt.get().tokens();
            int matcherEnd =
                    tokens.size() > 2 && delimiterDepth(tokens.get(1)) == 1
                            ? matching(tokens, 1)
                            : -1;
            if (matcherEnd < 0
                    || matcherEnd + 3 >= tokens.size()
                    || !tokens.get(matcherEnd + 1).isPunct('=')
                    || !tokens.get(matcherEnd + 2).isPunct('>')) {
                return Optional.empty();
            }
            int bodyStart = matcherEnd + 3;
            int bodyEnd = matching(tokens, bodyStart);
            if (bodyEnd < 0 || delimiterDepth(tokens.get(bodyStart)) != 1) {
                return Optional.empty();
            }
            int rest = bodyEnd + 1;
            if (rest < tokens.size() && tokens.get(rest).isPunct(';')) {
                rest++;
            }
            if (rest != tokens.size() - 1) {
                return Optional.empty();
            }

            List<String> params = new ArrayList<>();
            List<String> fragments = new ArrayList<>();
            List<Token> matcher = tokens.subList(2, matcherEnd);
            for (int i = 0; i < matcher.size(); i += 5) {
                boolean binding =
                        i + 3 < matcher.size()
                                && matcher.get(i).isPunct('$')
                                && matcher.get(i + 1).getKind() == TokenKind.IDENT
                                && matcher.get(i + 2).isPunct(':')
                                && matcher.get(i + 3).getKind() == TokenKind.IDENT;
                boolean separated = i + 4 >= matcher.size() || matcher.get(i + 4).isPunct(',');
                if (!binding || !separated) {
                    return Optional.empty();
                }
                params.add(matcher.get(i + 1).getText());
                fragments.add(matcher.get(i + 3).getText());
            }
            return Optional.of(
                    new Template(
                            name.get(),
                            params,
                            fragments,
                            definition.getTree(),
                            new ArrayList<>(tokens.subList(bodyStart, bodyEnd + 1))));
        }

        /** Substitute the arguments into the body; expression arguments are parenthesized. */
        String expand(List<String> args) {
            int start = body.get(0).getEnd();
            int end = body.get(body.size() - 1).getStart();
            SyntaxEditor editor = new SyntaxEditor(tree, start, end);
            for (int i = 1; i + 2 < body.size(); i++) {
                Token dollar = body.get(i);
                Token ident = body.get(i + 1);
                int param = params.indexOf(ident.getText());
                if (!dollar.isPunct('$') || ident.getKind() != TokenKind.IDENT || param < 0) {
                    continue;
                }
                String arg = args.get(param);
                boolean wrap = fragments.get(param).equals("expr") && !isAtomic(arg);
                String replacement = wrap ? "(" + arg + ")" : arg;
                editor.replaceRange(dollar.getStart(), ident.getEnd(), replacement);
            }
            return editor.finish().trim();
        }

        /** @return true if the body holds statements rather than a single expression. */
        boolean isStatements() {
            int depth = 0;
            for (int i = 1; i < body.size() - 1; i++) {
                Token t = body.get(i);
                depth += delimiterDepth(t);
                if (depth == 0 && t.isPunct(';')) {
                    return true;
                }
            }
            return false;
        }

        /** @return true if the body is one token or one delimited group. */
        boolean isDelimited() {
            List<Token> inner = body.subList(1, body.size() - 1);
            if (inner.size() == 1) {
                return true;
            }
            boolean metaVar =
                    inner.size() == 2
                            && inner.get(0).isPunct('$')
                            && params.contains(inner.get(1).getText());
            return metaVar
                    || !inner.isEmpty()
                            && delimiterDepth(inner.get(0)) == 1
                            && matching(inner, 0) == inner.size() - 1;
        }

        private static boolean isAtomic(String arg) {
            return arg.matches("[A-Za-z_][A-Za-z0-9_]*|[0-9][A-Za-z0-9_.]*");
        }
    }
}
