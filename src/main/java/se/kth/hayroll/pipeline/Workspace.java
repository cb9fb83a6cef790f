package se.kth.hayroll.pipeline;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import se.kth.hayroll.syntax.SyntaxTree;
import se.kth.hayroll.syntax.TreeSitterParser;
import se.kth.hayroll.util.DiffPrinter;
import se.kth.hayroll.util.LazyLogger;

/**
 * The Rust files of one workspace, parsed. Files are kept in memory and updated pass by pass;
 * nothing is written until {@link #write()} is called. File identifiers are paths relative to
 * the workspace root.
 */
public class Workspace {
    private static final LazyLogger LOGGER = new LazyLogger(Workspace.class);

    private final Path root;
    private final Map<Path, String> originals = new LinkedHashMap<>();
    private final Map<Path, SyntaxTree> trees = new LinkedHashMap<>();

    private Workspace(Path root) {
        this.root = root;
    }

    /**
     * Load every {@code .rs} file below a directory, or a single file. Build output under
     * {@code target} directories is skipped.
     */
    public static Workspace load(Path path) throws IOException {
        if (Files.isRegularFile(path)) {
            Workspace ws = new Workspace(path.toAbsolutePath().getParent());
            ws.add(path.getFileName(), read(path));
            return ws;
        }
        if (!Files.isDirectory(path)) {
            throw new IOException("No such workspace: " + path);
        }
        Workspace ws = new Workspace(path.toAbsolutePath());
        List<Path> files;
        try (Stream<Path> walk = Files.walk(path)) {
            files =
                    walk.filter(Files::isRegularFile)
                            .filter(p -> p.getFileName().toString().endsWith(".rs"))
                            .map(path::relativize)
                            .filter(p -> !p.startsWith("target"))
                            .sorted()
                            .collect(Collectors.toList());
        }
        for (Path file : files) {
            ws.add(file, read(path.resolve(file)));
        }
        LOGGER.info(() -> "Found " + ws.trees.size() + " Rust files in " + ws.root);
        return ws;
    }

    /** Create a workspace from in-memory sources, keyed by relative path. */
    public static Workspace of(Path root, Map<Path, String> sources) {
        Workspace ws = new Workspace(root);
        sources.forEach(ws::add);
        return ws;
    }

    private static String read(Path file) throws IOException {
        return new String(Files.readAllBytes(file), StandardCharsets.UTF_8);
    }

    private void add(Path file, String text) {
        LOGGER.debug(() -> "Parsing " + file);
        originals.put(file, text);
        trees.put(file, TreeSitterParser.parseSourceFile(text));
    }

    public Path getRoot() {
        return root;
    }

    public List<Path> getFiles() {
        return new ArrayList<>(trees.keySet());
    }

    public SyntaxTree getTree(Path file) {
        SyntaxTree tree = trees.get(file);
        if (tree == null) {
            throw new IllegalArgumentException("Not a workspace file: " + file);
        }
        return tree;
    }

    /** @return The current trees in file order. */
    public Map<Path, SyntaxTree> getTrees() {
        return Collections.unmodifiableMap(trees);
    }

    public String getText(Path file) {
        return getTree(file).getText();
    }

    /** Replace the text of a file and parse it again. */
    public void update(Path file, String text) {
        getTree(file);
        trees.put(file, TreeSitterParser.parseSourceFile(text));
    }

    /** Add a file that did not exist when the workspace was loaded. */
    public void create(Path file, String text) {
        if (trees.containsKey(file)) {
            throw new IllegalArgumentException("File already exists: " + file);
        }
        originals.put(file, "");
        trees.put(file, TreeSitterParser.parseSourceFile(text));
    }

    /** @return The files whose text differs from what was loaded. */
    public List<Path> getChangedFiles() {
        return trees.keySet().stream()
                .filter(f -> !originals.get(f).equals(getText(f)))
                .collect(Collectors.toList());
    }

    /** @return A unified diff of every changed file against its loaded text. */
    public String diff() {
        StringBuilder sb = new StringBuilder();
        for (Path file : getChangedFiles()) {
            sb.append(
                    DiffPrinter.unifiedDiff(
                            file.toString(),
                            originals.get(file),
                            withTrailingNewline(getText(file))));
        }
        return sb.toString();
    }

    /** Write every changed file back to the path it was read from. */
    public void write() throws IOException {
        for (Path file : getChangedFiles()) {
            Path target = root.resolve(file);
            LOGGER.info(() -> "Writing " + target);
            if (target.getParent() != null) {
                Files.createDirectories(target.getParent());
            }
            byte[] bytes = withTrailingNewline(getText(file)).getBytes(StandardCharsets.UTF_8);
            Files.write(target, bytes);
        }
    }

    private static String withTrailingNewline(String text) {
        return text.endsWith("\n") ? text : text + "\n";
    }
}
