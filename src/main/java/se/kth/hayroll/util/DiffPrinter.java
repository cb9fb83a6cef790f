package se.kth.hayroll.util;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import org.eclipse.jgit.diff.DiffAlgorithm;
import org.eclipse.jgit.diff.DiffFormatter;
import org.eclipse.jgit.diff.EditList;
import org.eclipse.jgit.diff.RawText;
import org.eclipse.jgit.diff.RawTextComparator;

/** Line-based unified diffs using JGit, used to preview the effect of a run without writing. */
public class DiffPrinter {

    /**
     * Render a unified diff between two revisions of a file.
     *
     * @param path Path printed in the diff header.
     * @param before The original text.
     * @param after The rewritten text.
     * @return The diff, or the empty string if the texts are equal.
     */
    public static String unifiedDiff(String path, String before, String after) {
        if (before.equals(after)) {
            return "";
        }
        RawText a = new RawText(before.getBytes(StandardCharsets.UTF_8));
        RawText b = new RawText(after.getBytes(StandardCharsets.UTF_8));
        EditList edits =
                DiffAlgorithm.getAlgorithm(DiffAlgorithm.SupportedAlgorithm.HISTOGRAM)
                        .diff(RawTextComparator.DEFAULT, a, b);

        ByteArrayOutputStream out = new ByteArrayOutputStream();
        try (DiffFormatter formatter = new DiffFormatter(out)) {
            String header = "--- a/" + path + "\n+++ b/" + path + "\n";
            out.write(header.getBytes(StandardCharsets.UTF_8));
            formatter.format(edits, a, b);
            formatter.flush();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to render diff for " + path, e);
        }
        return new String(out.toByteArray(), StandardCharsets.UTF_8);
    }
}
