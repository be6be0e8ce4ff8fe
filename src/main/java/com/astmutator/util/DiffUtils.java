package com.astmutator.util;

import org.eclipse.jgit.diff.DiffAlgorithm;
import org.eclipse.jgit.diff.DiffFormatter;
import org.eclipse.jgit.diff.Edit;
import org.eclipse.jgit.diff.EditList;
import org.eclipse.jgit.diff.RawText;
import org.eclipse.jgit.diff.RawTextComparator;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;

public class DiffUtils {

    private static final DiffAlgorithm ALGORITHM =
            DiffAlgorithm.getAlgorithm(DiffAlgorithm.SupportedAlgorithm.HISTOGRAM);

    /**
     * Unified diff of two versions of a file, with {@code a/} and {@code b/} headers.
     * Returns an empty string when the texts are identical.
     */
    public static String unifiedDiff(String fileName, String original, String mutated) {
        RawText oldText = toRawText(original);
        RawText newText = toRawText(mutated);
        EditList edits = edits(oldText, newText);
        if (edits.isEmpty()) {
            return "";
        }

        ByteArrayOutputStream out = new ByteArrayOutputStream();
        try (DiffFormatter formatter = new DiffFormatter(out)) {
            out.write(("--- a/" + fileName + "\n+++ b/" + fileName + "\n").getBytes(StandardCharsets.UTF_8));
            formatter.format(edits, oldText, newText);
            formatter.flush();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to format diff for " + fileName, e);
        }
        return out.toString(StandardCharsets.UTF_8);
    }

    /**
     * Number of lines touched on the mutated side; pure deletions count their removed lines.
     */
    public static int countChangedLines(String original, String mutated) {
        int changed = 0;
        for (Edit e : edits(toRawText(original), toRawText(mutated))) {
            int newCount = e.getEndB() - e.getBeginB();
            changed += newCount > 0 ? newCount : e.getEndA() - e.getBeginA();
        }
        return changed;
    }

    private static EditList edits(RawText oldText, RawText newText) {
        return ALGORITHM.diff(RawTextComparator.DEFAULT, oldText, newText);
    }

    private static RawText toRawText(String text) {
        return new RawText(text.getBytes(StandardCharsets.UTF_8));
    }
}
