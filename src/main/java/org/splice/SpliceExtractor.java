package org.splice;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.splice.match.TreeMatcher;
import org.splice.rewrite.RewriteOptions;
import org.splice.rewrite.RewriteResult;
import org.splice.rewrite.Rewriter;
import org.splice.rewrite.TextEdit;
import org.splice.rewrite.TextRewriter;
import org.splice.syntax.Node;
import org.splice.syntax.Session;
import org.splice.syntax.SourceFile;
import org.splice.syntax.Span;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.*;
import java.util.*;

import static org.splice.Helpers.*;

/**
 * Splices the changes between two versions of a source file (or of a whole source tree) into the
 * old text, and reports the edits as JSON.
 */
public class SpliceExtractor {

    private static final Logger logger = LoggerFactory.getLogger(SpliceExtractor.class);


    /** Outcome of splicing one pair of texts. */
    public static final class FileSplice {
        public final Node oldTree;
        public final Node newTree;
        public final List<TextEdit> edits;
        public final List<Span> abandoned;
        public final String text;
        public final boolean roundTrip;

        FileSplice(Node oldTree, Node newTree, List<TextEdit> edits, List<Span> abandoned,
                   String text, boolean roundTrip) {
            this.oldTree = oldTree;
            this.newTree = newTree;
            this.edits = edits;
            this.abandoned = abandoned;
            this.text = text;
            this.roundTrip = roundTrip;
        }
    }

    /**
     * Parses both texts, matches the new tree against the old one and rewrites the old text.
     * {@code roundTrip} tells whether the rewritten text parses to the same structure as
     * {@code newText}.
     *
     * @throws org.splice.syntax.ParseException if either text does not parse
     */
    public static FileSplice spliceText(String name, String oldText, String newText, RewriteOptions options) {
        Session session = new Session();
        Node oldTree = session.parseCrate(name, oldText);
        Node newTree = session.parseCrate(name + " (new)", newText);
        TreeMatcher.assignIds(oldTree, newTree);

        RewriteResult result = new Rewriter(session, options).rewrite(oldTree, newTree);
        SourceFile oldFile = oldTree.span().file();
        List<TextEdit> edits = TextRewriter.flatten(result.rewrites());
        String text = TextRewriter.apply(oldFile, edits);

        Node reparsed = new Session().parseCrate(name + " (rewritten)", text);
        boolean roundTrip = reparsed.sameStructure(newTree);
        if (!roundTrip && !result.hasAbandoned()) {
            logger.warn("{}: rewritten text does not parse to the new tree", name);
        }
        return new FileSplice(oldTree, newTree, edits, result.abandoned(), text, roundTrip);
    }

    /**
     * Splices one pair of files and returns the JSON-ready report entry.
     *
     * @param outFile where to write the rewritten text, or null
     */
    public static Map<String, Object> spliceFiles(String rel, Path oldPath, Path newPath,
                                                  RewriteOptions options, Path outFile) {
        Map<String, Object> entry = new LinkedHashMap<>();
        entry.put("path", rel);
        try {
            String oldText = readSource(oldPath);
            String newText = readSource(newPath);
            if (sha1(oldText.getBytes(StandardCharsets.UTF_8)).equals(sha1(newText.getBytes(StandardCharsets.UTF_8)))) {
                entry.put("status", "unchanged");
                entry.put("edits", Collections.emptyList());
                if (outFile != null) {
                    writeSource(outFile, oldText);
                }
                return entry;
            }

            long tStart = System.nanoTime();
            FileSplice splice = spliceText(rel, oldText, newText, options);
            long tookMs = msSince(tStart);

            entry.put("status", "modified");
            entry.put("edits", toEditList(splice.edits));
            entry.put("abandoned", toSpanList(splice.abandoned));
            entry.put("roundTrip", splice.roundTrip);
            entry.put("spliceTimeMs", tookMs);
            if (outFile != null) {
                writeSource(outFile, splice.text);
            }
        } catch (Exception ex) {
            logger.warn("{}: {}", rel, ex.getMessage());
            entry.put("status", "error");
            entry.put("error", ex.getClass().getSimpleName() + ": " + ex.getMessage());
            entry.put("edits", Collections.emptyList());
            entry.put("spliceTimeMs", null);
        }
        return entry;
    }

    /**
     * Compare two source directories and write a JSON report.
     *
     * @param oldProjectDir path to OLD sources
     * @param newProjectDir path to NEW sources
     * @param outputJson    path to the result JSON file to create/overwrite
     * @param outDir        directory receiving the rewritten sources, or null
     * @throws IOException if any IO error occurs outside a single file's splice
     */
    public static Map<String, Object> saveProjectSpliceToJson(String oldProjectDir,
                                                              String newProjectDir,
                                                              String outputJson,
                                                              String outDir,
                                                              RewriteOptions options) throws IOException {
        Path oldRoot = Paths.get(oldProjectDir).toAbsolutePath().normalize();
        Path newRoot = Paths.get(newProjectDir).toAbsolutePath().normalize();
        Path outRoot = outDir == null ? null : Paths.get(outDir).toAbsolutePath().normalize();

        // 1) Collect all source files by relative path for both roots.
        Map<String, Path> oldFiles = listRustFiles(oldRoot);
        Map<String, Path> newFiles = listRustFiles(newRoot);

        // 2) Build the union of relative paths and classify.
        Set<String> allRelPaths = new TreeSet<>();
        allRelPaths.addAll(oldFiles.keySet());
        allRelPaths.addAll(newFiles.keySet());

        Map<String, Object> report = new LinkedHashMap<>();
        report.put("before", oldRoot.toString());
        report.put("after", newRoot.toString());
        report.put("generatedAt", new Date().toString());
        report.put("options", toOptionMap(options));

        List<Map<String, Object>> files = new ArrayList<>();
        Map<String, Integer> counts = new TreeMap<>();
        for (String rel : allRelPaths) {
            Path oldPath = oldFiles.get(rel);
            Path newPath = newFiles.get(rel);
            Path outFile = outRoot == null ? null : outRoot.resolve(rel);
            Map<String, Object> entry;
            if (oldPath != null && newPath != null) {
                logger.info("splicing {}", rel);
                entry = spliceFiles(rel, oldPath, newPath, options, outFile);
            } else if (oldPath != null) {
                entry = new LinkedHashMap<>();
                entry.put("path", rel);
                entry.put("status", "deleted_file");
            } else {
                entry = new LinkedHashMap<>();
                entry.put("path", rel);
                entry.put("status", "added_file");
                if (outFile != null) {
                    writeSource(outFile, readSource(newPath));
                }
            }
            counts.merge((String) entry.get("status"), 1, Integer::sum);
            files.add(entry);
        }
        report.put("summary", counts);
        report.put("files", files);

        writeJson(Paths.get(outputJson), report);
        logger.info("report for {} files written to {}", files.size(), outputJson);
        return report;
    }

    public static void writeJson(Path outFile, Object report) throws IOException {
        Gson gson = new GsonBuilder().setPrettyPrinting().disableHtmlEscaping().create();
        writeSource(outFile, gson.toJson(report));
    }

    public static Map<String, Object> fileReport(String rel, FileSplice splice) {
        Map<String, Object> entry = new LinkedHashMap<>();
        entry.put("path", rel);
        entry.put("status", splice.edits.isEmpty() ? "unchanged" : "modified");
        entry.put("edits", toEditList(splice.edits));
        entry.put("abandoned", toSpanList(splice.abandoned));
        entry.put("roundTrip", splice.roundTrip);
        return entry;
    }

    private static List<Map<String, Object>> toEditList(List<TextEdit> edits) {
        List<Map<String, Object>> result = new ArrayList<>();
        for (TextEdit edit : edits) {
            Map<String, Object> m = new LinkedHashMap<>();
            Span target = edit.target();
            m.put("kind", target.isEmpty() ? "insert" : edit.text().isEmpty() ? "delete" : "replace");
            m.put("lo", target.lo());
            m.put("hi", target.hi());
            m.put("before", oneLine(target.text()));
            m.put("after", oneLine(edit.text()));
            result.add(m);
        }
        return result;
    }

    private static List<String> toSpanList(List<Span> spans) {
        List<String> result = new ArrayList<>();
        for (Span span : spans) {
            result.add(span.lo() + ".." + span.hi());
        }
        return result;
    }

    private static Map<String, Object> toOptionMap(RewriteOptions options) {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("headerRecovery", options.headerRecovery());
        m.put("sequenceAlignment", options.sequenceAlignment());
        m.put("layoutAware", options.layoutAware());
        return m;
    }
}
