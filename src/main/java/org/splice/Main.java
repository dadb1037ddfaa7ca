package org.splice;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.splice.rewrite.RewriteOptions;
import org.splice.syntax.Node;
import org.splice.syntax.ParseException;

import java.io.IOException;
import java.io.PrintStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.splice.SpliceExtractor.saveProjectSpliceToJson;

/**
 * Command line entry point.
 *
 * <pre>
 * Main &lt;old&gt; &lt;new&gt; [--json FILE] [--out PATH] [--dump-tree] [--lisp]
 *      [--no-recovery] [--no-sequence] [--no-layout]
 * </pre>
 *
 * With two files, prints the old file rewritten to match the new one (or writes it to
 * {@code --out}). With two directories, splices every pair of {@code .rs} files and writes a JSON
 * report to {@code --json} (default {@code splice-report.json}).
 */
public class Main {

    private static final Logger logger = LoggerFactory.getLogger(Main.class);

    static final String USAGE = "usage: Main <old> <new> [--json FILE] [--out PATH] [--dump-tree] [--lisp]"
            + " [--no-recovery] [--no-sequence] [--no-layout]";

    public static void main(String[] args) {
        int status = run(args, System.out, System.err);
        if (status != 0) {
            System.exit(status);
        }
    }

    static int run(String[] args, PrintStream out, PrintStream err) {
        List<String> positional = new ArrayList<>();
        String json = null;
        String outPath = null;
        boolean dumpTree = false;
        boolean lisp = false;
        RewriteOptions options = RewriteOptions.defaults();

        for (int i = 0; i < args.length; i++) {
            String arg = args[i];
            switch (arg) {
                case "--json":
                case "--out":
                    if (i + 1 >= args.length) {
                        err.println(arg + " needs an argument");
                        err.println(USAGE);
                        return 2;
                    }
                    if (arg.equals("--json")) {
                        json = args[++i];
                    } else {
                        outPath = args[++i];
                    }
                    break;
                case "--dump-tree":
                    dumpTree = true;
                    break;
                case "--lisp":
                    lisp = true;
                    break;
                case "--no-recovery":
                    options = options.withHeaderRecovery(false);
                    break;
                case "--no-sequence":
                    options = options.withSequenceAlignment(false);
                    break;
                case "--no-layout":
                    options = options.withLayoutAware(false);
                    break;
                default:
                    if (arg.startsWith("--")) {
                        err.println("unknown option " + arg);
                        err.println(USAGE);
                        return 2;
                    }
                    positional.add(arg);
            }
        }
        if (positional.size() != 2) {
            err.println(USAGE);
            return 2;
        }

        Path oldPath = Paths.get(positional.get(0));
        Path newPath = Paths.get(positional.get(1));
        try {
            if (Files.isDirectory(oldPath) && Files.isDirectory(newPath)) {
                String report = json == null ? "splice-report.json" : json;
                Map<String, Object> result = saveProjectSpliceToJson(oldPath.toString(), newPath.toString(),
                        report, outPath, options);
                out.println("Splice report written to " + report + " " + result.get("summary"));
                return 0;
            }
            if (Files.isRegularFile(oldPath) && Files.isRegularFile(newPath)) {
                return spliceFiles(oldPath, newPath, json, outPath, dumpTree, lisp, options, out);
            }
            err.println("expected two files or two directories: " + oldPath + ", " + newPath);
            return 2;
        } catch (ParseException e) {
            err.println(e.getMessage());
            return 1;
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    private static int spliceFiles(Path oldPath, Path newPath, String json, String outPath, boolean dumpTree,
                                   boolean lisp, RewriteOptions options, PrintStream out) throws IOException {
        String rel = oldPath.getFileName().toString();
        logger.info("splicing {} into {}", newPath, oldPath);
        SpliceExtractor.FileSplice splice = SpliceExtractor.spliceText(rel,
                Helpers.readSource(oldPath), Helpers.readSource(newPath), options);

        if (dumpTree) {
            out.println(";; old tree");
            out.print(dump(splice.oldTree, lisp));
            out.println(";; new tree");
            out.print(dump(splice.newTree, lisp));
        }
        if (json != null) {
            SpliceExtractor.writeJson(Paths.get(json), SpliceExtractor.fileReport(rel, splice));
            logger.info("report written to {}", json);
        }
        if (outPath != null) {
            Helpers.writeSource(Paths.get(outPath), splice.text);
            logger.info("{} edits written to {}", splice.edits.size(), outPath);
        } else {
            out.print(splice.text);
        }
        if (!splice.abandoned.isEmpty()) {
            logger.warn("{} nodes could not be rewritten", splice.abandoned.size());
        }
        return 0;
    }

    private static String dump(Node tree, boolean lisp) {
        return lisp ? Serializers.toLisp(tree) + "\n" : Serializers.toTreeSitterString(tree);
    }
}
