package org.splice.syntax;

import java.util.ArrayList;
import java.util.List;

/**
 * Owns every {@link SourceFile} seen during one session: the original inputs, the text printed
 * for fresh subtrees, and macro-expansion pseudo-files.
 */
public final class SourceMap {

    private final List<SourceFile> files = new ArrayList<>();
    private int freshCount;

    public SourceFile addFile(String name, String text) {
        SourceFile file = new SourceFile(name, text, false);
        files.add(file);
        return file;
    }

    public SourceFile addFreshFile(String text) {
        return addFile("<fresh-" + (++freshCount) + ">", text);
    }

    public SourceFile addMacroFile(String text) {
        SourceFile file = new SourceFile("<macros>", text, true);
        files.add(file);
        return file;
    }

    /** Human-readable form of a span and the text it covers, for log lines. */
    public static String describe(Span span) {
        if (span.file() == null) {
            return "<dummy>";
        }
        return span.file().name() + ": " + span.lo() + " .. " + span.hi() + " = " + span.text();
    }
}
