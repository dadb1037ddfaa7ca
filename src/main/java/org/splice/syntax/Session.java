package org.splice.syntax;

/**
 * Parse session: the source map plus the node identifier counter. Every node parsed in a session
 * gets an identifier distinct from every other node parsed in the same session.
 */
public final class Session {

    private final SourceMap sourceMap = new SourceMap();
    private int nextId;
    private int fragmentCount;

    public SourceMap sourceMap() {
        return sourceMap;
    }

    public int nextNodeId() {
        return nextId++;
    }

    /**
     * Parses {@code file} as exactly one node of {@code kind}.
     *
     * @throws ParseException if the text is not one well-formed node of that kind
     */
    public Node parse(NodeKind kind, SourceFile file) {
        return new Parser(this, file).parseLone(kind);
    }

    public Node parse(NodeKind kind, String text) {
        return parse(kind, sourceMap.addFile("<fragment-" + (++fragmentCount) + ">", text));
    }

    public Node parseCrate(String name, String text) {
        return parse(NodeKind.CRATE, sourceMap.addFile(name, text));
    }
}
