package org.splice.rewrite;

public final class RewriteOptions {

    private static final RewriteOptions DEFAULTS = new RewriteOptions(true, true, true);

    private final boolean headerRecovery;
    private final boolean sequenceAlignment;
    private final boolean layoutAware;

    private RewriteOptions(boolean headerRecovery, boolean sequenceAlignment, boolean layoutAware) {
        this.headerRecovery = headerRecovery;
        this.sequenceAlignment = sequenceAlignment;
        this.layoutAware = layoutAware;
    }

    public static RewriteOptions defaults() {
        return DEFAULTS;
    }

    public boolean headerRecovery() {
        return headerRecovery;
    }

    /**
     * Align item, statement and attribute lists by node identifier. When off, those lists are
     * reconciled positionally and any length change reprints the parent.
     */
    public boolean sequenceAlignment() {
        return sequenceAlignment;
    }

    public boolean layoutAware() {
        return layoutAware;
    }

    public RewriteOptions withHeaderRecovery(boolean enabled) {
        return new RewriteOptions(enabled, sequenceAlignment, layoutAware);
    }

    public RewriteOptions withSequenceAlignment(boolean enabled) {
        return new RewriteOptions(headerRecovery, enabled, layoutAware);
    }

    public RewriteOptions withLayoutAware(boolean enabled) {
        return new RewriteOptions(headerRecovery, sequenceAlignment, enabled);
    }

    @Override
    public String toString() {
        return "RewriteOptions{headerRecovery=" + headerRecovery + ", sequenceAlignment="
                + sequenceAlignment + ", layoutAware=" + layoutAware + "}";
    }
}
