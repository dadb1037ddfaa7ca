package org.splice.rewrite;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Insert/delete/keep scripts aligning two identifier sequences along a longest common
 * subsequence.
 *
 * <p>The alignment is deterministic: when the identifiers at the current positions are equal they
 * are kept, and when skipping either side leaves an equally long common subsequence the old-side
 * deletion comes before the new-side insertion.
 */
public final class EditScript {

    public enum Op {
        /** Old and new element are the same node. */
        KEEP,
        /** The old element has no counterpart. */
        DELETE,
        /** The new element has no counterpart. */
        INSERT,
        /** A deleted old element paired with an inserted new one. */
        REPLACE
    }

    private EditScript() {
    }

    public static List<Op> diff(List<Integer> oldIds, List<Integer> newIds) {
        int n = oldIds.size();
        int m = newIds.size();
        // lcs[i][j] = length of the LCS of oldIds[i..] and newIds[j..]
        int[][] lcs = new int[n + 1][m + 1];
        for (int i = n - 1; i >= 0; i--) {
            for (int j = m - 1; j >= 0; j--) {
                if (oldIds.get(i).equals(newIds.get(j))) {
                    lcs[i][j] = lcs[i + 1][j + 1] + 1;
                } else {
                    lcs[i][j] = Math.max(lcs[i + 1][j], lcs[i][j + 1]);
                }
            }
        }

        List<Op> ops = new ArrayList<>(n + m);
        int i = 0;
        int j = 0;
        while (i < n && j < m) {
            if (oldIds.get(i).equals(newIds.get(j))) {
                ops.add(Op.KEEP);
                i++;
                j++;
            } else if (lcs[i + 1][j] >= lcs[i][j + 1]) {
                ops.add(Op.DELETE);
                i++;
            } else {
                ops.add(Op.INSERT);
                j++;
            }
        }
        ops.addAll(Collections.nCopies(n - i, Op.DELETE));
        ops.addAll(Collections.nCopies(m - j, Op.INSERT));
        return ops;
    }

    /**
     * Pairs each run of deletions that is directly followed by a run of insertions into
     * replacements. The unpaired rest of the longer run keeps its operation and follows the
     * replacements.
     */
    public static List<Op> coalesce(List<Op> ops) {
        List<Op> result = new ArrayList<>(ops.size());
        int k = 0;
        while (k < ops.size()) {
            if (ops.get(k) != Op.DELETE) {
                result.add(ops.get(k));
                k++;
                continue;
            }
            int deletes = 0;
            while (k < ops.size() && ops.get(k) == Op.DELETE) {
                deletes++;
                k++;
            }
            int inserts = 0;
            while (k < ops.size() && ops.get(k) == Op.INSERT) {
                inserts++;
                k++;
            }
            int replaces = Math.min(deletes, inserts);
            result.addAll(Collections.nCopies(replaces, Op.REPLACE));
            result.addAll(Collections.nCopies(deletes - replaces, Op.DELETE));
            result.addAll(Collections.nCopies(inserts - replaces, Op.INSERT));
        }
        return result;
    }
}
