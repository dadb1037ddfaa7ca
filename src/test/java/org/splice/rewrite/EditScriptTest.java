package org.splice.rewrite;

import static org.junit.jupiter.api.Assertions.*;
import static org.splice.rewrite.EditScript.Op.DELETE;
import static org.splice.rewrite.EditScript.Op.INSERT;
import static org.splice.rewrite.EditScript.Op.KEEP;
import static org.splice.rewrite.EditScript.Op.REPLACE;

import java.util.List;
import org.junit.jupiter.api.Test;

final class EditScriptTest {

    @Test
    void identicalSequencesAreKept() {
        assertEquals(List.of(KEEP, KEEP, KEEP), EditScript.diff(List.of(1, 2, 3), List.of(1, 2, 3)));
        assertEquals(List.of(), EditScript.diff(List.of(), List.of()));
    }

    @Test
    void singleChangesAreLocal() {
        assertEquals(List.of(KEEP, INSERT, KEEP, KEEP),
                EditScript.diff(List.of(1, 2, 3), List.of(1, 4, 2, 3)));
        assertEquals(List.of(KEEP, DELETE, KEEP), EditScript.diff(List.of(1, 2, 3), List.of(1, 3)));
        assertEquals(List.of(KEEP, DELETE, INSERT, KEEP),
                EditScript.diff(List.of(1, 2, 3), List.of(1, 4, 3)));
    }

    @Test
    void deletionComesFirstOnTies() {
        assertEquals(List.of(DELETE, KEEP, INSERT), EditScript.diff(List.of(1, 2), List.of(2, 1)));
        assertEquals(List.of(DELETE, INSERT), EditScript.diff(List.of(1), List.of(2)));
    }

    @Test
    void oneEmptySideIsAllInsertsOrAllDeletes() {
        assertEquals(List.of(INSERT, INSERT), EditScript.diff(List.of(), List.of(7, 8)));
        assertEquals(List.of(DELETE, DELETE), EditScript.diff(List.of(7, 8), List.of()));
    }

    @Test
    void scriptCoversBothSequences() {
        List<Integer> oldIds = List.of(5, 1, 9, 2, 7, 3);
        List<Integer> newIds = List.of(1, 4, 2, 3, 8, 5);
        List<EditScript.Op> ops = EditScript.diff(oldIds, newIds);
        long keeps = ops.stream().filter(op -> op == KEEP).count();
        long deletes = ops.stream().filter(op -> op == DELETE).count();
        long inserts = ops.stream().filter(op -> op == INSERT).count();
        assertEquals(3, keeps, "longest common subsequence is 1, 2, 3");
        assertEquals(oldIds.size(), keeps + deletes);
        assertEquals(newIds.size(), keeps + inserts);
    }

    @Test
    void coalescePairsDeleteRunsWithFollowingInsertRuns() {
        assertEquals(List.of(KEEP, REPLACE, KEEP),
                EditScript.coalesce(List.of(KEEP, DELETE, INSERT, KEEP)));
        assertEquals(List.of(REPLACE, DELETE),
                EditScript.coalesce(List.of(DELETE, DELETE, INSERT)));
        assertEquals(List.of(REPLACE, INSERT),
                EditScript.coalesce(List.of(DELETE, INSERT, INSERT)));
    }

    @Test
    void coalesceLeavesSeparatedRunsAlone() {
        List<EditScript.Op> ops = List.of(KEEP, DELETE, KEEP, INSERT);
        assertEquals(ops, EditScript.coalesce(ops));
        assertEquals(List.of(INSERT, DELETE), EditScript.coalesce(List.of(INSERT, DELETE)),
                "an insertion before a deletion is not a replacement");
    }
}
