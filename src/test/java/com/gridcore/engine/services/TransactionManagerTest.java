package com.gridcore.engine.services;

import com.gridcore.engine.exceptions.BatchNotFoundException;
import com.gridcore.engine.exceptions.BatchStateException;
import com.gridcore.engine.models.CellAddress;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class TransactionManagerTest {

    private TransactionManager manager;

    @BeforeEach
    void setUp() {
        manager = new TransactionManager();
    }

    @Test
    void testGeneratedIds() {
        String first = manager.beginBatch(null);
        manager.rollback(first);
        String second = manager.beginBatch("");
        assertTrue(first.startsWith("batch-"));
        assertNotEquals(first, second);
    }

    /**
     * Mutations come back in the order they were recorded.
     */
    @Test
    void testCommitReturnsRecordedMutations() {
        manager.beginBatch("b1");
        manager.record(Mutation.setCell(CellAddress.fromString("A1"), "1"));
        manager.record(Mutation.structural(Mutation.Kind.INSERT_ROWS, 0, 1));
        manager.record(Mutation.deleteCell(CellAddress.fromString("B1")));

        Transaction transaction = manager.commit("b1");
        assertEquals("b1", transaction.getId());
        assertEquals(3, transaction.getMutations().size());
        assertEquals(Mutation.Kind.SET_CELL, transaction.getMutations().get(0).getKind());
        assertEquals(Mutation.Kind.DELETE_CELL, transaction.getMutations().get(2).getKind());
        assertTrue(transaction.hasStructuralMutations());
        assertFalse(manager.isOpen());
    }

    @Test
    void testOnlyOneBatchAtATime() {
        manager.beginBatch("outer");
        BatchStateException e = assertThrows(BatchStateException.class, () -> manager.beginBatch("inner"));
        assertEquals("BATCH_ALREADY_OPEN", e.getCode());
        assertEquals("outer", manager.getActiveId());
    }

    @Test
    void testUnknownBatchId() {
        assertThrows(BatchNotFoundException.class, () -> manager.commit("missing"));
        manager.beginBatch("real");
        assertThrows(BatchNotFoundException.class, () -> manager.rollback("other"));
        assertTrue(manager.isOpen());
    }

    @Test
    void testRecordWithoutBatch() {
        assertThrows(IllegalStateException.class,
                () -> manager.record(Mutation.deleteCell(CellAddress.fromString("A1"))));
    }
}
