package com.gridcore.engine.services;

import com.gridcore.engine.exceptions.InvalidStructuralOperationException;
import com.gridcore.engine.formula.ReferenceCollector;
import com.gridcore.engine.models.Cell;
import com.gridcore.engine.models.CellAddress;
import com.gridcore.engine.models.CellStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class StructuralTransformerTest {

    private CellStore store;
    private DependencyGraph graph;
    private StructuralTransformer transformer;

    private static CellAddress a(String text) {
        return CellAddress.fromString(text);
    }

    @BeforeEach
    void setUp() {
        store = new CellStore();
        graph = new DependencyGraph();
        transformer = new StructuralTransformer(store, graph, 10, 10);
    }

    private void set(String address, String raw) {
        Cell cell = CellFactory.create(a(address), raw);
        store.put(cell);
        if (cell.hasFormula()) {
            graph.setDependencies(cell.getAddress(), ReferenceCollector.collect(cell.getFormula()));
        }
    }

    @Test
    void testInsertRowsMovesCellsAndRebuildsGraph() {
        set("A1", "1");
        set("A2", "2");
        set("B2", "=A1+A2");

        transformer.insertRows(1, 2);

        assertEquals("1", store.get(a("A1")).getRawValue());
        assertNull(store.get(a("A2")));
        assertEquals("2", store.get(a("A4")).getRawValue());
        assertEquals("=A1+A4", store.get(a("B4")).getRawValue());
        assertEquals(Set.of(a("A1"), a("A4")), graph.precedentsOf(a("B4")));
        assertFalse(graph.hasDependencies(a("B2")));
    }

    @Test
    void testDeleteColumnsDropsCellsInSpan() {
        set("A1", "1");
        set("B1", "2");
        set("C1", "3");
        set("D1", "=A1+B1+C1");

        transformer.deleteColumns(1, 2);

        assertEquals(2, store.size());
        assertEquals("=A1+#REF!+#REF!", store.get(a("B1")).getRawValue());
        assertEquals(Set.of(a("A1")), graph.precedentsOf(a("B1")));
    }

    @Test
    void testInvalidArguments() {
        assertThrows(InvalidStructuralOperationException.class, () -> transformer.insertRows(-1, 1));
        assertThrows(InvalidStructuralOperationException.class, () -> transformer.deleteRows(0, 0));
        assertThrows(InvalidStructuralOperationException.class, () -> transformer.insertColumns(10, 1));
    }

    /**
     * An insert that would push an occupied cell past the last row is rejected before anything moves.
     */
    @Test
    void testInsertPastSheetEdgeIsRejected() {
        set("A9", "9");
        set("B1", "=A9");
        assertThrows(InvalidStructuralOperationException.class, () -> transformer.insertRows(0, 2));
        assertEquals("9", store.get(a("A9")).getRawValue());
        assertEquals("=A9", store.get(a("B1")).getRawValue());
    }

    @Test
    void testEdgeCasesAreValid() {
        transformer.insertRows(0, 1);
        transformer.deleteRows(9, 1);
        assertEquals(0, store.size());

        set("A10", "last");
        transformer.deleteRows(9, 1);
        assertEquals(0, store.size());
    }
}
