package com.gridcore.engine.services;

import com.gridcore.engine.evaluator.CellResolver;
import com.gridcore.engine.evaluator.Evaluator;
import com.gridcore.engine.models.Cell;
import com.gridcore.engine.models.CellAddress;
import com.gridcore.engine.models.CellRange;
import com.gridcore.engine.models.CellStore;
import com.gridcore.engine.models.CellValue;
import com.gridcore.engine.models.ErrorType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.PriorityQueue;
import java.util.Set;

/**
 * Re-evaluates formula cells after a change, precedents first.
 *
 * A pass goes through these states:
 * 1) COLLECTING: the changed formula cells plus all their transitive dependents form the dirty set.
 * 2) ORDERING: Kahn's algorithm over the dirty subgraph; ties are broken row-major.
 * 3) EVALUATING: each dirty cell is evaluated exactly once in that order.
 * Cells the sort could not place sit on a cycle and get #CIRCULAR!.
 */
public class RecalculationEngine {

    private static final Logger logger = LoggerFactory.getLogger(RecalculationEngine.class);

    public enum State {
        IDLE,
        COLLECTING,
        ORDERING,
        EVALUATING
    }

    private final CellStore store;
    private final DependencyGraph graph;
    private final Evaluator evaluator;
    private final CellResolver resolver;
    private State state = State.IDLE;
    private int lastEvaluatedCount;

    public RecalculationEngine(CellStore store, DependencyGraph graph, Evaluator evaluator) {
        this.store = store;
        this.graph = graph;
        this.evaluator = evaluator;
        this.resolver = new StoreResolver(store);
    }

    public State getState() {
        return state;
    }

    /**
     * Number of formula cells evaluated by the most recent pass.
     */
    public int getLastEvaluatedCount() {
        return lastEvaluatedCount;
    }

    /**
     * Recalculates every formula cell in the sheet.
     */
    public Map<CellAddress, CellValue> recalculate() {
        return recalculate(store.formulaAddresses());
    }

    /**
     * Recalculates 'address' (if it holds a formula) and everything that depends on it.
     */
    public Map<CellAddress, CellValue> recalculateCell(CellAddress address) {
        return recalculate(Collections.singleton(address));
    }

    /**
     * Recalculates the union of the changed cells and their dependents.
     * Returns the cells whose computed value changed, in evaluation order.
     */
    public Map<CellAddress, CellValue> recalculate(Collection<CellAddress> changed) {
        try {
            state = State.COLLECTING;
            Set<CellAddress> dirty = collectDirty(changed);

            state = State.ORDERING;
            List<CellAddress> order = topologicalOrder(dirty);

            state = State.EVALUATING;
            Map<CellAddress, CellValue> updates = new LinkedHashMap<>();
            for (CellAddress address : order) {
                Cell cell = store.get(address);
                CellValue value = evaluator.evaluate(cell.getFormula(), resolver);
                if (!value.equals(cell.getValue())) {
                    updates.put(address, value);
                }
                cell.setValue(value);
            }
            if (order.size() < dirty.size()) {
                markCircular(dirty, order, updates);
            }
            lastEvaluatedCount = dirty.size();
            logger.debug("Recalculated {} cells, {} changed", dirty.size(), updates.size());
            return updates;
        } finally {
            state = State.IDLE;
        }
    }

    private Set<CellAddress> collectDirty(Collection<CellAddress> changed) {
        Set<CellAddress> dirty = new LinkedHashSet<>();
        for (CellAddress address : changed) {
            if (isFormula(address)) {
                dirty.add(address);
            }
            for (CellAddress dependent : graph.dependentsOf(address)) {
                if (isFormula(dependent)) {
                    dirty.add(dependent);
                }
            }
        }
        return dirty;
    }

    private List<CellAddress> topologicalOrder(Set<CellAddress> dirty) {
        Map<CellAddress, Integer> inDegree = new HashMap<>();
        for (CellAddress address : dirty) {
            inDegree.put(address, dirtyPrecedents(address, dirty).size());
        }

        PriorityQueue<CellAddress> ready = new PriorityQueue<>();
        for (Map.Entry<CellAddress, Integer> entry : inDegree.entrySet()) {
            if (entry.getValue() == 0) {
                ready.add(entry.getKey());
            }
        }

        List<CellAddress> order = new ArrayList<>(dirty.size());
        while (!ready.isEmpty()) {
            CellAddress current = ready.poll();
            order.add(current);
            for (CellAddress dependent : graph.directDependentsOf(current)) {
                Integer degree = inDegree.get(dependent);
                if (degree == null) {
                    continue;
                }
                inDegree.put(dependent, degree - 1);
                if (degree - 1 == 0) {
                    ready.add(dependent);
                }
            }
        }
        return order;
    }

    // Distinct dirty cells read by 'address', through single references or range edges.
    private Set<CellAddress> dirtyPrecedents(CellAddress address, Set<CellAddress> dirty) {
        Set<CellAddress> result = new HashSet<>();
        for (CellAddress precedent : graph.precedentsOf(address)) {
            if (dirty.contains(precedent)) {
                result.add(precedent);
            }
        }
        Set<CellRange> ranges = graph.rangePrecedentsOf(address);
        if (!ranges.isEmpty()) {
            for (CellAddress candidate : dirty) {
                for (CellRange range : ranges) {
                    if (range.contains(candidate)) {
                        result.add(candidate);
                        break;
                    }
                }
            }
        }
        return result;
    }

    private void markCircular(Set<CellAddress> dirty, List<CellAddress> order, Map<CellAddress, CellValue> updates) {
        Set<CellAddress> placed = new LinkedHashSet<>(order);
        CellValue circular = CellValue.error(ErrorType.CIRCULAR);
        List<CellAddress> stuck = new ArrayList<>();
        for (CellAddress address : dirty) {
            if (!placed.contains(address)) {
                stuck.add(address);
            }
        }
        Collections.sort(stuck);
        logger.warn("Cycle detected during recalculation, marking {} cells as {}", stuck.size(), circular.getError().getCode());
        for (CellAddress address : stuck) {
            Cell cell = store.get(address);
            if (!circular.equals(cell.getValue())) {
                updates.put(address, circular);
            }
            cell.setValue(circular);
        }
    }

    private boolean isFormula(CellAddress address) {
        Cell cell = store.get(address);
        return cell != null && cell.hasFormula();
    }

    /**
     * Reads computed values from the store. Large ranges are answered from the
     * occupied cells only, so their cost follows the number of stored cells.
     */
    private static final class StoreResolver implements CellResolver {

        private final CellStore store;

        private StoreResolver(CellStore store) {
            this.store = store;
        }

        @Override
        public CellValue resolve(CellAddress address) {
            return store.getValue(address);
        }

        @Override
        public List<CellValue> resolveRange(CellRange range) {
            if (range.size() <= store.size()) {
                return CellResolver.super.resolveRange(range);
            }
            List<CellValue> values = new ArrayList<>();
            for (CellAddress address : store.addressesWithin(range)) {
                values.add(store.getValue(address));
            }
            return values;
        }
    }
}
