package com.gridcore.engine.services;

import com.gridcore.engine.models.CellAddress;
import com.gridcore.engine.models.CellRange;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Tracks references between cells:
 * - forward adjacency: cell -> the cells it reads (precedents)
 * - reverse adjacency: cell -> the cells that read it (dependents)
 * - range edges: cell -> large ranges it reads, kept as one rectangle each
 * Both maps are kept in sync by every mutation. A cell depends on a range edge
 * exactly when the rectangle contains it.
 */
public class DependencyGraph {

    private final Map<CellAddress, Set<CellAddress>> forward = new HashMap<>();
    private final Map<CellAddress, Set<CellAddress>> reverse = new HashMap<>();
    private final Map<CellAddress, Set<CellRange>> rangeEdges = new HashMap<>();

    /**
     * Replaces all outgoing edges of 'address' with 'references'.
     */
    public void setDependencies(CellAddress address, Collection<CellAddress> references) {
        setDependencies(address, references, Collections.emptySet());
    }

    /**
     * Replaces all outgoing edges of 'address' with single references and range edges.
     */
    public void setDependencies(CellAddress address, Collection<CellAddress> references,
                                Collection<CellRange> ranges) {
        removeDependencies(address);
        if (!ranges.isEmpty()) {
            rangeEdges.put(address, new LinkedHashSet<>(ranges));
        }
        if (references.isEmpty()) {
            return;
        }
        Set<CellAddress> targets = new LinkedHashSet<>(references);
        forward.put(address, targets);
        for (CellAddress target : targets) {
            reverse.computeIfAbsent(target, k -> new LinkedHashSet<>()).add(address);
        }
    }

    /**
     * Removes all forward references of 'address', and
     * also removes 'address' from each target's reverse references.
     */
    public void removeDependencies(CellAddress address) {
        rangeEdges.remove(address);
        Set<CellAddress> oldTargets = forward.remove(address);
        if (oldTargets == null) {
            return;
        }
        for (CellAddress target : oldTargets) {
            Set<CellAddress> dependents = reverse.get(target);
            if (dependents != null) {
                dependents.remove(address);
                if (dependents.isEmpty()) {
                    reverse.remove(target);
                }
            }
        }
    }

    /**
     * True if giving 'address' the precedents 'references' would close a cycle:
     * either a direct self reference, or some reference already depends on 'address'.
     */
    public boolean wouldCycle(CellAddress address, Collection<CellAddress> references) {
        return wouldCycle(address, references, Collections.emptySet());
    }

    /**
     * As {@link #wouldCycle(CellAddress, Collection)}, with range edges read as every
     * cell they contain. Only cells that have precedents themselves are followed.
     */
    public boolean wouldCycle(CellAddress address, Collection<CellAddress> references,
                              Collection<CellRange> ranges) {
        if (references.contains(address)) {
            return true;
        }
        for (CellRange range : ranges) {
            if (range.contains(address)) {
                return true;
            }
        }
        Set<CellAddress> visited = new HashSet<>();
        Deque<CellAddress> stack = new ArrayDeque<>(references);
        for (CellRange range : ranges) {
            stack.addAll(nodesWithin(range));
        }
        while (!stack.isEmpty()) {
            CellAddress current = stack.pop();
            if (!visited.add(current)) {
                continue;
            }
            for (CellAddress precedent : forward.getOrDefault(current, Collections.emptySet())) {
                if (precedent.equals(address)) {
                    return true;
                }
                stack.push(precedent);
            }
            for (CellRange range : rangeEdges.getOrDefault(current, Collections.emptySet())) {
                if (range.contains(address)) {
                    return true;
                }
                stack.addAll(nodesWithin(range));
            }
        }
        return false;
    }

    public Set<CellAddress> precedentsOf(CellAddress address) {
        return Collections.unmodifiableSet(forward.getOrDefault(address, Collections.emptySet()));
    }

    public Set<CellRange> rangePrecedentsOf(CellAddress address) {
        return Collections.unmodifiableSet(rangeEdges.getOrDefault(address, Collections.emptySet()));
    }

    /**
     * Cells that read 'address' directly, through a single reference or a range edge.
     */
    public Set<CellAddress> directDependentsOf(CellAddress address) {
        Set<CellAddress> direct = reverse.getOrDefault(address, Collections.emptySet());
        if (rangeEdges.isEmpty()) {
            return Collections.unmodifiableSet(direct);
        }
        Set<CellAddress> result = new LinkedHashSet<>(direct);
        for (Map.Entry<CellAddress, Set<CellRange>> entry : rangeEdges.entrySet()) {
            for (CellRange range : entry.getValue()) {
                if (range.contains(address)) {
                    result.add(entry.getKey());
                    break;
                }
            }
        }
        return Collections.unmodifiableSet(result);
    }

    /**
     * Every cell that transitively reads 'address', in breadth-first order.
     */
    public Set<CellAddress> dependentsOf(CellAddress address) {
        Set<CellAddress> result = new LinkedHashSet<>();
        Deque<CellAddress> queue = new ArrayDeque<>();
        queue.add(address);
        while (!queue.isEmpty()) {
            CellAddress current = queue.poll();
            for (CellAddress dependent : directDependentsOf(current)) {
                if (result.add(dependent)) {
                    queue.add(dependent);
                }
            }
        }
        result.remove(address);
        return result;
    }

    public boolean hasDependencies(CellAddress address) {
        return forward.containsKey(address) || rangeEdges.containsKey(address);
    }

    public void clear() {
        forward.clear();
        reverse.clear();
        rangeEdges.clear();
    }

    /**
     * Number of edges; a range edge counts once.
     */
    public int edgeCount() {
        int count = 0;
        for (Set<CellAddress> targets : forward.values()) {
            count += targets.size();
        }
        for (Set<CellRange> ranges : rangeEdges.values()) {
            count += ranges.size();
        }
        return count;
    }

    // Read-only views keyed by A1 text, used by the REST layer. Range edges appear as "A1:B9".
    public Map<String, Set<String>> getForwardGraph() {
        Map<CellAddress, Set<String>> merged = new TreeMap<>();
        forward.forEach((key, targets) -> merged.computeIfAbsent(key, k -> new LinkedHashSet<>()).addAll(toText(targets)));
        rangeEdges.forEach((key, ranges) -> merged.computeIfAbsent(key, k -> new LinkedHashSet<>()).addAll(toText(ranges)));
        Map<String, Set<String>> result = new LinkedHashMap<>();
        merged.forEach((key, targets) -> result.put(key.toString(), targets));
        return result;
    }

    public Map<String, Set<String>> getReverseGraph() {
        Map<String, Set<String>> result = new LinkedHashMap<>();
        new TreeMap<>(reverse).forEach((key, dependents) -> result.put(key.toString(), toText(dependents)));
        Map<CellRange, Set<String>> byRange = new LinkedHashMap<>();
        new TreeMap<>(rangeEdges).forEach((key, ranges) -> {
            for (CellRange range : ranges) {
                byRange.computeIfAbsent(range, r -> new LinkedHashSet<>()).add(key.toString());
            }
        });
        byRange.forEach((range, dependents) -> result.put(range.toString(), dependents));
        return result;
    }

    // Cells inside 'range' that read something themselves.
    private List<CellAddress> nodesWithin(CellRange range) {
        List<CellAddress> nodes = new ArrayList<>();
        for (CellAddress node : forward.keySet()) {
            if (range.contains(node)) {
                nodes.add(node);
            }
        }
        for (CellAddress node : rangeEdges.keySet()) {
            if (range.contains(node) && !forward.containsKey(node)) {
                nodes.add(node);
            }
        }
        return nodes;
    }

    private static Set<String> toText(Collection<?> items) {
        Set<String> text = new LinkedHashSet<>();
        for (Object item : items) {
            text.add(item.toString());
        }
        return text;
    }
}
