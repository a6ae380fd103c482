package com.formulatrace.app.models;

import com.formulatrace.app.util.CellAddresses;

import java.util.*;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Represents an in-memory workbook:
 * - Ordered sheets, looked up case-insensitively by name
 * - Two dependency graphs (forward, reverse) to track formula references
 * - A read/write lock for concurrency
 *
 * The graphs are what the in-memory host answers precedent and dependent
 * index queries from.
 */
public class Workbook {

    // sheetKey -> Sheet, in creation order
    private final Map<String, Sheet> sheets = new LinkedHashMap<>();

    // Forward adjacency: formula cell -> areas its formula references
    private final Map<CellAddress, List<AreaRef>> dependencyGraphForward = new HashMap<>();
    // Reverse adjacency: referenced area -> formula cells that reference it
    private final Map<AreaRef, Set<CellAddress>> dependencyGraphReverse = new LinkedHashMap<>();

    // Lock to prevent race conditions when multiple threads update the workbook
    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();

    /**
     * Returns the existing sheet with this name or creates it.
     */
    public Sheet addSheet(String name) {
        return sheets.computeIfAbsent(CellAddresses.sheetKey(name), k -> new Sheet(name.trim()));
    }

    public Sheet getSheet(String name) {
        return sheets.get(CellAddresses.sheetKey(name));
    }

    public List<Sheet> getSheets() {
        return new ArrayList<>(sheets.values());
    }

    // ------------------------
    // Dependency Management
    // ------------------------

    /**
     * Adds a reference from 'source' -> 'area' in the forward graph,
     * and the reverse graph from 'area' -> 'source'.
     */
    public void addDependency(CellAddress source, AreaRef area) {
        List<AreaRef> targets = dependencyGraphForward.computeIfAbsent(source, k -> new ArrayList<>());
        if (!targets.contains(area)) {
            targets.add(area);
        }
        dependencyGraphReverse
                .computeIfAbsent(area, k -> new LinkedHashSet<>())
                .add(source);
    }

    /**
     * Removes all forward references from 'source', and
     * also removes 'source' from each area's reverse references.
     */
    public void clearDependencies(CellAddress source) {
        List<AreaRef> oldTargets = dependencyGraphForward.remove(source);
        if (oldTargets == null) {
            return;
        }
        for (AreaRef area : oldTargets) {
            Set<CellAddress> revSet = dependencyGraphReverse.get(area);
            if (revSet != null) {
                revSet.remove(source);
                if (revSet.isEmpty()) {
                    dependencyGraphReverse.remove(area);
                }
            }
        }
    }

    /**
     * Areas referenced by the formula at 'source', in formula order.
     */
    public List<AreaRef> getPrecedentAreas(CellAddress source) {
        return dependencyGraphForward.getOrDefault(source, Collections.emptyList());
    }

    /**
     * Formula cells that reference 'target', directly or through a range.
     */
    public Set<CellAddress> getDependentCells(CellAddress target) {
        Set<CellAddress> dependents = new LinkedHashSet<>();
        for (Map.Entry<AreaRef, Set<CellAddress>> entry : dependencyGraphReverse.entrySet()) {
            if (entry.getKey().contains(target)) {
                dependents.addAll(entry.getValue());
            }
        }
        return dependents;
    }

    public ReentrantReadWriteLock getLock() {
        return lock;
    }
}
