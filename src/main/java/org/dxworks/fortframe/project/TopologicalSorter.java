package org.dxworks.fortframe.project;

import org.dxworks.fortframe.model.FortranEntity;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Consumer;

/**
 * Orders entities so that each comes after everything it depends on. Entities
 * that become ready together are ordered by name. Members of a dependency cycle
 * are reported and appended in the order they were first seen.
 */
public final class TopologicalSorter {

    private TopologicalSorter() {
        // utility class
    }

    private static final Comparator<FortranEntity> BY_NAME =
            Comparator.comparing(e -> e.name == null ? "" : e.name);

    public static <T extends FortranEntity> List<T> sort(Map<T, Set<T>> dependencies, Consumer<List<T>> onCycle) {
        Map<T, Set<T>> remaining = new LinkedHashMap<>();
        dependencies.forEach((item, deps) -> {
            remaining.computeIfAbsent(item, k -> new LinkedHashSet<>()).addAll(deps);
            for (T dep : deps) {
                remaining.computeIfAbsent(dep, k -> new LinkedHashSet<>());
            }
        });
        remaining.forEach((item, deps) -> deps.remove(item));

        List<T> sorted = new ArrayList<>();
        while (!remaining.isEmpty()) {
            List<T> ready = new ArrayList<>();
            remaining.forEach((item, deps) -> {
                if (deps.isEmpty()) {
                    ready.add(item);
                }
            });
            if (ready.isEmpty()) {
                List<T> cyclic = new ArrayList<>(remaining.keySet());
                onCycle.accept(cyclic);
                sorted.addAll(cyclic);
                break;
            }
            ready.sort(BY_NAME);
            for (T item : ready) {
                remaining.remove(item);
            }
            for (Set<T> deps : remaining.values()) {
                deps.removeAll(ready);
            }
            sorted.addAll(ready);
        }
        return sorted;
    }
}
