package org.dxworks.fortframe.project;

import org.dxworks.fortframe.model.FortranModule;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class TopologicalSorterTest {

    private static FortranModule module(String name) {
        return new FortranModule(name, null, "public");
    }

    private static List<String> names(List<FortranModule> modules) {
        return modules.stream().map(m -> m.name).collect(Collectors.toList());
    }

    @Test
    void dependencies_come_first_and_ties_are_alphabetical() {
        FortranModule kinds = module("kinds");
        FortranModule solver = module("solver");
        FortranModule mesh = module("mesh");
        FortranModule app = module("app");
        Map<FortranModule, Set<FortranModule>> graph = new LinkedHashMap<>();
        graph.put(app, Set.of(solver, mesh));
        graph.put(solver, Set.of(kinds));
        graph.put(mesh, Set.of(kinds));
        graph.put(kinds, Set.of());

        List<List<FortranModule>> cycles = new ArrayList<>();
        List<FortranModule> sorted = TopologicalSorter.sort(graph, cycles::add);

        assertEquals(List.of("kinds", "mesh", "solver", "app"), names(sorted));
        assertTrue(cycles.isEmpty());
    }

    @Test
    void cycles_are_reported_and_appended() {
        FortranModule base = module("base");
        FortranModule left = module("left");
        FortranModule right = module("right");
        Map<FortranModule, Set<FortranModule>> graph = new LinkedHashMap<>();
        graph.put(base, Set.of());
        graph.put(left, Set.of(right, base));
        graph.put(right, Set.of(left));

        List<List<FortranModule>> cycles = new ArrayList<>();
        List<FortranModule> sorted = TopologicalSorter.sort(graph, cycles::add);

        assertEquals(List.of("base", "left", "right"), names(sorted));
        assertEquals(1, cycles.size());
        assertEquals(List.of("left", "right"), names(cycles.get(0)));
    }

    @Test
    void self_dependency_is_ignored() {
        FortranModule lonely = module("lonely");
        Map<FortranModule, Set<FortranModule>> graph = new LinkedHashMap<>();
        graph.put(lonely, Set.of(lonely));

        assertEquals(List.of("lonely"), names(TopologicalSorter.sort(graph, cycle -> {
            throw new AssertionError("unexpected cycle");
        })));
    }
}
