package org.dxworks.fortframe.project;

import org.dxworks.fortframe.model.FortranModule;
import org.dxworks.fortframe.model.FortranVariable;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;

public class EntitySorterTest {

    private static FortranModule moduleWithVariables() {
        FortranModule module = new FortranModule("vars", null, "public");
        module.variables.add(new FortranVariable("zeta", "real", module, "private"));
        module.variables.add(new FortranVariable("alpha", "integer", module, "public"));
        module.variables.add(new FortranVariable("mid", "logical", module, "protected"));
        return module;
    }

    private static List<String> variableNames(FortranModule module) {
        return module.variables.stream().map(v -> v.name).collect(Collectors.toList());
    }

    @Test
    void source_order_is_kept_by_default() {
        FortranModule module = moduleWithVariables();
        EntitySorter.sortComponents(module, "src");

        assertEquals(List.of("zeta", "alpha", "mid"), variableNames(module));
        assertNull(EntitySorter.comparatorFor("src"));
    }

    @Test
    void alpha_and_permission_orders() {
        FortranModule alpha = moduleWithVariables();
        EntitySorter.sortComponents(alpha, "alpha");
        assertEquals(List.of("alpha", "mid", "zeta"), variableNames(alpha));

        FortranModule permission = moduleWithVariables();
        EntitySorter.sortComponents(permission, "permission");
        assertEquals(List.of("alpha", "mid", "zeta"), variableNames(permission));
    }

    @Test
    void type_order_groups_by_declared_type() {
        FortranModule module = moduleWithVariables();
        EntitySorter.sortComponents(module, "type-alpha");

        assertEquals(List.of("alpha", "mid", "zeta"), variableNames(module));
        assertEquals("integer", EntitySorter.typeName(module.variables.get(0)));
    }

    @Test
    void sort_metadata_overrides_the_default() {
        FortranModule module = moduleWithVariables();
        module.meta.put("sort", "alpha");
        EntitySorter.sortComponents(module, "src");

        assertEquals(List.of("alpha", "mid", "zeta"), variableNames(module));
    }

    @Test
    void unknown_order_is_rejected() {
        assertThrows(IllegalArgumentException.class, () -> EntitySorter.comparatorFor("random"));
    }
}
