package org.dxworks.fortframe.crosswalk;

import org.dxworks.fortframe.FortframeConfig;
import org.dxworks.fortframe.diagnostics.FortranWarning;
import org.dxworks.fortframe.diagnostics.WarningKind;
import org.dxworks.fortframe.diagnostics.WarningLog;
import org.dxworks.fortframe.model.FortranSubroutine;
import org.dxworks.fortframe.project.FortranProject;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.List;
import java.util.Map;

import static org.dxworks.fortframe.TestUtils.lines;
import static org.dxworks.fortframe.TestUtils.parseFree;
import static org.dxworks.fortframe.TestUtils.project;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class CrossWalkerTest {

    @Test
    void member_access_paths_follow_component_types() throws IOException {
        WarningLog warnings = WarningLog.quiet();
        FortranProject project = project(FortframeConfig.defaults(), warnings, "crosswalk.f90");

        assertEquals(1, project.crossWalks.size());
        CrossWalkResult result = project.crossWalks.get(0);
        assertEquals("simulate", result.procedure);
        assertEquals("crosswalk.f90", result.file);

        CrossWalkNode state = result.variables.get("state");
        assertEquals("type", state.vartype);
        assertEquals("crosswalk.f90", state.filename);
        CrossWalkNode layer = state.variables.get("layer");
        assertEquals(List.of("depth"), List.copyOf(layer.variables.keySet()));
        assertEquals("real", layer.variables.get("depth").vartype);
        assertFalse(state.variables.containsKey("missing"));

        assertEquals(List.of("unknown_thing"), result.unresolved);
    }

    @Test
    void missing_components_are_reported() throws IOException {
        WarningLog warnings = WarningLog.quiet();
        project(FortframeConfig.defaults(), warnings, "crosswalk.f90");

        List<FortranWarning> resolution = warnings.ofKind(WarningKind.RESOLUTION);
        assertEquals(1, resolution.size());
        assertEquals("Component 'missing' not found in the type of 'state'", resolution.get(0).message);
        assertEquals("simulate", resolution.get(0).entity);
    }

    @Test
    void bare_names_skip_keywords_numbers_and_declared_variables() {
        FortranSubroutine sub = parseFree(lines(
                "subroutine step(dt)",
                "  real :: dt, acc",
                "  acc = sqrt(velocity) * 2.5 + drift",
                "end subroutine step")).subroutines.get(0);

        CrossWalker.addBareNames(sub);

        assertTrue(sub.memberAccessResults.contains("drift"));
        assertFalse(sub.memberAccessResults.contains("acc"));
        assertFalse(sub.memberAccessResults.contains("2.5"));
        assertFalse(sub.memberAccessResults.contains("*"));
    }

    @Test
    void access_paths_share_their_prefixes() {
        Map<String, CrossWalker.PathTree> roots =
                CrossWalker.pathTree(List.of("grid%cells%area", "grid%cells%volume", "grid%nx", "flag"));

        assertEquals(List.of("grid", "flag"), List.copyOf(roots.keySet()));
        CrossWalker.PathTree grid = roots.get("grid");
        assertEquals(List.of("cells", "nx"), List.copyOf(grid.children.keySet()));
        assertEquals(List.of("area", "volume"), List.copyOf(grid.children.get("cells").children.keySet()));
        assertTrue(roots.get("flag").children.isEmpty());
    }
}
