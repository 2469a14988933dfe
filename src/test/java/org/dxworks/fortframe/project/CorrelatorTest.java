package org.dxworks.fortframe.project;

import org.dxworks.fortframe.FortframeConfig;
import org.dxworks.fortframe.SourceForm;
import org.dxworks.fortframe.TestUtils;
import org.dxworks.fortframe.diagnostics.FortranWarning;
import org.dxworks.fortframe.diagnostics.WarningKind;
import org.dxworks.fortframe.diagnostics.WarningLog;
import org.dxworks.fortframe.model.CallRecord;
import org.dxworks.fortframe.model.EntityRef;
import org.dxworks.fortframe.model.FortranBlockData;
import org.dxworks.fortframe.model.FortranBoundProcedure;
import org.dxworks.fortframe.model.FortranCommon;
import org.dxworks.fortframe.model.FortranContainer;
import org.dxworks.fortframe.model.FortranEntity;
import org.dxworks.fortframe.model.FortranFunction;
import org.dxworks.fortframe.model.FortranInterface;
import org.dxworks.fortframe.model.FortranModule;
import org.dxworks.fortframe.model.FortranProcedure;
import org.dxworks.fortframe.model.FortranProgram;
import org.dxworks.fortframe.model.FortranSourceFile;
import org.dxworks.fortframe.model.FortranSubmodule;
import org.dxworks.fortframe.model.FortranType;
import org.dxworks.fortframe.model.FortranVariable;
import org.dxworks.fortframe.model.UseStatement;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

import static org.dxworks.fortframe.TestUtils.lines;
import static org.dxworks.fortframe.TestUtils.project;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class CorrelatorTest {

    private static <T extends FortranEntity> T named(List<T> entities, String name) {
        return entities.stream()
                .filter(e -> e.name.equalsIgnoreCase(name))
                .findFirst()
                .orElseThrow(() -> new AssertionError("No entity named " + name));
    }

    private static List<String> names(List<? extends FortranEntity> entities) {
        return entities.stream().map(e -> e.name).collect(Collectors.toList());
    }

    private static FortranProject inline(WarningLog warnings, String text) {
        FortranProject project = new FortranProject(FortframeConfig.defaults(), warnings);
        project.addSource("inline.f90", "inline.f90", text, SourceForm.FREE);
        project.correlate();
        return project;
    }

    private static List<String> messages(WarningLog warnings) {
        return warnings.ofKind(WarningKind.RESOLUTION).stream().map(w -> w.message).collect(Collectors.toList());
    }

    @Test
    void use_only_imports_renamed_entities() throws IOException {
        FortranProject project = project(FortframeConfig.defaults(), WarningLog.quiet(), "geometry.f90");
        FortranProcedure render = named(project.fileScopeProcedures(), "render");

        assertTrue(render.symbols.vars.containsKey("pi"));
        assertTrue(render.symbols.vars.containsKey("euler"));
        assertFalse(render.symbols.vars.containsKey("e"));
        assertTrue(render.symbols.types.containsKey("circle"));
        assertFalse(render.symbols.types.containsKey("shape"));
    }

    @Test
    void calls_through_a_variable_resolve_to_inherited_bindings() throws IOException {
        FortranProject project = project(FortframeConfig.defaults(), WarningLog.quiet(), "geometry.f90");
        FortranProcedure render = named(project.fileScopeProcedures(), "render");

        CallRecord call = render.calls.get(0);
        assertEquals(List.of("c", "describe"), call.chain);
        assertInstanceOf(FortranBoundProcedure.class, call.resolved);
        assertEquals("describe", call.getTarget());
    }

    @Test
    void program_calls_resolve_through_plain_use() throws IOException {
        FortranProject project = project(FortframeConfig.defaults(), WarningLog.quiet(), "geometry.f90");
        FortranProgram main = project.programs.get(0);

        CallRecord makeCircle = main.calls.stream().filter(c -> c.lastName().equals("make_circle")).findFirst().get();
        assertInstanceOf(FortranFunction.class, makeCircle.resolved);

        CallRecord render = main.calls.stream().filter(c -> c.lastName().equals("render")).findFirst().get();
        assertFalse(render.isResolved());
    }

    @Test
    void extended_types_merge_generic_bindings() throws IOException {
        FortranProject project = project(FortframeConfig.defaults(), WarningLog.quiet(), "geometry.f90");
        FortranModule geometry = named(project.modules, "geometry");
        FortranType shape = named(geometry.types, "shape");
        FortranType circle = named(geometry.types, "circle");

        assertSame(shape, circle.getExtendedType());
        assertEquals(List.of("x", "y"), circle.getInheritedComponents());
        assertTrue(circle.getInheritedBindings().containsAll(List.of("describe", "show_shape")));

        FortranBoundProcedure show = named(circle.boundProcs, "show");
        assertTrue(show.generic);
        assertEquals(List.of("show_shape", "show_circle"),
                show.bindings.stream().map(b -> b.name).collect(Collectors.toList()));
        assertTrue(show.bindings.stream().allMatch(EntityRef::isResolved));

        FortranBoundProcedure describe = named(shape.boundProcs, "describe");
        assertEquals("shape_describe", describe.bindings.get(0).target.name);
    }

    @Test
    void private_entities_are_hidden_not_dropped() throws IOException {
        FortranProject project = project(FortframeConfig.defaults(), WarningLog.quiet(), "geometry.f90");
        FortranModule geometry = named(project.modules, "geometry");

        assertEquals(List.of("shape", "circle"), names(geometry.types));
        assertEquals(List.of("make_circle"), names(geometry.functions));
        assertTrue(geometry.subroutines.isEmpty());

        FortranType registry = (FortranType) named(geometry.hidden, "registry");
        assertEquals("Internal bookkeeping type", registry.docList.get(0).strip());
        assertTrue(named(geometry.hidden, "shape_describe") instanceof FortranProcedure);

        assertTrue(geometry.publicSymbols.procs.containsKey("make_circle"));
        assertFalse(geometry.publicSymbols.procs.containsKey("show_shape"));
    }

    @Test
    void common_blocks_are_linked_across_units() throws IOException {
        FortranProject project = project(FortframeConfig.defaults(), WarningLog.quiet(), "legacy.f");
        FortranProcedure accum = named(project.fileScopeProcedures(), "accum");
        FortranBlockData init = project.blockData.get(0);

        FortranCommon stats = accum.common.get(0);
        assertEquals(List.of("COUNT", "MEAN"), names(stats.variables));
        assertEquals("real", stats.variables.get(0).vartype);
        assertEquals("integer", stats.variables.get(1).vartype);

        assertEquals(2, project.common.get("stats").size());
        assertEquals(List.of("INIT"), stats.getSharedWith());
        assertEquals(List.of("ACCUM"), init.common.get(0).getSharedWith());
    }

    @Test
    void declared_common_members_move_into_the_block() {
        FortranProject project = inline(WarningLog.quiet(), lines(
                "subroutine tally()",
                "  integer :: hits(10)",
                "  common /counters/ hits(10)",
                "end subroutine tally"));
        FortranProcedure tally = project.fileScopeProcedures().get(0);
        FortranCommon counters = tally.common.get(0);

        FortranVariable hits = counters.variables.get(0);
        assertEquals("integer", hits.vartype);
        assertSame(counters, hits.parent);
        assertSame(tally, hits.scope);
        assertFalse(tally.hidden.contains(hits));
    }

    @Test
    void cyclic_extension_is_broken_with_a_warning() {
        WarningLog warnings = WarningLog.quiet();
        FortranProject project = inline(warnings, lines(
                "module loops",
                "  type, extends(second) :: first",
                "  end type first",
                "  type, extends(first) :: second",
                "  end type second",
                "end module loops"));
        FortranModule loops = project.modules.get(0);

        assertNull(named(loops.types, "first").getExtendedType());
        assertSame(named(loops.types, "first"), named(loops.types, "second").getExtendedType());
        assertEquals(1, messages(warnings).stream().filter(m -> m.contains("extends itself")).count());
    }

    @Test
    void unknown_modules_are_reported_except_intrinsic_ones() {
        WarningLog warnings = WarningLog.quiet();
        inline(warnings, lines(
                "program uses",
                "  use iso_c_binding",
                "  use nowhere",
                "end program uses"));

        List<FortranWarning> resolution = warnings.ofKind(WarningKind.RESOLUTION);
        assertEquals(1, resolution.size());
        assertTrue(resolution.get(0).message.startsWith("Could not find module 'nowhere'"));
        assertEquals(3, resolution.get(0).line);
    }

    @Test
    void unknown_generic_member_is_reported() {
        WarningLog warnings = WarningLog.quiet();
        inline(warnings, lines(
                "module gens",
                "  interface combine",
                "    module procedure combine_real, missing_impl",
                "  end interface combine",
                "contains",
                "  subroutine combine_real(x)",
                "    real :: x",
                "  end subroutine combine_real",
                "end module gens"));

        assertEquals(List.of("Could not find interface procedure 'missing_impl' in 'gens'"), messages(warnings));
    }

    @Test
    void statistics_count_correlated_entities() throws IOException {
        FortranProject project = project(FortframeConfig.defaults(), WarningLog.quiet(), "geometry.f90");
        ProjectStatistics stats = project.getStatistics();

        assertEquals(1, stats.files);
        assertEquals(2, stats.modules);
        assertEquals(1, stats.programs);
        assertEquals(2, stats.types);
        assertEquals(2, stats.procedures);
        assertTrue(stats.typeLinesAll >= stats.typeLines);
    }

    @Test
    void submodule_implementation_links_to_its_interface() {
        WarningLog warnings = WarningLog.quiet();
        FortranProject project = inline(warnings, lines(
                "module shapes",
                "  implicit none",
                "  interface",
                "    module function area(r) result(a)",
                "      real, intent(in) :: r",
                "      real :: a",
                "    end function area",
                "  end interface",
                "end module shapes",
                "",
                "submodule (shapes) shapes_impl",
                "contains",
                "  module function area(r) result(a)",
                "    real, intent(in) :: r",
                "    real :: a",
                "    a = 3.14 * r * r",
                "  end function area",
                "end submodule shapes_impl"));

        FortranModule shapes = named(project.modules, "shapes");
        FortranSubmodule impl = named(project.submodules, "shapes_impl");
        List<FortranEntity> candidates = new ArrayList<>(impl.moduleFunctions);
        candidates.addAll(impl.hidden);
        FortranProcedure area = (FortranProcedure) named(candidates, "area");

        assertTrue(warnings.ofKind(WarningKind.RESOLUTION).isEmpty());
        assertEquals(List.of("shapes"), impl.getAncestryNames());
        assertTrue(shapes.descendants.contains(impl));
        assertTrue(impl.functions.isEmpty());
        assertInstanceOf(FortranInterface.class, area.moduleCounterpart);
        assertSame(area, ((FortranInterface) area.moduleCounterpart).procedure.moduleCounterpart);
    }

    @Test
    void configured_external_modules_resolve_uses() {
        WarningLog warnings = WarningLog.quiet();
        FortranProject project = new FortranProject(
                FortframeConfig.defaults().toBuilder().extraModule("mpi", "https://www.mpi-forum.org").build(),
                warnings);
        project.addSource("inline.f90", "inline.f90", lines(
                "program ring",
                "  use mpi",
                "end program ring"), SourceForm.FREE);
        project.correlate();

        UseStatement use = named(project.programs, "ring").uses.get(0);
        assertTrue(warnings.ofKind(WarningKind.RESOLUTION).isEmpty());
        assertTrue(use.module.target.external);
        assertEquals("https://www.mpi-forum.org", use.module.target.externalUrl);
    }

    @Test
    void submodule_without_ancestor_is_still_correlated() {
        WarningLog warnings = WarningLog.quiet();
        FortframeConfig config = FortframeConfig.defaults().toBuilder()
                .display(List.of("public", "protected", "private"))
                .build();
        FortranProject project = new FortranProject(config, warnings);
        project.addSource("inline.f90", "inline.f90", lines(
                "submodule (missing_mod) orphan",
                "contains",
                "  module subroutine run()",
                "    call helper()",
                "  end subroutine run",
                "  subroutine helper()",
                "  end subroutine helper",
                "end submodule orphan"), SourceForm.FREE);
        project.correlate();

        FortranSubmodule orphan = named(project.submodules, "orphan");
        assertEquals(List.of("run"), names(orphan.moduleSubroutines));
        assertEquals(List.of("helper"), names(orphan.subroutines));
        assertSame(named(orphan.subroutines, "helper"), orphan.moduleSubroutines.get(0).calls.get(0).resolved);
        assertTrue(messages(warnings).contains("Could not identify ancestor module ('missing_mod') of submodule 'orphan'"));
    }

    @Test
    void procedures_contained_in_programs_are_listed_project_wide() {
        FortranProject project = inline(WarningLog.quiet(), lines(
                "program driver",
                "  call inner()",
                "contains",
                "  subroutine inner()",
                "  end subroutine inner",
                "end program driver"));

        assertEquals(List.of("inner"), names(project.procedures));
    }

    @Test
    void every_listed_entity_is_owned_by_its_container() throws IOException {
        FortranProject project = project(FortframeConfig.defaults(), WarningLog.quiet(), "geometry.f90", "legacy.f");

        for (FortranSourceFile file : project.files) {
            assertNull(file.parent);
            assertOwnership(file);
        }
    }

    private static void assertOwns(FortranEntity owner, List<? extends FortranEntity> children) {
        for (FortranEntity child : children) {
            assertSame(owner, child.parent, () -> child.name + " is listed under " + owner.name);
            assertOwnership(child);
        }
    }

    private static void assertOwnership(FortranEntity entity) {
        if (entity instanceof FortranSourceFile) {
            FortranSourceFile file = (FortranSourceFile) entity;
            assertOwns(file, file.modules);
            assertOwns(file, file.submodules);
            assertOwns(file, file.programs);
            assertOwns(file, file.blockData);
        }
        if (entity instanceof FortranType) {
            FortranType type = (FortranType) entity;
            assertOwns(type, type.boundProcs);
            assertOwns(type, type.finalProcs);
        }
        if (entity instanceof FortranCommon) {
            assertOwns(entity, ((FortranCommon) entity).variables);
        }
        if (entity instanceof FortranContainer && !(entity instanceof FortranInterface)) {
            FortranContainer container = (FortranContainer) entity;
            assertOwns(container, container.variables);
            assertOwns(container, container.common);
            assertOwns(container, container.subroutines);
            assertOwns(container, container.functions);
            assertOwns(container, container.types);
            assertOwns(container, container.interfaces);
            assertOwns(container, container.absInterfaces);
            assertOwns(container, container.enums);
            assertOwns(container, container.hidden);
        }
    }

    @Test
    void correlating_again_changes_nothing() throws IOException {
        FortranProject project = project(FortframeConfig.defaults(), WarningLog.quiet(), "geometry.f90", "legacy.f");
        String first = TestUtils.APPROVAL_MAPPER.writeValueAsString(project.files);
        int procedures = project.procedures.size();

        project.correlate();

        assertEquals(first, TestUtils.APPROVAL_MAPPER.writeValueAsString(project.files));
        assertEquals(procedures, project.procedures.size());
        FortranProject fresh = project(FortframeConfig.defaults(), WarningLog.quiet(), "geometry.f90", "legacy.f");
        assertEquals(first, TestUtils.APPROVAL_MAPPER.writeValueAsString(fresh.files));
    }
}
