package org.dxworks.fortframe.parser;

import org.dxworks.fortframe.FortframeConfig;
import org.dxworks.fortframe.diagnostics.FortranLiteralException;
import org.dxworks.fortframe.diagnostics.FortranStructureException;
import org.dxworks.fortframe.diagnostics.WarningKind;
import org.dxworks.fortframe.diagnostics.WarningLog;
import org.dxworks.fortframe.model.FortranEntity;
import org.dxworks.fortframe.model.FortranEnum;
import org.dxworks.fortframe.model.FortranFunction;
import org.dxworks.fortframe.model.FortranInterface;
import org.dxworks.fortframe.model.FortranModule;
import org.dxworks.fortframe.model.FortranSourceFile;
import org.dxworks.fortframe.model.FortranSubroutine;
import org.dxworks.fortframe.model.FortranType;
import org.dxworks.fortframe.model.FortranVariable;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.Collectors;

import static org.dxworks.fortframe.TestUtils.lines;
import static org.dxworks.fortframe.TestUtils.parseFree;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class FortranParserTest {

    private static List<String> names(List<? extends FortranEntity> entities) {
        return entities.stream().map(e -> e.name).collect(Collectors.toList());
    }

    @Test
    void module_with_declarations_types_and_procedures() {
        FortranSourceFile file = parseFree(lines(
                "module physics",
                "  !! Physical helpers",
                "  real, parameter :: g = 9.81",
                "  type :: particle",
                "    real :: mass = 1.0",
                "    real, dimension(3) :: position",
                "  end type particle",
                "contains",
                "  subroutine push(p, force)",
                "    type(particle), intent(inout) :: p",
                "    real, intent(in) :: force(3)",
                "  end subroutine push",
                "  pure function weight(p) result(w)",
                "    type(particle), intent(in) :: p",
                "    real :: w",
                "  end function weight",
                "end module physics"));

        assertEquals(1, file.modules.size());
        FortranModule module = file.modules.get(0);
        assertEquals("physics", module.name);
        assertEquals(List.of(" Physical helpers"), module.docList);
        assertEquals(1, module.lineNumber);

        FortranVariable g = module.variables.get(0);
        assertEquals("g", g.name);
        assertEquals("real", g.vartype);
        assertTrue(g.parameter);
        assertEquals("9.81", g.initial);

        FortranType particle = module.types.get(0);
        assertEquals(List.of("mass", "position"), names(particle.variables));
        assertEquals("1.0", particle.variables.get(0).initial);

        FortranSubroutine push = module.subroutines.get(0);
        assertEquals(List.of("p", "force"), names(push.args));
        FortranVariable p = (FortranVariable) push.args.get(0);
        assertEquals("type", p.vartype);
        assertEquals("particle", p.proto.name);
        assertEquals("inout", p.intent);
        assertEquals("(3)", ((FortranVariable) push.args.get(1)).dimension);
        assertTrue(push.variables.isEmpty());

        FortranFunction weight = module.functions.get(0);
        assertTrue(weight.attribs.contains("pure"));
        assertEquals("w", weight.retvar.name);
        assertEquals("real", weight.retvar.vartype);
        assertTrue(module.symbols.procs.containsKey("push"));
        assertTrue(module.publicSymbols.types.containsKey("particle"));
    }

    @Test
    void undeclared_arguments_are_implicitly_typed() {
        FortranSourceFile file = parseFree(lines(
                "subroutine legacy(alpha, idx)",
                "end subroutine legacy"));

        FortranSubroutine legacy = file.subroutines.get(0);
        assertEquals("real", ((FortranVariable) legacy.args.get(0)).vartype);
        assertEquals("integer", ((FortranVariable) legacy.args.get(1)).vartype);
    }

    @Test
    void private_statement_and_public_list_set_permissions() {
        FortranSourceFile file = parseFree(lines(
                "module access",
                "  private",
                "  public :: visible_one",
                "  integer :: hidden_one",
                "  integer :: visible_one",
                "end module access"));

        FortranModule module = file.modules.get(0);
        assertEquals("private", module.variables.get(0).permission);
        assertEquals("public", module.variables.get(1).permission);
        assertTrue(module.publicList.contains("visible_one"));
        assertFalse(module.publicSymbols.vars.containsKey("hidden_one"));
    }

    @Test
    void generic_and_specific_interfaces() {
        FortranSourceFile file = parseFree(lines(
                "module solvers",
                "  interface solve",
                "    module procedure solve_real, solve_int",
                "  end interface solve",
                "  interface",
                "    subroutine callback(x)",
                "      real :: x",
                "    end subroutine callback",
                "  end interface",
                "  abstract interface",
                "    function rhs(t) result(y)",
                "      real :: t, y",
                "    end function rhs",
                "  end interface",
                "end module solvers"));

        FortranModule module = file.modules.get(0);
        assertEquals(2, module.interfaces.size());
        FortranInterface generic = module.interfaces.get(0);
        assertTrue(generic.generic);
        assertEquals(List.of("solve_real", "solve_int"), names(generic.modProcs));

        FortranInterface specific = module.interfaces.get(1);
        assertFalse(specific.generic);
        assertEquals("callback", specific.name);
        assertSame(specific, specific.procedure.parent);

        assertEquals(1, module.absInterfaces.size());
        assertTrue(module.absInterfaces.get(0).abstractInterface);
        assertEquals("rhs", module.absInterfaces.get(0).procedure.name);
    }

    @Test
    void enumerators_are_numbered_consecutively() {
        FortranSourceFile file = parseFree(lines(
                "module colors",
                "  enum, bind(c)",
                "    enumerator :: red = 1, green, blue",
                "    enumerator :: black = 10, white",
                "  end enum",
                "end module colors"));

        FortranEnum colors = file.modules.get(0).enums.get(0);
        List<String> values = colors.variables.stream().map(v -> v.initial).collect(Collectors.toList());
        assertEquals(List.of("1", "2", "3", "10", "11"), values);
    }

    @Test
    void non_integer_enumerator_is_a_literal_error() {
        String source = lines(
                "module broken",
                "  enum, bind(c)",
                "    enumerator :: half = 0.5",
                "  end enum",
                "end module broken");

        FortranLiteralException error = assertThrows(FortranLiteralException.class, () -> parseFree(source));
        assertTrue(error.getMessage().contains("half"));
    }

    @Test
    void unterminated_module_is_a_structure_error() {
        String source = lines(
                "subroutine complete()",
                "end subroutine complete",
                "module dangling",
                "  integer :: n");

        FortranStructureException error = assertThrows(FortranStructureException.class, () -> parseFree(source));
        assertEquals("test.f90", error.getFile());
        assertTrue(error.getMessage().contains("File ended while still nested in module 'dangling'"));
    }

    @Test
    void permissive_mode_keeps_what_was_parsed_before_the_error() {
        WarningLog warnings = WarningLog.quiet();
        FortranSourceFile file = parseFree(lines(
                "subroutine complete()",
                "end subroutine complete",
                "module dangling",
                "  integer :: n"), FortframeConfig.with(true, false), warnings);

        assertEquals(List.of("complete"), names(file.subroutines));
        assertTrue(file.modules.isEmpty());
        assertEquals(1, warnings.ofKind(WarningKind.STRUCTURE).size());
        assertTrue(warnings.all().get(0).message.endsWith("(rest of file skipped)"));
    }

    @Test
    void force_mode_reports_misplaced_statements_and_continues() {
        String source = lines(
                "module twice",
                "contains",
                "contains",
                "  subroutine after()",
                "  end subroutine after",
                "end module twice");

        assertThrows(FortranStructureException.class, () -> parseFree(source));

        WarningLog warnings = WarningLog.quiet();
        FortranSourceFile file = parseFree(source, FortframeConfig.with(false, true), warnings);
        assertEquals(List.of("after"), names(file.modules.get(0).subroutines));
        assertTrue(warnings.all().get(0).message.startsWith("Multiple CONTAINS statements present"));
    }

    @Test
    void calls_are_recorded_once_with_their_chain() {
        FortranSourceFile file = parseFree(lines(
                "subroutine driver(grid)",
                "  type(mesh) :: grid",
                "  call grid%refine(2)",
                "  call solve(grid)",
                "  call solve(grid)",
                "  x = sqrt(area(grid))",
                "end subroutine driver"));

        FortranSubroutine driver = file.subroutines.get(0);
        List<String> targets = driver.calls.stream().map(c -> String.join("%", c.chain)).collect(Collectors.toList());
        assertEquals(List.of("grid%refine", "solve", "area"), targets);
        assertEquals(3, driver.calls.get(0).line);
        assertNull(driver.calls.get(0).resolved);
    }

    @Test
    void common_blocks_and_namelists() {
        FortranSourceFile file = parseFree(lines(
                "subroutine io_setup()",
                "  integer :: a, b",
                "  common /shared/ a, b /other/ c",
                "  namelist /params/ a, b",
                "end subroutine io_setup"));

        FortranSubroutine setup = file.subroutines.get(0);
        assertEquals(List.of("shared", "other"), names(setup.common));
        assertEquals(List.of("a", "b"), setup.common.get(0).memberNames);
        assertEquals(List.of("c"), setup.common.get(1).memberNames);
        assertEquals(List.of("a", "b"), setup.namelists.get(0).memberNames);
    }

    @Test
    void type_bound_procedures_and_extension() {
        FortranSourceFile file = parseFree(lines(
                "module zoo",
                "  type, abstract :: animal",
                "  contains",
                "    procedure(speak_iface), deferred :: speak",
                "    procedure :: eat, sleep",
                "    generic :: act => eat, sleep",
                "  end type animal",
                "  type, extends(animal) :: dog",
                "  end type dog",
                "end module zoo"));

        FortranType animal = file.modules.get(0).types.get(0);
        assertTrue(animal.attribs.contains("abstract"));
        assertEquals(List.of("speak", "sleep", "eat", "act"), names(animal.boundProcs));
        assertTrue(animal.boundProcs.get(0).deferred);
        assertEquals("speak_iface", animal.boundProcs.get(0).protoName);
        assertTrue(animal.boundProcs.get(3).generic);
        assertEquals(2, animal.boundProcs.get(3).bindings.size());

        FortranType dog = file.modules.get(0).types.get(1);
        assertNotNull(dog.extendsRef);
        assertEquals("animal", dog.extendsRef.name);
    }

    private static FortranVariable declare(String declaration) {
        return parseFree(lines("module decls", "  " + declaration + " :: x", "end module decls"))
                .modules.get(0).variables.get(0);
    }

    @Test
    void full_declaration_parses_back_to_the_same_variable() {
        for (String declaration : List.of("character*10", "real*8", "double precision",
                "integer(kind=int64), dimension(3)", "type(point)")) {
            FortranVariable original = declare(declaration);
            FortranVariable reparsed = declare(original.getFullDeclaration());

            assertEquals(original.getFullDeclaration(), reparsed.getFullDeclaration(), declaration);
            assertEquals(original.vartype, reparsed.vartype, declaration);
            assertEquals(original.typeKind, reparsed.typeKind, declaration);
            assertEquals(original.strlen, reparsed.strlen, declaration);
            assertEquals(original.attribs, reparsed.attribs, declaration);
            assertEquals(original.dimension, reparsed.dimension, declaration);
        }
    }
}
