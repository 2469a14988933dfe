package org.dxworks.fortframe.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

public enum EntityKind {
    SOURCE_FILE("sourcefile", false,
            ChildSlot.MODULE, ChildSlot.SUBMODULE, ChildSlot.PROGRAM, ChildSlot.BLOCK_DATA,
            ChildSlot.SUBROUTINE, ChildSlot.FUNCTION),
    MODULE("module", true,
            ChildSlot.SUBROUTINE, ChildSlot.FUNCTION, ChildSlot.MODULE_PROCEDURE, ChildSlot.TYPE,
            ChildSlot.INTERFACE, ChildSlot.ENUM, ChildSlot.VARIABLE, ChildSlot.USE, ChildSlot.COMMON,
            ChildSlot.NAMELIST, ChildSlot.ATTRIBUTES),
    SUBMODULE("submodule", true,
            ChildSlot.SUBROUTINE, ChildSlot.FUNCTION, ChildSlot.MODULE_PROCEDURE, ChildSlot.TYPE,
            ChildSlot.INTERFACE, ChildSlot.ENUM, ChildSlot.VARIABLE, ChildSlot.USE, ChildSlot.COMMON,
            ChildSlot.NAMELIST, ChildSlot.ATTRIBUTES),
    PROGRAM("program", true,
            ChildSlot.SUBROUTINE, ChildSlot.FUNCTION, ChildSlot.TYPE, ChildSlot.INTERFACE, ChildSlot.ENUM,
            ChildSlot.VARIABLE, ChildSlot.USE, ChildSlot.COMMON, ChildSlot.NAMELIST, ChildSlot.ATTRIBUTES,
            ChildSlot.CALLS),
    BLOCK_DATA("blockdata", false,
            ChildSlot.TYPE, ChildSlot.VARIABLE, ChildSlot.USE, ChildSlot.COMMON, ChildSlot.ATTRIBUTES),
    SUBROUTINE("subroutine", true,
            ChildSlot.SUBROUTINE, ChildSlot.FUNCTION, ChildSlot.TYPE, ChildSlot.INTERFACE, ChildSlot.ENUM,
            ChildSlot.VARIABLE, ChildSlot.USE, ChildSlot.COMMON, ChildSlot.NAMELIST, ChildSlot.ATTRIBUTES,
            ChildSlot.CALLS),
    FUNCTION("function", true,
            ChildSlot.SUBROUTINE, ChildSlot.FUNCTION, ChildSlot.TYPE, ChildSlot.INTERFACE, ChildSlot.ENUM,
            ChildSlot.VARIABLE, ChildSlot.USE, ChildSlot.COMMON, ChildSlot.NAMELIST, ChildSlot.ATTRIBUTES,
            ChildSlot.CALLS),
    MODULE_PROCEDURE("moduleprocedure", true,
            ChildSlot.SUBROUTINE, ChildSlot.FUNCTION, ChildSlot.TYPE, ChildSlot.INTERFACE, ChildSlot.ENUM,
            ChildSlot.VARIABLE, ChildSlot.USE, ChildSlot.COMMON, ChildSlot.NAMELIST, ChildSlot.ATTRIBUTES,
            ChildSlot.CALLS),
    INTERFACE("interface", false, ChildSlot.SUBROUTINE, ChildSlot.FUNCTION, ChildSlot.VARIABLE),
    MODULE_PROCEDURE_REFERENCE("moduleprocedurereference", false),
    TYPE("type", true, ChildSlot.VARIABLE, ChildSlot.BOUND_PROCEDURE, ChildSlot.FINAL_PROCEDURE),
    VARIABLE("variable", false),
    BOUND_PROCEDURE("boundprocedure", false),
    FINAL_PROCEDURE("finalproc", false),
    COMMON("common", false),
    NAMELIST("namelist", false),
    ENUM("enum", false, ChildSlot.VARIABLE);

    private final String name;
    private final boolean canHaveContains;
    private final Set<ChildSlot> slots;

    EntityKind(String name, boolean canHaveContains, ChildSlot... slots) {
        this.name = name;
        this.canHaveContains = canHaveContains;
        this.slots = slots.length == 0
                ? Collections.emptySet()
                : Collections.unmodifiableSet(EnumSet.copyOf(Arrays.asList(slots)));
    }

    @JsonValue
    public String getName() {
        return name;
    }

    public boolean canHaveContains() {
        return canHaveContains;
    }

    public boolean accepts(ChildSlot slot) {
        return slots.contains(slot);
    }

    /** Subroutines, functions and module procedure implementations. */
    public boolean isProcedure() {
        return this == SUBROUTINE || this == FUNCTION || this == MODULE_PROCEDURE;
    }

    /** Program units whose procedures may only follow a CONTAINS statement. */
    public boolean isCodeUnit() {
        return this == MODULE || this == SUBMODULE || this == PROGRAM || isProcedure();
    }
}
