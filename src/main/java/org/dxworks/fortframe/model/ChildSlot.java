package org.dxworks.fortframe.model;

/** Kinds of statement a container may hold. */
public enum ChildSlot {
    MODULE,
    SUBMODULE,
    PROGRAM,
    BLOCK_DATA,
    SUBROUTINE,
    FUNCTION,
    MODULE_PROCEDURE,
    TYPE,
    INTERFACE,
    ENUM,
    VARIABLE,
    USE,
    COMMON,
    NAMELIST,
    ATTRIBUTES,
    CALLS,
    BOUND_PROCEDURE,
    FINAL_PROCEDURE
}
