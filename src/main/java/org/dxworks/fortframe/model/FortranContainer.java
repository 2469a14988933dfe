package org.dxworks.fortframe.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * An entity built from a block of statements. Which of the collections below a
 * container may fill is decided by its {@link EntityKind}.
 */
public abstract class FortranContainer extends FortranEntity {
    public List<FortranSubroutine> subroutines = new ArrayList<>();
    public List<FortranFunction> functions = new ArrayList<>();
    public List<FortranVariable> variables = new ArrayList<>();
    public List<FortranType> types = new ArrayList<>();
    public List<FortranInterface> interfaces = new ArrayList<>();
    public List<FortranInterface> absInterfaces = new ArrayList<>();
    public List<FortranCommon> common = new ArrayList<>();
    public List<FortranNamelist> namelists = new ArrayList<>();
    public List<FortranEnum> enums = new ArrayList<>();
    /** Children filtered out by the display settings. */
    public List<FortranEntity> hidden = new ArrayList<>();

    /** Attribute statements ({@code public :: x}, {@code dimension y(3)}) per lower-cased name, applied at cleanup. */
    @JsonIgnore
    public Map<String, List<String>> attrDict = new LinkedHashMap<>();
    /** Values from {@code parameter (n = 3)} statements, applied at cleanup. */
    @JsonIgnore
    public Map<String, String> paramDict = new LinkedHashMap<>();
    /** Tables visible inside this container, filled by the correlator. */
    @JsonIgnore
    public SymbolTables symbols = new SymbolTables();

    protected FortranContainer(String name, FortranEntity parent, String permission) {
        super(name, parent, permission);
    }

    public boolean accepts(ChildSlot slot) {
        return kind().accepts(slot);
    }

    /** Functions, subroutines and, for modules, separate module procedures, in that order. */
    @JsonIgnore
    public List<FortranProcedure> getRoutines() {
        List<FortranProcedure> routines = new ArrayList<>();
        routines.addAll(functions);
        routines.addAll(subroutines);
        return routines;
    }
}
