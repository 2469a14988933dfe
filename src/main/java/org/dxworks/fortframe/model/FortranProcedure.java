package org.dxworks.fortframe.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.util.ArrayList;
import java.util.List;

/** Subroutines, functions and separate module procedure implementations. */
public abstract class FortranProcedure extends FortranCodeUnit {
    public List<String> attribs = new ArrayList<>();
    /** Dummy arguments: variables, procedures given by an interface, or implicitly typed variables. */
    public List<FortranEntity> args = new ArrayList<>();
    /** Argument names as written in the header, matched to declarations at cleanup. */
    @JsonIgnore
    public List<String> argNames = new ArrayList<>();
    public String bindC;
    /** Declared with the MODULE prefix: the interface or implementation of a separate module procedure. */
    public boolean module;
    /** The other half of a separate module procedure, once correlated. */
    @JsonIgnore
    public FortranEntity moduleCounterpart;
    @JsonIgnore
    public FortranBoundProcedure binding;

    protected FortranProcedure(String name, FortranEntity parent, String permission) {
        super(name, parent, permission);
    }

    /** Human readable kind, used by the type sort order. */
    public abstract String procType();

    /** The arguments visible inside the body; separate module procedures see their interface's. */
    public List<FortranEntity> effectiveArgs() {
        return args;
    }

    public FortranVariable effectiveRetvar() {
        return null;
    }

    /** Procedure declared in the body of a non-generic interface block. */
    @JsonIgnore
    public boolean isInterfaceProcedure() {
        return parent instanceof FortranInterface && !((FortranInterface) parent).generic;
    }
}
