package org.dxworks.fortframe.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.util.ArrayList;
import java.util.List;

/**
 * An INTERFACE block. A generic interface keeps its procedures and
 * {@code module procedure} references; a specific or abstract block is split at
 * cleanup into one single-procedure interface per declared procedure.
 */
public class FortranInterface extends FortranContainer {
    public boolean generic;
    public boolean abstractInterface;
    /** The procedure declared by a single-procedure interface. */
    public FortranProcedure procedure;
    public List<FortranModuleProcedureReference> modProcs = new ArrayList<>();
    public int numLinesAll;
    /** Single-procedure interfaces built from a specific or abstract block at cleanup. */
    @JsonIgnore
    public List<FortranInterface> contents = new ArrayList<>();

    public FortranInterface(String name, FortranEntity parent, String permission) {
        super(name, parent, permission);
    }

    /** Wraps {@code procedure}, declared in {@code block}, into its own interface owned by the block's owner. */
    public static FortranInterface wrap(FortranProcedure procedure, FortranInterface block) {
        FortranInterface wrapper = new FortranInterface(procedure.name, block.parent, procedure.permission);
        wrapper.abstractInterface = block.abstractInterface;
        wrapper.docList = block.docList;
        wrapper.meta = block.meta;
        wrapper.lineNumber = procedure.lineNumber;
        wrapper.numLines = block.numLines;
        wrapper.variables = new ArrayList<>(block.variables);
        wrapper.visible = block.visible;
        wrapper.procedure = procedure;
        procedure.parent = wrapper;
        procedure.visible = false;
        return wrapper;
    }

    @Override
    public EntityKind kind() {
        return EntityKind.INTERFACE;
    }
}
