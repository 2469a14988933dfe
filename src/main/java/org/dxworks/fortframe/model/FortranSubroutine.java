package org.dxworks.fortframe.model;

public class FortranSubroutine extends FortranProcedure {

    public FortranSubroutine(String name, FortranEntity parent, String permission) {
        super(name, parent, permission);
    }

    @Override
    public EntityKind kind() {
        return EntityKind.SUBROUTINE;
    }

    @Override
    public String procType() {
        return "subroutine";
    }
}
