package org.dxworks.fortframe.model;

public class FortranProgram extends FortranCodeUnit {

    public FortranProgram(String name, FortranEntity parent) {
        super(name == null ? "" : name, parent, parent == null ? "public" : parent.permission);
        this.visible = true;
    }

    @Override
    public EntityKind kind() {
        return EntityKind.PROGRAM;
    }
}
