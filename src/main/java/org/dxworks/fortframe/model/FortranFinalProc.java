package org.dxworks.fortframe.model;

public class FortranFinalProc extends FortranEntity {
    public EntityRef<FortranEntity> procedure;

    public FortranFinalProc(String name, FortranEntity parent) {
        super(name, parent, "public");
        this.procedure = new EntityRef<>(name);
    }

    @Override
    public EntityKind kind() {
        return EntityKind.FINAL_PROCEDURE;
    }
}
