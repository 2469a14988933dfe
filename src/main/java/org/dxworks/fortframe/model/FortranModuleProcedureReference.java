package org.dxworks.fortframe.model;

/** A {@code module procedure name} line inside a generic interface. */
public class FortranModuleProcedureReference extends FortranEntity {
    public EntityRef<FortranEntity> procedure;

    public FortranModuleProcedureReference(String name, FortranEntity parent, String permission) {
        super(name, parent, permission);
        this.procedure = new EntityRef<>(name);
    }

    @Override
    public EntityKind kind() {
        return EntityKind.MODULE_PROCEDURE_REFERENCE;
    }
}
