package org.dxworks.fortframe.model;

/** {@code enum, bind(c)} block; its enumerators are integer variables with consecutive values. */
public class FortranEnum extends FortranContainer {

    public FortranEnum(String name, FortranEntity parent, String permission) {
        super(name, parent, permission);
    }

    @Override
    public EntityKind kind() {
        return EntityKind.ENUM;
    }
}
