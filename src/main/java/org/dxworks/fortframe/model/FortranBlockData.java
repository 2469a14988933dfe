package org.dxworks.fortframe.model;

/** Legacy unit initialising variables held in common blocks. */
public class FortranBlockData extends FortranCodeUnit {

    public static final String UNNAMED = "<unnamed>";

    public FortranBlockData(String name, FortranEntity parent) {
        super(name == null || name.isEmpty() ? UNNAMED : name, parent, "public");
        this.visible = true;
    }

    @Override
    public EntityKind kind() {
        return EntityKind.BLOCK_DATA;
    }
}
