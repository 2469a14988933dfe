package org.dxworks.fortframe.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.util.ArrayList;
import java.util.List;

public class FortranNamelist extends FortranEntity {
    @JsonIgnore
    public List<String> memberNames = new ArrayList<>();
    public List<EntityRef<FortranEntity>> variables = new ArrayList<>();

    public FortranNamelist(String name, FortranEntity parent, String permission) {
        super(name, parent, permission);
    }

    @Override
    public EntityKind kind() {
        return EntityKind.NAMELIST;
    }
}
