package org.dxworks.fortframe.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

public class FortranSubmodule extends FortranModule {
    public EntityRef<FortranModule> ancestorModule;
    public EntityRef<FortranSubmodule> parentSubmodule;
    /** Ancestor module first, then each parent submodule down to this one's direct parent. */
    @JsonIgnore
    public List<FortranModule> ancestry = new ArrayList<>();
    public List<FortranFunction> moduleFunctions = new ArrayList<>();
    public List<FortranSubroutine> moduleSubroutines = new ArrayList<>();

    public FortranSubmodule(String name, FortranEntity parent, String ancestorModule, String parentSubmodule) {
        super(name, parent, "private");
        this.ancestorModule = new EntityRef<>(ancestorModule);
        this.parentSubmodule = parentSubmodule == null ? null : new EntityRef<>(parentSubmodule);
    }

    @Override
    public EntityKind kind() {
        return EntityKind.SUBMODULE;
    }

    @Override
    @JsonIgnore
    public List<FortranProcedure> getRoutines() {
        List<FortranProcedure> routines = super.getRoutines();
        routines.addAll(moduleFunctions);
        routines.addAll(moduleSubroutines);
        return routines;
    }

    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    public List<String> getAncestryNames() {
        return ancestry.stream().map(m -> m.name).collect(Collectors.toList());
    }
}
