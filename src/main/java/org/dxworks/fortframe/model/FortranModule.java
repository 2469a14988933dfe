package org.dxworks.fortframe.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

public class FortranModule extends FortranCodeUnit {
    public boolean external;
    public String externalUrl;
    public List<FortranModuleProcedure> moduleProcedures = new ArrayList<>();
    /** Modules this one depends on, directly or through the modules it uses. */
    @JsonIgnore
    public List<FortranModule> deplist = new ArrayList<>();
    @JsonIgnore
    public List<FortranSubmodule> descendants = new ArrayList<>();
    /** What a USE of this module can import. */
    @JsonIgnore
    public SymbolTables publicSymbols = new SymbolTables();

    public FortranModule(String name, FortranEntity parent, String permission) {
        super(name, parent, permission);
        this.visible = true;
    }

    /** Stand-in for a module documented elsewhere; resolves USE statements but exports nothing. */
    public static FortranModule external(String name, String url) {
        FortranModule module = new FortranModule(name, null, "public");
        module.external = true;
        module.externalUrl = url;
        return module;
    }

    @Override
    public EntityKind kind() {
        return EntityKind.MODULE;
    }

    @Override
    @JsonIgnore
    public List<FortranProcedure> getRoutines() {
        List<FortranProcedure> routines = super.getRoutines();
        routines.addAll(moduleProcedures);
        return routines;
    }

    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    public List<String> getDependencies() {
        return deplist.stream().map(m -> m.name).collect(Collectors.toList());
    }

    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    public List<String> getDescendantNames() {
        return descendants.stream().map(m -> m.name).collect(Collectors.toList());
    }
}
