package org.dxworks.fortframe.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/** A derived type definition. */
public class FortranType extends FortranContainer {
    @JsonProperty("extends")
    public EntityRef<FortranType> extendsRef;
    public List<String> attribs = new ArrayList<>();
    /** Length and kind type parameters, matched to component declarations at cleanup. */
    public List<FortranVariable> parameters = new ArrayList<>();
    @JsonIgnore
    public List<String> parameterNames = new ArrayList<>();
    public boolean sequence;
    public List<FortranBoundProcedure> boundProcs = new ArrayList<>();
    public List<FortranFinalProc> finalProcs = new ArrayList<>();
    /** A procedure or generic interface with the same name as the type. */
    public EntityRef<FortranEntity> constructor;
    public int numLinesAll;
    /** Public components of the extended type; owned there. */
    @JsonIgnore
    public List<FortranVariable> inheritedVariables = new ArrayList<>();
    /** Specific bindings of the extended type that are not overridden here; owned there. */
    @JsonIgnore
    public List<FortranBoundProcedure> inheritedBoundProcs = new ArrayList<>();
    @JsonIgnore
    public boolean correlated;

    public FortranType(String name, FortranEntity parent, String permission) {
        super(name, parent, permission);
    }

    @Override
    public EntityKind kind() {
        return EntityKind.TYPE;
    }

    @JsonIgnore
    public FortranType getExtendedType() {
        return extendsRef == null ? null : extendsRef.target;
    }

    /** Own and inherited components, inherited first. */
    @JsonIgnore
    public List<FortranVariable> allVariables() {
        List<FortranVariable> all = new ArrayList<>(inheritedVariables);
        all.addAll(variables);
        return all;
    }

    /** Own and inherited bindings, inherited first. */
    @JsonIgnore
    public List<FortranBoundProcedure> allBoundProcs() {
        List<FortranBoundProcedure> all = new ArrayList<>(inheritedBoundProcs);
        all.addAll(boundProcs);
        return all;
    }

    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    public List<String> getInheritedComponents() {
        return inheritedVariables.stream().map(v -> v.name).collect(Collectors.toList());
    }

    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    public List<String> getInheritedBindings() {
        return inheritedBoundProcs.stream().map(b -> b.name).collect(Collectors.toList());
    }
}
