package org.dxworks.fortframe.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * {@code module procedure name} body in a (sub)module. Arguments and result
 * belong to the interface it implements and are only referenced here.
 */
public class FortranModuleProcedure extends FortranProcedure {
    @JsonIgnore
    public FortranProcedure implementedInterface;

    public FortranModuleProcedure(String name, FortranEntity parent, String permission) {
        super(name, parent, permission);
        this.module = true;
    }

    @Override
    public EntityKind kind() {
        return EntityKind.MODULE_PROCEDURE;
    }

    @Override
    public String procType() {
        return "module procedure";
    }

    @Override
    public List<FortranEntity> effectiveArgs() {
        return implementedInterface != null ? implementedInterface.effectiveArgs() : new ArrayList<>();
    }

    @Override
    public FortranVariable effectiveRetvar() {
        return implementedInterface != null ? implementedInterface.effectiveRetvar() : null;
    }

    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    public List<String> getInterfaceArgs() {
        return effectiveArgs().stream().map(a -> a.name).collect(Collectors.toList());
    }
}
