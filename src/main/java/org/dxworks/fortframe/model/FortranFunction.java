package org.dxworks.fortframe.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

public class FortranFunction extends FortranProcedure {
    /** Name of the result variable: the RESULT clause, else the function name. */
    @JsonIgnore
    public String resultName;
    public FortranVariable retvar;

    public FortranFunction(String name, FortranEntity parent, String permission) {
        super(name, parent, permission);
        this.resultName = name;
    }

    @Override
    public EntityKind kind() {
        return EntityKind.FUNCTION;
    }

    @Override
    public String procType() {
        return "function";
    }

    @Override
    public FortranVariable effectiveRetvar() {
        return retvar;
    }
}
