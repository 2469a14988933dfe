package org.dxworks.fortframe.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;

/** The {@code name(args)} inside {@code type(...)}, {@code class(...)} or {@code procedure(...)}. */
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public class TypePrototype {
    public String name;
    public String args;
    /** The derived type, procedure or abstract interface the name resolved to. */
    @JsonIgnore
    public FortranEntity target;

    public TypePrototype(String name, String args) {
        this.name = name;
        this.args = args == null ? "" : args;
    }

    public TypePrototype copy() {
        TypePrototype copy = new TypePrototype(name, args);
        copy.target = target;
        return copy;
    }

    public boolean isResolved() {
        return target != null;
    }

    @Override
    public String toString() {
        String base = target != null ? target.name : name;
        return args.isEmpty() ? base : base + "(" + args + ")";
    }
}
