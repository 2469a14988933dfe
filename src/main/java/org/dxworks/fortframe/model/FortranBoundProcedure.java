package org.dxworks.fortframe.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.util.ArrayList;
import java.util.List;

/**
 * A type-bound procedure: {@code procedure :: name => impl}, or a generic binding
 * {@code generic :: name => a, b}.
 */
public class FortranBoundProcedure extends FortranEntity {
    public List<String> attribs = new ArrayList<>();
    public boolean deferred;
    public boolean generic;
    /** Interface named in {@code procedure(iface)}. */
    public String protoName;
    @JsonIgnore
    public FortranEntity protoTarget;
    /** Procedures (or, for a generic binding, other bindings) this name is bound to. */
    public List<EntityRef<FortranEntity>> bindings = new ArrayList<>();

    public FortranBoundProcedure(String name, FortranEntity parent, String permission) {
        super(name, parent, permission);
    }

    @Override
    public EntityKind kind() {
        return EntityKind.BOUND_PROCEDURE;
    }

    /** A generic binding inherited from an extended type, re-owned by {@code newParent}. */
    public FortranBoundProcedure copyFor(FortranType newParent) {
        FortranBoundProcedure copy = new FortranBoundProcedure(name, newParent, permission);
        copy.attribs = new ArrayList<>(attribs);
        copy.deferred = deferred;
        copy.generic = generic;
        copy.protoName = protoName;
        copy.protoTarget = protoTarget;
        for (EntityRef<FortranEntity> binding : bindings) {
            EntityRef<FortranEntity> ref = new EntityRef<>(binding.name);
            ref.target = binding.target;
            copy.bindings.add(ref);
        }
        copy.docList = docList;
        copy.meta = meta;
        copy.lineNumber = lineNumber;
        copy.visible = visible;
        return copy;
    }

    /** Lines of the procedures this binding resolves to. */
    public int bindingLines() {
        int total = 0;
        for (EntityRef<FortranEntity> binding : bindings) {
            if (binding.target != null && binding.target != this) {
                total += binding.target.numLines;
            }
        }
        return total;
    }
}
