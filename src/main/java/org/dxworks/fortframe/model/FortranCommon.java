package org.dxworks.fortframe.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * A named (or blank) common block as declared in one scope. Declarations of the
 * members move here from the enclosing unit once correlated.
 */
public class FortranCommon extends FortranEntity {
    public static final String BLANK = "";

    @JsonIgnore
    public List<String> memberNames = new ArrayList<>();
    public List<FortranVariable> variables = new ArrayList<>();
    /** Every declaration of this block in the project, this one included. */
    @JsonIgnore
    public List<FortranCommon> otherUses = new ArrayList<>();

    public FortranCommon(String name, FortranEntity parent) {
        super(name == null ? BLANK : name, parent, "public");
    }

    @Override
    public EntityKind kind() {
        return EntityKind.COMMON;
    }

    /** Units elsewhere in the project that declare the same block. */
    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    public List<String> getSharedWith() {
        return otherUses.stream()
                .filter(c -> c != this)
                .map(c -> c.parent == null ? c.name : c.parent.name)
                .collect(Collectors.toList());
    }
}
