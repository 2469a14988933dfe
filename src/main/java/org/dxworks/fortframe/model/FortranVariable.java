package org.dxworks.fortframe.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.ArrayList;
import java.util.List;

@JsonPropertyOrder({"kind", "name", "vartype", "typeKind", "strlen", "proto", "dimension", "attribs", "intent",
        "optional", "parameter", "points", "initial", "permission"})
public class FortranVariable extends FortranEntity {
    public String vartype;
    /** Kind type parameter, e.g. {@code 8} in {@code real(kind=8)}. */
    public String typeKind;
    public String strlen;
    public TypePrototype proto;
    public List<String> attribs = new ArrayList<>();
    public String intent = "";
    public boolean optional;
    public boolean parameter;
    /** Initialised with {@code =>} rather than {@code =}. */
    public boolean points;
    public String initial;
    public String dimension = "";

    public FortranVariable(String name, String vartype, FortranEntity parent, String permission) {
        super(name, parent, permission);
        this.vartype = vartype.toLowerCase();
        splitDimension();
    }

    /** Implicitly typed variable: {@code i..n} are integers, everything else is real. */
    public static FortranVariable implicit(String name, FortranEntity parent) {
        return new FortranVariable(name, implicitType(name), parent, "public");
    }

    public static String implicitType(String name) {
        char first = Character.toLowerCase(name.charAt(0));
        return first >= 'i' && first <= 'n' ? "integer" : "real";
    }

    // "x(10)", "c*8" and "a[*]" declare the dimension or length next to the name
    private void splitDimension() {
        int index = -1;
        for (char marker : new char[]{'(', '[', '*'}) {
            int at = name.indexOf(marker);
            if (at > 0 && (index < 0 || at < index)) {
                index = at;
            }
        }
        if (index > 0) {
            dimension = name.substring(index);
            name = name.substring(0, index);
        }
    }

    public String getFullType() {
        StringBuilder result = new StringBuilder(vartype);
        List<String> parameters = new ArrayList<>();
        if (typeKind != null && !typeKind.isEmpty()) {
            parameters.add("kind=" + typeKind);
        }
        if (strlen != null && !strlen.isEmpty()) {
            parameters.add("len=" + strlen);
        }
        if (!parameters.isEmpty()) {
            result.append('(').append(String.join(", ", parameters)).append(')');
        } else if (proto != null) {
            result.append('(').append(proto).append(')');
        }
        return result.toString();
    }

    public String getFullDeclaration() {
        StringBuilder result = new StringBuilder(getFullType());
        for (String attrib : attribs) {
            result.append(", ").append(attrib);
        }
        if (!dimension.isEmpty()) {
            result.append(", ").append(dimension);
        }
        if (parameter) {
            result.append(", parameter");
        }
        return result.toString();
    }

    @JsonIgnore
    public boolean isProcedurePointer() {
        return "procedure".equals(vartype);
    }

    @Override
    public EntityKind kind() {
        return EntityKind.VARIABLE;
    }
}
