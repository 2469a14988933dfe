package org.dxworks.fortframe.parser;

import org.dxworks.fortframe.model.TypePrototype;

/** Declared type at the start of a declaration, and the text after it. */
public class ParsedType {
    public final String vartype;
    public final String rest;
    public String kind;
    public String strlen;
    public TypePrototype proto;

    public ParsedType(String vartype, String rest) {
        this.vartype = vartype;
        this.rest = rest;
    }
}
