package org.dxworks.fortframe.model;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Lower-cased name lookups visible from a scope: procedures (and procedure
 * pointers), abstract interfaces, derived types and variables.
 */
public class SymbolTables {
    public final Map<String, FortranEntity> procs = new LinkedHashMap<>();
    public final Map<String, FortranEntity> absInterfaces = new LinkedHashMap<>();
    public final Map<String, FortranType> types = new LinkedHashMap<>();
    public final Map<String, FortranEntity> vars = new LinkedHashMap<>();

    public SymbolTables copy() {
        SymbolTables copy = new SymbolTables();
        copy.putAll(this);
        return copy;
    }

    public void putAll(SymbolTables other) {
        procs.putAll(other.procs);
        absInterfaces.putAll(other.absInterfaces);
        types.putAll(other.types);
        vars.putAll(other.vars);
    }

    public boolean isEmpty() {
        return procs.isEmpty() && absInterfaces.isEmpty() && types.isEmpty() && vars.isEmpty();
    }
}
