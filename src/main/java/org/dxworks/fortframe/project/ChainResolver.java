package org.dxworks.fortframe.project;

import org.dxworks.fortframe.model.FortranBoundProcedure;
import org.dxworks.fortframe.model.FortranCodeUnit;
import org.dxworks.fortframe.model.FortranContainer;
import org.dxworks.fortframe.model.FortranEntity;
import org.dxworks.fortframe.model.FortranFunction;
import org.dxworks.fortframe.model.FortranProcedure;
import org.dxworks.fortframe.model.FortranType;
import org.dxworks.fortframe.model.FortranVariable;
import org.dxworks.fortframe.model.SymbolTables;
import org.dxworks.fortframe.parser.FortranPatterns;

import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;

/**
 * Follows a {@code a%b%c} reference from the unit it appears in: each segment is
 * looked up in what the previous one names, a procedure's result type, a
 * derived type or the type of a variable.
 */
final class ChainResolver {

    private ChainResolver() {
        // utility class
    }

    /** The entity the last segment of {@code chain} names, or null when any segment is unknown. */
    static FortranEntity resolve(FortranCodeUnit unit, List<String> chain) {
        FortranEntity context = unit;
        FortranEntity item = null;
        for (int i = 0; i < chain.size(); i++) {
            if (i > 0) {
                context = typeOf(item, unit);
                if (context == null) {
                    return null;
                }
            }
            item = labels(context).get(chain.get(i).toLowerCase());
            if (item == null) {
                return null;
            }
        }
        return item;
    }

    // The derived type whose components a following segment selects
    private static FortranEntity typeOf(FortranEntity item, FortranCodeUnit unit) {
        if (item instanceof FortranType) {
            return item;
        }
        if (item instanceof FortranFunction) {
            FortranVariable retvar = ((FortranFunction) item).retvar;
            if (retvar == null) {
                return null;
            }
            return lookupType(retvar, ((FortranFunction) item).symbols);
        }
        if (item instanceof FortranVariable) {
            FortranType type = lookupType((FortranVariable) item, Correlator.hostSymbols(item));
            return type != null ? type : lookupType((FortranVariable) item, unit.symbols);
        }
        return null;
    }

    private static FortranType lookupType(FortranVariable variable, SymbolTables symbols) {
        if (variable.proto != null && variable.proto.target instanceof FortranType) {
            return (FortranType) variable.proto.target;
        }
        String name = null;
        if (variable.proto != null && ("type".equals(variable.vartype) || "class".equals(variable.vartype))) {
            name = variable.proto.name;
        } else {
            Matcher wrapper = FortranPatterns.TYPE_WRAPPER.matcher(variable.vartype);
            if (wrapper.matches()) {
                name = wrapper.group(2);
            }
        }
        return name == null ? null : symbols.types.get(name.strip().toLowerCase());
    }

    /** Every name visible inside {@code context}, keyed in lower case. */
    static Map<String, FortranEntity> labels(FortranEntity context) {
        Map<String, FortranEntity> labels = new LinkedHashMap<>();
        if (context instanceof FortranType) {
            collectTypeLabels((FortranType) context, labels, new HashSet<>());
            return labels;
        }
        if (context instanceof FortranContainer) {
            SymbolTables symbols = ((FortranContainer) context).symbols;
            labels.putAll(symbols.procs);
            labels.putAll(symbols.types);
            labels.putAll(symbols.vars);
            for (FortranVariable variable : ((FortranContainer) context).variables) {
                labels.put(variable.lowerName(), variable);
            }
        }
        if (context instanceof FortranProcedure) {
            FortranProcedure procedure = (FortranProcedure) context;
            for (FortranEntity arg : procedure.effectiveArgs()) {
                labels.put(arg.lowerName(), arg);
            }
            FortranVariable retvar = procedure.effectiveRetvar();
            if (retvar != null) {
                labels.put(retvar.lowerName(), retvar);
            }
        }
        return labels;
    }

    private static void collectTypeLabels(FortranType type, Map<String, FortranEntity> labels, Set<FortranType> seen) {
        if (!seen.add(type)) {
            return;
        }
        // components of an extended type are reached through the base first
        FortranType base = type.getExtendedType();
        if (base != null) {
            collectTypeLabels(base, labels, seen);
            labels.put(base.lowerName(), base);
        }
        for (FortranVariable variable : type.variables) {
            labels.put(variable.lowerName(), variable);
        }
        for (FortranBoundProcedure boundProc : type.allBoundProcs()) {
            labels.put(boundProc.lowerName(), boundProc);
        }
    }
}
