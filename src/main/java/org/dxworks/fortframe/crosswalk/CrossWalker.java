package org.dxworks.fortframe.crosswalk;

import org.dxworks.fortframe.diagnostics.WarningKind;
import org.dxworks.fortframe.diagnostics.WarningLog;
import org.dxworks.fortframe.model.FortranCodeUnit;
import org.dxworks.fortframe.model.FortranEntity;
import org.dxworks.fortframe.model.FortranProcedure;
import org.dxworks.fortframe.model.FortranType;
import org.dxworks.fortframe.model.FortranVariable;
import org.dxworks.fortframe.parser.FortranPatterns;

import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Builds the type dictionary of a procedure: every {@code a%b%c} access found
 * in its body is matched against the variable {@code a} and the components of
 * its derived type, level by level.
 */
public class CrossWalker {

    private static final Set<String> CONTROL = Set.of(
            "if", "then", "do", "select", "case", "end", "cycle", "stop", "continue", "goto", "else", "implicit",
            "call", "return", "exit", "enddo", "endif", "while", "elseif");
    private static final Set<String> OPERATORS = Set.of(".or.", ".and.", ".not.", "=", "<", ">", "0:0");
    private static final Set<String> INTRINSICS = Set.of(
            "abs", "acos", "asin", "atan", "exp", "log", "log10", "mod", "sin", "cos", "tan", "sqrt", "min", "max",
            "amin1", "amax1", "alog", "alog10");
    private static final Set<String> RESERVED = Set.of(
            "allocate", "deallocate", "source", "kind", "len", "size", "allocated", "associated", "null", "none",
            "true", "false");
    private static final Set<String> IO = Set.of(
            "read", "write", "print", "format", "unit", "rewind", "backspace", "endfile", "inquire", "open", "close",
            "flush", "file", "exist", "iostat");
    private static final Set<String> CUSTOM = Set.of("-theta", "theta", "float", "int");
    private static final Set<String> SYMBOLS = Set.of("*", "<", ">", "=", ":", ".", ",", "/", "-", "+", "**");

    private static final Set<String> NOT_VARIABLES = Stream.of(CONTROL, OPERATORS, INTRINSICS, RESERVED, IO, CUSTOM, SYMBOLS)
            .flatMap(Set::stream)
            .collect(Collectors.toUnmodifiableSet());

    private final WarningLog warnings;

    public CrossWalker(WarningLog warnings) {
        this.warnings = warnings;
    }

    public CrossWalkResult crossWalk(FortranProcedure procedure) {
        addBareNames(procedure);

        CrossWalkResult result = new CrossWalkResult();
        result.procedure = procedure.name;
        result.file = procedure.getFilename();

        Map<String, PathTree> roots = pathTree(procedure.memberAccessResults);
        roots.forEach((root, tree) -> {
            FortranEntity declared = lookup(procedure, root);
            if (!(declared instanceof FortranVariable)) {
                result.unresolved.add(root);
                return;
            }
            FortranVariable variable = (FortranVariable) declared;
            CrossWalkNode node = CrossWalkNode.of(variable);
            node.filename = variable.getFilename();
            walk(procedure, variable, node, tree);
            result.variables.put(root, node);
        });
        return result;
    }

    /**
     * Adds to the member accesses the plain names left in the body once keywords,
     * intrinsics, operators, numbers and the procedure's own variables are removed.
     */
    static void addBareNames(FortranCodeUnit unit) {
        Set<String> own = new HashSet<>();
        for (FortranVariable variable : unit.variables) {
            own.add(variable.lowerName());
        }
        // pruned procedure internals still count as declared here
        for (FortranEntity hidden : unit.hidden) {
            if (hidden instanceof FortranVariable) {
                own.add(hidden.lowerName());
            }
        }
        for (String raw : unit.otherResults) {
            String item = stripQuotes(raw.strip());
            if (item.isEmpty()) {
                continue;
            }
            String lower = item.toLowerCase(Locale.ROOT);
            if (NOT_VARIABLES.contains(lower) || own.contains(lower) || FortranPatterns.NUMBER.matcher(item).matches()) {
                continue;
            }
            if (!unit.memberAccessResults.contains(item)) {
                unit.memberAccessResults.add(item);
            }
        }
    }

    private static String stripQuotes(String item) {
        int start = 0;
        int end = item.length();
        while (start < end && (item.charAt(start) == '\'' || item.charAt(start) == '"')) {
            start++;
        }
        while (end > start && (item.charAt(end - 1) == '\'' || item.charAt(end - 1) == '"')) {
            end--;
        }
        return item.substring(start, end);
    }

    static Map<String, PathTree> pathTree(List<String> paths) {
        PathTree root = new PathTree();
        for (String path : paths) {
            PathTree current = root;
            for (String part : path.split("%")) {
                String segment = part.strip();
                if (segment.isEmpty()) {
                    continue;
                }
                current = current.children.computeIfAbsent(segment, k -> new PathTree());
            }
        }
        return root.children;
    }

    private static FortranEntity lookup(FortranProcedure procedure, String name) {
        String key = name.toLowerCase(Locale.ROOT);
        FortranEntity found = procedure.symbols.vars.get(key);
        if (found != null) {
            return found;
        }
        for (FortranEntity arg : procedure.effectiveArgs()) {
            if (arg.lowerName().equals(key)) {
                return arg;
            }
        }
        FortranVariable retvar = procedure.effectiveRetvar();
        return retvar != null && retvar.lowerName().equals(key) ? retvar : null;
    }

    private void walk(FortranProcedure procedure, FortranVariable parent, CrossWalkNode parentNode, PathTree tree) {
        tree.children.forEach((name, subtree) -> {
            FortranVariable component = component(parent, name);
            if (component == null) {
                warnings.warn(WarningKind.RESOLUTION, procedure.getFilename(), procedure.lineNumber, procedure.name,
                        "Component '" + name + "' not found in the type of '" + parent.name + "'");
                return;
            }
            CrossWalkNode node = CrossWalkNode.of(component);
            parentNode.variables.put(name, node);
            walk(procedure, component, node, subtree);
        });
    }

    private static FortranVariable component(FortranVariable variable, String name) {
        if (variable.proto == null || !(variable.proto.target instanceof FortranType)) {
            return null;
        }
        for (FortranVariable candidate : ((FortranType) variable.proto.target).allVariables()) {
            if (candidate.name.equalsIgnoreCase(name)) {
                return candidate;
            }
        }
        return null;
    }

    static class PathTree {
        final Map<String, PathTree> children = new LinkedHashMap<>();
    }
}
