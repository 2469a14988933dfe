package org.dxworks.fortframe.project;

import org.dxworks.fortframe.FortframeConfig;
import org.dxworks.fortframe.diagnostics.WarningKind;
import org.dxworks.fortframe.diagnostics.WarningLog;
import org.dxworks.fortframe.model.CallRecord;
import org.dxworks.fortframe.model.EntityKind;
import org.dxworks.fortframe.model.EntityRef;
import org.dxworks.fortframe.model.FortranBlockData;
import org.dxworks.fortframe.model.FortranBoundProcedure;
import org.dxworks.fortframe.model.FortranCodeUnit;
import org.dxworks.fortframe.model.FortranCommon;
import org.dxworks.fortframe.model.FortranContainer;
import org.dxworks.fortframe.model.FortranEntity;
import org.dxworks.fortframe.model.FortranFinalProc;
import org.dxworks.fortframe.model.FortranFunction;
import org.dxworks.fortframe.model.FortranInterface;
import org.dxworks.fortframe.model.FortranModule;
import org.dxworks.fortframe.model.FortranModuleProcedure;
import org.dxworks.fortframe.model.FortranModuleProcedureReference;
import org.dxworks.fortframe.model.FortranNamelist;
import org.dxworks.fortframe.model.FortranProcedure;
import org.dxworks.fortframe.model.FortranSubmodule;
import org.dxworks.fortframe.model.FortranType;
import org.dxworks.fortframe.model.FortranVariable;
import org.dxworks.fortframe.model.SymbolTables;
import org.dxworks.fortframe.model.UseStatement;
import org.dxworks.fortframe.parser.FortranPatterns;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Predicate;
import java.util.regex.Matcher;

/**
 * Second pass over a parsed project: links USE statements, type extension,
 * bindings and calls to the entities they name, then prunes what should not be
 * displayed. Modules are handled in dependency order so that everything a unit
 * imports is complete before the unit itself is correlated.
 */
public class Correlator {

    private static final Set<String> INTRINSIC_MODULES = Set.of(
            "iso_fortran_env", "iso_c_binding", "ieee_arithmetic", "ieee_exceptions", "ieee_features",
            "omp_lib", "omp_lib_kinds");

    private final FortranProject project;
    private final FortframeConfig config;
    private final WarningLog warnings;
    private final EntityPruner pruner;

    public Correlator(FortranProject project, FortframeConfig config, WarningLog warnings) {
        this.project = project;
        this.config = config;
        this.warnings = warnings;
        this.pruner = new EntityPruner(config);
    }

    public void correlate() {
        config.getExtraModules().forEach((name, url) -> project.externalModules.add(FortranModule.external(name, url)));

        List<FortranCodeUnit> topLevel = new ArrayList<>();
        topLevel.addAll(project.modules);
        topLevel.addAll(project.fileScopeProcedures());
        topLevel.addAll(project.programs);
        topLevel.addAll(project.submodules);
        topLevel.addAll(project.blockData);
        for (FortranCodeUnit unit : topLevel) {
            findUsedModules(unit);
        }

        List<FortranCodeUnit> ranklist = new ArrayList<>(processingOrder());
        ranklist.addAll(project.fileScopeProcedures());
        ranklist.addAll(project.programs);
        ranklist.addAll(project.blockData);

        for (FortranCodeUnit unit : ranklist) {
            correlate(unit);
        }
        for (FortranCodeUnit unit : ranklist) {
            pruner.prune(unit);
        }
    }

    // ---- USE resolution and ordering ----

    void findUsedModules(FortranCodeUnit unit) {
        for (UseStatement use : unit.uses) {
            if (use.module.isResolved()) {
                continue;
            }
            FortranModule module = findModule(use.module.name);
            if (module != null) {
                use.module.resolve(module);
            } else if (!INTRINSIC_MODULES.contains(use.module.name.toLowerCase())) {
                warn(unit, use.line, "Could not find module '" + use.module.name + "' used in " + unit);
            }
        }

        if (unit instanceof FortranSubmodule) {
            FortranSubmodule submodule = (FortranSubmodule) unit;
            if (submodule.parentSubmodule != null && !submodule.parentSubmodule.isResolved()) {
                for (FortranSubmodule candidate : project.submodules) {
                    if (candidate.name.equalsIgnoreCase(submodule.parentSubmodule.name)) {
                        submodule.parentSubmodule.resolve(candidate);
                        break;
                    }
                }
            }
            if (!submodule.ancestorModule.isResolved()) {
                for (FortranModule candidate : project.modules) {
                    if (candidate.name.equalsIgnoreCase(submodule.ancestorModule.name)) {
                        submodule.ancestorModule.resolve(candidate);
                        break;
                    }
                }
            }
        }

        for (FortranProcedure routine : unit.getRoutines()) {
            findUsedModules(routine);
        }
        for (FortranInterface intf : unit.interfaces) {
            if (intf.procedure != null) {
                findUsedModules(intf.procedure);
            } else {
                for (FortranProcedure routine : intf.getRoutines()) {
                    findUsedModules(routine);
                }
            }
        }
    }

    private FortranModule findModule(String name) {
        for (FortranModule module : project.modules) {
            if (module.name.equalsIgnoreCase(name)) {
                return module;
            }
        }
        for (FortranModule module : project.externalModules) {
            if (module.name.equalsIgnoreCase(name)) {
                return module;
            }
        }
        return null;
    }

    private List<FortranModule> processingOrder() {
        Map<FortranModule, Set<FortranModule>> graph = new LinkedHashMap<>();
        for (FortranModule module : project.modules) {
            module.deplist = moduleDependencies(module);
            graph.put(module, new LinkedHashSet<>(module.deplist));
        }
        for (FortranSubmodule submodule : project.submodules) {
            FortranModule parent = submodule.ancestorModule.target;
            if (parent == null) {
                warn(submodule, submodule.lineNumber, "Could not identify ancestor module ('"
                        + submodule.ancestorModule.name + "') of submodule '" + submodule.name + "'");
            }
            if (submodule.parentSubmodule != null) {
                if (submodule.parentSubmodule.isResolved()) {
                    parent = submodule.parentSubmodule.target;
                } else {
                    warn(submodule, submodule.lineNumber, "Could not identify parent submodule ('"
                            + submodule.parentSubmodule.name + "') of submodule '" + submodule.name + "'");
                }
            }
            // without an ancestor only its own USE dependencies order it
            List<FortranModule> deps = new ArrayList<>();
            if (parent != null) {
                deps.add(parent);
            }
            deps.addAll(moduleDependencies(submodule));
            submodule.deplist = deps;
            graph.put(submodule, new LinkedHashSet<>(deps));
        }
        return TopologicalSorter.sort(graph, cycle -> warnings.warn(WarningKind.RESOLUTION, null, null, null,
                "Cyclic module dependencies between " + names(cycle) + "; correlating them in discovery order"));
    }

    /** Modules used by {@code unit} or by any procedure inside it. */
    private static List<FortranModule> moduleDependencies(FortranCodeUnit unit) {
        Set<FortranModule> used = new LinkedHashSet<>();
        collectUsedModules(unit, used);
        List<FortranModule> modules = new ArrayList<>();
        for (FortranModule module : used) {
            if (module.kind() == EntityKind.MODULE && !module.external) {
                modules.add(module);
            }
        }
        return modules;
    }

    private static void collectUsedModules(FortranCodeUnit unit, Set<FortranModule> used) {
        for (UseStatement use : unit.uses) {
            if (use.module.isResolved()) {
                used.add(use.module.target);
            }
        }
        for (FortranInterface intf : unit.interfaces) {
            if (intf.procedure != null) {
                collectUsedModules(intf.procedure, used);
            }
        }
        for (FortranProcedure routine : unit.getRoutines()) {
            collectUsedModules(routine, used);
        }
    }

    // ---- Per-entity correlation ----

    void correlate(FortranEntity entity) {
        switch (entity.kind()) {
            case MODULE:
            case SUBMODULE:
            case PROGRAM:
            case SUBROUTINE:
            case FUNCTION:
            case MODULE_PROCEDURE:
                correlateCodeUnit((FortranCodeUnit) entity);
                break;
            case BLOCK_DATA:
                correlateBlockData((FortranBlockData) entity);
                break;
            case TYPE:
                correlateType((FortranType) entity);
                break;
            case INTERFACE:
                correlateInterface((FortranInterface) entity);
                break;
            case VARIABLE:
                correlateVariable((FortranVariable) entity);
                break;
            case BOUND_PROCEDURE:
                correlateBoundProcedure((FortranBoundProcedure) entity, (FortranType) entity.parent);
                break;
            case FINAL_PROCEDURE:
                correlateFinalProc((FortranFinalProc) entity);
                break;
            case COMMON:
                correlateCommon((FortranCommon) entity);
                break;
            case NAMELIST:
                correlateNamelist((FortranNamelist) entity);
                break;
            case SOURCE_FILE:
            case ENUM:
            case MODULE_PROCEDURE_REFERENCE:
                break;
        }
    }

    private void correlateCodeUnit(FortranCodeUnit unit) {
        SymbolTables tables = hostSymbols(unit).copy();
        tables.procs.putAll(unit.symbols.procs);
        for (FortranInterface absInterface : unit.absInterfaces) {
            tables.absInterfaces.put(absInterface.lowerName(), absInterface);
        }
        for (FortranType type : unit.types) {
            tables.types.put(type.lowerName(), type);
        }
        for (FortranVariable variable : unit.variables) {
            tables.vars.put(variable.lowerName(), variable);
        }
        if (unit.parent instanceof FortranProcedure) {
            addArguments(tables, (FortranProcedure) unit.parent);
        }
        if (unit instanceof FortranProcedure) {
            addArguments(tables, (FortranProcedure) unit);
        }

        if (unit instanceof FortranSubmodule) {
            inheritFromParentModule((FortranSubmodule) unit, tables);
        }
        unit.symbols = tables;

        if (unit instanceof FortranModule) {
            linkSeparateModuleProcedures((FortranModule) unit);
        }

        importUsedModules(unit);
        correlateTypes(unit);
        resolveCalls(unit);

        if (unit instanceof FortranSubmodule) {
            computeAncestry((FortranSubmodule) unit);
        }

        List<FortranEntity> children = new ArrayList<>();
        children.addAll(unit.functions);
        children.addAll(unit.subroutines);
        children.addAll(unit.interfaces);
        children.addAll(unit.absInterfaces);
        children.addAll(unit.variables);
        children.addAll(unit.common);
        if (unit instanceof FortranModule) {
            children.addAll(((FortranModule) unit).moduleProcedures);
        }
        children.addAll(unit.namelists);
        for (FortranEntity child : children) {
            correlate(child);
        }
        if (unit instanceof FortranProcedure && !(unit instanceof FortranModuleProcedure)) {
            FortranProcedure procedure = (FortranProcedure) unit;
            for (FortranEntity arg : procedure.args) {
                correlate(arg);
            }
            if (procedure.effectiveRetvar() != null) {
                correlate(procedure.effectiveRetvar());
            }
        }

        EntitySorter.sortComponents(unit, config.getSort());

        if (unit instanceof FortranSubmodule) {
            splitModuleProcedures((FortranSubmodule) unit);
        }
    }

    private static void addArguments(SymbolTables tables, FortranProcedure procedure) {
        for (FortranEntity arg : procedure.effectiveArgs()) {
            tables.vars.put(arg.lowerName(), arg);
        }
        FortranVariable retvar = procedure.effectiveRetvar();
        if (retvar != null) {
            tables.vars.put(retvar.lowerName(), retvar);
        }
    }

    private static void inheritFromParentModule(FortranSubmodule submodule, SymbolTables tables) {
        FortranModule source = null;
        if (submodule.parentSubmodule != null && submodule.parentSubmodule.isResolved()) {
            source = submodule.parentSubmodule.target;
        } else if (submodule.ancestorModule.isResolved()) {
            source = submodule.ancestorModule.target;
        }
        if (source == null) {
            return;
        }
        if (!source.descendants.contains(submodule)) {
            source.descendants.add(submodule);
        }
        tables.procs.putAll(source.symbols.procs);
        tables.absInterfaces.putAll(source.symbols.absInterfaces);
        tables.types.putAll(source.symbols.types);
        tables.vars.putAll(source.symbols.vars);
    }

    // Implementations of separate module procedures take their signature from the interface.
    private static void linkSeparateModuleProcedures(FortranModule module) {
        for (FortranProcedure procedure : module.getRoutines()) {
            if (!procedure.module) {
                continue;
            }
            FortranEntity declared = module.symbols.procs.get(procedure.lowerName());
            FortranProcedure base = null;
            if (declared instanceof FortranInterface && ((FortranInterface) declared).procedure != null) {
                base = ((FortranInterface) declared).procedure;
            } else if (declared instanceof FortranProcedure && declared != procedure
                    && declared.parent instanceof FortranInterface && ((FortranInterface) declared.parent).generic) {
                base = (FortranProcedure) declared;
            }
            if (base == null) {
                continue;
            }
            procedure.moduleCounterpart = declared;
            base.moduleCounterpart = procedure;
            if (procedure instanceof FortranModuleProcedure) {
                FortranModuleProcedure implementation = (FortranModuleProcedure) procedure;
                implementation.implementedInterface = base;
                implementation.attribs = new ArrayList<>(base.attribs);
            }
        }
    }

    private void importUsedModules(FortranCodeUnit unit) {
        for (UseStatement use : unit.uses) {
            FortranModule module = use.module.target;
            if (module == null) {
                continue;
            }
            SymbolTables used = usedEntities(module, use.clause);
            if (unit instanceof FortranModule) {
                reexport((FortranModule) unit, used);
            }
            unit.symbols.putAll(used);
        }
    }

    /** What {@code use module<clause>} imports, keyed by the local name. */
    static SymbolTables usedEntities(FortranModule module, String clause) {
        if (clause == null || clause.isBlank()) {
            return module.publicSymbols.copy();
        }
        Matcher onlyMatcher = FortranPatterns.ONLY.matcher(clause);
        boolean only = onlyMatcher.lookingAt();
        String names = only ? clause.substring(onlyMatcher.end()) : clause;

        Map<String, String> localNames = new HashMap<>();
        for (String item : names.split(",")) {
            String trimmed = item.strip();
            if (trimmed.isEmpty()) {
                continue;
            }
            Matcher rename = FortranPatterns.RENAME.matcher(trimmed);
            if (rename.find()) {
                localNames.put(rename.group(2).toLowerCase(), rename.group(1).toLowerCase());
            } else {
                localNames.put(trimmed.toLowerCase(), trimmed.toLowerCase());
            }
        }

        SymbolTables used = new SymbolTables();
        importNames(module.publicSymbols.procs, used.procs, localNames, only);
        importNames(module.publicSymbols.absInterfaces, used.absInterfaces, localNames, only);
        importNames(module.publicSymbols.types, used.types, localNames, only);
        importNames(module.publicSymbols.vars, used.vars, localNames, only);
        return used;
    }

    private static <T> void importNames(Map<String, T> exported, Map<String, T> target, Map<String, String> localNames,
                                        boolean only) {
        exported.forEach((name, entity) -> {
            String lower = name.toLowerCase();
            if (!only) {
                target.put(localNames.getOrDefault(lower, lower), entity);
            } else if (localNames.containsKey(lower)) {
                target.put(localNames.get(lower), entity);
            }
        });
    }

    private static void reexport(FortranModule module, SymbolTables used) {
        Predicate<String> isPublic = name -> "public".equals(module.permission) || module.publicList.contains(name);
        SymbolTables exported = module.publicSymbols;
        used.procs.forEach((name, entity) -> {
            if (isPublic.test(name)) {
                exported.procs.put(name, entity);
            }
        });
        used.absInterfaces.forEach((name, entity) -> {
            if (isPublic.test(name)) {
                exported.absInterfaces.put(name, entity);
            }
        });
        used.types.forEach((name, entity) -> {
            if (isPublic.test(name)) {
                exported.types.put(name, entity);
            }
        });
        used.vars.forEach((name, entity) -> {
            if (isPublic.test(name)) {
                exported.vars.put(name, entity);
            }
        });
    }

    private void correlateTypes(FortranContainer unit) {
        Map<FortranType, Set<FortranType>> graph = new LinkedHashMap<>();
        for (FortranType type : unit.types) {
            Set<FortranType> deps = new LinkedHashSet<>();
            if (type.extendsRef != null) {
                FortranType base = unit.symbols.types.get(type.extendsRef.name.toLowerCase());
                if (base != null && base != type) {
                    type.extendsRef.resolve(base);
                    deps.add(base);
                }
            }
            graph.put(type, deps);
        }
        List<FortranType> order = TopologicalSorter.sort(graph, cycle -> {
            for (FortranType type : cycle) {
                if (inExtendsCycle(type)) {
                    warn(type, type.lineNumber, "Derived type '" + type.name + "' extends itself through '"
                            + type.extendsRef.name + "'; ignoring the extension");
                    type.extendsRef.target = null;
                }
            }
        });
        for (FortranType type : order) {
            if (unit.types.contains(type)) {
                correlateType(type);
            }
        }
    }

    private static boolean inExtendsCycle(FortranType type) {
        Set<FortranType> seen = new HashSet<>();
        FortranType current = type.getExtendedType();
        while (current != null && seen.add(current)) {
            if (current == type) {
                return true;
            }
            current = current.getExtendedType();
        }
        return false;
    }

    private void resolveCalls(FortranCodeUnit unit) {
        Iterator<CallRecord> it = unit.calls.iterator();
        while (it.hasNext()) {
            CallRecord call = it.next();
            FortranEntity item = ChainResolver.resolve(unit, call.chain);
            if (item == null) {
                continue;
            }
            // type constructors and array references look like calls
            if (item instanceof FortranVariable || item instanceof FortranType) {
                it.remove();
            } else {
                call.resolved = item;
            }
        }
    }

    private void computeAncestry(FortranSubmodule submodule) {
        submodule.ancestry.clear();
        Set<FortranSubmodule> seen = new HashSet<>();
        FortranSubmodule item = submodule;
        while (item.parentSubmodule != null && seen.add(item)) {
            if (!item.parentSubmodule.isResolved()) {
                warn(submodule, submodule.lineNumber, "Unknown parent submodule '" + item.parentSubmodule.name
                        + "' of submodule '" + item.name + "'");
                return;
            }
            item = item.parentSubmodule.target;
            submodule.ancestry.add(0, item);
        }
        if (item.ancestorModule.isResolved()) {
            submodule.ancestry.add(0, item.ancestorModule.target);
        }
    }

    private static void splitModuleProcedures(FortranSubmodule submodule) {
        submodule.functions.removeIf(f -> {
            if (f.module) {
                submodule.moduleFunctions.add(f);
            }
            return f.module;
        });
        submodule.subroutines.removeIf(s -> {
            if (s.module) {
                submodule.moduleSubroutines.add(s);
            }
            return s.module;
        });
    }

    private void correlateBlockData(FortranBlockData blockData) {
        SymbolTables tables = new SymbolTables();
        for (FortranType type : blockData.types) {
            tables.types.put(type.lowerName(), type);
        }
        for (FortranVariable variable : blockData.variables) {
            tables.vars.put(variable.lowerName(), variable);
        }
        blockData.symbols = tables;
        importUsedModules(blockData);
        correlateTypes(blockData);
        for (FortranType type : blockData.types) {
            type.visible = true;
        }
        for (FortranVariable variable : new ArrayList<>(blockData.variables)) {
            correlate(variable);
        }
        for (FortranCommon common : blockData.common) {
            correlate(common);
        }
        EntitySorter.sortComponents(blockData, config.getSort());
    }

    private void correlateType(FortranType type) {
        if (type.correlated) {
            return;
        }
        type.correlated = true;
        type.symbols = hostSymbols(type).copy();
        type.numLinesAll = type.numLines;

        for (FortranVariable parameter : type.parameters) {
            correlate(parameter);
        }
        for (FortranVariable variable : type.variables) {
            correlate(variable);
        }

        if (type.extendsRef != null && !type.extendsRef.isResolved()) {
            warn(type, type.lineNumber, "Could not find base type ('" + type.extendsRef.name
                    + "') of derived type '" + type.name + "'");
        }
        FortranType base = type.getExtendedType();
        type.inheritedVariables.clear();
        type.inheritedBoundProcs.clear();
        if (base != null) {
            correlateType(base);
            for (FortranVariable variable : base.allVariables()) {
                if ("public".equals(variable.permission)) {
                    type.inheritedVariables.add(variable);
                }
            }
        }

        for (FortranBoundProcedure boundProc : type.boundProcs) {
            if (!boundProc.generic) {
                correlateBoundProcedure(boundProc, type);
            }
        }

        List<FortranBoundProcedure> inheritedGenerics = new ArrayList<>();
        List<FortranBoundProcedure> overriddenGenerics = new ArrayList<>();
        if (base != null) {
            for (FortranBoundProcedure inherited : base.allBoundProcs()) {
                if ("private".equals(inherited.permission)) {
                    continue;
                }
                boolean overridden = type.boundProcs.stream().anyMatch(b -> b.name.equalsIgnoreCase(inherited.name));
                if (!overridden) {
                    if (inherited.generic) {
                        inheritedGenerics.add(inherited.copyFor(type));
                    } else {
                        type.inheritedBoundProcs.add(inherited);
                    }
                } else if (inherited.generic) {
                    overriddenGenerics.add(inherited.copyFor(type));
                }
            }
        }
        type.boundProcs.addAll(0, inheritedGenerics);

        for (FortranBoundProcedure boundProc : type.boundProcs) {
            for (FortranBoundProcedure inherited : overriddenGenerics) {
                if (inherited.name.equalsIgnoreCase(boundProc.name)) {
                    List<EntityRef<FortranEntity>> merged = new ArrayList<>(inherited.bindings);
                    merged.addAll(boundProc.bindings);
                    boundProc.bindings = merged;
                    break;
                }
            }
            if (boundProc.generic) {
                correlateBoundProcedure(boundProc, type);
            }
        }

        for (FortranFinalProc finalProc : type.finalProcs) {
            correlateFinalProc(finalProc);
        }

        FortranEntity constructor = type.symbols.procs.get(type.lowerName());
        if (constructor != null) {
            type.constructor = new EntityRef<>(constructor);
            constructor.permission = type.permission;
            type.numLines += constructor instanceof FortranInterface
                    ? ((FortranInterface) constructor).numLinesAll
                    : constructor.numLines;
        }

        EntitySorter.sortComponents(type, config.getSort());

        for (FortranFinalProc finalProc : type.finalProcs) {
            if (finalProc.procedure.isResolved()) {
                type.numLinesAll += finalProc.procedure.target.numLines;
            }
        }
        for (FortranBoundProcedure boundProc : type.boundProcs) {
            type.numLinesAll += boundProc.bindingLines();
        }
    }

    private void correlateBoundProcedure(FortranBoundProcedure boundProc, FortranType type) {
        SymbolTables tables = type.symbols;
        if (boundProc.protoName != null) {
            String proto = boundProc.protoName.toLowerCase();
            FortranEntity target = tables.procs.get(proto);
            boundProc.protoTarget = target != null ? target : tables.absInterfaces.get(proto);
        }

        if (boundProc.generic) {
            Map<String, FortranBoundProcedure> byName = new HashMap<>();
            for (FortranBoundProcedure candidate : type.allBoundProcs()) {
                byName.put(candidate.lowerName(), candidate);
            }
            for (EntityRef<FortranEntity> binding : boundProc.bindings) {
                FortranBoundProcedure specific = byName.get(binding.name.toLowerCase());
                if (specific != null && specific != boundProc) {
                    binding.resolve(specific);
                }
            }
        } else if (!boundProc.deferred) {
            for (EntityRef<FortranEntity> binding : boundProc.bindings) {
                FortranEntity target = tables.procs.get(binding.name.toLowerCase());
                if (target != null) {
                    binding.resolve(target);
                    if (target instanceof FortranProcedure) {
                        ((FortranProcedure) target).binding = boundProc;
                    }
                }
            }
        }
    }

    private void correlateFinalProc(FortranFinalProc finalProc) {
        FortranEntity procedure = hostSymbols(finalProc).procs.get(finalProc.lowerName());
        if (procedure != null) {
            finalProc.procedure.resolve(procedure);
        }
    }

    private void correlateInterface(FortranInterface intf) {
        intf.symbols = hostSymbols(intf).copy();
        intf.numLinesAll = intf.numLines;
        if (intf.generic) {
            Iterator<FortranModuleProcedureReference> it = intf.modProcs.iterator();
            while (it.hasNext()) {
                FortranModuleProcedureReference reference = it.next();
                FortranEntity procedure = intf.symbols.procs.get(reference.lowerName());
                if (procedure == null) {
                    warn(intf, reference.lineNumber, "Could not find interface procedure '" + reference.name
                            + "' in '" + (intf.parent == null ? null : intf.parent.name) + "'");
                    continue;
                }
                // procedure pointers and dummy procedures named in the interface
                if (procedure instanceof FortranVariable) {
                    intf.variables.add((FortranVariable) procedure);
                    it.remove();
                    continue;
                }
                reference.procedure.resolve(procedure);
                intf.numLinesAll += procedure.numLines;
            }
            for (FortranProcedure routine : intf.getRoutines()) {
                correlate(routine);
            }
        } else if (intf.procedure != null) {
            correlate(intf.procedure);
        }
        EntitySorter.sortComponents(intf, config.getSort());
    }

    private void correlateVariable(FortranVariable variable) {
        if (variable.proto == null || variable.proto.name == null) {
            return;
        }
        String proto = variable.proto.name.toLowerCase();
        if (proto.equals("*")) {
            return;
        }
        SymbolTables tables = hostSymbols(variable);
        if (variable.vartype.equals("type") || variable.vartype.equals("class")) {
            FortranType type = tables.types.get(proto);
            if (type != null) {
                variable.proto.target = type;
            }
        } else if (variable.vartype.equals("procedure")) {
            FortranEntity target = tables.procs.get(proto);
            if (target == null) {
                target = tables.absInterfaces.get(proto);
            }
            if (target != null) {
                variable.proto.target = target;
            }
        }
    }

    private void correlateCommon(FortranCommon common) {
        FortranContainer owner = (FortranContainer) common.parent;
        SymbolTables tables = owner.symbols;
        common.variables.clear();
        for (String member : common.memberNames) {
            String key = baseName(member).toLowerCase();
            FortranEntity declared = tables.vars.get(key);
            if (declared instanceof FortranVariable) {
                FortranVariable variable = (FortranVariable) declared;
                if (owner.variables.remove(variable)) {
                    variable.scope = owner;
                    variable.parent = common;
                }
                common.variables.add(variable);
            } else {
                common.variables.add(FortranVariable.implicit(member, common));
            }
        }
        List<FortranCommon> shared = project.common.computeIfAbsent(common.name.toLowerCase(), k -> new ArrayList<>());
        if (!shared.contains(common)) {
            shared.add(common);
        }
        common.otherUses = shared;
        EntitySorter.sortComponents(common, config.getSort());
    }

    private static String baseName(String member) {
        int open = member.indexOf('(');
        return (open >= 0 ? member.substring(0, open) : member).strip();
    }

    private void correlateNamelist(FortranNamelist namelist) {
        SymbolTables tables = hostSymbols(namelist);
        namelist.variables.clear();
        for (String member : namelist.memberNames) {
            EntityRef<FortranEntity> ref = new EntityRef<>(member);
            FortranEntity variable = tables.vars.get(member);
            if (variable != null) {
                ref.resolve(variable);
            }
            namelist.variables.add(ref);
        }
    }

    // ---- Helpers ----

    /** Symbol tables of the nearest enclosing container, as seen from {@code entity}. */
    static SymbolTables hostSymbols(FortranEntity entity) {
        FortranEntity current = entity.lookupScope();
        while (current != null && !(current instanceof FortranContainer)) {
            current = current.lookupScope();
        }
        return current == null ? new SymbolTables() : ((FortranContainer) current).symbols;
    }

    private void warn(FortranEntity entity, Integer line, String message) {
        warnings.warn(WarningKind.RESOLUTION, entity.getFilename(), line, entity.name, message);
    }

    private static String names(List<? extends FortranEntity> entities) {
        List<String> names = new ArrayList<>();
        for (FortranEntity entity : entities) {
            names.add("'" + entity.name + "'");
        }
        return String.join(", ", names);
    }
}
