package org.dxworks.fortframe.parser;

import org.dxworks.fortframe.diagnostics.FortranLiteralException;
import org.dxworks.fortframe.diagnostics.WarningKind;
import org.dxworks.fortframe.model.FortranBlockData;
import org.dxworks.fortframe.model.FortranCodeUnit;
import org.dxworks.fortframe.model.FortranContainer;
import org.dxworks.fortframe.model.FortranEntity;
import org.dxworks.fortframe.model.FortranEnum;
import org.dxworks.fortframe.model.FortranFunction;
import org.dxworks.fortframe.model.FortranInterface;
import org.dxworks.fortframe.model.FortranModule;
import org.dxworks.fortframe.model.FortranProcedure;
import org.dxworks.fortframe.model.FortranSubmodule;
import org.dxworks.fortframe.model.FortranType;
import org.dxworks.fortframe.model.FortranVariable;
import org.dxworks.fortframe.model.SymbolTables;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

/**
 * Finishes an entity once its END statement has been read: buffered attribute
 * statements are applied, arguments and results are matched to declarations and
 * the local procedure table is built.
 */
public final class EntityCleanup {

    private EntityCleanup() {
        // utility class
    }

    private static final List<String> PERMISSIONS = List.of("public", "private", "protected");

    public static void cleanup(FortranContainer entity, ParseContext ctx) {
        switch (entity.kind()) {
            case MODULE:
            case SUBMODULE:
                cleanupModule((FortranModule) entity, ctx);
                break;
            case SUBROUTINE:
            case FUNCTION:
                cleanupProcedure((FortranProcedure) entity, ctx);
                break;
            case PROGRAM:
            case MODULE_PROCEDURE:
                cleanupCodeUnit((FortranCodeUnit) entity, ctx);
                break;
            case BLOCK_DATA:
                FortranBlockData blockData = (FortranBlockData) entity;
                blockData.ioTracker.finish(ctx.warnings, ctx.filename, blockData.lineNumber, blockData.name);
                processBlockDataAttribs(blockData);
                break;
            case TYPE:
                cleanupType((FortranType) entity);
                break;
            case ENUM:
                cleanupEnum((FortranEnum) entity, ctx);
                break;
            case INTERFACE:
                cleanupInterface((FortranInterface) entity);
                break;
            case SOURCE_FILE:
                break;
            default:
                throw new IllegalStateException("No cleanup for " + entity.kind());
        }
    }

    static void cleanupCodeUnit(FortranCodeUnit unit, ParseContext ctx) {
        unit.ioTracker.finish(ctx.warnings, ctx.filename, unit.lineNumber, unit.name);
        processAttribs(unit, ctx);

        Map<String, FortranEntity> procs = unit.symbols.procs;
        for (FortranProcedure routine : unit.getRoutines()) {
            procs.put(routine.lowerName(), routine);
        }
        for (FortranInterface intf : unit.interfaces) {
            if (!intf.abstractInterface) {
                procs.put(intf.lowerName(), intf);
            }
            if (intf.generic) {
                for (FortranProcedure routine : intf.getRoutines()) {
                    procs.put(routine.lowerName(), routine);
                }
            }
        }
        unit.variables.removeIf(v -> v.attribs.contains("external"));
    }

    static void cleanupModule(FortranModule module, ParseContext ctx) {
        cleanupCodeUnit(module, ctx);
        for (FortranVariable variable : module.variables) {
            if (variable.isProcedurePointer()) {
                module.symbols.procs.put(variable.lowerName(), variable);
            }
        }
        SymbolTables pub = module.publicSymbols;
        module.symbols.procs.forEach((name, proc) -> {
            if (isExported(proc)) {
                pub.procs.put(proc.lowerName(), proc);
            }
        });
        for (FortranVariable variable : module.variables) {
            if (isExported(variable)) {
                pub.vars.put(variable.lowerName(), variable);
            }
        }
        for (FortranType type : module.types) {
            if (isExported(type)) {
                pub.types.put(type.lowerName(), type);
            }
        }
        for (FortranInterface absInterface : module.absInterfaces) {
            if (isExported(absInterface)) {
                pub.absInterfaces.put(absInterface.lowerName(), absInterface);
            }
        }
    }

    private static boolean isExported(FortranEntity entity) {
        return "public".equals(entity.permission) || "protected".equals(entity.permission);
    }

    static void cleanupProcedure(FortranProcedure procedure, ParseContext ctx) {
        if (procedure instanceof FortranFunction) {
            FortranFunction function = (FortranFunction) procedure;
            if (function.retvar == null) {
                function.retvar = takeVariable(function, function.resultName);
                if (function.retvar == null) {
                    function.retvar = FortranVariable.implicit(function.resultName, function);
                }
            }
        }

        cleanupCodeUnit(procedure, ctx);

        for (String argName : procedure.argNames) {
            FortranEntity arg = takeVariable(procedure, argName);
            if (arg == null) {
                arg = takeInterfaceProcedure(procedure, argName);
            }
            if (arg == null) {
                arg = FortranVariable.implicit(argName, procedure);
            }
            procedure.args.add(arg);
        }
    }

    private static FortranVariable takeVariable(FortranContainer container, String name) {
        Iterator<FortranVariable> it = container.variables.iterator();
        while (it.hasNext()) {
            FortranVariable variable = it.next();
            if (variable.name.equalsIgnoreCase(name)) {
                it.remove();
                return variable;
            }
        }
        return null;
    }

    // A dummy procedure declared through an interface block.
    private static FortranProcedure takeInterfaceProcedure(FortranProcedure owner, String name) {
        Iterator<FortranInterface> it = owner.interfaces.iterator();
        while (it.hasNext()) {
            FortranInterface intf = it.next();
            if (intf.abstractInterface || intf.generic || intf.procedure == null) {
                continue;
            }
            if (intf.procedure.name.equalsIgnoreCase(name)) {
                it.remove();
                owner.symbols.procs.remove(intf.lowerName());
                FortranProcedure proc = intf.procedure;
                proc.parent = owner;
                return proc;
            }
        }
        return null;
    }

    static void cleanupType(FortranType type) {
        for (String parameterName : type.parameterNames) {
            FortranVariable parameter = takeVariable(type, parameterName);
            if (parameter == null) {
                parameter = new FortranVariable(parameterName, "integer", type, "public");
            }
            type.parameters.add(parameter);
        }
    }

    static void cleanupEnum(FortranEnum enumeration, ParseContext ctx) {
        int previous = -1;
        for (FortranVariable enumerator : enumeration.variables) {
            if (enumerator.initial == null || enumerator.initial.isEmpty()) {
                enumerator.initial = String.valueOf(previous + 1);
            }
            String value = DeclarationParser.removeKindSuffix(enumerator.initial).strip();
            try {
                previous = Integer.parseInt(value);
            } catch (NumberFormatException e) {
                throw new FortranLiteralException(ctx.filename, enumerator.lineNumber,
                        "Non-integer ('" + enumerator.initial + "') assigned to enumerator '" + enumerator.name + "'.");
            }
        }
    }

    static void cleanupInterface(FortranInterface intf) {
        if (intf.generic && !intf.abstractInterface) {
            return;
        }
        for (FortranProcedure routine : intf.getRoutines()) {
            intf.contents.add(FortranInterface.wrap(routine, intf));
        }
    }

    /** Applies buffered attribute statements and computes the public list. */
    static void processAttribs(FortranCodeUnit unit, ParseContext ctx) {
        List<FortranEntity> items = new ArrayList<>();
        // types before interfaces
        items.addAll(unit.functions);
        items.addAll(unit.subroutines);
        items.addAll(unit.types);
        items.addAll(unit.interfaces);
        items.addAll(unit.absInterfaces);
        for (FortranEntity item : items) {
            List<String> attrs = unit.attrDict.remove(item.lowerName());
            if (attrs == null) {
                continue;
            }
            for (String attr : attrs) {
                applyItemAttribute(item, attr);
            }
        }

        for (FortranVariable variable : unit.variables) {
            List<String> attrs = unit.attrDict.remove(variable.lowerName());
            if (attrs == null) {
                continue;
            }
            for (String attr : attrs) {
                applyVariableAttribute(variable, attr, unit.paramDict);
            }
        }

        List<FortranEntity> declared = new ArrayList<>(items);
        declared.addAll(unit.variables);
        List<String> publicList = new ArrayList<>();
        for (FortranEntity item : declared) {
            if ("public".equals(item.permission)) {
                publicList.add(item.lowerName());
            }
        }
        unit.attrDict.forEach((name, attrs) -> {
            if (attrs.contains("public")) {
                publicList.add(name);
            }
        });
        if (!(unit instanceof FortranSubmodule)) {
            unit.publicList = publicList;
        }

        if (ctx.config.isWarnUndocumented()) {
            unit.attrDict.forEach((name, attrs) -> {
                for (String attr : attrs) {
                    ctx.warnings.warn(WarningKind.ATTRIBUTE, ctx.filename, unit.lineNumber, unit.name,
                            "Unknown entity '" + name + "' with attribute '" + attr + "' in "
                                    + unit.kind().getName() + " '" + unit.name + "'");
                }
            });
        }
        unit.attrDict.clear();
    }

    static void processBlockDataAttribs(FortranBlockData blockData) {
        for (FortranType type : blockData.types) {
            List<String> attrs = blockData.attrDict.remove(type.lowerName());
            if (attrs != null) {
                attrs.forEach(attr -> applyItemAttribute(type, attr));
            }
        }
        for (FortranVariable variable : blockData.variables) {
            List<String> attrs = blockData.attrDict.remove(variable.lowerName());
            if (attrs != null) {
                attrs.forEach(attr -> applyVariableAttribute(variable, attr, blockData.paramDict));
            }
        }
        blockData.attrDict.clear();
    }

    private static void applyItemAttribute(FortranEntity item, String attr) {
        if (PERMISSIONS.contains(attr)) {
            item.permission = attr;
            return;
        }
        if (attr.startsWith("bind")) {
            String name = attr.substring(5, attr.length() - 1);
            if (item instanceof FortranProcedure) {
                ((FortranProcedure) item).bindC = name;
                return;
            }
            if (item instanceof FortranInterface && ((FortranInterface) item).procedure != null) {
                ((FortranInterface) item).procedure.bindC = name;
                return;
            }
        }
        if (item instanceof FortranProcedure) {
            ((FortranProcedure) item).attribs.add(attr);
        } else if (item instanceof FortranType) {
            ((FortranType) item).attribs.add(attr);
        } else if (item instanceof FortranInterface && ((FortranInterface) item).procedure != null) {
            ((FortranInterface) item).procedure.attribs.add(attr);
        }
    }

    private static void applyVariableAttribute(FortranVariable variable, String attr, Map<String, String> paramDict) {
        if (PERMISSIONS.contains(attr)) {
            variable.permission = attr;
        } else if (attr.startsWith("intent")) {
            variable.intent = attr.substring(7, attr.length() - 1);
        } else if (FortranPatterns.DIM.matcher(attr).matches()
                && (attr.contains("pointer") || attr.contains("allocatable"))) {
            int open = attr.indexOf('(');
            variable.attribs.add(attr.substring(0, open));
            variable.dimension = attr.substring(open);
        } else if (attr.equals("parameter")) {
            variable.attribs.add(attr);
            variable.initial = paramDict.get(variable.lowerName());
        } else {
            variable.attribs.add(attr);
        }
    }
}
