package org.dxworks.fortframe.project;

import org.dxworks.fortframe.model.FortranCommon;
import org.dxworks.fortframe.model.FortranContainer;
import org.dxworks.fortframe.model.FortranEntity;
import org.dxworks.fortframe.model.FortranFunction;
import org.dxworks.fortframe.model.FortranModule;
import org.dxworks.fortframe.model.FortranProcedure;
import org.dxworks.fortframe.model.FortranSourceFile;
import org.dxworks.fortframe.model.FortranSubmodule;
import org.dxworks.fortframe.model.FortranType;
import org.dxworks.fortframe.model.FortranVariable;

import java.util.Comparator;
import java.util.List;
import java.util.Map;

/**
 * Applies the display order named by the {@code sort} setting (or an entity's
 * {@code sort} metadata) to the child collections of an entity.
 */
public final class EntitySorter {

    private EntitySorter() {
        // utility class
    }

    private static final Map<String, Integer> PERMISSION_RANK =
            Map.of("public", 1, "protected", 2, "private", 3);

    public static void sortComponents(FortranEntity entity, String defaultOrder) {
        String order = entity.meta.getOrDefault("sort", defaultOrder).toLowerCase();
        Comparator<FortranEntity> comparator = comparatorFor(order);
        if (comparator == null) {
            return;
        }

        switch (entity.kind()) {
            case SOURCE_FILE:
                FortranSourceFile file = (FortranSourceFile) entity;
                sortContainer(file, comparator);
                file.modules.sort(comparator);
                file.submodules.sort(comparator);
                file.programs.sort(comparator);
                file.blockData.sort(comparator);
                break;
            case SUBMODULE:
                FortranSubmodule submodule = (FortranSubmodule) entity;
                submodule.moduleFunctions.sort(comparator);
                submodule.moduleSubroutines.sort(comparator);
                sortContainer(submodule, comparator);
                submodule.moduleProcedures.sort(comparator);
                break;
            case MODULE:
                sortContainer((FortranContainer) entity, comparator);
                ((FortranModule) entity).moduleProcedures.sort(comparator);
                break;
            case TYPE:
                FortranType type = (FortranType) entity;
                sortContainer(type, comparator);
                type.boundProcs.sort(comparator);
                type.finalProcs.sort(comparator);
                break;
            case PROGRAM:
            case BLOCK_DATA:
            case SUBROUTINE:
            case FUNCTION:
            case MODULE_PROCEDURE:
            case INTERFACE:
            case ENUM:
                sortContainer((FortranContainer) entity, comparator);
                break;
            case COMMON:
                ((FortranCommon) entity).variables.sort(comparator);
                break;
            case MODULE_PROCEDURE_REFERENCE:
            case VARIABLE:
            case BOUND_PROCEDURE:
            case FINAL_PROCEDURE:
            case NAMELIST:
                break;
        }
    }

    private static void sortContainer(FortranContainer container, Comparator<FortranEntity> comparator) {
        container.variables.sort(comparator);
        container.common.sort(comparator);
        container.subroutines.sort(comparator);
        container.functions.sort(comparator);
        container.interfaces.sort(comparator);
        container.absInterfaces.sort(comparator);
        container.types.sort(comparator);
    }

    /** @return null for source order */
    static Comparator<FortranEntity> comparatorFor(String order) {
        switch (order) {
            case "alpha":
                return Comparator.comparing(EntitySorter::name);
            case "permission":
                return Comparator.comparing(EntitySorter::permissionRank);
            case "permission-alpha":
                return Comparator.comparing(e -> permissionRank(e) + "-" + name(e));
            case "type":
                return Comparator.comparing(EntitySorter::typeName);
            case "type-alpha":
                return Comparator.comparing(e -> typeName(e) + "-" + name(e));
            case "src":
                return null;
            default:
                throw new IllegalArgumentException("Unknown sort order '" + order + "'");
        }
    }

    private static String name(FortranEntity entity) {
        return entity.name == null ? "" : entity.name;
    }

    private static int permissionRank(FortranEntity entity) {
        return PERMISSION_RANK.getOrDefault(entity.permission, 0);
    }

    static String typeName(FortranEntity entity) {
        if (entity instanceof FortranVariable) {
            FortranVariable variable = (FortranVariable) entity;
            StringBuilder result = new StringBuilder("class".equals(variable.vartype) ? "type" : variable.vartype);
            appendPart(result, variable.typeKind);
            appendPart(result, variable.strlen);
            if (variable.proto != null) {
                appendPart(result, variable.proto.toString());
            }
            return result.toString();
        }
        if (entity instanceof FortranProcedure) {
            FortranProcedure procedure = (FortranProcedure) entity;
            if (procedure instanceof FortranFunction && ((FortranFunction) procedure).retvar != null) {
                return procedure.procType() + "-" + typeName(((FortranFunction) procedure).retvar);
            }
            return procedure.procType();
        }
        return entity.kind().getName();
    }

    private static void appendPart(StringBuilder result, String part) {
        if (part != null && !part.isEmpty()) {
            result.append('-').append(part);
        }
    }
}
