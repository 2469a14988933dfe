package org.dxworks.fortframe.project;

import org.dxworks.fortframe.FortframeConfig;
import org.dxworks.fortframe.model.FortranBlockData;
import org.dxworks.fortframe.model.FortranCodeUnit;
import org.dxworks.fortframe.model.FortranContainer;
import org.dxworks.fortframe.model.FortranEntity;
import org.dxworks.fortframe.model.FortranInterface;
import org.dxworks.fortframe.model.FortranSubmodule;
import org.dxworks.fortframe.model.FortranType;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;

/**
 * Moves children that should not be displayed into their owner's
 * {@link FortranContainer#hidden} list. Nothing is dropped: every child stays
 * in exactly one collection of its owner.
 */
public class EntityPruner {

    private final FortframeConfig config;

    public EntityPruner(FortframeConfig config) {
        this.config = config;
    }

    public void prune(FortranEntity entity) {
        switch (entity.kind()) {
            case SUBROUTINE:
            case FUNCTION:
            case MODULE_PROCEDURE:
                if (!config.isProcInternals()) {
                    hideInternals((FortranContainer) entity);
                    return;
                }
                pruneCodeUnit((FortranCodeUnit) entity);
                break;
            case MODULE:
            case SUBMODULE:
            case PROGRAM:
                pruneCodeUnit((FortranCodeUnit) entity);
                break;
            case BLOCK_DATA:
                pruneBlockData((FortranBlockData) entity);
                break;
            case TYPE:
                pruneType((FortranType) entity);
                break;
            case SOURCE_FILE:
            case INTERFACE:
            case MODULE_PROCEDURE_REFERENCE:
            case VARIABLE:
            case BOUND_PROCEDURE:
            case FINAL_PROCEDURE:
            case COMMON:
            case NAMELIST:
            case ENUM:
                break;
        }
    }

    private void hideInternals(FortranContainer procedure) {
        moveAll(procedure, procedure.functions);
        moveAll(procedure, procedure.subroutines);
        moveAll(procedure, procedure.types);
        moveAll(procedure, procedure.interfaces);
        moveAll(procedure, procedure.absInterfaces);
        moveAll(procedure, procedure.variables);
    }

    private void pruneCodeUnit(FortranCodeUnit unit) {
        filter(unit, unit.functions);
        filter(unit, unit.subroutines);
        filter(unit, unit.types);
        filter(unit, unit.interfaces);
        filter(unit, unit.absInterfaces);
        filter(unit, unit.variables);
        if (unit instanceof FortranSubmodule) {
            FortranSubmodule submodule = (FortranSubmodule) unit;
            filter(submodule, submodule.moduleProcedures);
            filter(submodule, submodule.moduleSubroutines);
            filter(submodule, submodule.moduleFunctions);
        }

        for (FortranInterface intf : unit.absInterfaces) {
            intf.visible = true;
        }
        for (FortranInterface intf : unit.interfaces) {
            intf.visible = true;
        }

        List<FortranEntity> children = new ArrayList<>();
        children.addAll(unit.functions);
        children.addAll(unit.subroutines);
        children.addAll(unit.types);
        if (unit instanceof FortranSubmodule) {
            FortranSubmodule submodule = (FortranSubmodule) unit;
            children.addAll(submodule.moduleProcedures);
            children.addAll(submodule.moduleFunctions);
            children.addAll(submodule.moduleSubroutines);
        }
        for (FortranEntity child : children) {
            child.visible = true;
            prune(child);
        }
    }

    private void pruneType(FortranType type) {
        filter(type, type.boundProcs);
        filter(type, type.variables);
        type.boundProcs.forEach(b -> b.visible = true);
        type.variables.forEach(v -> v.visible = true);
    }

    private void pruneBlockData(FortranBlockData blockData) {
        filter(blockData, blockData.types);
        filter(blockData, blockData.variables);
        for (FortranType type : blockData.types) {
            type.visible = true;
            prune(type);
        }
    }

    boolean shouldDisplay(FortranEntity owner, FortranEntity item) {
        if (config.isHideUndocumented() && item.docList.isEmpty()) {
            return false;
        }
        return owner.display.contains(item.permission);
    }

    private <T extends FortranEntity> void filter(FortranContainer owner, List<T> collection) {
        Iterator<T> it = collection.iterator();
        while (it.hasNext()) {
            T item = it.next();
            if (!shouldDisplay(owner, item)) {
                it.remove();
                owner.hidden.add(item);
            }
        }
    }

    private static <T extends FortranEntity> void moveAll(FortranContainer owner, List<T> collection) {
        owner.hidden.addAll(collection);
        collection.clear();
    }
}
