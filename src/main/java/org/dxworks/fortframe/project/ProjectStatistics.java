package org.dxworks.fortframe.project;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import org.dxworks.fortframe.model.FortranEntity;
import org.dxworks.fortframe.model.FortranType;

import java.util.List;

@JsonPropertyOrder({"files", "modules", "submodules", "procedures", "types", "absInterfaces", "programs",
        "blockData", "fileLines", "moduleLines", "procedureLines", "typeLines", "typeLinesAll",
        "absInterfaceLines", "programLines", "blockDataLines"})
public class ProjectStatistics {
    public int files;
    public int modules;
    public int submodules;
    public int procedures;
    public int types;
    public int absInterfaces;
    public int programs;
    public int blockData;

    public int fileLines;
    /** Modules and submodules together. */
    public int moduleLines;
    public int procedureLines;
    public int typeLines;
    /** Type definitions plus the procedures bound to them. */
    public int typeLinesAll;
    public int absInterfaceLines;
    public int programLines;
    public int blockDataLines;

    static ProjectStatistics of(FortranProject project) {
        ProjectStatistics stats = new ProjectStatistics();
        stats.files = project.files.size();
        stats.modules = project.modules.size();
        stats.submodules = project.submodules.size();
        stats.procedures = project.procedures.size();
        stats.types = project.types.size();
        stats.absInterfaces = project.absInterfaces.size();
        stats.programs = project.programs.size();
        stats.blockData = project.blockData.size();

        stats.fileLines = sumLines(project.files);
        stats.moduleLines = sumLines(project.modules) + sumLines(project.submodules);
        stats.procedureLines = sumLines(project.procedures);
        stats.typeLines = sumLines(project.types);
        for (FortranType type : project.types) {
            stats.typeLinesAll += type.numLinesAll;
        }
        stats.absInterfaceLines = sumLines(project.absInterfaces);
        stats.programLines = sumLines(project.programs);
        stats.blockDataLines = sumLines(project.blockData);
        return stats;
    }

    private static int sumLines(List<? extends FortranEntity> entities) {
        int total = 0;
        for (FortranEntity entity : entities) {
            total += entity.numLines;
        }
        return total;
    }
}
