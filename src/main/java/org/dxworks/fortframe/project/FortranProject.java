package org.dxworks.fortframe.project;

import org.dxworks.fortframe.FortframeConfig;
import org.dxworks.fortframe.SourceForm;
import org.dxworks.fortframe.SourceFormDetector;
import org.dxworks.fortframe.crosswalk.CrossWalkResult;
import org.dxworks.fortframe.crosswalk.CrossWalker;
import org.dxworks.fortframe.diagnostics.WarningLog;
import org.dxworks.fortframe.model.FortranBlockData;
import org.dxworks.fortframe.model.FortranCommon;
import org.dxworks.fortframe.model.FortranContainer;
import org.dxworks.fortframe.model.FortranEntity;
import org.dxworks.fortframe.model.FortranInterface;
import org.dxworks.fortframe.model.FortranModule;
import org.dxworks.fortframe.model.FortranProcedure;
import org.dxworks.fortframe.model.FortranProgram;
import org.dxworks.fortframe.model.FortranSourceFile;
import org.dxworks.fortframe.model.FortranSubmodule;
import org.dxworks.fortframe.model.FortranSubroutine;
import org.dxworks.fortframe.model.FortranType;
import org.dxworks.fortframe.parser.FortranParser;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * The files of one documentation run. Files are parsed as they are added;
 * {@link #correlate()} then links them together and builds the project-wide
 * lists.
 */
public class FortranProject {

    public final List<FortranSourceFile> files = new ArrayList<>();
    public final List<FortranModule> modules = new ArrayList<>();
    public final List<FortranSubmodule> submodules = new ArrayList<>();
    public final List<FortranProgram> programs = new ArrayList<>();
    public final List<FortranBlockData> blockData = new ArrayList<>();
    /** Stand-ins for modules documented elsewhere, from the {@code extraModules} setting. */
    public final List<FortranModule> externalModules = new ArrayList<>();
    /** Every declaration of each common block, keyed by lower-cased block name. */
    public final Map<String, List<FortranCommon>> common = new LinkedHashMap<>();

    public final List<FortranEntity> procedures = new ArrayList<>();
    public final List<FortranInterface> absInterfaces = new ArrayList<>();
    public final List<FortranType> types = new ArrayList<>();
    public final List<FortranProcedure> submodProcedures = new ArrayList<>();
    public final List<CrossWalkResult> crossWalks = new ArrayList<>();

    private final FortframeConfig config;
    private final WarningLog warnings;
    private final FortranParser parser;
    private ProjectStatistics statistics;
    private boolean correlated;

    public FortranProject(FortframeConfig config, WarningLog warnings) {
        this.config = config;
        this.warnings = warnings;
        this.parser = new FortranParser(config, warnings);
    }

    public FortranSourceFile addFile(Path path) throws IOException {
        SourceForm form = SourceFormDetector.detectSourceForm(path, config)
                .orElseThrow(() -> new IllegalArgumentException("Not a Fortran source file: " + path));
        String text = Files.readString(path, StandardCharsets.UTF_8);
        if (text.startsWith("\uFEFF")) {
            text = text.substring(1);
        }
        return addSource(path.getFileName().toString(), path.toString(), text, form);
    }

    public FortranSourceFile addSource(String filename, String path, String text, SourceForm form) {
        FortranSourceFile file = parser.parse(filename, path, text, form);
        files.add(file);
        modules.addAll(file.modules);
        submodules.addAll(file.submodules);
        programs.addAll(file.programs);
        blockData.addAll(file.blockData);
        return file;
    }

    /** Functions then subroutines declared outside any module, file by file. */
    public List<FortranProcedure> fileScopeProcedures() {
        List<FortranProcedure> result = new ArrayList<>();
        for (FortranSourceFile file : files) {
            result.addAll(file.functions);
            result.addAll(file.subroutines);
        }
        return result;
    }

    public void correlate() {
        if (correlated) {
            return;
        }
        correlated = true;
        new Correlator(this, config, warnings).correlate();
        flatten();
        statistics = ProjectStatistics.of(this);

        CrossWalker crossWalker = new CrossWalker(warnings);
        for (FortranProcedure procedure : fileScopeProcedures()) {
            if (procedure instanceof FortranSubroutine) {
                crossWalks.add(crossWalker.crossWalk(procedure));
            }
        }
    }

    private void flatten() {
        List<FortranContainer> containers = new ArrayList<>();
        containers.addAll(modules);
        containers.addAll(submodules);
        containers.addAll(programs);
        containers.addAll(fileScopeProcedures());

        procedures.addAll(fileScopeProcedures());
        for (FortranContainer container : containers) {
            if (container instanceof FortranModule || container instanceof FortranProgram) {
                procedures.addAll(container.functions);
                procedures.addAll(container.subroutines);
                procedures.addAll(container.interfaces);
            }
            absInterfaces.addAll(container.absInterfaces);
            types.addAll(container.types);
        }
        for (FortranModule module : modules) {
            submodProcedures.addAll(module.moduleProcedures);
        }
        for (FortranSubmodule submodule : submodules) {
            submodProcedures.addAll(submodule.moduleFunctions);
            submodProcedures.addAll(submodule.moduleSubroutines);
            submodProcedures.addAll(submodule.moduleProcedures);
        }
    }

    /** Line counts and sizes of the correlated project; null before {@link #correlate()}. */
    public ProjectStatistics getStatistics() {
        return statistics;
    }

    public FortframeConfig getConfig() {
        return config;
    }

    public WarningLog getWarnings() {
        return warnings;
    }
}
