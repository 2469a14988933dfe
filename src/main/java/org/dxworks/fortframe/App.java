package org.dxworks.fortframe;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.dxworks.fortframe.crosswalk.CrossWalkResult;
import org.dxworks.fortframe.diagnostics.FortranLiteralException;
import org.dxworks.fortframe.diagnostics.FortranStructureException;
import org.dxworks.fortframe.diagnostics.FortranWarning;
import org.dxworks.fortframe.diagnostics.WarningLog;
import org.dxworks.fortframe.io.FileIoReport;
import org.dxworks.fortframe.model.ChildSlot;
import org.dxworks.fortframe.model.FortranCodeUnit;
import org.dxworks.fortframe.model.FortranContainer;
import org.dxworks.fortframe.model.FortranEntity;
import org.dxworks.fortframe.model.FortranProcedure;
import org.dxworks.fortframe.model.FortranSourceFile;
import org.dxworks.fortframe.project.FortranProject;

import java.io.BufferedWriter;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;

public class App {
    private static final ObjectMapper MAPPER = new ObjectMapper();

    public static void main(String[] args) throws Exception {
        if (args.length < 2) {
            System.err.println("Usage: java -jar fortframe.jar <input-folder> <output-file>");
            System.err.println("  <input-folder>: Path to a Fortran source directory or file");
            System.err.println("  <output-file>:  Path to output JSONL file");
            System.exit(2);
        }
        System.exit(run(Paths.get(args[0]), Paths.get(args[1]), FortframeConfig.load()));
    }

    /** Analyses {@code input} into {@code jsonlOutput}; returns the process exit code. */
    public static int run(Path input, Path jsonlOutput, FortframeConfig config) throws IOException {
        if (!Files.exists(input)) {
            System.err.println("Error: Input path does not exist: " + input);
            return 1;
        }
        if (jsonlOutput.getParent() != null) {
            Files.createDirectories(jsonlOutput.getParent());
        }

        System.out.println("Starting Fortran analysis...");
        System.out.println("Input: " + input.toAbsolutePath());

        List<Path> files = collectSourceFiles(input, config);
        System.out.println("Found " + files.size() + " source files");

        Instant startTime = Instant.now();
        WarningLog warnings = new WarningLog();
        FortranProject project = new FortranProject(config, warnings);
        try {
            int current = 0;
            for (Path file : files) {
                current++;
                System.out.println("[" + current + "/" + files.size() + "] Parsing " + file.getFileName());
                project.addFile(file);
            }
            System.out.println("Correlating " + project.files.size() + " files...");
            project.correlate();
        } catch (FortranStructureException | FortranLiteralException e) {
            System.err.println(e.getMessage());
            return 1;
        }

        int ioRecords = 0;
        try (BufferedWriter writer = Files.newBufferedWriter(jsonlOutput, StandardCharsets.UTF_8)) {
            Map<String, Object> runInfo = new LinkedHashMap<>();
            runInfo.put("kind", "run");
            runInfo.put("started_at", startTime.toString());
            runInfo.put("input_path", input.toString());
            runInfo.put("total_files", files.size());
            writeRecord(writer, runInfo);

            for (FortranSourceFile file : project.files) {
                Map<String, Object> fileRecord = new LinkedHashMap<>();
                fileRecord.put("kind", "file");
                fileRecord.put("path", file.path);
                fileRecord.put("entity", file);
                writeRecord(writer, fileRecord);
            }

            for (FortranCodeUnit unit : unitsWithCalls(project)) {
                Map<String, FileIoReport> summary = unit.ioSummary();
                if (summary.isEmpty()) {
                    continue;
                }
                Map<String, Object> ioRecord = new LinkedHashMap<>();
                ioRecord.put("kind", "io");
                ioRecord.put("procedure", unit.name);
                ioRecord.put("file", unit.getFilename());
                ioRecord.put("summary", summary);
                writeRecord(writer, ioRecord);
                ioRecords++;
            }

            for (CrossWalkResult crossWalk : project.crossWalks) {
                writeRecord(writer, crossWalk);
            }
            for (FortranWarning warning : warnings.all()) {
                writeRecord(writer, warning);
            }

            Instant endTime = Instant.now();
            Map<String, Object> doneInfo = new LinkedHashMap<>();
            doneInfo.put("kind", "done");
            doneInfo.put("ended_at", endTime.toString());
            doneInfo.put("files_analyzed", project.files.size());
            doneInfo.put("warnings", warnings.all().size());
            doneInfo.put("statistics", project.getStatistics());
            doneInfo.put("duration_seconds", Duration.between(startTime, endTime).getSeconds());
            writeRecord(writer, doneInfo);
        }

        System.out.println("\n" + "=".repeat(60));
        System.out.println("Analysis complete!");
        System.out.println("Files analyzed: " + project.files.size());
        System.out.println("Procedures with file I/O: " + ioRecords);
        if (!warnings.isEmpty()) {
            System.out.println("Warnings: " + warnings.all().size());
        }
        System.out.println("Output written to: " + jsonlOutput.toAbsolutePath());
        System.out.println("=".repeat(60));
        return 0;
    }

    private static void writeRecord(BufferedWriter writer, Object record) throws IOException {
        writer.write(MAPPER.writeValueAsString(record));
        writer.newLine();
    }

    private static List<Path> collectSourceFiles(Path input, FortframeConfig config) throws IOException {
        List<Path> files = new ArrayList<>();
        if (Files.isDirectory(input)) {
            try (Stream<Path> stream = Files.walk(input)) {
                stream.filter(Files::isRegularFile)
                      .filter(p -> SourceFormDetector.detectSourceForm(p, config).isPresent())
                      .filter(p -> withinMaxLines(p, config.getMaxFileLines()))
                      .sorted()
                      .forEach(files::add);
            }
        } else if (Files.isRegularFile(input)) {
            if (SourceFormDetector.detectSourceForm(input, config).isPresent()
                    && withinMaxLines(input, config.getMaxFileLines())) {
                files.add(input);
            }
        }
        return files;
    }

    private static boolean withinMaxLines(Path path, int maxFileLines) {
        try (Stream<String> lines = Files.lines(path, StandardCharsets.UTF_8)) {
            long count = lines.limit((long) maxFileLines + 1L).count();
            return count <= maxFileLines;
        } catch (IOException | UncheckedIOException e) {
            System.err.println("Warning: could not count lines of " + path + ": " + e.getMessage());
            return true;
        }
    }

    /** Every unit with executable statements, nested and hidden ones included. */
    static List<FortranCodeUnit> unitsWithCalls(FortranProject project) {
        List<FortranCodeUnit> units = new ArrayList<>();
        for (FortranSourceFile file : project.files) {
            collectUnits(file, units);
        }
        return units;
    }

    private static void collectUnits(FortranContainer container, List<FortranCodeUnit> units) {
        List<FortranContainer> children = new ArrayList<>();
        if (container instanceof FortranSourceFile) {
            FortranSourceFile file = (FortranSourceFile) container;
            children.addAll(file.modules);
            children.addAll(file.submodules);
            children.addAll(file.programs);
        }
        children.addAll(container.getRoutines());
        for (FortranEntity hidden : container.hidden) {
            if (hidden instanceof FortranProcedure) {
                children.add((FortranProcedure) hidden);
            }
        }
        for (FortranContainer child : children) {
            if (child instanceof FortranCodeUnit && child.accepts(ChildSlot.CALLS)) {
                units.add((FortranCodeUnit) child);
            }
            collectUnits(child, units);
        }
    }
}
