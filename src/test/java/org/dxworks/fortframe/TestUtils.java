package org.dxworks.fortframe;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.dxworks.fortframe.diagnostics.WarningLog;
import org.dxworks.fortframe.model.FortranSourceFile;
import org.dxworks.fortframe.parser.FortranParser;
import org.dxworks.fortframe.project.FortranProject;

import java.io.IOException;
import java.nio.file.Path;
import java.nio.file.Paths;

public class TestUtils {
    public static final ObjectMapper APPROVAL_MAPPER = new ObjectMapper()
            .enable(SerializationFeature.INDENT_OUTPUT)
            .enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS)
            .setSerializationInclusion(JsonInclude.Include.NON_NULL);

    public static final Path SAMPLES = Paths.get("src/test/resources/samples/fortran");

    public static String lines(String... lines) {
        return String.join("\n", lines) + "\n";
    }

    public static FortranSourceFile parseFree(String text) {
        return parseFree(text, FortframeConfig.defaults(), WarningLog.quiet());
    }

    public static FortranSourceFile parseFree(String text, FortframeConfig config, WarningLog warnings) {
        return new FortranParser(config, warnings).parse("test.f90", "test.f90", text, SourceForm.FREE);
    }

    /** Parses and correlates the given samples as one project. */
    public static FortranProject project(FortframeConfig config, WarningLog warnings, String... samples)
            throws IOException {
        FortranProject project = new FortranProject(config, warnings);
        for (String sample : samples) {
            project.addFile(SAMPLES.resolve(sample));
        }
        project.correlate();
        return project;
    }
}
