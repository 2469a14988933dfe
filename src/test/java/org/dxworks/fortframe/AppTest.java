package org.dxworks.fortframe;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

import static org.dxworks.fortframe.TestUtils.SAMPLES;
import static org.dxworks.fortframe.TestUtils.lines;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class AppTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private static List<JsonNode> records(Path jsonl) throws IOException {
        List<JsonNode> records = new ArrayList<>();
        for (String line : Files.readAllLines(jsonl, StandardCharsets.UTF_8)) {
            records.add(MAPPER.readTree(line));
        }
        return records;
    }

    private static List<JsonNode> ofKind(List<JsonNode> records, String kind) {
        return records.stream().filter(r -> kind.equals(r.get("kind").asText())).collect(Collectors.toList());
    }

    @Test
    void writes_run_file_io_crosswalk_and_done_records(@TempDir Path tempDir) throws IOException {
        Path output = tempDir.resolve("out/analysis.jsonl");

        int exitCode = App.run(SAMPLES, output, FortframeConfig.defaults());

        assertEquals(0, exitCode);
        List<JsonNode> records = records(output);
        assertEquals("run", records.get(0).get("kind").asText());
        assertEquals(5, records.get(0).get("total_files").asInt());
        assertEquals("done", records.get(records.size() - 1).get("kind").asText());

        List<String> files = ofKind(records, "file").stream()
                .map(r -> r.get("entity").get("name").asText())
                .collect(Collectors.toList());
        assertEquals(List.of("crosswalk.f90", "geometry.f90", "io_conditions.f90", "io_sample.f90", "legacy.f"), files);

        List<String> ioProcedures = ofKind(records, "io").stream()
                .map(r -> r.get("procedure").asText())
                .collect(Collectors.toList());
        assertEquals(List.of("read_header", "load_data"), ioProcedures);
        assertTrue(ofKind(records, "io").get(1).get("summary").has("a.txt"));

        JsonNode simulate = ofKind(records, "crosswalk").stream()
                .filter(r -> r.get("procedure").asText().equals("simulate"))
                .findFirst().get();
        assertTrue(simulate.get("variables").get("state").get("variables").has("layer"));

        JsonNode done = records.get(records.size() - 1);
        assertEquals(5, done.get("files_analyzed").asInt());
        assertEquals(ofKind(records, "warning").size(), done.get("warnings").asInt());
        assertEquals(3, done.get("statistics").get("modules").asInt());
    }

    @Test
    void missing_input_is_an_error(@TempDir Path tempDir) throws IOException {
        int exitCode = App.run(tempDir.resolve("nothing-here"), tempDir.resolve("out.jsonl"), FortframeConfig.defaults());

        assertEquals(1, exitCode);
        assertFalse(Files.exists(tempDir.resolve("out.jsonl")));
    }

    @Test
    void structural_error_fails_the_run_unless_permissive(@TempDir Path tempDir) throws IOException {
        Path source = tempDir.resolve("src");
        Files.createDirectories(source);
        Files.writeString(source.resolve("broken.f90"), lines("module dangling", "  integer :: n"));

        assertEquals(1, App.run(source, tempDir.resolve("strict.jsonl"), FortframeConfig.defaults()));

        Path output = tempDir.resolve("permissive.jsonl");
        assertEquals(0, App.run(source, output, FortframeConfig.with(true, false)));
        List<JsonNode> warnings = ofKind(records(output), "warning");
        assertEquals(1, warnings.size());
        assertEquals("structure", warnings.get(0).get("category").asText());
    }

    @Test
    void non_fortran_files_are_skipped(@TempDir Path tempDir) throws IOException {
        Files.writeString(tempDir.resolve("notes.txt"), "not fortran\n");
        Files.writeString(tempDir.resolve("tiny.f90"), lines("program tiny", "end program tiny"));
        Path output = tempDir.resolve("tiny.jsonl");

        assertEquals(0, App.run(tempDir, output, FortframeConfig.defaults()));
        assertEquals(1, ofKind(records(output), "file").size());
    }
}
