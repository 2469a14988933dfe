package org.dxworks.fortframe;

import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class FortframeConfigTest {

    private static final Path CONFIGS = Paths.get("src/test/resources/config");

    @Test
    void defaults_when_file_is_missing() {
        FortframeConfig config = FortframeConfig.load(CONFIGS.resolve("does-not-exist.yml"));

        assertEquals(20000, config.getMaxFileLines());
        assertEquals("!", config.getDocmark());
        assertEquals(">", config.getPredocmark());
        assertEquals(List.of("public", "protected"), config.getDisplay());
        assertEquals("src", config.getSort());
        assertFalse(config.isPermissive());
        assertFalse(config.isProcInternals());
        assertTrue(config.isFixedLengthLimit());
        assertTrue(config.getExtensions().contains("f90"));
        assertTrue(config.getFixedExtensions().contains("f"));
    }

    @Test
    void yaml_values_override_defaults() {
        FortframeConfig config = FortframeConfig.load(CONFIGS.resolve("fortframe-config.yml"));

        assertEquals(5000, config.getMaxFileLines());
        assertEquals("*", config.getDocmark());
        assertEquals("<", config.getPredocmark());
        assertEquals(List.of("real_kind"), config.getExtraVartypes());
        assertTrue(config.isLowercase());
        assertTrue(config.isPermissive());
        assertFalse(config.isForce());
        assertTrue(config.isWarnUndocumented());
        assertEquals(List.of("public", "private"), config.getDisplay());
        assertTrue(config.isProcInternals());
        assertEquals("alpha", config.getSort());
        assertEquals(List.of("f77"), config.getFixedExtensions());
        assertTrue(config.getExtensions().contains("f90"));
        assertEquals(Map.of("mpi", "https://www.mpi-forum.org/docs/"), config.getExtraModules());
    }

    @Test
    void unknown_sort_order_falls_back_to_source_order() {
        FortframeConfig config = FortframeConfig.load(CONFIGS.resolve("bad-sort.yml"));

        assertEquals("src", config.getSort());
    }

    @Test
    void unreadable_file_falls_back_to_defaults() {
        FortframeConfig config = FortframeConfig.load(CONFIGS.resolve("broken.yml"));

        assertEquals(20000, config.getMaxFileLines());
    }

    @Test
    void builder_copies_are_independent() {
        FortframeConfig base = FortframeConfig.with(true, false);
        FortframeConfig changed = base.toBuilder().force(true).sort("type-alpha").build();

        assertTrue(changed.isPermissive());
        assertTrue(changed.isForce());
        assertEquals("type-alpha", changed.getSort());
        assertFalse(base.isForce());
        assertEquals("src", base.getSort());
    }
}
