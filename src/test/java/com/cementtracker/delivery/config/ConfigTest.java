package com.cementtracker.delivery.config;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ConfigTest {

    @Test
    void blankOverrideShouldFallBackToDefault() {
        Config config = Config.fromMap(Path.of("."), Map.of("sync.default_window_days", " "));

        assertEquals(7, config.getInt("sync.default_window_days", 1));
        assertEquals("default", config.sourceOf("sync.default_window_days"));
        assertEquals(50.0, config.getDouble("sync.nominal_bag_weight", 0.0), 1e-12);
    }

    @Test
    void overridesShouldWinAndReportTheirSource() {
        Config config = Config.fromMap(Path.of("/srv/tracker"), Map.of(
                "db.sql_log.enabled", "yes",
                "export.path", "exports/data.csv",
                "sync.nominal_bag_weight", "not-a-number"));

        assertTrue(config.getBoolean("db.sql_log.enabled"));
        assertEquals("override", config.sourceOf("db.sql_log.enabled"));
        assertEquals(Path.of("/srv/tracker/exports/data.csv"), config.getPath("export.path"));
        assertEquals(42.0, config.getDouble("sync.nominal_bag_weight", 42.0), 1e-12);
    }

    @Test
    void unreadableLocalFileShouldKeepClasspathValues(@TempDir Path dir) throws Exception {
        Files.createDirectory(dir.resolve("config.properties"));

        Config config = Config.load(dir);

        assertEquals("scale.sscil@sevenringscement.com", config.getString("sync.expected_sender"));
        assertEquals("resource", config.sourceOf("sync.expected_sender"));
    }

    @Test
    void getListShouldSplitOnCommaAndSemicolon() {
        Config config = Config.fromMap(Path.of("."), Map.of("sync.sender_aliases", "a, b;;c ,"));

        assertEquals(List.of("a", "b", "c"), config.getList("sync.sender_aliases"));
        assertEquals(List.of(), config.getList("no.such.key"));
    }

    @Test
    void requireStringShouldRejectMissingValue() {
        Config config = Config.fromMap(Path.of("."), Map.of());

        assertThrows(IllegalArgumentException.class, () -> config.requireString("imap.host"));
        assertFalse(config.getBoolean("imap.host"));
    }

    @Test
    void loadShouldLayerWorkingDirFileOverClasspath(@TempDir Path workDir) throws Exception {
        Files.writeString(workDir.resolve("config.properties"), "sync.default_window_days=14\n");

        Config config = Config.load(workDir);

        assertEquals(14, config.getInt("sync.default_window_days", 7));
        assertEquals("override", config.sourceOf("sync.default_window_days"));
        assertEquals("resource", config.sourceOf("imap.folder"));
    }
}
