package org.odsutils.controllers;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.odsutils.OdsTestFixtures;
import org.odsutils.service.OdsEngine;
import org.springframework.boot.DefaultApplicationArguments;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class OdsShowRunnerTest {

    @TempDir
    Path tempDir;

    private OdsEngine engine;
    private OdsShowRunner runner;

    @BeforeEach
    void setUp() {
        engine = OdsTestFixtures.engine();
        runner = new OdsShowRunner(engine);
    }

    @Test
    void showReadsTheFileIntoTheWorkingInstance() {
        Path file = tempDir.resolve("show.json");
        OdsTestFixtures.odsFileService().write(file, List.of(OdsTestFixtures.normalizer().normalize(
                OdsTestFixtures.entry("casa", "2024-06-01T00:00:00", "2024-06-01T01:00:00"), Map.of())));

        runner.run(new DefaultApplicationArguments("--show=" + file));

        assertThat(engine.getInstance(null).orElseThrow().getNumberOfRecords()).isEqualTo(1);
    }

    @Test
    void defaultsOptionLoadsNamedDefaults() {
        runner.run(new DefaultApplicationArguments("--defaults=$hcro"));

        assertThat(engine.getDefaults()).containsEntry("site_id", "ata");
    }

    @Test
    void listsBundledDefaultsFiles() {
        assertThat(runner.listBundledDefaults()).contains("hcro.json");
    }

    @Test
    void noOptionsDoesNothing() {
        runner.run(new DefaultApplicationArguments());

        assertThat(engine.getInstance(null).orElseThrow().isEmpty()).isTrue();
        assertThat(engine.getDefaults()).isEmpty();
    }
}
