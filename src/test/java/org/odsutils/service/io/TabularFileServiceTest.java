package org.odsutils.service.io;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.odsutils.OdsTestFixtures;
import org.odsutils.models.OdsRecord;
import org.odsutils.models.TabularReadOptions;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TabularFileServiceTest {

    @TempDir
    Path tempDir;

    private final TabularFileService tabularFileService = new TabularFileService(new ObjectMapper());

    @Test
    void readsCommaSeparatedRowsAndOmitsBlankCells() throws IOException {
        Path file = tempDir.resolve("obs.csv");
        Files.writeString(file, "src_id,src_start_utc,notes\ncasa,2024-06-01T00:00:00,\ncygx,2024-06-01T01:00:00,bright\n");

        List<Map<String, Object>> rows = tabularFileService.read(file, TabularReadOptions.separatedBy(","));

        assertThat(rows).hasSize(2);
        assertThat(rows.get(0)).containsOnlyKeys("src_id", "src_start_utc");
        assertThat(rows.get(1)).containsEntry("notes", "bright");
    }

    @Test
    void splitsOnWhitespaceInAutoMode() throws IOException {
        Path file = tempDir.resolve("obs.txt");
        Files.writeString(file, "src_id   src_start_utc\n  casa\t2024-06-01T00:00:00\n\n");

        List<Map<String, Object>> rows = tabularFileService.read(file, TabularReadOptions.defaults());

        assertThat(rows).containsExactly(Map.of("src_id", "casa", "src_start_utc", "2024-06-01T00:00:00"));
    }

    @Test
    void substitutesThenRemapsHeaders() throws IOException {
        Path file = tempDir.resolve("obs.csv");
        Files.writeString(file, "src-id;start time\ncasa;2024-06-01T00:00:00\n");

        TabularReadOptions options = TabularReadOptions.separatedBy(";")
                .withReplaceChar("-,_")
                .withHeaderMap(Map.of("start time", "src_start_utc"));

        assertThat(tabularFileService.read(file, options))
                .containsExactly(Map.of("src_id", "casa", "src_start_utc", "2024-06-01T00:00:00"));
    }

    @Test
    void readsHeaderMapFromFile() throws IOException {
        Path mapFile = tempDir.resolve("header.json");
        Files.writeString(mapFile, "{\"source\": \"src_id\"}");
        Path file = tempDir.resolve("obs.csv");
        Files.writeString(file, "source\ncasa\n");

        TabularReadOptions options = TabularReadOptions.separatedBy(",").withHeaderMapFile(mapFile);

        assertThat(tabularFileService.read(file, options)).containsExactly(Map.of("src_id", "casa"));
    }

    @Test
    void writesSelectedColumnsWithIsoTimes() throws IOException {
        OdsRecord record = OdsTestFixtures.normalizer().normalize(
                OdsTestFixtures.entry("casa", "2024-06-01T00:00:00.250", "2024-06-01T01:00:00"), Map.of());
        record.set("notes", null);
        Path file = tempDir.resolve("export/obs.csv");

        tabularFileService.write(file, List.of(record), List.of("src_id", "src_start_utc", "notes"),
                OdsTestFixtures.standard().fields(), ",");

        assertThat(Files.readAllLines(file)).containsExactly("src_id,src_start_utc,notes", "casa,2024-06-01T00:00:00,");
    }

    @Test
    void unknownExportColumnIsRejectedBeforeWriting() {
        Path file = tempDir.resolve("bad.csv");

        assertThatThrownBy(() -> tabularFileService.write(file, List.of(), List.of("src_id", "telescope"),
                OdsTestFixtures.standard().fields(), ","))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("telescope");
        assertThat(file).doesNotExist();
    }
}
