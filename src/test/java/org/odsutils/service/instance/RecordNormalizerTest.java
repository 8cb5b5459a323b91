package org.odsutils.service.instance;

import org.junit.jupiter.api.Test;
import org.odsutils.OdsTestFixtures;
import org.odsutils.models.OdsRecord;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class RecordNormalizerTest {

    private final RecordNormalizer normalizer = OdsTestFixtures.normalizer();

    @Test
    void everyFieldIsPresentWhateverTheInput() {
        OdsRecord fromEmpty = normalizer.normalize(Map.of(), Map.of());
        OdsRecord fromNull = normalizer.normalize(null, null);
        OdsRecord fromPartial = normalizer.normalize(Map.of("src_id", "casa"), null);

        for (OdsRecord record : new OdsRecord[]{fromEmpty, fromNull, fromPartial}) {
            assertThat(record.asMap().keySet()).containsExactlyElementsOf(OdsTestFixtures.standard().fields());
        }
        assertThat(fromEmpty.asMap().values()).containsOnlyNulls();
        assertThat(fromPartial.get("src_id")).isEqualTo("casa");
        assertThat(fromPartial.get("site_id")).isNull();
    }

    @Test
    void inputWinsOverDefaults() {
        OdsRecord record = normalizer.normalize(
                Map.of("site_id", "gbt"),
                Map.of("site_id", "ata", "notes", "from defaults"));

        assertThat(record.get("site_id")).isEqualTo("gbt");
        assertThat(record.get("notes")).isEqualTo("from defaults");
    }

    @Test
    void explicitNullInInputIsKept() {
        Map<String, Object> input = new HashMap<>();
        input.put("site_id", null);

        OdsRecord record = normalizer.normalize(input, Map.of("site_id", "ata"));

        assertThat(record.get("site_id")).isNull();
    }

    @Test
    void interpretsTimeFields() {
        OdsRecord record = normalizer.normalize(Map.of(
                "src_start_utc", "2024-06-01 10:00:00",
                "src_end_utc", "now/1h"), Map.of());

        assertThat(record.instant("src_start_utc")).contains(Instant.parse("2024-06-01T10:00:00Z"));
        assertThat(record.instant("src_end_utc")).contains(OdsTestFixtures.NOW.plusSeconds(3600));
    }

    @Test
    void recordsTimeParseFailures() {
        OdsRecord record = normalizer.normalize(Map.of("src_start_utc", "sometime soon"), Map.of());

        assertThat(record.get("src_start_utc")).isNull();
        assertThat(record.getParseFailures()).containsKey("src_start_utc");
        assertThat(OdsTestFixtures.standard().validate(record))
                .contains("src_start_utc could not be interpreted as a time ('sometime soon')");
    }

    @Test
    void remembersUnknownInputKeys() {
        OdsRecord record = normalizer.normalize(Map.of("src_id", "casa", "telescope", "ata"), Map.of());

        assertThat(record.has("telescope")).isFalse();
        assertThat(record.getUnknownFields()).containsExactly("telescope");
    }

    @Test
    void applyIgnoresFieldsOutsideTheStandard() {
        OdsRecord record = normalizer.normalize(Map.of(), Map.of());

        assertThat(normalizer.apply(record, "telescope", "ata")).isFalse();
        assertThat(normalizer.apply(record, "src_id", "casa")).isTrue();
        assertThat(record.get("src_id")).isEqualTo("casa");
    }
}
