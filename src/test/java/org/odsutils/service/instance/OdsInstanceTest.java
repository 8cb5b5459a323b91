package org.odsutils.service.instance;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.odsutils.OdsTestFixtures;
import org.odsutils.models.OdsRecord;
import org.odsutils.models.RecordUpdate;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class OdsInstanceTest {

    private OdsInstance instance;
    private RecordNormalizer normalizer;

    @BeforeEach
    void setUp() {
        instance = OdsTestFixtures.instance("test");
        normalizer = instance.getNormalizer();
    }

    private void append(Map<String, Object> entry) {
        instance.append(normalizer.normalize(entry, Map.of()));
    }

    private List<Object> sourceIds() {
        return instance.getRecords().stream().map(record -> record.get("src_id")).toList();
    }

    @Test
    void emptyInstanceHasNoTimeSpan() {
        instance.recomputeMetadata();

        assertThat(instance.isEmpty()).isTrue();
        assertThat(instance.getEarliest()).isEqualTo(OdsInstance.FAR_FUTURE);
        assertThat(instance.getLatest()).isEqualTo(OdsInstance.FAR_PAST);
        assertThat(instance.hasTimeSpan()).isFalse();
    }

    @Test
    void recomputePartitionsValidAndInvalid() {
        append(OdsTestFixtures.entry("a", "2024-06-01T10:00:00", "2024-06-01T11:00:00"));
        append(OdsTestFixtures.entry("b", "2024-06-01T09:00:00", "2024-06-01T13:00:00"));
        Map<String, Object> broken = OdsTestFixtures.entry(null, "2024-06-01T08:00:00", "2024-06-01T07:00:00");
        broken.put("telescope", "ata");
        append(broken);

        instance.recomputeMetadata();

        assertThat(instance.getValidIndices()).containsExactly(0, 1);
        assertThat(instance.getInvalidReasons()).containsOnlyKeys(2);
        assertThat(instance.getInvalidReasons().get(2))
                .containsExactly("src_id is not set", "src_end_utc is before src_start_utc");
        assertThat(instance.getEarliest()).isEqualTo(Instant.parse("2024-06-01T08:00:00Z"));
        assertThat(instance.getLatest()).isEqualTo(Instant.parse("2024-06-01T13:00:00Z"));
        assertThat(instance.getUnknownFieldNames()).containsExactly("telescope");
        assertThat(instance.getDistinctValues().get("site_id")).containsExactly("ata");
    }

    @Test
    void singleValuedFieldsSkipVaryingOnes() {
        append(OdsTestFixtures.entry("a", "2024-06-01T10:00:00", "2024-06-01T11:00:00"));
        append(OdsTestFixtures.entry("b", "2024-06-01T10:00:00", "2024-06-01T12:00:00"));
        instance.recomputeMetadata();

        Map<String, Object> single = instance.singleValuedFields();

        assertThat(single).containsEntry("site_id", "ata")
                .containsEntry("src_start_utc", Instant.parse("2024-06-01T10:00:00Z"))
                .doesNotContainKeys("src_id", "src_end_utc", OdsInstance.INVALID_KEY);
    }

    @Test
    void updateOutOfRangeChangesNothing() {
        append(OdsTestFixtures.entry("a", "2024-06-01T10:00:00", "2024-06-01T11:00:00"));

        assertThat(instance.updateAt(5, RecordUpdate.delete())).isZero();
        assertThat(instance.updateAt(-1, RecordUpdate.patch(Map.of("src_id", "x")))).isZero();
        assertThat(instance.getNumberOfRecords()).isEqualTo(1);
    }

    @Test
    void updatePatchesKnownFieldsOnly() {
        append(OdsTestFixtures.entry("a", "2024-06-01T10:00:00", "2024-06-01T11:00:00"));
        instance.recomputeMetadata();

        int changed = instance.updateAt(0, RecordUpdate.patch(Map.of(
                "src_id", "renamed",
                "src_end_utc", "2024-06-01T15:00:00",
                "telescope", "ata")));

        assertThat(changed).isEqualTo(2);
        assertThat(instance.getRecord(0).get("src_id")).isEqualTo("renamed");
        assertThat(instance.getLatest()).isEqualTo(Instant.parse("2024-06-01T15:00:00Z"));
    }

    @Test
    void updateDeleteRemovesTheRecord() {
        append(OdsTestFixtures.entry("a", "2024-06-01T10:00:00", "2024-06-01T11:00:00"));
        append(OdsTestFixtures.entry("b", "2024-06-01T12:00:00", "2024-06-01T13:00:00"));
        instance.recomputeMetadata();

        int removed = instance.updateAt(0, RecordUpdate.delete());

        assertThat(removed).isEqualTo(OdsTestFixtures.standard().fields().size());
        assertThat(sourceIds()).containsExactly("b");
        assertThat(instance.getEarliest()).isEqualTo(Instant.parse("2024-06-01T12:00:00Z"));
    }

    @Test
    void sortOrdersByStartTime() {
        append(OdsTestFixtures.entry("late", "2024-06-01T12:00:00", "2024-06-01T13:00:00"));
        append(OdsTestFixtures.entry("early", "2024-06-01T09:00:00", "2024-06-01T10:00:00"));
        append(OdsTestFixtures.entry("middle", "2024-06-01T10:00:00", "2024-06-01T11:00:00"));

        instance.sortAndDedup(OdsTestFixtures.standard().sortOrderTime(), false, false);
        assertThat(sourceIds()).containsExactly("early", "middle", "late");

        instance.sortAndDedup(OdsTestFixtures.standard().sortOrderTime(), false, true);
        assertThat(sourceIds()).containsExactly("late", "middle", "early");
    }

    @Test
    void collapseKeepsTheLastArrival() {
        Map<String, Object> first = OdsTestFixtures.entry("a", "2024-06-01T10:00:00", "2024-06-01T11:00:00");
        Map<String, Object> second = OdsTestFixtures.entry("a", "2024-06-01T10:00:00", "2024-06-01T11:00:00");
        second.put("notes", "second");
        append(first);
        append(second);
        append(OdsTestFixtures.entry("b", "2024-06-01T10:00:00", "2024-06-01T11:00:00"));

        instance.sortAndDedup(OdsTestFixtures.standard().sortOrderTime(), true, false);

        assertThat(sourceIds()).containsExactly("a", "b");
        assertThat(instance.getRecord(0).get("notes")).isEqualTo("second");
    }

    @Test
    void withoutCollapseEqualKeysAllSurviveInArrivalOrder() {
        Map<String, Object> first = OdsTestFixtures.entry("a", "2024-06-01T10:00:00", "2024-06-01T11:00:00");
        Map<String, Object> second = OdsTestFixtures.entry("a", "2024-06-01T10:00:00", "2024-06-01T11:00:00");
        second.put("notes", "second");
        append(first);
        append(second);

        instance.sortAndDedup(List.of("src_id"), false, false);

        assertThat(instance.getRecords()).extracting(record -> record.get("notes")).containsExactly("test", "second");
    }

    @Test
    void collapseIsIdempotent() {
        append(OdsTestFixtures.entry("a", "2024-06-01T10:00:00", "2024-06-01T11:00:00"));
        append(OdsTestFixtures.entry("a", "2024-06-01T10:00:00", "2024-06-01T11:00:00"));
        append(OdsTestFixtures.entry("c", "2024-06-01T08:00:00", "2024-06-01T11:00:00"));
        append(OdsTestFixtures.entry("b", "2024-06-01T10:00:00", "2024-06-01T11:00:00"));
        List<String> fields = OdsTestFixtures.standard().sortOrderTime();

        instance.sortAndDedup(fields, true, false);
        List<OdsRecord> once = instance.copyRecords();
        instance.sortAndDedup(fields, true, false);

        assertThat(instance.getRecords()).containsExactlyElementsOf(once);
        assertThat(sourceIds()).containsExactly("c", "a", "b");
    }

    @Test
    void replaceRecordsRecomputesMetadata() {
        append(OdsTestFixtures.entry("a", "2024-06-01T10:00:00", "2024-06-01T11:00:00"));
        instance.recomputeMetadata();

        instance.replaceRecords(List.of());

        assertThat(instance.getValidIndices()).isEmpty();
        assertThat(instance.hasTimeSpan()).isFalse();
    }
}
