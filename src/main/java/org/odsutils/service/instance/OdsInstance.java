package org.odsutils.service.instance;

import lombok.extern.slf4j.Slf4j;
import org.odsutils.models.OdsRecord;
import org.odsutils.models.RecordUpdate;
import org.odsutils.models.standard.Standard;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * A named collection of ODS records plus metadata derived from a full scan of them. Appends do not
 * rescan; callers batch their changes and call {@link #recomputeMetadata()} once.
 */
@Slf4j
public class OdsInstance {

    public static final String INVALID_KEY = "invalid";
    public static final Instant FAR_PAST = Instant.parse("0001-01-01T00:00:00Z");
    public static final Instant FAR_FUTURE = Instant.parse("9999-12-31T23:59:59Z");

    private final String name;
    private final RecordNormalizer normalizer;

    private List<OdsRecord> records = new ArrayList<>();
    private List<Integer> validIndices = List.of();
    private Map<Integer, List<String>> invalidReasons = Map.of();
    private Map<String, Set<Object>> distinctValues = Map.of(INVALID_KEY, Set.of());
    private Instant earliest = FAR_FUTURE;
    private Instant latest = FAR_PAST;

    public OdsInstance(String name, RecordNormalizer normalizer) {
        this.name = Objects.requireNonNull(name, "name");
        this.normalizer = Objects.requireNonNull(normalizer, "normalizer");
    }

    public String getName() {
        return name;
    }

    public Standard getStandard() {
        return normalizer.standard();
    }

    public RecordNormalizer getNormalizer() {
        return normalizer;
    }

    public void append(OdsRecord record) {
        records.add(record);
    }

    /**
     * Rebuilds valid/invalid partition, distinct values and earliest/latest times from scratch.
     */
    public void recomputeMetadata() {
        Standard standard = getStandard();
        Instant earliestSeen = FAR_FUTURE;
        Instant latestSeen = FAR_PAST;
        List<Integer> valid = new ArrayList<>();
        Map<Integer, List<String>> invalid = new LinkedHashMap<>();
        Map<String, Set<Object>> distinct = new LinkedHashMap<>();
        Set<Object> unknownKeys = new HashSet<>();

        for (int index = 0; index < records.size(); index++) {
            OdsRecord record = records.get(index);
            for (Map.Entry<String, Object> entry : record.asMap().entrySet()) {
                distinct.computeIfAbsent(entry.getKey(), key -> new HashSet<>()).add(entry.getValue());
            }
            unknownKeys.addAll(record.getUnknownFields());

            Instant start = record.instant(standard.start()).orElse(null);
            if (start != null && start.isBefore(earliestSeen)) {
                earliestSeen = start;
            }
            Instant stop = record.instant(standard.stop()).orElse(null);
            if (stop != null && stop.isAfter(latestSeen)) {
                latestSeen = stop;
            }

            List<String> reasons = standard.validate(record);
            if (reasons.isEmpty()) {
                valid.add(index);
            } else {
                invalid.put(index, List.copyOf(reasons));
            }
        }
        distinct.put(INVALID_KEY, unknownKeys);

        this.validIndices = Collections.unmodifiableList(valid);
        this.invalidReasons = Collections.unmodifiableMap(invalid);
        this.distinctValues = Collections.unmodifiableMap(distinct);
        this.earliest = earliestSeen;
        this.latest = latestSeen;
    }

    /**
     * Applies a patch or a delete to the record at {@code index}.
     *
     * @return number of fields changed (patch) or the removed record's field count (delete);
     *         0 when the index is out of range
     */
    public int updateAt(int index, RecordUpdate update) {
        if (index < 0 || index >= records.size()) {
            log.warn("Instance {}: entry {} is out of range (0..{})", name, index, records.size() - 1);
            return 0;
        }
        int changed = 0;
        if (update.isDelete()) {
            changed = records.remove(index).size();
        } else {
            OdsRecord record = records.get(index);
            for (Map.Entry<String, Object> entry : update.values().entrySet()) {
                if (normalizer.apply(record, entry.getKey(), entry.getValue())) {
                    changed++;
                }
            }
        }
        if (changed > 0) {
            recomputeMetadata();
        }
        return changed;
    }

    /**
     * Reorders the records on the string form of {@code fields}; with {@code collapse} records that
     * share a key reduce to one.
     */
    public void sortAndDedup(List<String> fields, boolean collapse, boolean reverse) {
        this.records = RecordSorter.sort(records, fields, collapse, reverse);
    }

    public void replaceRecords(List<OdsRecord> replacement) {
        this.records = new ArrayList<>(replacement);
        recomputeMetadata();
    }

    public List<OdsRecord> getRecords() {
        return Collections.unmodifiableList(records);
    }

    public OdsRecord getRecord(int index) {
        return records.get(index);
    }

    public List<OdsRecord> copyRecords() {
        List<OdsRecord> copies = new ArrayList<>(records.size());
        for (OdsRecord record : records) {
            copies.add(record.copy());
        }
        return copies;
    }

    public int getNumberOfRecords() {
        return records.size();
    }

    public boolean isEmpty() {
        return records.isEmpty();
    }

    public List<Integer> getValidIndices() {
        return validIndices;
    }

    public Map<Integer, List<String>> getInvalidReasons() {
        return invalidReasons;
    }

    public Map<String, Set<Object>> getDistinctValues() {
        return distinctValues;
    }

    public Set<Object> getUnknownFieldNames() {
        return distinctValues.getOrDefault(INVALID_KEY, Set.of());
    }

    /** Fields holding exactly one distinct value across all records. */
    public Map<String, Object> singleValuedFields() {
        Map<String, Object> single = new LinkedHashMap<>();
        distinctValues.forEach((field, values) -> {
            if (!INVALID_KEY.equals(field) && values.size() == 1) {
                single.put(field, values.iterator().next());
            }
        });
        return single;
    }

    public Instant getEarliest() {
        return earliest;
    }

    public Instant getLatest() {
        return latest;
    }

    public boolean hasTimeSpan() {
        return !FAR_FUTURE.equals(earliest) && !FAR_PAST.equals(latest);
    }

    @Override
    public String toString() {
        return "OdsInstance[" + name + ", " + records.size() + " records]";
    }
}
