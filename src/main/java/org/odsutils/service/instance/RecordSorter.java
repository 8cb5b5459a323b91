package org.odsutils.service.instance;

import org.odsutils.models.OdsRecord;

import java.util.ArrayList;
import java.util.List;
import java.util.NavigableMap;
import java.util.TreeMap;

/**
 * Sorts records on the string form of a list of fields. Without collapse, the record position is
 * the last key term so every record survives; with collapse, records sharing a key reduce to the
 * one that arrived last.
 */
public final class RecordSorter {

    private RecordSorter() {
    }

    public static List<OdsRecord> sort(List<OdsRecord> records, List<String> fields, boolean collapse, boolean reverse) {
        TreeMap<SortKey, Integer> keyed = new TreeMap<>();
        for (int i = 0; i < records.size(); i++) {
            keyed.put(SortKey.of(records.get(i), fields, collapse ? null : i), i);
        }
        NavigableMap<SortKey, Integer> ordered = reverse ? keyed.descendingMap() : keyed;
        List<OdsRecord> sorted = new ArrayList<>(ordered.size());
        for (Integer index : ordered.values()) {
            sorted.add(records.get(index).copy());
        }
        return sorted;
    }

    record SortKey(List<String> parts, Integer position) implements Comparable<SortKey> {

        static SortKey of(OdsRecord record, List<String> fields, Integer position) {
            List<String> parts = new ArrayList<>(fields.size());
            for (String field : fields) {
                parts.add(record.stringValue(field));
            }
            return new SortKey(parts, position);
        }

        @Override
        public int compareTo(SortKey other) {
            int common = Math.min(parts.size(), other.parts.size());
            for (int i = 0; i < common; i++) {
                int cmp = parts.get(i).compareTo(other.parts.get(i));
                if (cmp != 0) {
                    return cmp;
                }
            }
            if (parts.size() != other.parts.size()) {
                return Integer.compare(parts.size(), other.parts.size());
            }
            if (position == null || other.position == null) {
                return 0;
            }
            return Integer.compare(position, other.position);
        }
    }
}
