package org.odsutils.models;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Change to a single record: either a patch of field values or removal of the record.
 */
public final class RecordUpdate {

    private static final RecordUpdate DELETE = new RecordUpdate(null);

    private final Map<String, Object> values;

    private RecordUpdate(Map<String, Object> values) {
        this.values = values;
    }

    public static RecordUpdate patch(Map<String, ?> values) {
        return new RecordUpdate(values == null ? new LinkedHashMap<>() : new LinkedHashMap<>(values));
    }

    public static RecordUpdate delete() {
        return DELETE;
    }

    public boolean isDelete() {
        return values == null;
    }

    public Map<String, Object> values() {
        return values == null ? Map.of() : values;
    }
}
