package org.odsutils.models.input;

import java.util.List;
import java.util.Map;

/**
 * I/O side of {@link RecordInput} resolution.
 */
public interface RecordSource {

    /** Reads the record array of a persisted ODS file or URL. */
    List<Map<String, Object>> read(String location);

    /** Extracts the properties of an arbitrary object as field/value pairs. */
    Map<String, Object> attributesOf(Object bean);
}
