package org.odsutils.models.standard;

import org.odsutils.models.OdsRecord;
import org.odsutils.models.enums.FieldType;

import java.util.List;
import java.util.Set;

/**
 * Field schema of ODS records: which fields exist, which hold times, how records are keyed for
 * time ordering and what makes a record valid. Implementations are immutable.
 */
public interface Standard {

    String version();

    /** Key of the record array in persisted ODS files. */
    String dataKey();

    /** All fields, in canonical order. */
    List<String> fields();

    boolean isField(String name);

    FieldType fieldType(String name);

    Set<String> timeFields();

    default boolean isTimeField(String name) {
        return timeFields().contains(name);
    }

    List<String> sortOrderTime();

    String source();

    String start();

    String stop();

    String lat();

    String lon();

    String elevation();

    String ra();

    String dec();

    /**
     * @return human-readable reasons the record is invalid; empty when it is valid
     */
    List<String> validate(OdsRecord record);
}
