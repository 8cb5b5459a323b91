package org.odsutils.service.instance;

import org.odsutils.models.OdsRecord;
import org.odsutils.models.standard.Standard;
import org.odsutils.utils.DateInterpreter;

import java.time.Instant;
import java.util.Map;
import java.util.Optional;

/**
 * Shapes raw field maps into complete records of a standard. Values come from the input first,
 * then from the defaults; time fields are interpreted into instants.
 */
public class RecordNormalizer {

    private final Standard standard;
    private final DateInterpreter dateInterpreter;

    public RecordNormalizer(Standard standard, DateInterpreter dateInterpreter) {
        this.standard = standard;
        this.dateInterpreter = dateInterpreter;
    }

    public Standard standard() {
        return standard;
    }

    public OdsRecord normalize(Map<String, ?> input, Map<String, ?> defaults) {
        Map<String, ?> safeInput = input == null ? Map.of() : input;
        Map<String, ?> safeDefaults = defaults == null ? Map.of() : defaults;
        OdsRecord record = new OdsRecord(standard.fields());
        for (String field : standard.fields()) {
            Object value = null;
            if (safeInput.containsKey(field)) {
                value = safeInput.get(field);
            } else if (safeDefaults.containsKey(field)) {
                value = safeDefaults.get(field);
            }
            apply(record, field, value);
        }
        for (String key : safeInput.keySet()) {
            if (!standard.isField(key)) {
                record.addUnknownField(key);
            }
        }
        return record;
    }

    /**
     * Sets one field, interpreting time values.
     *
     * @return false if the field is not part of the standard
     */
    public boolean apply(OdsRecord record, String field, Object value) {
        if (!standard.isField(field)) {
            return false;
        }
        if (value == null || !standard.isTimeField(field)) {
            return record.set(field, value);
        }
        Optional<Instant> instant = dateInterpreter.interpret(value);
        if (instant.isPresent()) {
            record.set(field, instant.get());
        } else {
            record.markParseFailure(field, "could not be interpreted as a time ('" + value + "')");
        }
        return true;
    }
}
