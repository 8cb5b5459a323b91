package org.odsutils.models;

import org.odsutils.utils.TimeFormats;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * One ODS schedule entry. Holds every field of its standard as a key; {@code null} marks an absent
 * value. Input keys that were not fields, and time values that could not be interpreted, are kept
 * alongside the fields so the owning instance can report them.
 */
public final class OdsRecord {

    private final Map<String, Object> fields;
    private final Set<String> unknownFields;
    private final Map<String, String> parseFailures;

    public OdsRecord(List<String> fieldNames) {
        this.fields = new LinkedHashMap<>();
        for (String fieldName : fieldNames) {
            fields.put(fieldName, null);
        }
        this.unknownFields = new LinkedHashSet<>();
        this.parseFailures = new LinkedHashMap<>();
    }

    private OdsRecord(OdsRecord other) {
        this.fields = new LinkedHashMap<>(other.fields);
        this.unknownFields = new LinkedHashSet<>(other.unknownFields);
        this.parseFailures = new LinkedHashMap<>(other.parseFailures);
    }

    public OdsRecord copy() {
        return new OdsRecord(this);
    }

    public boolean has(String field) {
        return fields.containsKey(field);
    }

    public Object get(String field) {
        return fields.get(field);
    }

    public Optional<Instant> instant(String field) {
        return fields.get(field) instanceof Instant instant ? Optional.of(instant) : Optional.empty();
    }

    /**
     * Sets a field value, clearing any earlier parse failure for it. Unknown field names are ignored.
     *
     * @return true if the field exists on this record
     */
    public boolean set(String field, Object value) {
        if (!fields.containsKey(field)) {
            return false;
        }
        fields.put(field, value);
        parseFailures.remove(field);
        return true;
    }

    public void markParseFailure(String field, String message) {
        if (fields.containsKey(field)) {
            fields.put(field, null);
            parseFailures.put(field, message);
        }
    }

    public void addUnknownField(String name) {
        unknownFields.add(name);
    }

    public String stringValue(String field) {
        return TimeFormats.stringify(fields.get(field));
    }

    public int size() {
        return fields.size();
    }

    public Map<String, Object> asMap() {
        return Collections.unmodifiableMap(fields);
    }

    /** Field values with instants rendered in their external ISO form. */
    public Map<String, Object> toExternalMap() {
        Map<String, Object> external = new LinkedHashMap<>();
        fields.forEach((key, value) -> external.put(key, TimeFormats.externalValue(value)));
        return external;
    }

    public Set<String> getUnknownFields() {
        return Collections.unmodifiableSet(unknownFields);
    }

    public Map<String, String> getParseFailures() {
        return Collections.unmodifiableMap(parseFailures);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof OdsRecord other)) {
            return false;
        }
        return fields.equals(other.fields);
    }

    @Override
    public int hashCode() {
        return Objects.hash(fields);
    }

    @Override
    public String toString() {
        return toExternalMap().toString();
    }
}
