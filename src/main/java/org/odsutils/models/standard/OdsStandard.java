package org.odsutils.models.standard;

import org.odsutils.models.OdsRecord;
import org.odsutils.models.enums.FieldType;
import org.springframework.util.CollectionUtils;
import org.springframework.util.StringUtils;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

public final class OdsStandard implements Standard {

    private static final Set<String> BOOLEAN_TEXT = Set.of("true", "false", "1", "0");

    private final String version;
    private final String dataKey;
    private final Map<String, FieldType> fieldTypes;
    private final List<String> fields;
    private final Set<String> timeFields;
    private final List<String> required;
    private final List<String> sortOrderTime;
    private final String source;
    private final String start;
    private final String stop;
    private final String lat;
    private final String lon;
    private final String elevation;
    private final String ra;
    private final String dec;

    public OdsStandard(StandardDefinition definition) {
        if (definition == null || CollectionUtils.isEmpty(definition.getFields())) {
            throw new IllegalArgumentException("Standard definition must declare at least one field");
        }
        this.version = definition.getVersion();
        this.dataKey = StringUtils.hasText(definition.getDataKey()) ? definition.getDataKey() : "ods_data";
        this.fieldTypes = new LinkedHashMap<>(definition.getFields());
        this.fields = List.copyOf(fieldTypes.keySet());
        Set<String> times = new LinkedHashSet<>();
        fieldTypes.forEach((name, type) -> {
            if (type == FieldType.TIME) {
                times.add(name);
            }
        });
        this.timeFields = Set.copyOf(times);
        this.required = CollectionUtils.isEmpty(definition.getRequired()) ? fields : List.copyOf(definition.getRequired());
        this.sortOrderTime = List.copyOf(definition.getSortOrderTime());
        this.source = requireField(definition.getSource(), "source");
        this.start = requireField(definition.getStart(), "start");
        this.stop = requireField(definition.getStop(), "stop");
        this.lat = definition.getLat();
        this.lon = definition.getLon();
        this.elevation = definition.getElevation();
        this.ra = definition.getRa();
        this.dec = definition.getDec();
        for (String key : sortOrderTime) {
            requireField(key, "sort_order_time");
        }
    }

    private String requireField(String name, String role) {
        if (!StringUtils.hasText(name) || !fieldTypes.containsKey(name)) {
            throw new IllegalArgumentException("Standard " + version + ": '" + name + "' given as " + role + " is not a field");
        }
        return name;
    }

    @Override
    public List<String> validate(OdsRecord record) {
        List<String> reasons = new ArrayList<>();
        for (String field : required) {
            if (!record.has(field)) {
                reasons.add(field + " is missing");
                continue;
            }
            Object value = record.get(field);
            if (value == null) {
                String failure = record.getParseFailures().get(field);
                reasons.add(failure != null ? field + " " + failure : field + " is not set");
                continue;
            }
            String typeProblem = checkType(fieldTypes.get(field), value);
            if (typeProblem != null) {
                reasons.add(field + " " + typeProblem);
            }
        }
        Instant startTime = record.instant(start).orElse(null);
        Instant stopTime = record.instant(stop).orElse(null);
        if (startTime != null && stopTime != null && stopTime.isBefore(startTime)) {
            reasons.add(stop + " is before " + start);
        }
        checkRange(record, lat, -90.0, 90.0, reasons);
        checkRange(record, dec, -90.0, 90.0, reasons);
        return reasons;
    }

    private String checkType(FieldType type, Object value) {
        return switch (type) {
            case TIME -> value instanceof Instant ? null : "is not a time (" + value + ")";
            case FLOAT -> toDouble(value) != null ? null : "is not a number (" + value + ")";
            case BOOLEAN -> value instanceof Boolean || BOOLEAN_TEXT.contains(value.toString().trim().toLowerCase(Locale.ROOT))
                    ? null : "is not a boolean (" + value + ")";
            case STRING -> null;
        };
    }

    private void checkRange(OdsRecord record, String field, double min, double max, List<String> reasons) {
        if (field == null) {
            return;
        }
        Double value = toDouble(record.get(field));
        if (value != null && (value < min || value > max)) {
            reasons.add(field + " out of range (" + value + ")");
        }
    }

    private static Double toDouble(Object value) {
        if (value instanceof Number number) {
            return number.doubleValue();
        }
        if (value instanceof String text) {
            try {
                return Double.parseDouble(text.trim());
            } catch (NumberFormatException ex) {
                return null;
            }
        }
        return null;
    }

    @Override
    public String version() {
        return version;
    }

    @Override
    public String dataKey() {
        return dataKey;
    }

    @Override
    public List<String> fields() {
        return fields;
    }

    @Override
    public boolean isField(String name) {
        return fieldTypes.containsKey(name);
    }

    @Override
    public FieldType fieldType(String name) {
        return fieldTypes.get(name);
    }

    @Override
    public Set<String> timeFields() {
        return timeFields;
    }

    @Override
    public List<String> sortOrderTime() {
        return sortOrderTime;
    }

    @Override
    public String source() {
        return source;
    }

    @Override
    public String start() {
        return start;
    }

    @Override
    public String stop() {
        return stop;
    }

    @Override
    public String lat() {
        return lat;
    }

    @Override
    public String lon() {
        return lon;
    }

    @Override
    public String elevation() {
        return elevation;
    }

    @Override
    public String ra() {
        return ra;
    }

    @Override
    public String dec() {
        return dec;
    }

    @Override
    public String toString() {
        return "OdsStandard[" + version + "]";
    }
}
