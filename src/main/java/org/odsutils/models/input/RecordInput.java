package org.odsutils.models.input;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * The shapes of input accepted when adding records to an instance. Built by the caller, resolved
 * into raw field maps by the engine.
 */
public sealed interface RecordInput
        permits RecordInput.SingleRecord, RecordInput.RecordList, RecordInput.FileReference, RecordInput.AttributeBag {

    /**
     * @return one map per input element; a {@code null} element marks an entry that could not be
     *         interpreted and is skipped by the caller
     */
    List<Map<String, Object>> resolve(RecordSource source);

    String describe();

    static RecordInput of(Map<String, ?> fields) {
        return new SingleRecord(fields);
    }

    static RecordInput of(List<? extends Map<String, ?>> records) {
        return new RecordList(records);
    }

    static RecordInput file(String location) {
        return new FileReference(location);
    }

    static RecordInput bean(Object bean) {
        return new AttributeBag(bean);
    }

    record SingleRecord(Map<String, ?> fields) implements RecordInput {
        @Override
        public List<Map<String, Object>> resolve(RecordSource source) {
            return Collections.singletonList(fields == null ? null : new LinkedHashMap<>(fields));
        }

        @Override
        public String describe() {
            return "single record";
        }
    }

    record RecordList(List<? extends Map<String, ?>> records) implements RecordInput {
        public RecordList {
            Objects.requireNonNull(records, "records");
        }

        @Override
        public List<Map<String, Object>> resolve(RecordSource source) {
            List<Map<String, Object>> resolved = new ArrayList<>(records.size());
            for (Map<String, ?> entry : records) {
                resolved.add(entry == null ? null : new LinkedHashMap<>(entry));
            }
            return resolved;
        }

        @Override
        public String describe() {
            return "list";
        }
    }

    record FileReference(String location) implements RecordInput {
        public FileReference {
            Objects.requireNonNull(location, "location");
        }

        @Override
        public List<Map<String, Object>> resolve(RecordSource source) {
            return source.read(location);
        }

        @Override
        public String describe() {
            return location;
        }
    }

    record AttributeBag(Object bean) implements RecordInput {
        @Override
        public List<Map<String, Object>> resolve(RecordSource source) {
            return Collections.singletonList(bean == null ? null : source.attributesOf(bean));
        }

        @Override
        public String describe() {
            return bean == null ? "attributes" : "attributes of " + bean.getClass().getSimpleName();
        }
    }
}
