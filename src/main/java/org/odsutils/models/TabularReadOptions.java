package org.odsutils.models;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;

/**
 * Options for reading a delimited data file.
 *
 * @param separator     literal delimiter, or {@code auto}/blank for runs of whitespace
 * @param replaceChar   header substitution: {@code [from]} removes, {@code [from, to]} replaces
 * @param headerMap     header renames, file header to ODS field
 * @param headerMapFile JSON file holding header renames; used when {@code headerMap} is null
 */
public record TabularReadOptions(String separator,
                                 List<String> replaceChar,
                                 Map<String, String> headerMap,
                                 Path headerMapFile) {

    public static final String AUTO = "auto";

    public static TabularReadOptions defaults() {
        return new TabularReadOptions(AUTO, null, null, null);
    }

    public static TabularReadOptions separatedBy(String separator) {
        return new TabularReadOptions(separator, null, null, null);
    }

    public TabularReadOptions withReplaceChar(String spec) {
        List<String> parts = spec == null ? null : List.of(spec.split(",", -1));
        return new TabularReadOptions(separator, parts, headerMap, headerMapFile);
    }

    public TabularReadOptions withHeaderMap(Map<String, String> map) {
        return new TabularReadOptions(separator, replaceChar, map, headerMapFile);
    }

    public TabularReadOptions withHeaderMapFile(Path file) {
        return new TabularReadOptions(separator, replaceChar, headerMap, file);
    }

    public boolean whitespaceSeparated() {
        return separator == null || separator.isBlank() || AUTO.equalsIgnoreCase(separator);
    }
}
