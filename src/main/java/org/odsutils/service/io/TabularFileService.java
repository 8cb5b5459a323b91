package org.odsutils.service.io;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVPrinter;
import org.apache.commons.csv.CSVRecord;
import org.odsutils.models.OdsRecord;
import org.odsutils.models.TabularReadOptions;
import org.odsutils.utils.TimeFormats;
import org.springframework.stereotype.Service;
import org.springframework.util.CollectionUtils;
import org.springframework.util.StringUtils;

import java.io.IOException;
import java.io.Reader;
import java.io.StringReader;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Delimited text import and export of ODS records. The first line is the header.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class TabularFileService {

    private static final TypeReference<LinkedHashMap<String, String>> HEADER_MAP_TYPE = new TypeReference<>() {
    };

    private final ObjectMapper objectMapper;

    public List<Map<String, Object>> read(Path path, TabularReadOptions options) {
        TabularReadOptions safeOptions = options == null ? TabularReadOptions.defaults() : options;
        String delimiter = safeOptions.whitespaceSeparated() ? "\t" : safeOptions.separator();
        CSVFormat format = CSVFormat.DEFAULT.builder()
                .setDelimiter(delimiter)
                .setHeader()
                .setSkipHeaderRecord(true)
                .setIgnoreSurroundingSpaces(true)
                .setIgnoreEmptyLines(true)
                .setAllowMissingColumnNames(true)
                .build();

        try (Reader reader = openReader(path, safeOptions);
             CSVParser parser = format.parse(reader)) {
            List<String> headers = mapHeaders(parser.getHeaderNames(), safeOptions);
            List<Map<String, Object>> rows = new ArrayList<>();
            for (CSVRecord record : parser) {
                Map<String, Object> row = new LinkedHashMap<>();
                for (int i = 0; i < record.size() && i < headers.size(); i++) {
                    String value = record.get(i);
                    if (StringUtils.hasText(value) && StringUtils.hasText(headers.get(i))) {
                        row.put(headers.get(i), value);
                    }
                }
                rows.add(row);
            }
            log.info("Read {} rows with columns {} from {}", rows.size(), headers, path);
            return rows;
        } catch (IOException | UncheckedIOException exception) {
            throw new IllegalStateException("Failed to read data file " + path + ": " + exception.getMessage(), exception);
        }
    }

    /**
     * Writes {@code columns} of each record, header first. Every column must be one of
     * {@code availableColumns}.
     */
    public void write(Path path, List<OdsRecord> records, List<String> columns, List<String> availableColumns, String separator) {
        List<String> missing = columns.stream()
                .filter(column -> !availableColumns.contains(column))
                .toList();
        if (!missing.isEmpty()) {
            throw new IllegalArgumentException("Columns not available for export: " + String.join(", ", missing));
        }
        CSVFormat format = CSVFormat.DEFAULT.builder()
                .setDelimiter(StringUtils.hasLength(separator) ? separator : ",")
                .setHeader(columns.toArray(String[]::new))
                .setRecordSeparator("\n")
                .build();
        try {
            if (path.getParent() != null) {
                Files.createDirectories(path.getParent());
            }
            try (Writer writer = Files.newBufferedWriter(path, StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE,
                    StandardOpenOption.TRUNCATE_EXISTING);
                 CSVPrinter printer = new CSVPrinter(writer, format)) {
                for (OdsRecord record : records) {
                    List<Object> row = new ArrayList<>(columns.size());
                    for (String column : columns) {
                        row.add(TimeFormats.externalValue(record.get(column)));
                    }
                    printer.printRecord(row);
                }
            }
            log.info("Wrote {} records to {}", records.size(), path);
        } catch (IOException ioException) {
            throw new IllegalStateException("Failed to write data file " + path, ioException);
        }
    }

    private Reader openReader(Path path, TabularReadOptions options) throws IOException {
        if (!options.whitespaceSeparated()) {
            return Files.newBufferedReader(path, StandardCharsets.UTF_8);
        }
        String normalized = Files.readAllLines(path, StandardCharsets.UTF_8).stream()
                .map(String::trim)
                .filter(line -> !line.isEmpty())
                .map(line -> String.join("\t", line.split("\\s+")))
                .collect(Collectors.joining("\n"));
        return new StringReader(normalized);
    }

    private List<String> mapHeaders(List<String> headerNames, TabularReadOptions options) {
        Map<String, String> headerMap = resolveHeaderMap(options);
        List<String> replaceChar = options.replaceChar();
        List<String> mapped = new ArrayList<>(headerNames.size());
        for (String header : headerNames) {
            String name = header == null ? "" : header.trim();
            if (!CollectionUtils.isEmpty(replaceChar) && StringUtils.hasLength(replaceChar.get(0))) {
                String replacement = replaceChar.size() > 1 ? replaceChar.get(1) : "";
                name = name.replace(replaceChar.get(0), replacement);
            }
            mapped.add(headerMap.getOrDefault(name, name));
        }
        return mapped;
    }

    private Map<String, String> resolveHeaderMap(TabularReadOptions options) {
        if (options.headerMap() != null) {
            return options.headerMap();
        }
        if (options.headerMapFile() == null) {
            return Map.of();
        }
        try {
            return objectMapper.readValue(options.headerMapFile().toFile(), HEADER_MAP_TYPE);
        } catch (IOException ioException) {
            throw new IllegalStateException("Failed to read header map " + options.headerMapFile(), ioException);
        }
    }
}
