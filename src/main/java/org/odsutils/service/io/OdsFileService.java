package org.odsutils.service.io;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import lombok.extern.slf4j.Slf4j;
import org.odsutils.models.OdsRecord;
import org.odsutils.models.input.RecordSource;
import org.odsutils.models.standard.Standard;
import org.springframework.core.io.ClassPathResource;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.InputStream;
import java.net.URL;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Reads and writes persisted ODS files: a JSON object whose data key holds the record array.
 */
@Slf4j
@Service
public class OdsFileService implements RecordSource {

    private static final TypeReference<LinkedHashMap<String, Object>> MAP_TYPE = new TypeReference<>() {
    };

    private final ObjectMapper objectMapper;
    private final Standard standard;

    public OdsFileService(ObjectMapper objectMapper, Standard standard) {
        this.objectMapper = objectMapper.copy()
                .findAndRegisterModules()
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .enable(SerializationFeature.INDENT_OUTPUT);
        this.standard = standard;
    }

    @Override
    public List<Map<String, Object>> read(String location) {
        JsonNode root = readTree(location);
        JsonNode entries = root.get(standard.dataKey());
        if (entries == null || !entries.isArray()) {
            throw new IllegalStateException("ODS input " + location + " has no '" + standard.dataKey() + "' array");
        }
        List<Map<String, Object>> records = new ArrayList<>(entries.size());
        for (JsonNode entry : entries) {
            if (entry.isObject()) {
                records.add(objectMapper.convertValue(entry, MAP_TYPE));
            } else {
                log.warn("Skipping non-object entry in {}: {}", location, entry);
                records.add(null);
            }
        }
        return records;
    }

    @Override
    public Map<String, Object> attributesOf(Object bean) {
        return objectMapper.convertValue(bean, MAP_TYPE);
    }

    public void write(Path path, List<OdsRecord> records) {
        if (records.isEmpty()) {
            log.warn("Writing an empty ODS file to {}!", path);
        }
        List<Map<String, Object>> entries = new ArrayList<>(records.size());
        for (OdsRecord record : records) {
            entries.add(record.toExternalMap());
        }
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put(standard.dataKey(), entries);
        try {
            if (path.getParent() != null) {
                Files.createDirectories(path.getParent());
            }
            objectMapper.writeValue(path.toFile(), payload);
            log.info("Wrote {} records to {}", records.size(), path);
        } catch (IOException ioException) {
            throw new IllegalStateException("Failed to write ODS file " + path, ioException);
        }
    }

    /** Reads a JSON object from a file; {@code .json} is appended when the name lacks it. */
    public Map<String, Object> readJsonObject(String fileName) {
        Path path = Path.of(withJsonSuffix(fileName));
        try {
            return objectMapper.readValue(path.toFile(), MAP_TYPE);
        } catch (IOException ioException) {
            throw new IllegalStateException("Failed to read JSON file " + path, ioException);
        }
    }

    public Map<String, Object> readClasspathObject(String resourcePath) {
        ClassPathResource resource = new ClassPathResource(resourcePath);
        try (InputStream inputStream = resource.getInputStream()) {
            return objectMapper.readValue(inputStream, MAP_TYPE);
        } catch (IOException ioException) {
            throw new IllegalStateException("Failed to read bundled file " + resourcePath, ioException);
        }
    }

    private JsonNode readTree(String location) {
        try {
            if (isUrl(location)) {
                return objectMapper.readTree(new URL(location));
            }
            return objectMapper.readTree(Path.of(withJsonSuffix(location)).toFile());
        } catch (IOException ioException) {
            throw new IllegalStateException("Failed to read ODS input " + location + ": " + ioException.getMessage(), ioException);
        }
    }

    private static boolean isUrl(String location) {
        String lowered = location.toLowerCase(Locale.ROOT);
        return lowered.startsWith("http://") || lowered.startsWith("https://");
    }

    private static String withJsonSuffix(String fileName) {
        return fileName.endsWith(".json") ? fileName : fileName + ".json";
    }
}
