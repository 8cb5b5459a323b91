package org.odsutils.service.standard;

import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.odsutils.models.standard.OdsStandard;
import org.odsutils.models.standard.Standard;
import org.odsutils.models.standard.StandardDefinition;
import org.springframework.core.io.ClassPathResource;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.io.IOException;
import java.io.InputStream;

@Slf4j
@Component
@RequiredArgsConstructor
public class StandardLoader {

    static final String LATEST = "latest";
    private static final String RESOURCE_PATTERN = "standards/ods-%s.json";

    private final ObjectMapper objectMapper;

    public Standard load(String version) {
        String resolved = StringUtils.hasText(version) ? version : LATEST;
        ClassPathResource resource = new ClassPathResource(String.format(RESOURCE_PATTERN, resolved));
        if (!resource.exists()) {
            throw new IllegalArgumentException("Unknown ODS standard version: " + resolved);
        }
        try (InputStream inputStream = resource.getInputStream()) {
            StandardDefinition definition = objectMapper.readValue(inputStream, StandardDefinition.class);
            Standard standard = new OdsStandard(definition);
            log.info("Loaded ODS standard {} ({} fields) from {}", standard.version(), standard.fields().size(), resource.getPath());
            return standard;
        } catch (IOException ioException) {
            throw new IllegalStateException("Failed to read ODS standard " + resource.getPath(), ioException);
        }
    }
}
