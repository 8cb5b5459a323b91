package org.odsutils.models.standard;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.odsutils.models.enums.FieldType;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Bound form of a {@code standards/ods-*.json} definition file.
 */
@Data
@NoArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class StandardDefinition {
    private String version;
    private String dataKey;
    private Map<String, FieldType> fields = new LinkedHashMap<>();
    private List<String> required = new ArrayList<>();
    private List<String> sortOrderTime = new ArrayList<>();
    private String source;
    private String start;
    private String stop;
    private String lat;
    private String lon;
    private String elevation;
    private String ra;
    private String dec;
}
