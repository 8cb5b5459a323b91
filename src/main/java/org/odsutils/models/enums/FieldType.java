package org.odsutils.models.enums;

import com.fasterxml.jackson.annotation.JsonProperty;

public enum FieldType {
    @JsonProperty("str")
    STRING,
    @JsonProperty("float")
    FLOAT,
    @JsonProperty("bool")
    BOOLEAN,
    @JsonProperty("time")
    TIME
}
