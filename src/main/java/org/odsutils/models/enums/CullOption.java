package org.odsutils.models.enums;

public enum CullOption {
    TIME,
    DUPLICATE
}
