package org.odsutils.models.enums;

/** Which end of an overlapping pair is moved when resolving overlaps. */
public enum AdjustSide {
    START,
    STOP
}
