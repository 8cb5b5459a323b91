package org.odsutils.models.enums;

public enum CullMode {
    /** Remove records that stopped before the cull time. */
    STALE,
    /** Remove records whose span does not contain the cull time. */
    INACTIVE
}
