package com.inflationdata.ipc.model;

/**
 * Economic nature of a division-level category.
 * NONE is used for aggregates and is stored as NULL.
 */
public enum Nature {
    GOODS,
    SERVICES,
    MIXED,
    NONE;

    /** Value for dim_category.nature, null for NONE */
    public String storedValue() {
        return this == NONE ? null : name();
    }
}
