package com.inflationdata.ipc.model;

/**
 * What the value columns of a source table hold.
 * INDEX columns are index levels and go through the variation calculator.
 */
public enum SourceMetric {
    INCIDENCE,
    INDEX,
    MOM_VARIATION
}
