package com.inflationdata.ipc.model;

/**
 * The two metric slots of a fact row.
 */
public enum MetricKind {
    INCIDENCE,
    MOM_VARIATION
}
