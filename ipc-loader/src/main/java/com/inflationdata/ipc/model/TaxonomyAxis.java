package com.inflationdata.ipc.model;

/**
 * Which classification axis a source's columns belong to.
 * Decides how the series part of a column name is interpreted.
 */
public enum TaxonomyAxis {
    /** The 12 COICOP divisions (capítulos) */
    DIVISION,
    /** Headline plus Núcleo / Regulados / Estacionales */
    ANALYTICAL,
    /** Bienes / Servicios */
    NATURE
}
