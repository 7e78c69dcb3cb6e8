package com.inflationdata.ipc.model;

/**
 * Values used for dim_category.category_name and the headline classification.
 * Kept in Spanish to match the published INDEC taxonomy.
 */
public final class CategoryNames {

    public static final String HEADLINE = "Nivel General";
    public static final String HEADLINE_CLASSIFICATION = "Total";
    public static final String ANALYTICAL = "Análisis";
    public static final String DIVISION = "División";
    public static final String NATURE = "Naturaleza";

    private CategoryNames() {
    }
}
