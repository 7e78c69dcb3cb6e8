package com.inflationdata.ipc.model;

import java.math.BigDecimal;

/**
 * Metric slots of a fact row as currently stored.
 */
public record StoredFact(BigDecimal incidence, BigDecimal momVariation) {
}
