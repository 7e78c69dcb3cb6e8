package com.inflationdata.ipc.model;

/**
 * What to do when two sources of equal priority give different values for the same slot.
 */
public enum TieBreakPolicy {
    /** Keep the value from the source listed first in configuration */
    FIRST_WINS,
    /** Leave the slot empty for that key and report a data-quality warning */
    REJECT
}
