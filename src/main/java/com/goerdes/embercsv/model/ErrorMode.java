package com.goerdes.embercsv.model;

/**
 * What a conversion does when a record cannot be turned into a row.
 */
public enum ErrorMode {
    /** Stop at the first failing record and delete the partially written CSV. */
    ABORT_ON_FIRST_ERROR,

    /** Write every valid row and collect the failures in the result. */
    SKIP_AND_REPORT
}
