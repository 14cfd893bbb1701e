package com.goerdes.embercsv.exception;

/**
 * Classifies why a record could not be turned into a row.
 */
public enum ErrorKind {
    /** The recursive search went through the whole record without a matching key. */
    FEATURE_NOT_FOUND,

    /** The feature resolved to an object or an array instead of a scalar. */
    NON_SCALAR_FEATURE,

    /** No {@code sections} key anywhere in the record. */
    SECTIONS_MISSING,

    /** A section entry lacks the requested field, or the field is not numeric. */
    SECTION_MALFORMED,

    /** No {@code datadirectories} key anywhere in the record. */
    DATADIRECTORY_MISSING,

    /** The data directory index is out of range or the entry lacks the requested key. */
    DATADIRECTORY_MALFORMED,

    /** The line could not be parsed as a JSON object at all. */
    MALFORMED_RECORD
}
