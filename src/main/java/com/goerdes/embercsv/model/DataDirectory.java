package com.goerdes.embercsv.model;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Positions within the {@code datadirectories} table of an EMBER record.
 * <p>
 * EMBER emits the table in the order of the PE optional header's
 * {@code IMAGE_DATA_DIRECTORY} array (winnt.h {@code IMAGE_DIRECTORY_ENTRY_*}).
 * A wrong index here silently yields values of a different directory, so these
 * must only change together with the record producer.
 */
@Getter
@RequiredArgsConstructor
public enum DataDirectory {
    /** IMAGE_DIRECTORY_ENTRY_EXPORT. */
    EXPORT_TABLE(0),

    /** IMAGE_DIRECTORY_ENTRY_RESOURCE. */
    RESOURCE_TABLE(2),

    /** IMAGE_DIRECTORY_ENTRY_DEBUG. */
    DEBUG(6),

    /** IMAGE_DIRECTORY_ENTRY_IAT. */
    IAT(12);

    private final int index;
}
