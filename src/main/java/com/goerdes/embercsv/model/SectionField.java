package com.goerdes.embercsv.model;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Per-section numeric fields that can be aggregated over the {@code sections} list.
 */
@Getter
@RequiredArgsConstructor
public enum SectionField {
    /** Shannon entropy of the section bytes. */
    ENTROPY("entropy", "entropy"),

    /** Size of the section on disk. */
    RAW_SIZE("size", "rawsize"),

    /** Size of the section once mapped into memory. */
    VIRTUAL_SIZE("vsize", "virtualsize");

    /** Key of the value inside a section entry. */
    private final String entryKey;

    /** Suffix used in feature names, e.g. {@code sections_mean_rawsize}. */
    private final String featureSuffix;
}
