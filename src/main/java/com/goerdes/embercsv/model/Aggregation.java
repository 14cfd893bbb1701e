package com.goerdes.embercsv.model;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * How per-section values are folded into a single feature value.
 */
@Getter
@RequiredArgsConstructor
public enum Aggregation {
    MEAN("mean"),
    MIN("min"),
    MAX("max");

    private final String featureToken;

    /**
     * @return the feature name for this aggregation of the given field, e.g. {@code sections_max_entropy}
     */
    public String featureName(SectionField field) {
        return "sections_" + featureToken + "_" + field.getFeatureSuffix();
    }
}
