package com.goerdes.embercsv.model;

import java.util.List;

/**
 * One output row, values ordered like the {@link FeatureSchema} that produced it.
 *
 * @param values scalar cell values
 */
public record FeatureRow(List<ScalarNode> values) {

    public FeatureRow {
        values = List.copyOf(values);
    }

}
