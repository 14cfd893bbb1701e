package com.goerdes.embercsv.components;

import com.goerdes.embercsv.exception.FeatureExtractionException;
import com.goerdes.embercsv.model.FeatureRow;
import com.goerdes.embercsv.model.FeatureSchema;
import com.goerdes.embercsv.model.MappingNode;
import com.goerdes.embercsv.model.RecordNode;
import com.goerdes.embercsv.model.ScalarNode;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

import java.util.ArrayList;
import java.util.List;

import static com.goerdes.embercsv.exception.ErrorKind.NON_SCALAR_FEATURE;

/**
 * Projects a record onto a fixed {@link FeatureSchema}, producing exactly one
 * row or failing as a whole. A partial row is never returned.
 */
@RequiredArgsConstructor
public class RecordProjector {

    private final FeatureResolver resolver;

    @Getter
    private final FeatureSchema schema;

    /**
     * Resolves every feature of the schema, in schema order.
     *
     * @param record the decoded record
     * @return a row with one scalar per schema column
     * @throws FeatureExtractionException on the first feature that is missing or not a scalar
     */
    public FeatureRow project(MappingNode record) {
        List<ScalarNode> values = new ArrayList<>(schema.size());
        for (String feature : schema.features()) {
            RecordNode value = resolver.resolve(record, feature);
            if (!(value instanceof ScalarNode scalar)) {
                throw new FeatureExtractionException(feature, NON_SCALAR_FEATURE,
                        "resolved to " + (value instanceof MappingNode ? "an object" : "a list") + ", not a scalar");
            }
            values.add(scalar);
        }
        return new FeatureRow(values);
    }
}
