package com.goerdes.embercsv.components;

import com.goerdes.embercsv.exception.FeatureExtractionException;
import com.goerdes.embercsv.model.Aggregation;
import com.goerdes.embercsv.model.MappingNode;
import com.goerdes.embercsv.model.RecordNode;
import com.goerdes.embercsv.model.ScalarNode;
import com.goerdes.embercsv.model.SectionField;
import com.goerdes.embercsv.model.SequenceNode;

import static com.goerdes.embercsv.exception.ErrorKind.SECTIONS_MISSING;
import static com.goerdes.embercsv.exception.ErrorKind.SECTION_MALFORMED;
import static com.goerdes.embercsv.utils.RecordSearchUtil.search;

/**
 * Aggregates one numeric field (entropy, raw size or virtual size) over all
 * entries of the record's {@code sections} list.
 * <p>
 * An empty section list yields {@code 0.0}. Min and max keep the value as it
 * appeared in the record (an integer size stays an integer), the mean is always
 * a double.
 */
public class SectionFeatureExtractor implements FeatureExtractor {

    public static final String SECTIONS_KEY = "sections";

    private final SectionField field;
    private final Aggregation aggregation;
    private final String featureName;

    public SectionFeatureExtractor(SectionField field, Aggregation aggregation) {
        this.field = field;
        this.aggregation = aggregation;
        this.featureName = aggregation.featureName(field);
    }

    @Override
    public String featureName() {
        return featureName;
    }

    @Override
    public RecordNode extract(MappingNode record) {
        RecordNode found = search(record, SECTIONS_KEY).orElseThrow(() ->
                new FeatureExtractionException(featureName, SECTIONS_MISSING, "'" + SECTIONS_KEY + "' not found in record"));

        if (!(found instanceof SequenceNode sections)) {
            throw new FeatureExtractionException(featureName, SECTION_MALFORMED, "'" + SECTIONS_KEY + "' is not a list");
        }
        if (sections.isEmpty()) {
            return ScalarNode.of(0.0);
        }

        double sum = 0;
        ScalarNode best = null;
        for (RecordNode section : sections.elements()) {
            ScalarNode value = sectionValue(section);
            double current = value.asDouble();
            sum += current;
            if (best == null
                    || (aggregation == Aggregation.MIN && current < best.asDouble())
                    || (aggregation == Aggregation.MAX && current > best.asDouble())) {
                best = value;
            }
        }

        return aggregation == Aggregation.MEAN ? ScalarNode.of(sum / sections.size()) : best;
    }

    /** Looks the field up inside a single section entry, searching its nested objects as well. */
    private ScalarNode sectionValue(RecordNode section) {
        RecordNode value = search(section, field.getEntryKey()).orElseThrow(() ->
                new FeatureExtractionException(featureName, SECTION_MALFORMED, "'" + field.getEntryKey() + "' not found in section"));
        if (value instanceof ScalarNode scalar && scalar.isNumber()) {
            return scalar;
        }
        throw new FeatureExtractionException(featureName, SECTION_MALFORMED, "'" + field.getEntryKey() + "' of section is not numeric");
    }
}
