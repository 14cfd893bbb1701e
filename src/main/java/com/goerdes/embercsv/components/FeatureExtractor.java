package com.goerdes.embercsv.components;

import com.goerdes.embercsv.exception.FeatureExtractionException;
import com.goerdes.embercsv.model.MappingNode;
import com.goerdes.embercsv.model.RecordNode;

/**
 * Computes one named feature from a whole record.
 */
public interface FeatureExtractor {

    /**
     * @return the feature name this extractor answers for
     */
    String featureName();

    /**
     * Extracts the feature value from the given record.
     *
     * @param record the decoded record, never modified
     * @return the extracted value
     * @throws FeatureExtractionException if the value cannot be determined
     */
    RecordNode extract(MappingNode record) throws FeatureExtractionException;

}
