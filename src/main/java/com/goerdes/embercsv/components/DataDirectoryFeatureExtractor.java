package com.goerdes.embercsv.components;

import com.goerdes.embercsv.exception.FeatureExtractionException;
import com.goerdes.embercsv.model.DataDirectory;
import com.goerdes.embercsv.model.DirectoryAttribute;
import com.goerdes.embercsv.model.MappingNode;
import com.goerdes.embercsv.model.RecordNode;
import com.goerdes.embercsv.model.ScalarNode;
import com.goerdes.embercsv.model.SequenceNode;

import static com.goerdes.embercsv.exception.ErrorKind.DATADIRECTORY_MALFORMED;
import static com.goerdes.embercsv.exception.ErrorKind.DATADIRECTORY_MISSING;
import static com.goerdes.embercsv.utils.RecordSearchUtil.search;

/**
 * Reads {@code size} or {@code virtual_address} of one fixed entry of the
 * record's {@code datadirectories} table. An empty table yields {@code 0.0}.
 */
public class DataDirectoryFeatureExtractor implements FeatureExtractor {

    public static final String DATADIRECTORIES_KEY = "datadirectories";

    private final String featureName;
    private final DataDirectory directory;
    private final DirectoryAttribute attribute;

    public DataDirectoryFeatureExtractor(String featureName, DataDirectory directory, DirectoryAttribute attribute) {
        this.featureName = featureName;
        this.directory = directory;
        this.attribute = attribute;
    }

    @Override
    public String featureName() {
        return featureName;
    }

    @Override
    public RecordNode extract(MappingNode record) {
        RecordNode found = search(record, DATADIRECTORIES_KEY).orElseThrow(() ->
                new FeatureExtractionException(featureName, DATADIRECTORY_MISSING, "'" + DATADIRECTORIES_KEY + "' not found in record"));

        if (!(found instanceof SequenceNode table)) {
            throw new FeatureExtractionException(featureName, DATADIRECTORY_MALFORMED, "'" + DATADIRECTORIES_KEY + "' is not a list");
        }
        if (table.isEmpty()) {
            return ScalarNode.of(0.0);
        }
        if (directory.getIndex() >= table.size()) {
            throw new FeatureExtractionException(featureName, DATADIRECTORY_MALFORMED,
                    "index " + directory.getIndex() + " (" + directory + ") out of range for " + table.size() + " entries");
        }

        RecordNode entry = table.elements().get(directory.getIndex());
        if (!(entry instanceof MappingNode mapping)) {
            throw new FeatureExtractionException(featureName, DATADIRECTORY_MALFORMED,
                    "entry " + directory.getIndex() + " (" + directory + ") is not an object");
        }
        return mapping.get(attribute.getKey()).orElseThrow(() ->
                new FeatureExtractionException(featureName, DATADIRECTORY_MALFORMED,
                        "'" + attribute.getKey() + "' missing in entry " + directory.getIndex() + " (" + directory + ")"));
    }
}
