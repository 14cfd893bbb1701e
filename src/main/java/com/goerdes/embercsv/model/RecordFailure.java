package com.goerdes.embercsv.model;

import com.goerdes.embercsv.exception.ErrorKind;
import com.goerdes.embercsv.exception.FeatureExtractionException;
import com.goerdes.embercsv.exception.MalformedRecordException;

/**
 * A record that did not make it into the CSV.
 *
 * @param lineNumber  1-based line of the record in the source file
 * @param featureName the feature that failed, {@code null} if the line itself was malformed
 * @param kind        why it failed
 * @param message     human readable detail
 */
public record RecordFailure(long lineNumber, String featureName, ErrorKind kind, String message) {

    public static RecordFailure of(long lineNumber, FeatureExtractionException e) {
        return new RecordFailure(lineNumber, e.getFeatureName(), e.getKind(), e.getMessage());
    }

    public static RecordFailure of(MalformedRecordException e) {
        return new RecordFailure(e.getLineNumber(), null, e.getKind(), e.getMessage());
    }

}
