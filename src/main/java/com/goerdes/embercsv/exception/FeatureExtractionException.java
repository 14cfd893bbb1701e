package com.goerdes.embercsv.exception;

import lombok.Getter;

/**
 * Raised when a single feature of a record cannot be extracted. Carries the feature
 * name and the {@link ErrorKind} so callers can tell "unresolved" apart from "non-scalar".
 */
@Getter
public class FeatureExtractionException extends FileProcessingException {

    private final String featureName;

    private final ErrorKind kind;

    public FeatureExtractionException(String featureName, ErrorKind kind, String message) {
        this(featureName, kind, message, null);
    }

    public FeatureExtractionException(String featureName, ErrorKind kind, String message, Throwable cause) {
        super("Feature '" + featureName + "' [" + kind + "]: " + message, cause);
        this.featureName = featureName;
        this.kind = kind;
    }

}
