package com.goerdes.embercsv.exception;

import lombok.Getter;

/**
 * Raised by the line reader when a line is not a parseable JSON object.
 */
@Getter
public class MalformedRecordException extends FileProcessingException {

    /** 1-based line number within the source file. */
    private final long lineNumber;

    public MalformedRecordException(long lineNumber, String message, Throwable cause) {
        super("Line " + lineNumber + ": " + message, cause);
        this.lineNumber = lineNumber;
    }

    public ErrorKind getKind() {
        return ErrorKind.MALFORMED_RECORD;
    }

}
