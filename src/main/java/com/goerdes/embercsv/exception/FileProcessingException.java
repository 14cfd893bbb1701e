package com.goerdes.embercsv.exception;

/**
 * Root of all errors raised while turning a JSON Lines file into CSV rows.
 */
public class FileProcessingException extends RuntimeException {

    public FileProcessingException(String message, Throwable cause) {
        super(message, cause);
    }

}
