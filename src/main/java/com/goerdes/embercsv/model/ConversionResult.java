package com.goerdes.embercsv.model;

import java.nio.file.Path;
import java.util.List;

/**
 * Terminal outcome of converting one JSON Lines file.
 *
 * @param successful  whether a CSV was produced
 * @param outputPath  the derived CSV path, {@code null} if the source was missing
 * @param recordsRead number of non-blank lines consumed
 * @param rowsWritten number of rows in the CSV, 0 if it was discarded
 * @param failures    records that were rejected
 * @param message     summary of the outcome
 */
public record ConversionResult(
        boolean successful,
        Path outputPath,
        long recordsRead,
        long rowsWritten,
        List<RecordFailure> failures,
        String message
) {

    public ConversionResult {
        failures = List.copyOf(failures);
    }

    public static ConversionResult refused(Path outputPath, String message) {
        return new ConversionResult(false, outputPath, 0, 0, List.of(), message);
    }

}
