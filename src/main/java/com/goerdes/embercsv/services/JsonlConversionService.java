package com.goerdes.embercsv.services;

import com.goerdes.embercsv.components.CsvRowWriter;
import com.goerdes.embercsv.components.FeatureResolver;
import com.goerdes.embercsv.components.JsonlRecordReader;
import com.goerdes.embercsv.components.JsonlRecordReader.SourceRecord;
import com.goerdes.embercsv.components.RecordProjector;
import com.goerdes.embercsv.exception.FeatureExtractionException;
import com.goerdes.embercsv.exception.MalformedRecordException;
import com.goerdes.embercsv.model.ConversionResult;
import com.goerdes.embercsv.model.ErrorMode;
import com.goerdes.embercsv.model.FeatureSchema;
import com.goerdes.embercsv.model.RecordFailure;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static com.goerdes.embercsv.utils.ConversionPaths.csvPathFor;
import static java.util.Objects.requireNonNull;

/**
 * Converts EMBER JSON Lines files into CSV files next to them.
 * <p>
 * In {@link ErrorMode#ABORT_ON_FIRST_ERROR} mode the conversion is all-or-nothing:
 * either every record becomes a complete row, or the CSV is removed again.
 */
@Service
@RequiredArgsConstructor
public class JsonlConversionService {

    private static final Logger log = LoggerFactory.getLogger(JsonlConversionService.class);

    private final FeatureResolver featureResolver;

    @Value("${conversion.features}")
    private List<String> defaultFeatures;

    @Value("${conversion.error-mode:ABORT_ON_FIRST_ERROR}")
    private ErrorMode defaultErrorMode;

    @Value("${conversion.progress-interval:10000}")
    private long progressInterval;

    /**
     * Converts with the configured feature schema and error mode.
     *
     * @param source the JSON Lines file
     * @return the outcome of the conversion
     */
    public ConversionResult convert(Path source) {
        return convert(source, defaultSchema(), defaultErrorMode);
    }

    /**
     * Converts {@code source} into a CSV with the same base name. An existing CSV
     * is never overwritten.
     *
     * @param source the JSON Lines file
     * @param schema the columns to extract
     * @param mode   how to react to records that cannot be converted
     * @return the outcome of the conversion
     */
    public ConversionResult convert(Path source, FeatureSchema schema, ErrorMode mode) {
        requireNonNull(source, "Source must not be null");
        requireNonNull(schema, "Schema must not be null");
        requireNonNull(mode, "Error mode must not be null");

        if (!Files.isRegularFile(source)) {
            log.error("File {} not found.", source);
            return ConversionResult.refused(null, "Source file not found: " + source);
        }

        Path target = csvPathFor(source);
        log.info("CSV file will be generated at {}", target);

        if (Files.exists(target)) {
            log.warn("The file {} already exists.", target);
            return ConversionResult.refused(target, "Output file already exists: " + target);
        }

        RecordProjector projector = new RecordProjector(featureResolver, schema);
        Progress progress = new Progress();

        try (JsonlRecordReader reader = new JsonlRecordReader(source);
             CsvRowWriter writer = openWriter(target)) {
            writer.writeHeader(schema.features());
            writeRows(source, reader, writer, projector, mode, progress);
        } catch (IOException e) {
            log.error("I/O error while converting {}: {}", source, e.getMessage());
            discard(target);
            return new ConversionResult(false, target, progress.read, 0, progress.failures,
                    "I/O error: " + e.getMessage());
        }

        if (progress.aborted) {
            discard(target);
            return new ConversionResult(false, target, progress.read, 0, progress.failures,
                    "Conversion aborted: " + progress.failures.get(0).message());
        }

        if (progress.failures.isEmpty()) {
            log.info("CSV file generated successfully at {}", target);
        } else {
            log.warn("CSV file generated at {} with {} skipped record(s)", target, progress.failures.size());
        }
        return new ConversionResult(true, target, progress.read, progress.written, progress.failures,
                progress.written + " row(s) written");
    }

    /**
     * Builds the schema from the {@code conversion.features} property.
     */
    public FeatureSchema defaultSchema() {
        return FeatureSchema.of(defaultFeatures);
    }

    public ErrorMode defaultErrorMode() {
        return defaultErrorMode;
    }

    /**
     * Opens the CSV sink for a new conversion. Fails if {@code target} already exists.
     */
    protected CsvRowWriter openWriter(Path target) throws IOException {
        return CsvRowWriter.create(target);
    }

    private void writeRows(Path source, JsonlRecordReader reader, CsvRowWriter writer,
                           RecordProjector projector, ErrorMode mode, Progress progress) throws IOException {
        while (true) {
            SourceRecord next;
            try {
                Optional<SourceRecord> read = reader.next();
                if (read.isEmpty()) {
                    return;
                }
                next = read.get();
            } catch (MalformedRecordException e) {
                progress.read++;
                log.error("Malformed record: {}", e.getMessage());
                if (progress.fail(RecordFailure.of(e), mode)) {
                    return;
                }
                continue;
            }

            progress.read++;
            try {
                writer.writeRow(projector.project(next.record()));
                progress.written++;
            } catch (FeatureExtractionException e) {
                log.error("Line {}: feature '{}' could not be extracted ({})",
                        next.lineNumber(), e.getFeatureName(), e.getKind());
                if (progress.fail(RecordFailure.of(next.lineNumber(), e), mode)) {
                    return;
                }
            }

            if (progressInterval > 0 && progress.read % progressInterval == 0) {
                log.info("[{}] lines processed for {}", progress.read, source);
            }
        }
    }

    private static void discard(Path target) {
        try {
            Files.deleteIfExists(target);
        } catch (IOException e) {
            log.error("Failed to remove partial output {}: {}", target, e.getMessage());
        }
    }

    /** Mutable counters of a single conversion run. */
    private static final class Progress {
        private long read;
        private long written;
        private boolean aborted;
        private final List<RecordFailure> failures = new ArrayList<>();

        /** Records the failure and returns whether the run has to stop. */
        private boolean fail(RecordFailure failure, ErrorMode mode) {
            failures.add(failure);
            aborted = mode == ErrorMode.ABORT_ON_FIRST_ERROR;
            return aborted;
        }
    }
}
