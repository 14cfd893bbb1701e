package com.goerdes.embercsv.api;

import com.goerdes.embercsv.exception.FileProcessingException;
import com.goerdes.embercsv.model.ConversionResult;
import com.goerdes.embercsv.services.JsonlConversionService;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

import java.nio.file.Paths;
import java.util.List;

/**
 * Converts the files passed as {@code --input=<path>} on startup, in order.
 * Stops with an exception at the first file that could not be converted, so the
 * process exits with a failure status.
 * <p>
 * Such runs start without the web server (see {@link com.goerdes.embercsv.EmberCsvApplication}),
 * so the process ends once every file is converted.
 */
@Component
@RequiredArgsConstructor
public class ConversionRunner implements ApplicationRunner {

    private static final Logger log = LoggerFactory.getLogger(ConversionRunner.class);

    public static final String INPUT_OPTION = "input";

    private final JsonlConversionService conversionService;

    @Override
    public void run(ApplicationArguments args) {
        List<String> inputs = args.getOptionValues(INPUT_OPTION);
        if (inputs == null || inputs.isEmpty()) {
            return;
        }
        log.info("Converting {} file(s)", inputs.size());
        for (String input : inputs) {
            ConversionResult result = conversionService.convert(Paths.get(input));
            if (!result.successful()) {
                throw new FileProcessingException("Conversion of " + input + " failed: " + result.message(), null);
            }
            log.info("{} -> {} ({} rows)", input, result.outputPath(), result.rowsWritten());
        }
    }
}
