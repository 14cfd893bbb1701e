package com.goerdes.embercsv.api;

import com.goerdes.embercsv.exception.FileProcessingException;
import com.goerdes.embercsv.model.ConversionResult;
import com.goerdes.embercsv.model.ErrorMode;
import com.goerdes.embercsv.model.FeatureSchema;
import com.goerdes.embercsv.services.JsonlConversionService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;

@RestController
@RequiredArgsConstructor
@RequestMapping("/api")
public class ConversionController {

    private final JsonlConversionService conversionService;

    /**
     * Converts a JSON Lines file that is reachable from the server into a CSV file
     * next to it.
     *
     * @param request source path, optional feature list and optional error mode
     * @return 200 with the result if the CSV was written, 422 with the result otherwise
     * @throws FileProcessingException if the request itself is invalid
     */
    @PostMapping("/convert")
    public ResponseEntity<ConversionResult> convert(@RequestBody ConversionRequest request) {
        if (request.source() == null || request.source().isBlank()) {
            throw new FileProcessingException("Source path is required", null);
        }
        Path source = toPath(request.source());

        List<String> features = request.features();
        FeatureSchema schema = features == null || features.isEmpty()
                ? conversionService.defaultSchema()
                : FeatureSchema.of(features);
        ErrorMode mode = request.errorMode() == null ? conversionService.defaultErrorMode() : request.errorMode();

        ConversionResult result = conversionService.convert(source, schema, mode);
        return ResponseEntity.status(result.successful() ? HttpStatus.OK : HttpStatus.UNPROCESSABLE_ENTITY).body(result);
    }

    private static Path toPath(String source) {
        try {
            return Paths.get(source);
        } catch (InvalidPathException e) {
            throw new FileProcessingException("Invalid source path: " + source, e);
        }
    }

    @ExceptionHandler(FileProcessingException.class)
    public ResponseEntity<String> onError(FileProcessingException ex) {
        return ResponseEntity.badRequest().body(ex.getMessage());
    }

}
