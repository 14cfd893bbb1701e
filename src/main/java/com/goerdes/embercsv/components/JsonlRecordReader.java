package com.goerdes.embercsv.components;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.goerdes.embercsv.exception.FileProcessingException;
import com.goerdes.embercsv.exception.MalformedRecordException;
import com.goerdes.embercsv.model.MappingNode;

import java.io.BufferedInputStream;
import java.io.ByteArrayOutputStream;
import java.io.Closeable;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.Optional;

import static com.goerdes.embercsv.utils.RecordTreeMapper.toMappingNode;

/**
 * Reads a JSON Lines file one record at a time. Each non-blank line must hold
 * exactly one JSON object.
 * <p>
 * Lines are split on raw bytes and decoded by Jackson, so invalid UTF-8 only
 * affects the line that contains it.
 */
public class JsonlRecordReader implements Closeable {

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);

    private final InputStream in;
    private final ByteArrayOutputStream line = new ByteArrayOutputStream(8192);
    private long lineNumber;

    public JsonlRecordReader(Path source) throws IOException {
        this.in = new BufferedInputStream(Files.newInputStream(source));
    }

    /**
     * Reads and decodes the next record. Blank lines are skipped.
     * A malformed line does not end the stream; the following call continues with the next line.
     *
     * @return the next record, or empty at end of input
     * @throws MalformedRecordException if the line is not a JSON object
     * @throws IOException              if reading the file fails
     */
    public Optional<SourceRecord> next() throws IOException {
        byte[] bytes;
        do {
            bytes = readLine();
            if (bytes == null) {
                return Optional.empty();
            }
            lineNumber++;
        } while (isBlank(bytes));

        try {
            JsonNode tree = MAPPER.readTree(bytes);
            return Optional.of(new SourceRecord(lineNumber, toMappingNode(tree)));
        } catch (JsonProcessingException e) {
            throw new MalformedRecordException(lineNumber, e.getOriginalMessage(), e);
        } catch (FileProcessingException e) {
            throw new MalformedRecordException(lineNumber, e.getMessage(), e);
        }
    }

    @Override
    public void close() throws IOException {
        in.close();
    }

    /** Returns the bytes up to the next line feed without the terminator, or null at end of input. */
    private byte[] readLine() throws IOException {
        line.reset();
        int b = in.read();
        if (b == -1) {
            return null;
        }
        while (b != -1 && b != '\n') {
            line.write(b);
            b = in.read();
        }
        byte[] bytes = line.toByteArray();
        int length = bytes.length;
        if (length > 0 && bytes[length - 1] == '\r') {
            return Arrays.copyOf(bytes, length - 1);
        }
        return bytes;
    }

    private static boolean isBlank(byte[] bytes) {
        for (byte b : bytes) {
            if (b != ' ' && b != '\t' && b != '\r' && b != '\f') {
                return false;
            }
        }
        return true;
    }

    /**
     * A decoded line of the source file.
     *
     * @param lineNumber 1-based line number
     * @param record     the decoded JSON object
     */
    public record SourceRecord(long lineNumber, MappingNode record) {}
}
