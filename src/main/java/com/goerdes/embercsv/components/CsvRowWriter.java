package com.goerdes.embercsv.components;

import com.goerdes.embercsv.model.FeatureRow;
import com.goerdes.embercsv.model.ScalarNode;

import java.io.BufferedWriter;
import java.io.Closeable;
import java.io.IOException;
import java.io.Writer;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.List;

import static java.nio.charset.StandardCharsets.UTF_8;

/**
 * Writes a header line followed by one line per {@link FeatureRow}.
 * Fields are quoted only when they contain a comma, a quote or a line break.
 */
public class CsvRowWriter implements Closeable {

    private static final String LINE_SEPARATOR = "\n";

    private final Writer writer;
    private int columns = -1;

    public CsvRowWriter(Writer writer) {
        this.writer = writer;
    }

    /**
     * Opens a writer on a file that must not exist yet.
     *
     * @throws java.nio.file.FileAlreadyExistsException if {@code target} already exists
     */
    public static CsvRowWriter create(Path target) throws IOException {
        BufferedWriter out = Files.newBufferedWriter(target, UTF_8, StandardOpenOption.CREATE_NEW, StandardOpenOption.WRITE);
        return new CsvRowWriter(out);
    }

    public void writeHeader(List<String> header) throws IOException {
        if (columns >= 0) {
            throw new IllegalStateException("Header already written");
        }
        columns = header.size();
        writeLine(header.stream().map(CsvRowWriter::escapeCsv).toList());
    }

    public void writeRow(FeatureRow row) throws IOException {
        if (columns < 0) {
            throw new IllegalStateException("Header must be written before rows");
        }
        if (row.values().size() != columns) {
            throw new IllegalArgumentException("Row has " + row.values().size() + " values, header has " + columns);
        }
        writeLine(row.values().stream().map(CsvRowWriter::format).toList());
    }

    private void writeLine(List<String> fields) throws IOException {
        writer.write(String.join(",", fields));
        writer.write(LINE_SEPARATOR);
    }

    @Override
    public void close() throws IOException {
        writer.close();
    }

    /**
     * Renders a scalar the way Python's csv module renders the equivalent value, so
     * existing consumers see the same cells: {@code True}/{@code False} for booleans,
     * an empty field for null, integers without a fraction.
     */
    static String format(ScalarNode scalar) {
        Object value = scalar.value();
        if (value == null) {
            return "";
        }
        if (value instanceof Boolean b) {
            return b ? "True" : "False";
        }
        if (value instanceof BigDecimal decimal) {
            return decimal.toPlainString();
        }
        if (value instanceof Integer || value instanceof Long || value instanceof Short || value instanceof BigInteger) {
            return value.toString();
        }
        if (value instanceof Number number) {
            return Double.toString(number.doubleValue());
        }
        return escapeCsv(value.toString());
    }

    static String escapeCsv(String s) {
        if (s == null) return "";
        boolean needs = s.contains(",") || s.contains("\"") || s.contains("\n") || s.contains("\r");
        if (!needs) return s;
        return "\"" + s.replace("\"", "\"\"") + "\"";
    }
}
