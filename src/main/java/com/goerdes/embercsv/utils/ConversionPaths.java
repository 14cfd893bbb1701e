package com.goerdes.embercsv.utils;

import java.nio.file.Path;

public class ConversionPaths {

    public static final String CSV_EXTENSION = ".csv";

    private ConversionPaths() {
    }

    /**
     * Derives the CSV output path by replacing the last extension of the file name,
     * e.g. {@code train_features_0.jsonl -> train_features_0.csv}. Leading dots of a
     * hidden file are not treated as an extension separator.
     *
     * @param source the JSON Lines input file
     * @return sibling path with a {@code .csv} extension
     */
    public static Path csvPathFor(Path source) {
        String name = source.getFileName().toString();
        int start = 0;
        while (start < name.length() && name.charAt(start) == '.') {
            start++;
        }
        int dot = name.lastIndexOf('.');
        String base = dot > start ? name.substring(0, dot) : name;
        return source.resolveSibling(base + CSV_EXTENSION);
    }
}
