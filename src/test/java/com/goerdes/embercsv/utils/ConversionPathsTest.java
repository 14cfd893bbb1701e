package com.goerdes.embercsv.utils;

import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.nio.file.Paths;

import static com.goerdes.embercsv.utils.ConversionPaths.csvPathFor;
import static org.junit.jupiter.api.Assertions.assertEquals;

class ConversionPathsTest {

    @Test
    void replacesLastExtension() {
        assertEquals(Paths.get("data", "train_features_0.csv"), csvPathFor(Paths.get("data", "train_features_0.jsonl")));
        assertEquals(Paths.get("data", "archive.tar.csv"), csvPathFor(Paths.get("data", "archive.tar.gz")));
    }

    @Test
    void appendsWhenThereIsNoExtension() {
        assertEquals(Paths.get("data", "features.csv"), csvPathFor(Paths.get("data", "features")));
        assertEquals(Paths.get("data", ".jsonl.csv"), csvPathFor(Paths.get("data", ".jsonl")));
    }

    @Test
    void worksWithoutParent() {
        assertEquals(Path.of("x.csv"), csvPathFor(Path.of("x.jsonl")));
    }
}
