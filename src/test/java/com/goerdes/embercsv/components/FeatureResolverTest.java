package com.goerdes.embercsv.components;

import com.goerdes.embercsv.exception.FeatureExtractionException;
import com.goerdes.embercsv.model.MappingNode;
import com.goerdes.embercsv.model.ScalarNode;
import com.goerdes.embercsv.model.SequenceNode;
import org.junit.jupiter.api.Test;

import static com.goerdes.embercsv.exception.ErrorKind.FEATURE_NOT_FOUND;
import static com.goerdes.embercsv.utils.TestUtils.dataDirectories;
import static com.goerdes.embercsv.utils.TestUtils.record;
import static org.junit.jupiter.api.Assertions.*;

class FeatureResolverTest {

    private final FeatureResolver resolver = new FeatureResolver(false);

    private static final MappingNode RECORD = record("""
            {'sha256': 'abc', 'label': 1,
             'header': {'optional': {'major_linker_version': 14, 'debug_size': 999}},
             'section': {'sections': [{'entropy': 1.0, 'size': 2, 'vsize': 3}]},
             'datadirectories': %s}""".formatted(dataDirectories(15)));

    @Test
    void registersAllComputedFeatures() {
        assertEquals(15, resolver.computedFeatures().size());
        assertTrue(resolver.computedFeatures().contains("sections_min_virtualsize"));
        assertTrue(resolver.computedFeatures().contains("resource_size"));
        assertTrue(resolver.extractorFor("machine").isEmpty());
    }

    @Test
    void fallsBackToRecursiveSearch() {
        assertEquals(ScalarNode.of(14), resolver.resolve(RECORD, "major_linker_version"));
        assertEquals(ScalarNode.of("abc"), resolver.resolve(RECORD, "sha256"));
    }

    @Test
    void computedFeatureWinsOverVerbatimKey() {
        assertEquals(ScalarNode.of(106), resolver.resolve(RECORD, "debug_size"));
    }

    @Test
    void directoryMapping() {
        assertEquals(ScalarNode.of(1006), resolver.resolve(RECORD, "debug_rva"));
        assertEquals(ScalarNode.of(1012), resolver.resolve(RECORD, "iat_rva"));
        assertEquals(ScalarNode.of(100), resolver.resolve(RECORD, "export_size"));
        assertEquals(ScalarNode.of(1000), resolver.resolve(RECORD, "export_rva"));
        assertEquals(ScalarNode.of(102), resolver.resolve(RECORD, "resource_size"));
    }

    @Test
    void legacyDirectoryMapping() {
        FeatureResolver legacy = new FeatureResolver(true);
        assertEquals(ScalarNode.of(1006), legacy.resolve(RECORD, "debug_size"));
        assertEquals(ScalarNode.of(1006), legacy.resolve(RECORD, "debug_rva"));
        assertEquals(ScalarNode.of(100), legacy.resolve(RECORD, "export_rva"));
    }

    @Test
    void returnsCompositesUnchecked() {
        assertInstanceOf(SequenceNode.class, resolver.resolve(RECORD, "sections"));
    }

    @Test
    void unknownFeatureIsNotFound() {
        FeatureExtractionException e = assertThrows(FeatureExtractionException.class,
                () -> resolver.resolve(RECORD, "nonexistent_feature"));
        assertEquals(FEATURE_NOT_FOUND, e.getKind());
        assertEquals("nonexistent_feature", e.getFeatureName());
    }
}
