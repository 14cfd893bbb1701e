package com.goerdes.embercsv.components;

import com.goerdes.embercsv.exception.FeatureExtractionException;
import com.goerdes.embercsv.model.Aggregation;
import com.goerdes.embercsv.model.MappingNode;
import com.goerdes.embercsv.model.RecordNode;
import com.goerdes.embercsv.model.SectionField;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import static com.goerdes.embercsv.exception.ErrorKind.FEATURE_NOT_FOUND;
import static com.goerdes.embercsv.model.DataDirectory.*;
import static com.goerdes.embercsv.model.DirectoryAttribute.SIZE;
import static com.goerdes.embercsv.model.DirectoryAttribute.VIRTUAL_ADDRESS;
import static com.goerdes.embercsv.utils.RecordSearchUtil.search;

/**
 * Maps a feature name to its value in a record.
 * <p>
 * Names of the computed section aggregates and data directory lookups are handled
 * by their dedicated {@link FeatureExtractor}, even when a key of the same name is
 * present in the record. Every other name is looked up with the recursive key
 * search over the whole record. Holds no per-record state.
 */
@Component
public class FeatureResolver {

    private final Map<String, FeatureExtractor> extractors;

    /**
     * @param legacyDirectoryMapping if {@code true}, {@code debug_size} reads the debug
     *                               directory's virtual address and {@code export_rva} reads
     *                               the export directory's size, reproducing older CSV exports
     */
    public FeatureResolver(@Value("${conversion.legacy-directory-mapping:false}") boolean legacyDirectoryMapping) {
        Map<String, FeatureExtractor> map = new LinkedHashMap<>();
        for (SectionField field : SectionField.values()) {
            for (Aggregation aggregation : Aggregation.values()) {
                register(map, new SectionFeatureExtractor(field, aggregation));
            }
        }
        register(map, new DataDirectoryFeatureExtractor("debug_size", DEBUG, legacyDirectoryMapping ? VIRTUAL_ADDRESS : SIZE));
        register(map, new DataDirectoryFeatureExtractor("debug_rva", DEBUG, VIRTUAL_ADDRESS));
        register(map, new DataDirectoryFeatureExtractor("iat_rva", IAT, VIRTUAL_ADDRESS));
        register(map, new DataDirectoryFeatureExtractor("export_size", EXPORT_TABLE, SIZE));
        register(map, new DataDirectoryFeatureExtractor("export_rva", EXPORT_TABLE, legacyDirectoryMapping ? SIZE : VIRTUAL_ADDRESS));
        register(map, new DataDirectoryFeatureExtractor("resource_size", RESOURCE_TABLE, SIZE));
        this.extractors = Collections.unmodifiableMap(map);
    }

    private static void register(Map<String, FeatureExtractor> map, FeatureExtractor extractor) {
        map.put(extractor.featureName(), extractor);
    }

    /**
     * Resolves one feature against a record. The returned node may still be an
     * object or an array; enforcing scalars is up to the caller.
     *
     * @param record  the decoded record
     * @param feature the requested feature name
     * @return the value found for the feature
     * @throws FeatureExtractionException if the feature cannot be resolved
     */
    public RecordNode resolve(MappingNode record, String feature) {
        FeatureExtractor extractor = extractors.get(feature);
        if (extractor != null) {
            return extractor.extract(record);
        }
        return search(record, feature).orElseThrow(() ->
                new FeatureExtractionException(feature, FEATURE_NOT_FOUND, "no matching key anywhere in record"));
    }

    /**
     * @return the dedicated extractor for the name, empty if the name falls back to the plain search
     */
    public Optional<FeatureExtractor> extractorFor(String feature) {
        return Optional.ofNullable(extractors.get(feature));
    }

    /**
     * @return names that are computed rather than searched for, in registration order
     */
    public Set<String> computedFeatures() {
        return extractors.keySet();
    }
}
