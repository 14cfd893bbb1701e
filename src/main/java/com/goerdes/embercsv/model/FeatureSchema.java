package com.goerdes.embercsv.model;

import com.goerdes.embercsv.exception.FileProcessingException;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * The ordered list of feature names that make up the CSV columns.
 * <p>
 * If {@link #LABEL} is requested it is always moved to the last column, so the
 * ground truth ends up at the end no matter where the caller put it.
 * Duplicate names are collapsed onto their first occurrence.
 *
 * @param features column names in output order
 */
public record FeatureSchema(List<String> features) {

    /** Name of the ground-truth column. */
    public static final String LABEL = "label";

    public FeatureSchema {
        features = List.copyOf(features);
    }

    /**
     * Builds a schema from caller-supplied names, applying the label-last rule.
     *
     * @param requested feature names in the order the caller wants them
     * @return the effective schema
     * @throws FileProcessingException if the list is empty or contains a blank name
     */
    public static FeatureSchema of(List<String> requested) {
        if (requested == null || requested.isEmpty()) {
            throw new FileProcessingException("Feature schema must not be empty", null);
        }
        Set<String> distinct = new LinkedHashSet<>();
        for (String name : requested) {
            if (name == null || name.isBlank()) {
                throw new FileProcessingException("Feature names must not be blank: " + requested, null);
            }
            distinct.add(name.trim());
        }
        List<String> ordered = new ArrayList<>(distinct);
        if (ordered.remove(LABEL)) {
            ordered.add(LABEL);
        }
        return new FeatureSchema(ordered);
    }

    public int size() {
        return features.size();
    }

}
