package com.goerdes.embercsv.model;

import com.goerdes.embercsv.exception.FileProcessingException;

/**
 * A leaf value: a {@link Number}, {@link String}, {@link Boolean} or JSON null.
 *
 * @param value the wrapped value, {@code null} for JSON null
 */
public record ScalarNode(Object value) implements RecordNode {

    public static final ScalarNode NULL = new ScalarNode(null);

    public ScalarNode {
        if (value != null && !(value instanceof Number) && !(value instanceof String) && !(value instanceof Boolean)) {
            throw new FileProcessingException("Unsupported scalar type: " + value.getClass().getName(), null);
        }
    }

    public static ScalarNode of(Object value) {
        return value == null ? NULL : new ScalarNode(value);
    }

    public boolean isNumber() {
        return value instanceof Number;
    }

    /**
     * @return the numeric value widened to double
     * @throws FileProcessingException if this scalar is not a number
     */
    public double asDouble() {
        if (value instanceof Number number) {
            return number.doubleValue();
        }
        throw new FileProcessingException("Not a number: " + value, null);
    }

}
