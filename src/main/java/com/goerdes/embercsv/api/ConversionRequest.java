package com.goerdes.embercsv.api;

import com.goerdes.embercsv.model.ErrorMode;

import java.util.List;

/**
 * Body of a conversion request.
 *
 * @param source    path of the JSON Lines file on the server
 * @param features  columns to extract, the configured default if omitted
 * @param errorMode how to treat failing records, the configured default if omitted
 */
public record ConversionRequest(String source, List<String> features, ErrorMode errorMode) {}
