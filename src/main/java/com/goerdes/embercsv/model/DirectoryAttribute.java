package com.goerdes.embercsv.model;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Keys of a single data directory entry.
 */
@Getter
@RequiredArgsConstructor
public enum DirectoryAttribute {
    SIZE("size"),
    VIRTUAL_ADDRESS("virtual_address");

    private final String key;
}
