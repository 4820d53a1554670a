package com.commerce.extobject.cli.model;

import java.nio.file.Path;

import lombok.AllArgsConstructor;
import lombok.Data;

/**
 * Derived values needed by the executor. Keeps MapCommand thin.
 */
@Data
@AllArgsConstructor
public class ValidatedMapOptions {
    Path mappings;
    Path document;
    String context;
    Path output;
}
