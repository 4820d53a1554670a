package com.commerce.extobject.cli.model;

import java.nio.file.Path;

import com.commerce.extobject.schema.TableSpec;

import lombok.AllArgsConstructor;
import lombok.Data;

/**
 * Derived values needed by the executor. Keeps SchemaCommand thin.
 */
@Data
@AllArgsConstructor
public class ValidatedSchemaOptions {
    Path mappings;
    TableSpec tableSpec;
    Path output;
}
