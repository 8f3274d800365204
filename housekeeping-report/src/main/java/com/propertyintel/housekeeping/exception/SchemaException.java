package com.propertyintel.housekeeping.exception;

import lombok.Getter;

import java.util.List;

/**
 * A required column is absent from an input table. Raised before any row is processed.
 */
@Getter
public class SchemaException extends RuntimeException {

    private final String source;
    private final List<String> missingColumns;

    public SchemaException(String source, List<String> missingColumns) {
        super(String.format("%s is missing required column(s): %s", source, String.join(", ", missingColumns)));
        this.source = source;
        this.missingColumns = List.copyOf(missingColumns);
    }
}
