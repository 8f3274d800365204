package com.propertyintel.housekeeping.exception;

import lombok.Getter;

import java.nio.file.Path;

@Getter
public class SourceNotFoundException extends RuntimeException {

    private final Path path;

    public SourceNotFoundException(Path path) {
        super("Input file not found: " + path);
        this.path = path;
    }
}
