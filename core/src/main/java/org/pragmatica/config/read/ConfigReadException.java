package org.pragmatica.config.read;

import org.pragmatica.config.ReadError;

/// Thrown by [ConfigReader#readOrThrow] when configuration cannot be read.
public class ConfigReadException extends RuntimeException {
    private final transient ReadError error;

    public ConfigReadException(ReadError error) {
        super(ReadErrorPrinter.prettyPrint(error));
        this.error = error;
    }

    public ReadError error() {
        return error;
    }
}
