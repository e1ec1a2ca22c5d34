package com.sitepulse.scribe.exception;

import java.nio.file.Path;

public class ExportWriteException extends RuntimeException {

    private final transient Path target;

    public ExportWriteException(String message, Path target, Throwable cause) {
        super(message, cause);
        this.target = target;
    }

    public Path getTarget() {
        return target;
    }
}
