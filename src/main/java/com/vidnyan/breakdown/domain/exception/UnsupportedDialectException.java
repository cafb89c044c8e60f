package com.vidnyan.breakdown.domain.exception;

/**
 * No import can be derived because the file type is not a known dialect.
 */
public class UnsupportedDialectException extends BreakdownException {

    private final String path;

    public UnsupportedDialectException(String path) {
        super("Unsupported source dialect: " + path);
        this.path = path;
    }

    public String getPath() {
        return path;
    }
}
