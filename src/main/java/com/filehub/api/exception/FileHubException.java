package com.filehub.api.exception;

import lombok.Getter;

/**
 * Base of every failure the file store reports to its callers. Raw persistence
 * exceptions are translated into one of the subclasses before leaving the service layer.
 */
@Getter
public abstract class FileHubException extends RuntimeException {

    private final ErrorKind kind;

    protected FileHubException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    protected FileHubException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }
}
