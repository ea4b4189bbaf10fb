package com.filehub.api.exception;

public class InvalidFilterException extends FileHubException {

    public InvalidFilterException(String message) {
        super(ErrorKind.VALIDATION, message);
    }
}
